package cloud.oro.identity.store;

import cloud.oro.identity.ClusterNotFoundException;
import cloud.oro.identity.DIDNode;
import cloud.oro.identity.DIDNotFoundException;
import cloud.oro.identity.IdentityCluster;
import cloud.oro.identity.LinkProof;

import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * Persistence boundary for nodes, clusters and link proofs.
 *
 * <p>
 * A store does not enforce cross-entity invariants; {@link cloud.oro.identity.DIDManager} is the only component that
 * does. Implementations must:
 * </p>
 * <ul>
 *   <li>never retain private key material passed to {@link #saveNode(DIDNode)};</li>
 *   <li>signal absent entries from {@link #getNode(String)} and {@link #getCluster(String)} with the typed
 *       exceptions below;</li>
 *   <li>enumerate nodes and clusters in insertion order and proofs in append order;</li>
 *   <li>hand out a single {@link ReadWriteLock} per store instance, which managers use to serialize writers.</li>
 * </ul>
 */
public interface DIDStore {

    void saveNode(DIDNode node);

    DIDNode getNode(String did) throws DIDNotFoundException;

    boolean containsNode(String did);

    List<DIDNode> listNodes();

    void saveCluster(IdentityCluster cluster);

    IdentityCluster getCluster(String clusterId) throws ClusterNotFoundException;

    boolean containsCluster(String clusterId);

    List<IdentityCluster> listClusters();

    void deleteCluster(String clusterId) throws ClusterNotFoundException;

    void saveProof(LinkProof proof);

    List<LinkProof> listProofs();

    ReadWriteLock lock();
}
