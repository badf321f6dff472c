package cloud.oro.identity.store;

import cloud.oro.identity.ClusterNotFoundException;
import cloud.oro.identity.DIDNode;
import cloud.oro.identity.DIDNotFoundException;
import cloud.oro.identity.IdentityCluster;
import cloud.oro.identity.LinkProof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe store keeping nodes, clusters and proofs in memory. Re-saving an existing node or cluster replaces
 * it in place, so enumeration order is the order of first insertion.
 */
public final class InMemoryDIDStore implements DIDStore {

    private final Map<String, DIDNode> nodes = new LinkedHashMap<>();
    private final Map<String, IdentityCluster> clusters = new LinkedHashMap<>();
    private final List<LinkProof> proofs = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public synchronized void saveNode(DIDNode node) {
        Objects.requireNonNull(node, "node");
        nodes.put(node.getDid(), node.withoutPrivateKey());
    }

    @Override
    public synchronized DIDNode getNode(String did) throws DIDNotFoundException {
        DIDNode node = did == null ? null : nodes.get(did);
        if (node == null) {
            throw new DIDNotFoundException(did);
        }
        return node;
    }

    @Override
    public synchronized boolean containsNode(String did) {
        return did != null && nodes.containsKey(did);
    }

    @Override
    public synchronized List<DIDNode> listNodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes.values()));
    }

    @Override
    public synchronized void saveCluster(IdentityCluster cluster) {
        Objects.requireNonNull(cluster, "cluster");
        clusters.put(cluster.clusterId(), cluster);
    }

    @Override
    public synchronized IdentityCluster getCluster(String clusterId) throws ClusterNotFoundException {
        IdentityCluster cluster = clusterId == null ? null : clusters.get(clusterId);
        if (cluster == null) {
            throw new ClusterNotFoundException(clusterId);
        }
        return cluster;
    }

    @Override
    public synchronized boolean containsCluster(String clusterId) {
        return clusterId != null && clusters.containsKey(clusterId);
    }

    @Override
    public synchronized List<IdentityCluster> listClusters() {
        return Collections.unmodifiableList(new ArrayList<>(clusters.values()));
    }

    @Override
    public synchronized void deleteCluster(String clusterId) throws ClusterNotFoundException {
        if (clusterId == null || clusters.remove(clusterId) == null) {
            throw new ClusterNotFoundException(clusterId);
        }
    }

    @Override
    public synchronized void saveProof(LinkProof proof) {
        proofs.add(Objects.requireNonNull(proof, "proof"));
    }

    @Override
    public synchronized List<LinkProof> listProofs() {
        return Collections.unmodifiableList(new ArrayList<>(proofs));
    }

    @Override
    public ReadWriteLock lock() {
        return lock;
    }
}
