package cloud.oro.identity;

import cloud.oro.identity.signing.Ed25519;
import cloud.oro.identity.signing.LinkPayload;
import cloud.oro.identity.signing.NodeKeyPair;
import cloud.oro.identity.signing.Signer;
import cloud.oro.identity.signing.SigningResult;
import cloud.oro.identity.store.DIDStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.logging.Logger;

/**
 * <p>
 * Service layer for creating, linking, revoking and resolving DIDs. The manager is the sole enforcer of the
 * identity invariants; the {@link DIDStore} it is given only persists what the manager decides.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Every node owns its own Ed25519 key. There is no master key: a cluster exists only as the union of
 *       pairwise link proofs.</li>
 *   <li>Linking needs both private keys. Both signatures are verified against the stored public keys before the
 *       store is touched, so a failed link leaves no trace.</li>
 *   <li>Linking nodes from two clusters merges them. The older cluster survives (ties go to the smaller cluster
 *       id) and absorbs the other's members.</li>
 *   <li>Revocation is terminal and affects only the revoked node. Revoked nodes stay cluster members so their
 *       proofs remain auditable.</li>
 *   <li>Writers are serialized on the store's write lock and readers share its read lock, so any number of
 *       managers may wrap the same store.</li>
 * </ul>
 */
public final class DIDManager {

    private static final Logger LOGGER = Logger.getLogger(DIDManager.class.getName());

    private static final Comparator<IdentityCluster> SURVIVOR_ORDER = Comparator
        .comparing(IdentityCluster::createdAt)
        .thenComparing(IdentityCluster::clusterId);

    private final IdentityConfig config;
    private final DIDStore store;
    private final Signer signer;

    public DIDManager(DIDStore store) {
        this(store, IdentityConfig.defaults());
    }

    /**
     * @param store  persistence boundary; its lifecycle belongs to the caller.
     * @param config configuration; a copy with defaults applied is captured.
     */
    public DIDManager(DIDStore store, IdentityConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config").withDefaults();
        this.signer = this.config.getSigner();
    }

    public DIDStore getStore() {
        return store;
    }

    /**
     * Creates a new active node with a fresh keypair.
     *
     * <p>
     * The returned node is the only place the private key is ever observable; the caller must retain it. The stored
     * copy has no private key.
     * </p>
     *
     * @param label human-readable label; {@code null} is stored as empty.
     * @return the new node, carrying its private key.
     * @throws DIDAlreadyExistsException when the derived DID is already stored.
     */
    public DIDNode createDid(String label) throws DIDException {
        NodeKeyPair keyPair = signer.generate();
        String did = Ed25519.deriveDid(keyPair.getPublicKey(), config.getDidMethod());

        Lock lock = store.lock().writeLock();
        lock.lock();
        try {
            if (store.containsNode(did)) {
                LOGGER.warning(() -> "[oro-identity] DID collision on create: " + did);
                throw new DIDAlreadyExistsException(did);
            }
            DIDNode node = DIDNode.builder()
                .did(did)
                .publicKey(keyPair.getPublicKey())
                .privateKey(keyPair.getPrivateKey())
                .label(label)
                .status(DIDStatus.ACTIVE)
                .createdAt(now())
                .build();
            store.saveNode(node.withoutPrivateKey());
            LOGGER.info(() -> String.format(Locale.ROOT, "[oro-identity] created %s (label=%s)", did, node.getLabel()));
            return node;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Links two DIDs into the same identity cluster.
     *
     * <p>
     * Workflow:
     * </p>
     * <ol>
     *   <li>Checks both DIDs exist and are active.</li>
     *   <li>Signs the canonical payload (domain tag, both DIDs, timestamp) with each private key.</li>
     *   <li>Verifies each signature against the stored public key; any mismatch aborts with nothing persisted.</li>
     *   <li>Creates, extends or merges clusters as needed and appends the proof.</li>
     * </ol>
     *
     * @return the appended proof.
     * @throws DIDNotFoundException      when either DID is unknown.
     * @throws DIDRevokedException       when either node is revoked, regardless of the keys supplied.
     * @throws LinkProofInvalidException when a key does not match the stored public key of its DID.
     * @throws ClusterAlreadyExistsException when a new cluster is needed and the generated id is already taken.
     */
    public LinkProof linkDids(String didA, byte[] privateKeyA, String didB, byte[] privateKeyB) throws DIDException {
        Objects.requireNonNull(didA, "didA");
        Objects.requireNonNull(didB, "didB");
        if (didA.equals(didB)) {
            throw new IllegalArgumentException("cannot link a DID to itself: " + didA);
        }

        Lock lock = store.lock().writeLock();
        lock.lock();
        try {
            DIDNode nodeA = store.getNode(didA);
            DIDNode nodeB = store.getNode(didB);
            requireActive(nodeA);
            requireActive(nodeB);

            Instant timestamp = now();
            byte[] payload = LinkPayload.canonical(config.getLinkDomainTag(), didA, didB, timestamp);
            Signature signatureA = signAndVerify(nodeA, privateKeyA, payload);
            Signature signatureB = signAndVerify(nodeB, privateKeyB, payload);

            String clusterId = joinClusters(nodeA, nodeB, timestamp);

            boolean aFirst = LinkPayload.firstOf(didA, didB).equals(didA);
            LinkProof proof = aFirst
                ? new LinkProof(didA, didB, signatureA, signatureB, clusterId, timestamp)
                : new LinkProof(didB, didA, signatureB, signatureA, clusterId, timestamp);
            store.saveProof(proof);
            LOGGER.info(() -> String.format(Locale.ROOT, "[oro-identity] linked %s <-> %s in cluster %s",
                didA, didB, clusterId));
            return proof;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Revokes a node. Revoking an already revoked node returns it unchanged, so callers may retry safely.
     *
     * <p>
     * Only the revoked node changes: it keeps its cluster membership and no other node is touched.
     * </p>
     *
     * @throws DIDNotFoundException when the DID is unknown.
     */
    public DIDNode revokeDid(String did, String reason) throws DIDException {
        Lock lock = store.lock().writeLock();
        lock.lock();
        try {
            DIDNode node = store.getNode(did);
            if (node.isRevoked()) {
                LOGGER.fine(() -> "[oro-identity] " + did + " already revoked");
                return node;
            }
            DIDNode revoked = node.revoked(now(), reason);
            store.saveNode(revoked);
            LOGGER.info(() -> String.format(Locale.ROOT, "[oro-identity] revoked %s (reason=%s)",
                did, revoked.getRevocationReason()));
            return revoked;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resolves the cluster a DID belongs to.
     *
     * @return the cluster, or empty when the node has never been linked.
     * @throws DIDNotFoundException     when the DID is unknown.
     * @throws ClusterNotFoundException when the node references a cluster the store no longer has.
     */
    public Optional<IdentityCluster> resolveIdentity(String did) throws DIDException {
        Lock lock = store.lock().readLock();
        lock.lock();
        try {
            DIDNode node = store.getNode(did);
            if (node.getClusterId() == null) {
                return Optional.empty();
            }
            try {
                return Optional.of(store.getCluster(node.getClusterId()));
            } catch (ClusterNotFoundException ex) {
                LOGGER.severe(() -> String.format(Locale.ROOT,
                    "[oro-identity] store inconsistency: %s points at missing cluster %s", did, node.getClusterId()));
                throw ex;
            }
        } finally {
            lock.unlock();
        }
    }

    public DIDNode getNode(String did) throws DIDNotFoundException {
        Lock lock = store.lock().readLock();
        lock.lock();
        try {
            return store.getNode(did);
        } finally {
            lock.unlock();
        }
    }

    public List<DIDNode> listNodes() {
        Lock lock = store.lock().readLock();
        lock.lock();
        try {
            return store.listNodes();
        } finally {
            lock.unlock();
        }
    }

    public List<IdentityCluster> listClusters() {
        Lock lock = store.lock().readLock();
        lock.lock();
        try {
            return store.listClusters();
        } finally {
            lock.unlock();
        }
    }

    public List<LinkProof> listProofs() {
        Lock lock = store.lock().readLock();
        lock.lock();
        try {
            return store.listProofs();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-checks a stored proof against the current public keys of both DIDs.
     *
     * @return {@code true} when both signatures verify over the canonical payload; {@code false} otherwise,
     *     including when either DID is unknown to this store.
     */
    public boolean verifyLinkProof(LinkProof proof) {
        Objects.requireNonNull(proof, "proof");
        Lock lock = store.lock().readLock();
        lock.lock();
        try {
            if (!store.containsNode(proof.didA()) || !store.containsNode(proof.didB())) {
                return false;
            }
            byte[] payload = LinkPayload.canonical(config.getLinkDomainTag(), proof.didA(), proof.didB(), proof.createdAt());
            return signer.verify(store.getNode(proof.didA()).getPublicKey(), payload, proof.signatureA().value())
                && signer.verify(store.getNode(proof.didB()).getPublicKey(), payload, proof.signatureB().value());
        } catch (DIDNotFoundException ex) {
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the display label of a cluster.
     *
     * @throws ClusterNotFoundException when the cluster is unknown.
     */
    public IdentityCluster setClusterLabel(String clusterId, String label) throws DIDException {
        Lock lock = store.lock().writeLock();
        lock.lock();
        try {
            IdentityCluster updated = store.getCluster(clusterId).withLabel(label);
            store.saveCluster(updated);
            LOGGER.info(() -> String.format(Locale.ROOT, "[oro-identity] cluster %s labelled %s", clusterId, label));
            return updated;
        } finally {
            lock.unlock();
        }
    }

    private void requireActive(DIDNode node) throws DIDRevokedException {
        if (!node.isActive()) {
            LOGGER.warning(() -> "[oro-identity] link rejected, " + node.getDid() + " is revoked");
            throw new DIDRevokedException(node.getDid());
        }
    }

    private Signature signAndVerify(DIDNode node, byte[] privateKey, byte[] payload) throws LinkProofInvalidException {
        String keyId = node.getDid() + IdentityConfig.KEY_ID_SUFFIX;
        SigningResult result;
        try {
            result = signer.sign(privateKey, payload, keyId);
        } catch (DIDException ex) {
            LOGGER.warning(() -> "[oro-identity] link rejected, unusable key for " + node.getDid());
            throw new LinkProofInvalidException("private key for " + node.getDid() + " is unusable: " + ex.getMessage(), ex);
        }
        if (!signer.verify(node.getPublicKey(), payload, result.value())) {
            LOGGER.warning(() -> "[oro-identity] link rejected, signature does not verify for " + node.getDid());
            throw new LinkProofInvalidException("signature for " + node.getDid() + " does not match its public key");
        }
        return new Signature(result.algorithm(), result.value(), result.keyId());
    }

    /**
     * Applies the membership change for a verified link and returns the id of the resulting cluster. Must be called
     * with the write lock held.
     */
    private String joinClusters(DIDNode nodeA, DIDNode nodeB, Instant timestamp) throws DIDException {
        String clusterA = nodeA.getClusterId();
        String clusterB = nodeB.getClusterId();

        if (clusterA == null && clusterB == null) {
            String clusterId = config.getClusterIdGenerator().get();
            if (store.containsCluster(clusterId)) {
                LOGGER.warning(() -> "[oro-identity] cluster id collision on link: " + clusterId);
                throw new ClusterAlreadyExistsException(clusterId);
            }
            IdentityCluster cluster = new IdentityCluster(
                clusterId,
                nodeA.getLabel().isEmpty() ? null : nodeA.getLabel(),
                new LinkedHashSet<>(List.of(nodeA.getDid(), nodeB.getDid())),
                timestamp
            );
            store.saveCluster(cluster);
            store.saveNode(nodeA.withClusterId(cluster.clusterId()));
            store.saveNode(nodeB.withClusterId(cluster.clusterId()));
            LOGGER.info(() -> String.format(Locale.ROOT, "[oro-identity] new cluster %s", cluster.clusterId()));
            return cluster.clusterId();
        }

        if (clusterA == null || clusterB == null) {
            DIDNode joining = clusterA == null ? nodeA : nodeB;
            IdentityCluster existing = store.getCluster(clusterA == null ? clusterB : clusterA);
            store.saveCluster(existing.withMembers(List.of(joining.getDid())));
            store.saveNode(joining.withClusterId(existing.clusterId()));
            return existing.clusterId();
        }

        if (clusterA.equals(clusterB)) {
            LOGGER.fine(() -> "[oro-identity] " + nodeA.getDid() + " and " + nodeB.getDid()
                + " already share cluster " + clusterA);
            return clusterA;
        }

        return merge(store.getCluster(clusterA), store.getCluster(clusterB));
    }

    private String merge(IdentityCluster first, IdentityCluster second) throws DIDException {
        List<IdentityCluster> ordered = new ArrayList<>(Arrays.asList(first, second));
        ordered.sort(SURVIVOR_ORDER);
        IdentityCluster survivor = ordered.get(0);
        IdentityCluster absorbed = ordered.get(1);

        Set<String> moved = absorbed.memberDids();
        List<DIDNode> members = new ArrayList<>(moved.size());
        for (String did : moved) {
            members.add(store.getNode(did));
        }
        for (DIDNode member : members) {
            store.saveNode(member.withClusterId(survivor.clusterId()));
        }
        store.saveCluster(survivor.withMembers(moved));
        store.deleteCluster(absorbed.clusterId());
        LOGGER.info(() -> String.format(Locale.ROOT, "[oro-identity] merged cluster %s into %s (%d members moved)",
            absorbed.clusterId(), survivor.clusterId(), moved.size()));
        return survivor.clusterId();
    }

    private Instant now() {
        return Instant.now(config.getClock());
    }
}
