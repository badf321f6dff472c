package cloud.oro.identity;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The set of DIDs asserted, through link proofs, to represent one real-world identity.
 *
 * <p>
 * Membership is authoritative here; {@link DIDNode#getClusterId()} is only a cached pointer. Members are kept in
 * insertion order and the set is never empty. Revoked nodes stay members so their proofs remain auditable.
 * </p>
 *
 * @param clusterId  generated identifier.
 * @param label      optional display label.
 * @param memberDids member DIDs in the order they joined.
 * @param createdAt  creation time; the older cluster survives a merge.
 */
public record IdentityCluster(String clusterId, String label, Set<String> memberDids, Instant createdAt) {

    public IdentityCluster {
        Objects.requireNonNull(clusterId, "clusterId");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(memberDids, "memberDids");
        if (memberDids.isEmpty()) {
            throw new IllegalArgumentException("cluster " + clusterId + " must have at least one member");
        }
        memberDids = Collections.unmodifiableSet(new LinkedHashSet<>(memberDids));
    }

    public boolean contains(String did) {
        return memberDids.contains(did);
    }

    public int size() {
        return memberDids.size();
    }

    /**
     * Returns a copy with {@code dids} appended; DIDs already present keep their position.
     */
    public IdentityCluster withMembers(Collection<String> dids) {
        Set<String> merged = new LinkedHashSet<>(memberDids);
        merged.addAll(dids);
        return new IdentityCluster(clusterId, label, merged, createdAt);
    }

    public IdentityCluster withLabel(String label) {
        return new IdentityCluster(clusterId, label, memberDids, createdAt);
    }
}
