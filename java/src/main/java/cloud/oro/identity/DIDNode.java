package cloud.oro.identity;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A single node identity: one DID backed by its own Ed25519 keypair.
 *
 * <p>
 * Instances are immutable. {@link DIDManager} writes changed copies through the store. The private key is only
 * populated on the instance returned by {@link DIDManager#createDid(String)}; stored instances never carry it and
 * it is excluded from {@link #equals(Object)}.
 * </p>
 */
public final class DIDNode {

    private final String did;
    private final byte[] publicKey;
    private final byte[] privateKey;
    private final String label;
    private final DIDStatus status;
    private final String clusterId;
    private final Instant createdAt;
    private final Instant revokedAt;
    private final String revocationReason;

    private DIDNode(Builder builder) {
        this.did = Objects.requireNonNull(builder.did, "did");
        this.publicKey = Objects.requireNonNull(builder.publicKey, "publicKey").clone();
        this.privateKey = builder.privateKey == null ? null : builder.privateKey.clone();
        this.label = builder.label == null ? "" : builder.label;
        this.status = builder.status == null ? DIDStatus.ACTIVE : builder.status;
        this.clusterId = builder.clusterId;
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt");
        this.revokedAt = builder.revokedAt;
        this.revocationReason = builder.revocationReason;
        if (!did.startsWith("did:")) {
            throw new IllegalArgumentException("DID must start with 'did:': " + did);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .did(did)
            .publicKey(publicKey)
            .privateKey(privateKey)
            .label(label)
            .status(status)
            .clusterId(clusterId)
            .createdAt(createdAt)
            .revokedAt(revokedAt)
            .revocationReason(revocationReason);
    }

    public String getDid() {
        return did;
    }

    public byte[] getPublicKey() {
        return publicKey.clone();
    }

    /**
     * Private seed of this node, or {@code null} for every instance except the one handed out at creation.
     */
    public byte[] getPrivateKey() {
        return privateKey == null ? null : privateKey.clone();
    }

    public boolean hasPrivateKey() {
        return privateKey != null;
    }

    public String getLabel() {
        return label;
    }

    public DIDStatus getStatus() {
        return status;
    }

    public String getClusterId() {
        return clusterId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getRevokedAt() {
        return revokedAt;
    }

    public String getRevocationReason() {
        return revocationReason;
    }

    public boolean isActive() {
        return status == DIDStatus.ACTIVE;
    }

    public boolean isRevoked() {
        return status == DIDStatus.REVOKED;
    }

    public DIDNode withoutPrivateKey() {
        if (privateKey == null) {
            return this;
        }
        return toBuilder().privateKey(null).build();
    }

    public DIDNode withClusterId(String clusterId) {
        return toBuilder().clusterId(clusterId).build();
    }

    public DIDNode revoked(Instant revokedAt, String reason) {
        return toBuilder()
            .status(DIDStatus.REVOKED)
            .revokedAt(Objects.requireNonNull(revokedAt, "revokedAt"))
            .revocationReason(reason == null ? "" : reason)
            .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DIDNode)) {
            return false;
        }
        DIDNode other = (DIDNode) o;
        return did.equals(other.did)
            && Arrays.equals(publicKey, other.publicKey)
            && label.equals(other.label)
            && status == other.status
            && Objects.equals(clusterId, other.clusterId)
            && createdAt.equals(other.createdAt)
            && Objects.equals(revokedAt, other.revokedAt)
            && Objects.equals(revocationReason, other.revocationReason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(did, label, status, clusterId, createdAt, revokedAt, revocationReason);
    }

    @Override
    public String toString() {
        return "DIDNode[did=" + did + ", label=" + label + ", status=" + status.value()
            + ", clusterId=" + clusterId + "]";
    }

    public static final class Builder {
        private String did;
        private byte[] publicKey;
        private byte[] privateKey;
        private String label;
        private DIDStatus status;
        private String clusterId;
        private Instant createdAt;
        private Instant revokedAt;
        private String revocationReason;

        public Builder did(String did) {
            this.did = did;
            return this;
        }

        public Builder publicKey(byte[] publicKey) {
            this.publicKey = publicKey == null ? null : publicKey.clone();
            return this;
        }

        public Builder privateKey(byte[] privateKey) {
            this.privateKey = privateKey == null ? null : privateKey.clone();
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder status(DIDStatus status) {
            this.status = status;
            return this;
        }

        public Builder clusterId(String clusterId) {
            this.clusterId = clusterId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder revokedAt(Instant revokedAt) {
            this.revokedAt = revokedAt;
            return this;
        }

        public Builder revocationReason(String revocationReason) {
            this.revocationReason = revocationReason;
            return this;
        }

        public DIDNode build() {
            return new DIDNode(this);
        }
    }
}
