package cloud.oro.identity;

import java.time.Instant;
import java.util.Objects;

/**
 * Bidirectional evidence that two nodes consented to share a cluster. Both signatures cover the same canonical
 * payload (see {@link cloud.oro.identity.signing.LinkPayload}) and the DIDs are held in lexicographic order,
 * with each signature paired to its DID. Proofs are never mutated or deleted.
 *
 * @param didA       DID that sorts first.
 * @param didB       DID that sorts second.
 * @param signatureA signature by {@code didA}'s key.
 * @param signatureB signature by {@code didB}'s key.
 * @param clusterId  cluster the link resulted in.
 * @param createdAt  timestamp bound into the signed payload.
 */
public record LinkProof(
    String didA,
    String didB,
    Signature signatureA,
    Signature signatureB,
    String clusterId,
    Instant createdAt
) {

    public LinkProof {
        Objects.requireNonNull(didA, "didA");
        Objects.requireNonNull(didB, "didB");
        Objects.requireNonNull(signatureA, "signatureA");
        Objects.requireNonNull(signatureB, "signatureB");
        Objects.requireNonNull(clusterId, "clusterId");
        Objects.requireNonNull(createdAt, "createdAt");
        if (didA.compareTo(didB) > 0) {
            throw new IllegalArgumentException("link proof DIDs must be in canonical order");
        }
    }
}
