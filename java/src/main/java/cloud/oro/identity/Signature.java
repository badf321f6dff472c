package cloud.oro.identity;

/**
 * One side's signature inside a {@link LinkProof}: the algorithm used, the signature value (base64 encoded), and
 * the key identifier, which is the signing DID followed by {@link IdentityConfig#KEY_ID_SUFFIX}.
 *
 * @param algorithm signing algorithm identifier (for example {@code EdDSA}).
 * @param value     base64 encoded signature material.
 * @param keyId     key reference of the signing node.
 */
public record Signature(String algorithm, String value, String keyId) {
}
