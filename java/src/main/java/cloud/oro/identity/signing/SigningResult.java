package cloud.oro.identity.signing;

/**
 * Output of a {@link Signer}: algorithm identifier, base64 signature value and the key reference it was made with.
 */
public record SigningResult(String algorithm, String value, String keyId) {
}
