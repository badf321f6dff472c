package cloud.oro.identity.signing;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.bouncycastle.util.encoders.Hex;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.Objects;

/**
 * Ed25519 key generation, signing, verification and DID derivation over raw key bytes.
 * Private keys are 32-byte seeds, public keys are 32 bytes and signatures are 64 bytes.
 */
public final class Ed25519 {

    public static final int KEY_LENGTH = 32;
    public static final int SIGNATURE_LENGTH = 64;

    private static final SecureRandom RANDOM = new SecureRandom();

    private Ed25519() {
    }

    public static NodeKeyPair generate() {
        Ed25519PrivateKeyParameters privateKey = new Ed25519PrivateKeyParameters(RANDOM);
        Ed25519PublicKeyParameters publicKey = privateKey.generatePublicKey();
        return new NodeKeyPair(privateKey.getEncoded(), publicKey.getEncoded());
    }

    /**
     * Reconstructs the public half of a key pair from its private seed.
     *
     * @throws IllegalArgumentException when the seed is not 32 bytes.
     */
    public static NodeKeyPair fromPrivateKey(byte[] privateKey) {
        Ed25519PrivateKeyParameters params = privateParameters(privateKey);
        return new NodeKeyPair(params.getEncoded(), params.generatePublicKey().getEncoded());
    }

    /**
     * Signs {@code payload}. Ed25519 signing is deterministic for a given key and message.
     *
     * @throws IllegalArgumentException when the private key is not a 32-byte seed.
     */
    public static byte[] sign(byte[] privateKey, byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, privateParameters(privateKey));
        signer.update(payload, 0, payload.length);
        return signer.generateSignature();
    }

    /**
     * Returns {@code true} only when {@code signature} is a valid signature of {@code payload} under
     * {@code publicKey}. Malformed input yields {@code false}, never an exception.
     */
    public static boolean verify(byte[] publicKey, byte[] payload, byte[] signature) {
        if (publicKey == null || payload == null || signature == null) {
            return false;
        }
        if (publicKey.length != KEY_LENGTH || signature.length != SIGNATURE_LENGTH) {
            return false;
        }
        try {
            Ed25519Signer verifier = new Ed25519Signer();
            verifier.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
            verifier.update(payload, 0, payload.length);
            return verifier.verifySignature(signature);
        } catch (RuntimeException ex) {
            // point decoding failures on garbage keys
            return false;
        }
    }

    /**
     * Derives {@code did:<method>:<hex(publicKey)>}. Same key and method always give the same DID.
     */
    public static String deriveDid(byte[] publicKey, String method) {
        Objects.requireNonNull(publicKey, "publicKey");
        String resolvedMethod = Objects.requireNonNull(method, "method").trim().toLowerCase(Locale.ROOT);
        if (resolvedMethod.isEmpty()) {
            throw new IllegalArgumentException("DID method must be non-empty");
        }
        if (publicKey.length != KEY_LENGTH) {
            throw new IllegalArgumentException("public key must be " + KEY_LENGTH + " bytes");
        }
        return "did:" + resolvedMethod + ":" + hex(publicKey);
    }

    static String hex(byte[] bytes) {
        return Hex.toHexString(bytes);
    }

    private static Ed25519PrivateKeyParameters privateParameters(byte[] privateKey) {
        if (privateKey == null || privateKey.length != KEY_LENGTH) {
            throw new IllegalArgumentException("private key must be a " + KEY_LENGTH + "-byte seed");
        }
        return new Ed25519PrivateKeyParameters(privateKey, 0);
    }
}
