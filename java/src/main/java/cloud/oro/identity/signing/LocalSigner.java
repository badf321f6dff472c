package cloud.oro.identity.signing;

import cloud.oro.identity.DIDException;

import java.util.Base64;
import java.util.Objects;

/**
 * Signer implementation that performs Ed25519 operations in-process with caller-supplied key material.
 * Nothing is retained between calls.
 */
public final class LocalSigner implements Signer {

    public static final String ALGORITHM = "EdDSA";

    @Override
    public NodeKeyPair generate() {
        return Ed25519.generate();
    }

    @Override
    public SigningResult sign(byte[] privateKey, byte[] payload, String keyId) throws DIDException {
        Objects.requireNonNull(payload, "payload");
        byte[] signature;
        try {
            signature = Ed25519.sign(privateKey, payload);
        } catch (IllegalArgumentException ex) {
            throw new DIDException("sign payload: " + ex.getMessage(), ex);
        }
        return new SigningResult(ALGORITHM, Base64.getEncoder().encodeToString(signature), keyId);
    }

    @Override
    public boolean verify(byte[] publicKey, byte[] payload, String signatureValue) {
        if (signatureValue == null || signatureValue.isBlank()) {
            return false;
        }
        byte[] signature;
        try {
            signature = Base64.getDecoder().decode(signatureValue);
        } catch (IllegalArgumentException ex) {
            return false;
        }
        return Ed25519.verify(publicKey, payload, signature);
    }
}
