package cloud.oro.identity.signing;

import cloud.oro.identity.DIDException;

/**
 * Key generation and signature seam used by {@link cloud.oro.identity.DIDManager}.
 */
public interface Signer {

    NodeKeyPair generate();

    SigningResult sign(byte[] privateKey, byte[] payload, String keyId) throws DIDException;

    boolean verify(byte[] publicKey, byte[] payload, String signatureValue);
}
