package cloud.oro.identity.signing;

import java.util.Objects;

/**
 * Raw Ed25519 key material for a single node: the 32-byte private seed and the 32-byte public key.
 * Arrays are copied on the way in and out.
 */
public final class NodeKeyPair {

    private final byte[] privateKey;
    private final byte[] publicKey;

    public NodeKeyPair(byte[] privateKey, byte[] publicKey) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey").clone();
        this.publicKey = Objects.requireNonNull(publicKey, "publicKey").clone();
    }

    public byte[] getPrivateKey() {
        return privateKey.clone();
    }

    public byte[] getPublicKey() {
        return publicKey.clone();
    }

    @Override
    public String toString() {
        return "NodeKeyPair[publicKey=" + Ed25519.hex(publicKey) + "]";
    }
}
