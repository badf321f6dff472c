package cloud.oro.identity;

/**
 * Raised when a link signature does not verify against the stored public key of its DID.
 */
public class LinkProofInvalidException extends DIDException {

    private static final long serialVersionUID = 1L;

    public LinkProofInvalidException(String message) {
        super(message);
    }

    public LinkProofInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
