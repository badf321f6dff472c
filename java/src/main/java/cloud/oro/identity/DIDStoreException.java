package cloud.oro.identity;

/**
 * Raised when a persisted identity store cannot be read, decoded or written.
 */
public class DIDStoreException extends DIDException {

    private static final long serialVersionUID = 1L;

    public DIDStoreException(String message) {
        super(message);
    }

    public DIDStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
