package cloud.oro.identity;

/**
 * Base exception thrown by identity operations. Every subclass is a recoverable, per-call failure: the
 * {@link DIDManager} and its store remain usable after any of them.
 */
public class DIDException extends Exception {

    private static final long serialVersionUID = 1L;

    public DIDException(String message) {
        super(message);
    }

    public DIDException(String message, Throwable cause) {
        super(message, cause);
    }
}
