package cloud.oro.identity;

/**
 * Raised when a freshly derived DID is already present in the store.
 */
public class DIDAlreadyExistsException extends DIDException {

    private static final long serialVersionUID = 1L;

    private final String did;

    public DIDAlreadyExistsException(String did) {
        super("DID already exists: " + did);
        this.did = did;
    }

    public String getDid() {
        return did;
    }
}
