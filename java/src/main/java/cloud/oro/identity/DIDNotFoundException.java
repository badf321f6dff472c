package cloud.oro.identity;

/**
 * Raised when an operation references a DID the store does not know.
 */
public class DIDNotFoundException extends DIDException {

    private static final long serialVersionUID = 1L;

    private final String did;

    public DIDNotFoundException(String did) {
        super("DID not found: " + did);
        this.did = did;
    }

    public String getDid() {
        return did;
    }
}
