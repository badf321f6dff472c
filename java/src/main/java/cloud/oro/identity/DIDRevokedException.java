package cloud.oro.identity;

/**
 * Raised when a link is attempted against a revoked node.
 */
public class DIDRevokedException extends DIDException {

    private static final long serialVersionUID = 1L;

    private final String did;

    public DIDRevokedException(String did) {
        super("DID is revoked: " + did);
        this.did = did;
    }

    public String getDid() {
        return did;
    }
}
