package cloud.oro.identity;

/**
 * Raised when the configured cluster id generator returns an id that is already stored.
 */
public class ClusterAlreadyExistsException extends DIDException {

    private static final long serialVersionUID = 1L;

    private final String clusterId;

    public ClusterAlreadyExistsException(String clusterId) {
        super("cluster already exists: " + clusterId);
        this.clusterId = clusterId;
    }

    public String getClusterId() {
        return clusterId;
    }
}
