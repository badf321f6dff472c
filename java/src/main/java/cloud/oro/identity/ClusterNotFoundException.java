package cloud.oro.identity;

/**
 * Raised when a cluster id cannot be resolved. When it surfaces from {@link DIDManager#resolveIdentity(String)}
 * a node points at a cluster that no longer exists, which means the store is inconsistent.
 */
public class ClusterNotFoundException extends DIDException {

    private static final long serialVersionUID = 1L;

    private final String clusterId;

    public ClusterNotFoundException(String clusterId) {
        super("cluster not found: " + clusterId);
        this.clusterId = clusterId;
    }

    public String getClusterId() {
        return clusterId;
    }
}
