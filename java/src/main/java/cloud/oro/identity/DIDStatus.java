package cloud.oro.identity;

import java.util.Locale;

/**
 * Lifecycle state of a {@link DIDNode}. {@link #REVOKED} is terminal.
 */
public enum DIDStatus {
    ACTIVE("active"),
    REVOKED("revoked");

    private final String value;

    DIDStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static DIDStatus fromValue(String value) {
        String trimmed = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (DIDStatus status : values()) {
            if (status.value.equals(trimmed)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown DID status " + value);
    }
}
