package cloud.oro.identity.signing;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Canonical byte payload signed by both sides of a link. The layout is
 * {@code <domainTag>\n<firstDid>\n<secondDid>\n<timestamp>} with the DIDs in lexicographic order, so the
 * payload does not depend on which side initiated the link. The domain tag keeps these signatures from being
 * replayed into any other protocol that signs with the same node keys.
 */
public final class LinkPayload {

    public static final String DEFAULT_DOMAIN_TAG = "oro-identity/link-proof/v1";

    private LinkPayload() {
    }

    public static byte[] canonical(String domainTag, String didA, String didB, Instant timestamp) {
        Objects.requireNonNull(domainTag, "domainTag");
        Objects.requireNonNull(didA, "didA");
        Objects.requireNonNull(didB, "didB");
        Objects.requireNonNull(timestamp, "timestamp");
        if (domainTag.indexOf('\n') >= 0 || didA.indexOf('\n') >= 0 || didB.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("link payload fields must not contain line breaks");
        }
        String first = firstOf(didA, didB);
        String second = first.equals(didA) ? didB : didA;
        String text = domainTag + '\n' + first + '\n' + second + '\n' + DateTimeFormatter.ISO_INSTANT.format(timestamp);
        return text.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Returns whichever DID sorts first; that DID is stored as {@code didA} of a link proof.
     */
    public static String firstOf(String didA, String didB) {
        return didA.compareTo(didB) <= 0 ? didA : didB;
    }
}
