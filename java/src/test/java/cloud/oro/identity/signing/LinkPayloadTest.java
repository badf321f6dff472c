package cloud.oro.identity.signing;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LinkPayloadTest {

    private static final Instant AT = Instant.parse("2026-03-01T10:15:30Z");

    @Test
    void payloadIsIndependentOfArgumentOrder() {
        byte[] forward = LinkPayload.canonical("tag", "did:oro:aa", "did:oro:bb", AT);
        byte[] reverse = LinkPayload.canonical("tag", "did:oro:bb", "did:oro:aa", AT);

        assertArrayEquals(forward, reverse);
    }

    @Test
    void payloadBindsTagDidsAndTimestamp() {
        String text = new String(LinkPayload.canonical("tag", "did:oro:bb", "did:oro:aa", AT), StandardCharsets.UTF_8);

        assertEquals("tag\ndid:oro:aa\ndid:oro:bb\n2026-03-01T10:15:30Z", text);
    }

    @Test
    void differentDomainTagsGiveDifferentPayloads() {
        assertFalse(java.util.Arrays.equals(
            LinkPayload.canonical("tag-1", "did:oro:aa", "did:oro:bb", AT),
            LinkPayload.canonical("tag-2", "did:oro:aa", "did:oro:bb", AT)));
    }

    @Test
    void rejectsLineBreaksInFields() {
        assertThrows(IllegalArgumentException.class,
            () -> LinkPayload.canonical("tag", "did:oro:aa\ndid:oro:cc", "did:oro:bb", AT));
    }

    @Test
    void firstOfPicksLexicographicallySmaller() {
        assertEquals("did:oro:aa", LinkPayload.firstOf("did:oro:bb", "did:oro:aa"));
        assertEquals("did:oro:aa", LinkPayload.firstOf("did:oro:aa", "did:oro:bb"));
    }
}
