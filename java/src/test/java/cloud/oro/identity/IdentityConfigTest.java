package cloud.oro.identity;

import cloud.oro.identity.signing.LocalSigner;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class IdentityConfigTest {

    @Test
    void appliesDefaultsForOptionalFields() {
        IdentityConfig config = IdentityConfig.builder().build();

        assertEquals(IdentityConfig.DEFAULT_DID_METHOD, config.getDidMethod());
        assertEquals(IdentityConfig.DEFAULT_LINK_DOMAIN_TAG, config.getLinkDomainTag());
        assertNotNull(config.getClock());
        assertInstanceOf(LocalSigner.class, config.getSigner());
        assertNotNull(config.getClusterIdGenerator().get());
        assertNotEquals(config.getClusterIdGenerator().get(), config.getClusterIdGenerator().get());
    }

    @Test
    void normalisesDidMethod() {
        IdentityConfig config = IdentityConfig.builder().didMethod(" Valence ").build();

        assertEquals("valence", config.getDidMethod());
    }

    @Test
    void rejectsInvalidDidMethod() {
        IdentityConfig.Builder builder = IdentityConfig.builder().didMethod("not:valid");

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void rejectsMultiLineDomainTag() {
        IdentityConfig.Builder builder = IdentityConfig.builder().linkDomainTag("a\nb");

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void honoursCustomCollaborators() {
        Clock clock = TickingClock.startingAt("2026-01-01T00:00:00Z");
        IdentityConfig config = IdentityConfig.builder()
            .clock(clock)
            .linkDomainTag("custom/v2")
            .clusterIdGenerator(() -> "fixed")
            .build();

        assertSame(clock, config.getClock());
        assertEquals("custom/v2", config.getLinkDomainTag());
        assertEquals("fixed", config.getClusterIdGenerator().get());
    }
}
