package cloud.oro.identity;

import cloud.oro.identity.signing.LinkPayload;
import cloud.oro.identity.signing.LocalSigner;
import cloud.oro.identity.signing.Signer;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Immutable configuration container used to bootstrap {@link DIDManager} instances.
 */
public final class IdentityConfig {

    public static final String DEFAULT_DID_METHOD = "oro";
    public static final String DEFAULT_LINK_DOMAIN_TAG = LinkPayload.DEFAULT_DOMAIN_TAG;
    public static final String KEY_ID_SUFFIX = "#keys-1";

    private static final Pattern DID_METHOD = Pattern.compile("[a-z0-9]+");

    private final String didMethod;
    private final String linkDomainTag;
    private final Clock clock;
    private final Signer signer;
    private final Supplier<String> clusterIdGenerator;

    private IdentityConfig(Builder builder) {
        this.didMethod = builder.didMethod;
        this.linkDomainTag = builder.linkDomainTag;
        this.clock = builder.clock;
        this.signer = builder.signer;
        this.clusterIdGenerator = builder.clusterIdGenerator;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static IdentityConfig defaults() {
        return builder().build();
    }

    public IdentityConfig withDefaults() {
        String method = Optional.ofNullable(didMethod)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(DEFAULT_DID_METHOD)
            .toLowerCase(Locale.ROOT);
        if (!DID_METHOD.matcher(method).matches()) {
            throw new IllegalArgumentException("unsupported DID method " + didMethod);
        }

        String tag = Optional.ofNullable(linkDomainTag)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(DEFAULT_LINK_DOMAIN_TAG);
        if (tag.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("LinkDomainTag must be a single line");
        }

        return new Builder()
            .didMethod(method)
            .linkDomainTag(tag)
            .clock(Optional.ofNullable(clock).orElseGet(Clock::systemUTC))
            .signer(Optional.ofNullable(signer).orElseGet(LocalSigner::new))
            .clusterIdGenerator(Optional.ofNullable(clusterIdGenerator).orElse(() -> UUID.randomUUID().toString()))
            .buildInternal();
    }

    public String getDidMethod() {
        return didMethod;
    }

    public String getLinkDomainTag() {
        return linkDomainTag;
    }

    public Clock getClock() {
        return clock;
    }

    public Signer getSigner() {
        return signer;
    }

    public Supplier<String> getClusterIdGenerator() {
        return clusterIdGenerator;
    }

    public static final class Builder {
        private String didMethod;
        private String linkDomainTag;
        private Clock clock;
        private Signer signer;
        private Supplier<String> clusterIdGenerator;

        public Builder didMethod(String didMethod) {
            this.didMethod = didMethod;
            return this;
        }

        public Builder linkDomainTag(String linkDomainTag) {
            this.linkDomainTag = linkDomainTag;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder signer(Signer signer) {
            this.signer = signer;
            return this;
        }

        public Builder clusterIdGenerator(Supplier<String> clusterIdGenerator) {
            this.clusterIdGenerator = clusterIdGenerator;
            return this;
        }

        public IdentityConfig build() {
            return new IdentityConfig(this).withDefaults();
        }

        private IdentityConfig buildInternal() {
            return new IdentityConfig(this);
        }
    }
}
