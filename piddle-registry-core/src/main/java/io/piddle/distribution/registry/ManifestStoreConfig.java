package io.piddle.distribution.registry;

import java.time.Clock;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings of {@link InMemoryManifestService}.
 *
 * <p>Can be read from properties:
 * <pre>
 * piddle.manifests.max-payload-bytes=4194304
 * piddle.manifests.verify-on-put=true
 * </pre>
 */
public final class ManifestStoreConfig {

    public static final String PREFIX = "piddle.manifests.";
    public static final String MAX_PAYLOAD_BYTES = PREFIX + "max-payload-bytes";
    public static final String VERIFY_ON_PUT = PREFIX + "verify-on-put";

    /** 4 MiB, the manifest body limit registries commonly enforce. */
    public static final long DEFAULT_MAX_PAYLOAD_BYTES = 4L * 1024 * 1024;

    private final long maxPayloadBytes;
    private final boolean verifyOnPut;
    private final Clock clock;

    private ManifestStoreConfig(Builder b) {
        this.maxPayloadBytes = b.maxPayloadBytes;
        this.verifyOnPut = b.verifyOnPut;
        this.clock = b.clock;
    }

    public static ManifestStoreConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the {@code piddle.manifests.*} keys; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static ManifestStoreConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        Builder b = builder();
        String max = props.getProperty(MAX_PAYLOAD_BYTES);
        if (max != null) {
            try {
                b.maxPayloadBytes(Long.parseLong(max.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(MAX_PAYLOAD_BYTES + " must be a number: " + max, e);
            }
        }
        String verify = props.getProperty(VERIFY_ON_PUT);
        if (verify != null) {
            String v = verify.trim();
            if (!v.equalsIgnoreCase("true") && !v.equalsIgnoreCase("false")) {
                throw new IllegalArgumentException(VERIFY_ON_PUT + " must be true or false: " + verify);
            }
            b.verifyOnPut(Boolean.parseBoolean(v));
        }
        return b.build();
    }

    /**
     * Largest payload {@code put} accepts.
     */
    public long maxPayloadBytes() {
        return maxPayloadBytes;
    }

    /**
     * Whether {@code put} checks the payload can be read back through the schema registry.
     */
    public boolean verifyOnPut() {
        return verifyOnPut;
    }

    public Clock clock() {
        return clock;
    }

    public static final class Builder {
        private long maxPayloadBytes = DEFAULT_MAX_PAYLOAD_BYTES;
        private boolean verifyOnPut = true;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder maxPayloadBytes(long maxPayloadBytes) {
            if (maxPayloadBytes <= 0) {
                throw new IllegalArgumentException("maxPayloadBytes must be positive");
            }
            this.maxPayloadBytes = maxPayloadBytes;
            return this;
        }

        public Builder verifyOnPut(boolean verifyOnPut) {
            this.verifyOnPut = verifyOnPut;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public ManifestStoreConfig build() {
            return new ManifestStoreConfig(this);
        }
    }
}
