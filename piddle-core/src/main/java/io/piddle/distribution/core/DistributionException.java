package io.piddle.distribution.core;

/**
 * Base class for manifest and schema related exceptions.
 *
 * <p>Provides a common hierarchy for registry-level errors. Subclasses name the offending
 * value (media type, digest, expected/actual) so that collaborators can translate them into
 * protocol responses without parsing messages.
 */
public abstract class DistributionException extends RuntimeException {

    protected DistributionException(String message) {
        super(message);
    }

    protected DistributionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a Content-Type header cannot be parsed as a media type.
     */
    public static class MediaTypeParse extends DistributionException {
        private final String header;

        public MediaTypeParse(String header, String reason) {
            super("malformed media type '" + header + "': " + reason);
            this.header = header;
        }

        public String header() {
            return header;
        }
    }

    /**
     * Raised when neither an exact nor a default manifest schema is registered for a media type.
     */
    public static class UnsupportedMediaType extends DistributionException {
        private final String mediaType;

        public UnsupportedMediaType(String mediaType) {
            this(mediaType, "unsupported manifest media type and no default available: " + mediaType);
        }

        public UnsupportedMediaType(String mediaType, String message) {
            super(message);
            this.mediaType = mediaType;
        }

        public String mediaType() {
            return mediaType;
        }
    }

    /**
     * Raised when a media type is registered a second time.
     */
    public static class DuplicateRegistration extends DistributionException {
        private final String mediaType;

        public DuplicateRegistration(String mediaType) {
            super("manifest media type registration would overwrite existing: " + mediaType);
            this.mediaType = mediaType;
        }

        public String mediaType() {
            return mediaType;
        }
    }

    /**
     * Raised when the media type declared inside a manifest disagrees with its schema.
     */
    public static class SchemaMismatch extends DistributionException {
        private final String expected;
        private final String actual;

        public SchemaMismatch(String expected, String actual) {
            super("mediaType in manifest should be '" + expected + "' not '" + actual + "'");
            this.expected = expected;
            this.actual = actual;
        }

        public String expected() {
            return expected;
        }

        public String actual() {
            return actual;
        }
    }

    /**
     * Raised when a manifest is serialized before its canonical bytes were established.
     */
    public static class UninitializedManifest extends DistributionException {
        public UninitializedManifest(String message) {
            super(message);
        }
    }

    /**
     * Raised when no manifest is stored under a digest.
     */
    public static class ManifestNotFound extends DistributionException {
        private final Digest digest;

        public ManifestNotFound(Digest digest) {
            super("unknown manifest " + digest);
            this.digest = digest;
        }

        public Digest digest() {
            return digest;
        }
    }

    /**
     * Raised when a manifest fails structural validation.
     */
    public static class ManifestInvalid extends DistributionException {
        public ManifestInvalid(String message) {
            super(message);
        }

        public ManifestInvalid(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a builder is handed a reference its schema cannot hold.
     */
    public static class UnsupportedDependency extends DistributionException {
        private final String mediaType;

        public UnsupportedDependency(String mediaType) {
            super("unsupported dependency media type: " + mediaType);
            this.mediaType = mediaType;
        }

        public String mediaType() {
            return mediaType;
        }
    }

    /**
     * Raised when a builder is finalized with required fields missing.
     */
    public static class Build extends DistributionException {
        public Build(String message) {
            super(message);
        }
    }

    /**
     * Raised when an operation's context was cancelled or its deadline passed.
     */
    public static class Cancelled extends DistributionException {
        public Cancelled(String message) {
            super(message);
        }
    }

    /**
     * Raised when a digest string is not of the form {@code <algorithm>:<hex>}.
     */
    public static class InvalidDigest extends DistributionException {
        private final String value;

        public InvalidDigest(String value, String reason) {
            super("invalid digest '" + value + "': " + reason);
            this.value = value;
        }

        public String value() {
            return value;
        }
    }
}
