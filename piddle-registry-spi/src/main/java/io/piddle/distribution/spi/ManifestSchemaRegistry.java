package io.piddle.distribution.spi;

import io.piddle.distribution.core.Descriptor;
import io.piddle.distribution.core.Digest;
import io.piddle.distribution.core.DistributionException;
import io.piddle.distribution.core.Manifest;
import io.piddle.distribution.core.MediaTypes;
import io.piddle.distribution.core.Payload;

import java.util.*;

/**
 * Registry that resolves a {@link ManifestUnmarshaller} for a manifest media type.
 *
 * <p>Use {@link #builder()} to create a registry with explicit schema registration:
 * <pre>{@code
 * ManifestSchemaRegistry registry = ManifestSchemaRegistry.builder()
 *     .register(ImageIndexSchema.INSTANCE)
 *     .build();
 * UnmarshalledManifest m = registry.unmarshal(request.contentType(), request.body());
 * }</pre>
 *
 * <p>Built registries are immutable and safe for concurrent lookup without locking. All
 * registration happens before a registry is handed to request-serving code.
 */
public interface ManifestSchemaRegistry {

    /**
     * Key of the default schema, used when a Content-Type is absent or matches nothing.
     */
    String DEFAULT_MEDIA_TYPE = "";

    /**
     * Find the schema registered under exactly this media type.
     *
     * @param mediaType bare, lower-cased media type ({@link #DEFAULT_MEDIA_TYPE} for the default)
     */
    Optional<ManifestUnmarshaller> find(String mediaType);

    /**
     * Registered media types, excluding the default. Iteration order is unspecified.
     */
    Set<String> mediaTypes();

    /**
     * Reconstructs a manifest from a Content-Type header and the exact bytes received.
     *
     * <p>The header's parameters are ignored. When no schema matches the media type, the
     * default schema is used if one is registered. The returned descriptor is computed from
     * {@code payload} itself, never from a re-encoded form, so it verifies against the bytes
     * that will later be stored.
     *
     * @throws DistributionException.MediaTypeParse if the header is malformed
     * @throws DistributionException.UnsupportedMediaType if neither the media type nor a default is registered
     */
    default UnmarshalledManifest unmarshal(String contentType, byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        String mediaType = MediaTypes.mediaTypeOf(contentType);
        ManifestUnmarshaller unmarshaller = find(mediaType)
                .or(() -> find(DEFAULT_MEDIA_TYPE))
                .orElseThrow(() -> new DistributionException.UnsupportedMediaType(mediaType));

        // the schema owns its copy; digest and size describe the same snapshot
        byte[] received = payload.clone();
        Digest digest = Digest.fromBytes(received);
        Manifest manifest = unmarshaller.unmarshal(received.clone());

        Payload reserialized = manifest.payload();
        if (!Arrays.equals(reserialized.bytes(), received)) {
            throw new DistributionException.ManifestInvalid(
                    "schema for '" + mediaType + "' did not preserve the received bytes");
        }
        return new UnmarshalledManifest(manifest, new Descriptor(reserialized.mediaType(), digest, received.length));
    }

    /**
     * Creates a new builder for constructing a registry with explicit schema registration.
     */
    static Builder builder() {
        return new Builder();
    }

    /**
     * A registry with no schemas: every media type is unsupported.
     */
    static ManifestSchemaRegistry empty() {
        return builder().build();
    }

    /**
     * Builder for creating a {@link ManifestSchemaRegistry}. Each media type may be registered
     * once; a second registration fails and leaves the first in place.
     */
    final class Builder {
        private final Map<String, ManifestUnmarshaller> schemas = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Register a schema under its {@link ManifestSchema#mediaType()}.
         *
         * @throws DistributionException.DuplicateRegistration if the media type is already registered
         */
        public Builder register(ManifestSchema schema) {
            Objects.requireNonNull(schema, "schema");
            return register(schema.mediaType(), schema);
        }

        /**
         * Register an unmarshaller for a media type. The empty string registers the default.
         *
         * @throws DistributionException.MediaTypeParse if {@code mediaType} is not a valid media type
         * @throws DistributionException.DuplicateRegistration if the media type is already registered
         */
        public Builder register(String mediaType, ManifestUnmarshaller unmarshaller) {
            Objects.requireNonNull(mediaType, "mediaType");
            Objects.requireNonNull(unmarshaller, "unmarshaller");
            String key = MediaTypes.mediaTypeOf(mediaType);
            if (schemas.containsKey(key)) {
                throw new DistributionException.DuplicateRegistration(key);
            }
            schemas.put(key, unmarshaller);
            return this;
        }

        /**
         * Register multiple schemas, stopping at the first duplicate.
         */
        public Builder registerAll(Iterable<? extends ManifestSchema> schemas) {
            for (ManifestSchema schema : schemas) {
                register(schema);
            }
            return this;
        }

        /**
         * Build the registry.
         *
         * @return an immutable registry containing the registered schemas
         */
        public ManifestSchemaRegistry build() {
            Map<String, ManifestUnmarshaller> snapshot = Map.copyOf(schemas);
            Set<String> mediaTypes = new HashSet<>(snapshot.keySet());
            mediaTypes.remove(DEFAULT_MEDIA_TYPE);
            Set<String> advertised = Set.copyOf(mediaTypes);
            return new ManifestSchemaRegistry() {
                @Override
                public Optional<ManifestUnmarshaller> find(String mediaType) {
                    if (mediaType == null) return Optional.empty();
                    return Optional.ofNullable(snapshot.get(mediaType));
                }

                @Override
                public Set<String> mediaTypes() {
                    return advertised;
                }
            };
        }
    }
}
