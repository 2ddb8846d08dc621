package io.piddle.distribution.spi;

import io.piddle.distribution.core.Manifest;

import java.util.Objects;

/**
 * A manifest schema: the media type it is served under and how to revive it from bytes.
 *
 * <p>This SPI keeps schema dispatch independent of any specific schema or serialization
 * library. Implementations live in separate modules.
 */
public interface ManifestSchema extends ManifestUnmarshaller {

    /**
     * Exact media type handled by this schema, or the empty string for a default schema that
     * serves requests whose Content-Type matches nothing else.
     */
    String mediaType();

    static ManifestSchema of(String mediaType, ManifestUnmarshaller unmarshaller) {
        Objects.requireNonNull(mediaType, "mediaType");
        Objects.requireNonNull(unmarshaller, "unmarshaller");
        return new ManifestSchema() {
            @Override
            public String mediaType() {
                return mediaType;
            }

            @Override
            public Manifest unmarshal(byte[] payload) {
                return unmarshaller.unmarshal(payload);
            }

            @Override
            public String toString() {
                return "ManifestSchema[" + mediaType + "]";
            }
        };
    }
}
