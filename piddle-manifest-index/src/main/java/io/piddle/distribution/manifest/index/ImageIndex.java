package io.piddle.distribution.manifest.index;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.piddle.distribution.core.Descriptor;
import io.piddle.distribution.core.Versioned;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured fields of an image index.
 *
 * @param schemaVersion schema version marker, {@link ImageIndexMediaTypes#SCHEMA_VERSION}
 * @param mediaType     declared media type, {@link ImageIndexMediaTypes#IMAGE_INDEX}
 * @param config        the image configuration blob
 * @param layers        layer blobs, base first
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"schemaVersion", "mediaType", "config", "layers"})
public record ImageIndex(int schemaVersion, String mediaType, Descriptor config, List<Descriptor> layers) {

    public ImageIndex {
        layers = layers == null ? List.of() : List.copyOf(layers);
    }

    /**
     * An index of the current schema version.
     */
    public static ImageIndex of(Descriptor config, List<Descriptor> layers) {
        return new ImageIndex(ImageIndexMediaTypes.SCHEMA_VERSION, ImageIndexMediaTypes.IMAGE_INDEX, config, layers);
    }

    @JsonIgnore
    public Versioned versioned() {
        return new Versioned(schemaVersion, mediaType);
    }

    /**
     * The config followed by the layers. Config first marks the root entry of the index.
     */
    @JsonIgnore
    public List<Descriptor> references() {
        List<Descriptor> references = new ArrayList<>(1 + layers.size());
        if (config != null) {
            references.add(config);
        }
        references.addAll(layers);
        return List.copyOf(references);
    }

    @JsonIgnore
    public Descriptor target() {
        return config;
    }
}
