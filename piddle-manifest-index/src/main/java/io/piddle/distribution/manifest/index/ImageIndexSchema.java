package io.piddle.distribution.manifest.index;

import io.piddle.distribution.spi.ManifestSchema;

/**
 * {@link ManifestSchema} for {@link ImageIndexMediaTypes#IMAGE_INDEX}.
 *
 * <p>Use {@link #INSTANCE} for explicit registration:
 * <pre>{@code
 * ManifestSchemaRegistry registry = ManifestSchemaRegistry.builder()
 *     .register(ImageIndexSchema.INSTANCE)
 *     .build();
 * }</pre>
 */
public final class ImageIndexSchema implements ManifestSchema {

    public static final ImageIndexSchema INSTANCE = new ImageIndexSchema();

    private ImageIndexSchema() {}

    @Override
    public String mediaType() {
        return ImageIndexMediaTypes.IMAGE_INDEX;
    }

    @Override
    public DeserializedImageIndex unmarshal(byte[] payload) {
        return DeserializedImageIndex.fromBytes(payload);
    }
}
