package io.piddle.distribution.manifest.index;

import java.util.Set;

/**
 * Media types of the image index and of the content it references.
 */
public final class ImageIndexMediaTypes {
    private ImageIndexMediaTypes() {}

    /** Accept/Content-Type of an image index. */
    public static final String IMAGE_INDEX = "application/vnd.piddle.image.index.v1+json";

    /** Config blob of an image. */
    public static final String IMAGE_CONFIG = "application/vnd.piddle.image.manifest.v1+json";

    public static final String LAYER = "application/vnd.piddle.image.layer.v1.tar";
    public static final String LAYER_GZIP = "application/vnd.piddle.image.layer.v1.tar+gzip";
    public static final String LAYER_ZSTD = "application/vnd.piddle.image.layer.v1.tar+zstd";

    // layers that must not be pushed to a registry
    public static final String NONDISTRIBUTABLE_LAYER = "application/vnd.piddle.image.layer.nondistributable.v1.tar";
    public static final String NONDISTRIBUTABLE_LAYER_GZIP = "application/vnd.piddle.image.layer.nondistributable.v1.tar+gzip";
    public static final String NONDISTRIBUTABLE_LAYER_ZSTD = "application/vnd.piddle.image.layer.nondistributable.v1.tar+zstd";

    public static final int SCHEMA_VERSION = 1;

    private static final Set<String> LAYERS = Set.of(
            LAYER, LAYER_GZIP, LAYER_ZSTD,
            NONDISTRIBUTABLE_LAYER, NONDISTRIBUTABLE_LAYER_GZIP, NONDISTRIBUTABLE_LAYER_ZSTD);

    public static boolean isLayer(String mediaType) {
        return mediaType != null && LAYERS.contains(mediaType);
    }

    public static boolean isNondistributable(String mediaType) {
        return mediaType != null && mediaType.startsWith("application/vnd.piddle.image.layer.nondistributable.");
    }
}
