package io.piddle.distribution.manifest.index;

import io.piddle.distribution.spi.ManifestSchema;
import io.piddle.distribution.spi.ManifestSchemaProvider;

import java.util.List;

/**
 * ServiceLoader provider for {@link ImageIndexSchema}.
 */
public final class ImageIndexSchemaProvider implements ManifestSchemaProvider {
    @Override
    public List<ManifestSchema> schemas() {
        return List.of(ImageIndexSchema.INSTANCE);
    }
}
