package io.piddle.distribution.spi;

import java.util.List;

/**
 * ServiceLoader provider for {@link ManifestSchema}.
 *
 * <p>Schema modules such as {@code piddle-manifest-index} register implementations via
 * {@code META-INF/services} so they are picked up at start-up without a central list.
 */
public interface ManifestSchemaProvider {
    List<ManifestSchema> schemas();
}
