package io.piddle.distribution.registry;

import io.piddle.distribution.spi.ManifestSchema;
import io.piddle.distribution.spi.ManifestSchemaProvider;
import io.piddle.distribution.spi.ManifestSchemaRegistry;
import io.piddle.distribution.spi.ManifestUnmarshaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * {@link ManifestSchemaRegistry} backed by {@link java.util.ServiceLoader}.
 *
 * <p>Every {@link ManifestSchemaProvider} visible to the class loader contributes its schemas
 * once, at construction. Two providers claiming the same media type fail construction with
 * {@link io.piddle.distribution.core.DistributionException.DuplicateRegistration}: a process
 * must not serve traffic with a conflicting schema table.
 */
public final class ServiceLoaderSchemaRegistry implements ManifestSchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServiceLoaderSchemaRegistry.class);

    private final ManifestSchemaRegistry delegate;

    public ServiceLoaderSchemaRegistry(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        ManifestSchemaRegistry.Builder builder = ManifestSchemaRegistry.builder();

        ServiceLoader<ManifestSchemaProvider> loader = ServiceLoader.load(ManifestSchemaProvider.class, cl);
        for (ManifestSchemaProvider p : loader) {
            for (ManifestSchema schema : p.schemas()) {
                log.debug("Registering manifest schema '{}' from {}", schema.mediaType(), p.getClass().getName());
                builder.register(schema);
            }
        }
        this.delegate = builder.build();
        log.info("Discovered {} manifest media types: {}", delegate.mediaTypes().size(), delegate.mediaTypes());
    }

    public static ServiceLoaderSchemaRegistry defaultRegistry() {
        return new ServiceLoaderSchemaRegistry(Thread.currentThread().getContextClassLoader());
    }

    @Override
    public Optional<ManifestUnmarshaller> find(String mediaType) {
        return delegate.find(mediaType);
    }

    @Override
    public Set<String> mediaTypes() {
        return delegate.mediaTypes();
    }
}
