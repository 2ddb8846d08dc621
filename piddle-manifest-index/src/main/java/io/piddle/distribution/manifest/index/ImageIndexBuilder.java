package io.piddle.distribution.manifest.index;

import io.piddle.distribution.core.Describable;
import io.piddle.distribution.core.Descriptor;
import io.piddle.distribution.core.DistributionException;
import io.piddle.distribution.core.ManifestBuilder;
import io.piddle.distribution.core.OperationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Assembles an image index from a config and layers appended base first.
 *
 * <p>Only layer media types are accepted as references; the config is set separately. Not
 * thread-safe.
 */
public final class ImageIndexBuilder implements ManifestBuilder {

    private Descriptor config;
    private final List<Descriptor> layers = new ArrayList<>();

    public ImageIndexBuilder() {
    }

    public ImageIndexBuilder(Describable config) {
        config(config);
    }

    public ImageIndexBuilder config(Describable config) {
        this.config = Objects.requireNonNull(config, "config").descriptor();
        return this;
    }

    @Override
    public void appendReference(Describable dependency) {
        Objects.requireNonNull(dependency, "dependency");
        Descriptor d = Objects.requireNonNull(dependency.descriptor(), "descriptor");
        if (!ImageIndexMediaTypes.isLayer(d.mediaType())) {
            throw new DistributionException.UnsupportedDependency(d.mediaType());
        }
        layers.add(d);
    }

    @Override
    public List<Descriptor> references() {
        return List.copyOf(layers);
    }

    /**
     * @throws DistributionException.Build if no config was set
     */
    @Override
    public DeserializedImageIndex build(OperationContext ctx) {
        ctx.checkActive();
        if (config == null) {
            throw new DistributionException.Build("image index requires a config descriptor");
        }
        return DeserializedImageIndex.fromStruct(ImageIndex.of(config, layers));
    }
}
