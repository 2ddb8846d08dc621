package io.piddle.distribution.core;

/**
 * Anything that can describe itself as a {@link Descriptor}: a manifest, a blob handle,
 * a sub-index. Describable values are what manifest builders accept as references.
 */
@FunctionalInterface
public interface Describable {
    Descriptor descriptor();
}
