package io.piddle.distribution.core;

import java.util.List;

/**
 * Incrementally assembles a manifest. Instances come from a schema-specific package, which
 * also decides which dependencies are acceptable.
 */
public interface ManifestBuilder {

    /**
     * Finalizes the manifest, establishing its canonical bytes.
     *
     * @throws DistributionException.Build if required fields are missing
     * @throws DistributionException.Cancelled if {@code ctx} is no longer active
     */
    Manifest build(OperationContext ctx);

    /**
     * References added so far, in the order they were appended (base to head).
     */
    List<Descriptor> references();

    /**
     * Appends a dependency after the existing ones.
     *
     * @throws DistributionException.UnsupportedDependency if the schema cannot hold this kind of
     *         content; the accumulated references are left unchanged
     */
    void appendReference(Describable dependency);
}
