package io.piddle.distribution.core;

import java.util.List;

/**
 * A registry object listing the content it is made of.
 *
 * <p>Every manifest schema implements this contract, which lets storage, HTTP and proxy layers
 * handle manifests without knowing the concrete schema.
 */
public interface Manifest {

    /**
     * Objects this manifest is made of: layers, configs or other manifests.
     *
     * <p>No order is enforced, but implementations return them in dependency order, base
     * before top, and callers such as pull planners rely on it.
     */
    List<Descriptor> references();

    /**
     * Serialized form of the manifest and its media type. The digest of the manifest is the
     * digest of these bytes.
     *
     * @throws DistributionException.UninitializedManifest if the manifest has no serialized form yet
     */
    Payload payload();
}
