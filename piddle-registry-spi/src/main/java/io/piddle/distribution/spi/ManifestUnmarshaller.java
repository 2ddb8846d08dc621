package io.piddle.distribution.spi;

import io.piddle.distribution.core.Manifest;

/**
 * Reconstructs a typed {@link Manifest} from the exact bytes received for one media type.
 *
 * <p>Implementations keep the given bytes as the manifest's canonical form; they never
 * re-encode them.
 */
@FunctionalInterface
public interface ManifestUnmarshaller {

    /**
     * @param payload serialized manifest, owned by the callee after the call
     * @throws io.piddle.distribution.core.DistributionException if the bytes are not a valid
     *         manifest of this schema
     */
    Manifest unmarshal(byte[] payload);
}
