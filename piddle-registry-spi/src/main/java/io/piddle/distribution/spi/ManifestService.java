package io.piddle.distribution.spi;

import io.piddle.distribution.core.Digest;
import io.piddle.distribution.core.Manifest;
import io.piddle.distribution.core.OperationContext;

/**
 * Digest-keyed storage of manifests.
 *
 * <p>This SPI is intentionally minimal and blocking. Implementations own all I/O; they must
 * support concurrent calls on independent digests and check {@link OperationContext} before
 * starting work and before committing a write, surfacing
 * {@link io.piddle.distribution.core.DistributionException.Cancelled} rather than writing partially.
 */
public interface ManifestService {

    /**
     * Existence check only; the content is not fetched.
     */
    boolean exists(OperationContext ctx, Digest digest) throws Exception;

    /**
     * Retrieves the manifest stored under {@code digest}, reconstructed through the schema
     * registered for its stored media type.
     *
     * @throws io.piddle.distribution.core.DistributionException.ManifestNotFound if absent
     */
    Manifest get(OperationContext ctx, Digest digest, ManifestServiceOption... options) throws Exception;

    /**
     * Stores the manifest's payload and returns the digest computed over exactly those bytes.
     *
     * <p>The digest is never taken from the caller. Storing identical bytes twice is a no-op
     * returning the same digest.
     *
     * @throws io.piddle.distribution.core.DistributionException.ManifestInvalid if the manifest fails validation
     */
    Digest put(OperationContext ctx, Manifest manifest, ManifestServiceOption... options) throws Exception;

    /**
     * Removes the manifest stored under {@code digest}. Referenced content is left alone.
     *
     * @throws io.piddle.distribution.core.DistributionException.ManifestNotFound if absent
     */
    void delete(OperationContext ctx, Digest digest) throws Exception;
}
