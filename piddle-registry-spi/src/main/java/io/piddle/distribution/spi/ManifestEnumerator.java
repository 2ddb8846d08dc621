package io.piddle.distribution.spi;

import io.piddle.distribution.core.OperationContext;

/**
 * Iterates over stored manifests.
 */
public interface ManifestEnumerator {

    /**
     * Calls {@code ingester} for each stored manifest digest. The first exception thrown by the
     * ingester ends the enumeration and is rethrown unchanged.
     */
    void enumerate(OperationContext ctx, DigestIngester ingester) throws Exception;
}
