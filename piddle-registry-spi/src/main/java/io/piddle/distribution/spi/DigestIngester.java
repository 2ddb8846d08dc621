package io.piddle.distribution.spi;

import io.piddle.distribution.core.Digest;

/**
 * Receives digests from a {@link ManifestEnumerator}. Throwing stops the enumeration.
 */
@FunctionalInterface
public interface DigestIngester {
    void ingest(Digest digest) throws Exception;
}
