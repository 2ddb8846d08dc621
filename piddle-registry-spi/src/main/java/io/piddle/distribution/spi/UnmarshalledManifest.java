package io.piddle.distribution.spi;

import io.piddle.distribution.core.Descriptor;
import io.piddle.distribution.core.Manifest;

import java.util.Objects;

/**
 * A reconstructed manifest and the descriptor of the bytes it was reconstructed from.
 *
 * @param manifest   typed manifest
 * @param descriptor digest and size of exactly the received bytes, with the manifest's media type
 */
public record UnmarshalledManifest(Manifest manifest, Descriptor descriptor) {
    public UnmarshalledManifest {
        Objects.requireNonNull(manifest, "manifest");
        Objects.requireNonNull(descriptor, "descriptor");
    }
}
