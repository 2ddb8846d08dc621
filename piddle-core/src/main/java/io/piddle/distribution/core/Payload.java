package io.piddle.distribution.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Serialized form of a manifest together with its media type.
 *
 * <p>The bytes are copied on construction and on access; the digest of a manifest is always
 * computed over exactly these bytes.
 */
public final class Payload {

    private final String mediaType;
    private final byte[] bytes;

    public Payload(String mediaType, byte[] bytes) {
        this.mediaType = Objects.requireNonNull(mediaType, "mediaType");
        this.bytes = Objects.requireNonNull(bytes, "bytes").clone();
    }

    public String mediaType() {
        return mediaType;
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    public Digest digest() {
        return Digest.fromBytes(bytes);
    }

    /**
     * Descriptor of this payload: its media type, canonical digest and length.
     */
    public Descriptor descriptor() {
        return Descriptor.forPayload(mediaType, bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Payload)) return false;
        Payload other = (Payload) o;
        return mediaType.equals(other.mediaType) && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * mediaType.hashCode() + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Payload{" + mediaType + ", " + bytes.length + " bytes}";
    }
}
