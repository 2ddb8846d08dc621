package io.piddle.distribution.manifest.index;

import io.piddle.distribution.core.Descriptor;
import io.piddle.distribution.core.DistributionException;
import io.piddle.distribution.core.Manifest;
import io.piddle.distribution.core.Payload;

import java.util.List;
import java.util.Objects;

/**
 * An {@link ImageIndex} together with its canonical JSON bytes.
 *
 * <p>Canonical bytes are established exactly once, either by encoding the structured fields
 * ({@link #fromStruct}) or by keeping the received bytes verbatim ({@link #fromBytes}). From then
 * on every serialization returns those bytes; the structured fields are never re-encoded, so the
 * digest a client observed stays valid.
 */
public final class DeserializedImageIndex implements Manifest {

    private final ImageIndex index;
    private final byte[] canonical;

    /**
     * Wraps fields without establishing canonical bytes; serializing such a value fails.
     */
    DeserializedImageIndex(ImageIndex index) {
        this(index, null);
    }

    private DeserializedImageIndex(ImageIndex index, byte[] canonical) {
        this.index = Objects.requireNonNull(index, "index");
        this.canonical = canonical;
    }

    /**
     * Encodes the structured fields and keeps the result as canonical bytes.
     *
     * @throws DistributionException.SchemaMismatch if {@code index} declares another media type
     */
    public static DeserializedImageIndex fromStruct(ImageIndex index) {
        Objects.requireNonNull(index, "index");
        checkMediaType(index);
        return new DeserializedImageIndex(index, ImageIndexJson.encode(index));
    }

    /**
     * Keeps a copy of {@code bytes} verbatim as canonical and decodes it.
     *
     * @throws DistributionException.ManifestInvalid if the bytes are not an image index document
     * @throws DistributionException.SchemaMismatch if the document declares another media type
     */
    public static DeserializedImageIndex fromBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        byte[] canonical = bytes.clone();
        ImageIndex index = ImageIndexJson.decode(canonical);
        checkMediaType(index);
        return new DeserializedImageIndex(index, canonical);
    }

    public ImageIndex index() {
        return index;
    }

    public boolean hasCanonicalBytes() {
        return canonical != null;
    }

    /**
     * @throws DistributionException.UninitializedManifest if no canonical bytes were established
     */
    public byte[] canonicalBytes() {
        if (canonical == null) {
            throw new DistributionException.UninitializedManifest(
                    "JSON representation not initialized in DeserializedImageIndex");
        }
        return canonical.clone();
    }

    @Override
    public List<Descriptor> references() {
        return index.references();
    }

    public Descriptor target() {
        return index.target();
    }

    @Override
    public Payload payload() {
        return new Payload(index.mediaType(), canonicalBytes());
    }

    private static void checkMediaType(ImageIndex index) {
        if (!ImageIndexMediaTypes.IMAGE_INDEX.equals(index.mediaType())) {
            throw new DistributionException.SchemaMismatch(ImageIndexMediaTypes.IMAGE_INDEX, index.mediaType());
        }
    }
}
