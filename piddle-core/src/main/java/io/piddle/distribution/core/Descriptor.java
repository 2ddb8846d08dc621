package io.piddle.distribution.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable pointer to a piece of content: digest, size and media type, plus optional
 * platform, annotations and alternate URLs.
 *
 * <p>The digest identifies the exact bytes of the referenced content and {@code size} is
 * their length. Neither is checked here; verification against the content is a storage concern.
 *
 * @param mediaType   vendor-specific type of the referenced content
 * @param digest      content identifier
 * @param size        length of the referenced content in bytes
 * @param urls        alternate locations (may be empty)
 * @param annotations arbitrary metadata; kept sorted by key so encoding is stable
 * @param platform    platform the content targets (may be null)
 */
@JsonPropertyOrder({"mediaType", "digest", "size", "urls", "annotations", "platform"})
public record Descriptor(
        String mediaType,
        Digest digest,
        long size,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> urls,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, String> annotations,
        @JsonInclude(JsonInclude.Include.NON_NULL) Platform platform) implements Describable {

    public Descriptor {
        urls = urls == null ? List.of() : List.copyOf(urls);
        annotations = annotations == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(annotations));
    }

    public Descriptor(String mediaType, Digest digest, long size) {
        this(mediaType, digest, size, null, null, null);
    }

    /**
     * Describes a serialized payload: canonical digest and length of exactly these bytes.
     */
    public static Descriptor forPayload(String mediaType, byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        return new Descriptor(mediaType, Digest.fromBytes(payload), payload.length);
    }

    public Descriptor withAnnotations(Map<String, String> annotations) {
        return new Descriptor(mediaType, digest, size, urls, annotations, platform);
    }

    public Descriptor withPlatform(Platform platform) {
        return new Descriptor(mediaType, digest, size, urls, annotations, platform);
    }

    public Descriptor withUrls(List<String> urls) {
        return new Descriptor(mediaType, digest, size, urls, annotations, platform);
    }

    @JsonIgnore
    @Override
    public Descriptor descriptor() {
        return this;
    }
}
