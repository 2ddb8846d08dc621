package io.piddle.distribution.spi;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Option passed to {@link ManifestService} calls.
 *
 * <p>Services act on the options they understand and ignore the rest.
 */
public interface ManifestServiceOption {

    /**
     * On put, associates {@code tag} with the stored manifest's digest.
     */
    static ManifestServiceOption withTag(String tag) {
        return new Tag(tag);
    }

    /**
     * On get, only manifests of one of these media types are returned.
     */
    static ManifestServiceOption acceptMediaTypes(String... mediaTypes) {
        return new AcceptMediaTypes(Set.copyOf(Arrays.asList(mediaTypes)));
    }

    /**
     * Returns the last option of the given type, if any.
     */
    static <T extends ManifestServiceOption> Optional<T> find(Class<T> type, ManifestServiceOption... options) {
        Objects.requireNonNull(type, "type");
        if (options == null) return Optional.empty();
        T found = null;
        for (ManifestServiceOption option : options) {
            if (type.isInstance(option)) {
                found = type.cast(option);
            }
        }
        return Optional.ofNullable(found);
    }

    record Tag(String tag) implements ManifestServiceOption {
        public Tag {
            Objects.requireNonNull(tag, "tag");
            if (tag.isBlank()) {
                throw new IllegalArgumentException("tag must not be blank");
            }
        }
    }

    record AcceptMediaTypes(Set<String> mediaTypes) implements ManifestServiceOption {
        public AcceptMediaTypes {
            mediaTypes = Set.copyOf(Objects.requireNonNull(mediaTypes, "mediaTypes"));
        }

        public boolean accepts(String mediaType) {
            return mediaTypes.isEmpty() || mediaTypes.contains(mediaType);
        }
    }
}
