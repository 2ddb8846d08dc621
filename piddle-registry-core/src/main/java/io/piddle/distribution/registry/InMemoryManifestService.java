package io.piddle.distribution.registry;

import io.piddle.distribution.core.Descriptor;
import io.piddle.distribution.core.Digest;
import io.piddle.distribution.core.DistributionException;
import io.piddle.distribution.core.Manifest;
import io.piddle.distribution.core.OperationContext;
import io.piddle.distribution.core.Payload;
import io.piddle.distribution.spi.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reference in-memory {@link ManifestService}.
 *
 * <p>Good for unit tests and examples. Not intended for production.
 *
 * <p>Manifests are kept as their canonical bytes under the digest of those bytes and are
 * reconstructed through the {@link ManifestSchemaRegistry} on every read:
 * <pre>{@code
 * ManifestSchemaRegistry registry = ManifestSchemaRegistry.builder()
 *     .register(ImageIndexSchema.INSTANCE)
 *     .build();
 * InMemoryManifestService manifests = new InMemoryManifestService(registry);
 * }</pre>
 *
 * <p>Entries are never modified in place. Concurrent puts of the same bytes store one entry;
 * a put racing a delete of the same digest leaves either the entry or nothing.
 */
public final class InMemoryManifestService implements ManifestService, ManifestEnumerator {

    private static final Logger log = LoggerFactory.getLogger(InMemoryManifestService.class);

    private final Map<Digest, StoredManifest> manifests = new ConcurrentHashMap<>();
    private final Map<String, Digest> tags = new ConcurrentHashMap<>();
    private final ManifestSchemaRegistry schemas;
    private final ManifestStoreConfig config;

    public InMemoryManifestService() {
        this(ServiceLoaderSchemaRegistry.defaultRegistry(), ManifestStoreConfig.defaults());
    }

    public InMemoryManifestService(ManifestSchemaRegistry schemas) {
        this(schemas, ManifestStoreConfig.defaults());
    }

    public InMemoryManifestService(ManifestSchemaRegistry schemas, ManifestStoreConfig config) {
        this.schemas = Objects.requireNonNull(schemas, "schemas");
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public boolean exists(OperationContext ctx, Digest digest) {
        ctx.checkActive();
        Objects.requireNonNull(digest, "digest");
        return manifests.containsKey(digest);
    }

    @Override
    public Manifest get(OperationContext ctx, Digest digest, ManifestServiceOption... options) {
        ctx.checkActive();
        Objects.requireNonNull(digest, "digest");
        StoredManifest stored = manifests.get(digest);
        if (stored == null) {
            throw new DistributionException.ManifestNotFound(digest);
        }

        Optional<ManifestServiceOption.AcceptMediaTypes> accept =
                ManifestServiceOption.find(ManifestServiceOption.AcceptMediaTypes.class, options);
        if (accept.isPresent() && !accept.get().accepts(stored.mediaType)) {
            throw new DistributionException.UnsupportedMediaType(stored.mediaType,
                    "manifest " + digest + " has media type " + stored.mediaType + " which the client does not accept");
        }

        UnmarshalledManifest result = schemas.unmarshal(stored.mediaType, stored.bytes);
        if (!result.descriptor().digest().equals(digest)) {
            throw new DistributionException.ManifestInvalid("stored content does not verify against " + digest);
        }
        return result.manifest();
    }

    @Override
    public Digest put(OperationContext ctx, Manifest manifest, ManifestServiceOption... options) {
        ctx.checkActive();
        Objects.requireNonNull(manifest, "manifest");

        validateReferences(manifest.references());
        Payload payload = manifest.payload();
        if (payload.size() > config.maxPayloadBytes()) {
            throw new DistributionException.ManifestInvalid(
                    "manifest payload of " + payload.size() + " bytes exceeds maximum of " + config.maxPayloadBytes());
        }
        byte[] bytes = payload.bytes();
        if (config.verifyOnPut()) {
            verifyReadable(payload.mediaType(), bytes);
        }
        Digest digest = Digest.fromBytes(bytes);

        ctx.checkActive();
        StoredManifest previous = manifests.putIfAbsent(digest,
                new StoredManifest(payload.mediaType(), bytes, config.clock().instant()));
        ManifestServiceOption.find(ManifestServiceOption.Tag.class, options)
                .ifPresent(tag -> tags.put(tag.tag(), digest));

        if (log.isDebugEnabled()) {
            log.debug("{} manifest {} ({}, {} bytes)", previous == null ? "Stored" : "Already had",
                    digest, payload.mediaType(), bytes.length);
        }
        return digest;
    }

    @Override
    public void delete(OperationContext ctx, Digest digest) {
        ctx.checkActive();
        Objects.requireNonNull(digest, "digest");
        if (manifests.remove(digest) == null) {
            throw new DistributionException.ManifestNotFound(digest);
        }
        tags.values().removeIf(digest::equals);
        log.debug("Deleted manifest {}", digest);
    }

    /**
     * Calls the ingester for each stored digest in ascending order of the digest string. The
     * set of digests is snapshotted when enumeration starts.
     */
    @Override
    public void enumerate(OperationContext ctx, DigestIngester ingester) throws Exception {
        ctx.checkActive();
        Objects.requireNonNull(ingester, "ingester");
        List<Digest> snapshot = new ArrayList<>(manifests.keySet());
        Collections.sort(snapshot);
        for (Digest digest : snapshot) {
            ctx.checkActive();
            ingester.ingest(digest);
        }
    }

    /**
     * Digest last stored with {@link ManifestServiceOption#withTag(String)}, if it still exists.
     */
    public Optional<Digest> resolveTag(String tag) {
        Digest digest = tags.get(Objects.requireNonNull(tag, "tag"));
        if (digest == null || !manifests.containsKey(digest)) return Optional.empty();
        return Optional.of(digest);
    }

    /**
     * When the manifest stored under {@code digest} was first put.
     */
    public Optional<Instant> createdAt(Digest digest) {
        StoredManifest stored = manifests.get(Objects.requireNonNull(digest, "digest"));
        return stored == null ? Optional.empty() : Optional.of(stored.createdAt);
    }

    public int size() {
        return manifests.size();
    }

    private static void validateReferences(List<Descriptor> references) {
        if (references == null) {
            throw new DistributionException.ManifestInvalid("manifest has no reference list");
        }
        for (int i = 0; i < references.size(); i++) {
            Descriptor d = references.get(i);
            if (d == null || d.digest() == null) {
                throw new DistributionException.ManifestInvalid("reference " + i + " has no digest");
            }
            try {
                d.digest().validate();
            } catch (DistributionException.InvalidDigest e) {
                throw new DistributionException.ManifestInvalid("reference " + i + " is malformed: " + e.getMessage(), e);
            }
            if (d.size() < 0) {
                throw new DistributionException.ManifestInvalid("reference " + i + " has negative size " + d.size());
            }
            if (d.mediaType() == null || d.mediaType().isBlank()) {
                throw new DistributionException.ManifestInvalid("reference " + i + " has no media type");
            }
        }
    }

    private void verifyReadable(String mediaType, byte[] bytes) {
        try {
            schemas.unmarshal(mediaType, bytes);
        } catch (DistributionException.ManifestInvalid e) {
            throw e;
        } catch (DistributionException e) {
            throw new DistributionException.ManifestInvalid("manifest cannot be read back: " + e.getMessage(), e);
        }
    }

    private static final class StoredManifest {
        private final String mediaType;
        private final byte[] bytes;
        private final Instant createdAt;

        private StoredManifest(String mediaType, byte[] bytes, Instant createdAt) {
            this.mediaType = mediaType;
            this.bytes = bytes;
            this.createdAt = createdAt;
        }
    }
}
