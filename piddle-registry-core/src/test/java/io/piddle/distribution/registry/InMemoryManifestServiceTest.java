package io.piddle.distribution.registry;

import io.piddle.distribution.core.Descriptor;
import io.piddle.distribution.core.Digest;
import io.piddle.distribution.core.DistributionException;
import io.piddle.distribution.core.Manifest;
import io.piddle.distribution.core.OperationContext;
import io.piddle.distribution.spi.ManifestSchemaRegistry;
import io.piddle.distribution.spi.ManifestServiceOption;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryManifestServiceTest {

    private static final Descriptor LAYER = new Descriptor("application/vnd.test.layer",
            Digest.fromBytes("layer".getBytes(StandardCharsets.UTF_8)), 5);

    private InMemoryManifestService store;
    private OperationContext ctx;

    @BeforeEach
    void setUp() {
        ManifestSchemaRegistry registry = ManifestSchemaRegistry.builder().register(TestManifest.schema()).build();
        store = new InMemoryManifestService(registry);
        ctx = OperationContext.background();
    }

    @Test
    void putComputesDigestOverPayloadAndGetReconstructs() throws Exception {
        TestManifest manifest = TestManifest.of("{\"a\": 1}", LAYER);

        Digest digest = store.put(ctx, manifest);

        assertThat(digest).isEqualTo(Digest.fromBytes("{\"a\": 1}".getBytes(StandardCharsets.UTF_8)));
        assertThat(store.exists(ctx, digest)).isTrue();

        Manifest read = store.get(ctx, digest);
        assertThat(read.payload()).isEqualTo(manifest.payload());
        assertThat(read.payload().digest()).isEqualTo(digest);
    }

    @Test
    void identicalPutsAreIdempotent() throws Exception {
        Digest first = store.put(ctx, TestManifest.of("same"));
        Digest second = store.put(ctx, TestManifest.of("same"));

        assertThat(second).isEqualTo(first);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void missingManifestIsNotFound() throws Exception {
        Digest missing = Digest.fromBytes("missing".getBytes(StandardCharsets.UTF_8));

        assertThat(store.exists(ctx, missing)).isFalse();
        assertThatThrownBy(() -> store.get(ctx, missing))
                .isInstanceOfSatisfying(DistributionException.ManifestNotFound.class,
                        e -> assertThat(e.digest()).isEqualTo(missing));
        assertThatThrownBy(() -> store.delete(ctx, missing))
                .isInstanceOf(DistributionException.ManifestNotFound.class);
    }

    @Test
    void deleteRemovesOnlyTheManifest() throws Exception {
        Digest digest = store.put(ctx, TestManifest.of("doomed", LAYER), ManifestServiceOption.withTag("v1"));
        assertThat(store.resolveTag("v1")).contains(digest);

        store.delete(ctx, digest);

        assertThat(store.exists(ctx, digest)).isFalse();
        assertThat(store.resolveTag("v1")).isEmpty();
        assertThatThrownBy(() -> store.delete(ctx, digest))
                .isInstanceOf(DistributionException.ManifestNotFound.class);
    }

    @Test
    void rejectsMalformedReferences() {
        Descriptor badDigest = new Descriptor("application/vnd.test.layer", Digest.of("sha256:aaa"), 3);
        Descriptor negativeSize = new Descriptor("application/vnd.test.layer", LAYER.digest(), -1);
        Descriptor noMediaType = new Descriptor(" ", LAYER.digest(), 5);

        assertThatThrownBy(() -> store.put(ctx, TestManifest.of("x", badDigest)))
                .isInstanceOf(DistributionException.ManifestInvalid.class)
                .hasMessageContaining("reference 0 is malformed")
                .hasCauseInstanceOf(DistributionException.InvalidDigest.class);
        assertThatThrownBy(() -> store.put(ctx, TestManifest.of("x", LAYER, negativeSize)))
                .isInstanceOf(DistributionException.ManifestInvalid.class)
                .hasMessageContaining("reference 1 has negative size");
        assertThatThrownBy(() -> store.put(ctx, TestManifest.of("x", noMediaType)))
                .isInstanceOf(DistributionException.ManifestInvalid.class)
                .hasMessageContaining("no media type");
        assertThat(store.size()).isZero();
    }

    @Test
    void rejectsOversizedPayload() {
        InMemoryManifestService small = new InMemoryManifestService(
                ManifestSchemaRegistry.builder().register(TestManifest.schema()).build(),
                ManifestStoreConfig.builder().maxPayloadBytes(4).build());

        assertThatThrownBy(() -> small.put(ctx, TestManifest.of("12345")))
                .isInstanceOf(DistributionException.ManifestInvalid.class)
                .hasMessageContaining("exceeds maximum of 4");
    }

    @Test
    void rejectsPayloadTheRegistryCannotRead() {
        Manifest unknown = new TestManifest("application/vnd.unknown", new byte[]{1}, List.of());

        assertThatThrownBy(() -> store.put(ctx, unknown))
                .isInstanceOf(DistributionException.ManifestInvalid.class)
                .hasCauseInstanceOf(DistributionException.UnsupportedMediaType.class);

        InMemoryManifestService lenient = new InMemoryManifestService(ManifestSchemaRegistry.empty(),
                ManifestStoreConfig.builder().verifyOnPut(false).build());
        assertThat(lenient.put(ctx, unknown)).isEqualTo(Digest.fromBytes(new byte[]{1}));
    }

    @Test
    void getHonoursAcceptedMediaTypes() throws Exception {
        Digest digest = store.put(ctx, TestManifest.of("typed"));

        assertThat(store.get(ctx, digest, ManifestServiceOption.acceptMediaTypes(TestManifest.MEDIA_TYPE))).isNotNull();
        assertThatThrownBy(() -> store.get(ctx, digest, ManifestServiceOption.acceptMediaTypes("application/other")))
                .isInstanceOfSatisfying(DistributionException.UnsupportedMediaType.class,
                        e -> assertThat(e.mediaType()).isEqualTo(TestManifest.MEDIA_TYPE));
    }

    @Test
    void enumeratesInDigestOrderAndStopsAtFirstFailure() throws Exception {
        Set<Digest> stored = Set.of(
                store.put(ctx, TestManifest.of("one")),
                store.put(ctx, TestManifest.of("two")),
                store.put(ctx, TestManifest.of("three")));

        List<Digest> seen = new ArrayList<>();
        store.enumerate(ctx, seen::add);
        assertThat(seen).containsExactlyInAnyOrderElementsOf(stored).isSorted();

        List<Digest> partial = new ArrayList<>();
        IllegalStateException boom = new IllegalStateException("boom");
        assertThatThrownBy(() -> store.enumerate(ctx, d -> {
            partial.add(d);
            if (partial.size() == 2) throw boom;
        })).isSameAs(boom);
        assertThat(partial).containsExactly(seen.get(0), seen.get(1));
    }

    @Test
    void cancelledContextAbortsBeforeAnyWork() {
        OperationContext cancelled = OperationContext.background();
        cancelled.cancel("shutdown");

        assertThatThrownBy(() -> store.put(cancelled, TestManifest.of("never")))
                .isInstanceOf(DistributionException.Cancelled.class)
                .hasMessage("shutdown");
        assertThatThrownBy(() -> store.exists(cancelled, LAYER.digest()))
                .isInstanceOf(DistributionException.Cancelled.class);
        assertThatThrownBy(() -> store.enumerate(cancelled, d -> {}))
                .isInstanceOf(DistributionException.Cancelled.class);
        assertThat(store.size()).isZero();
    }

    @Test
    void cancellationDuringSerializationLeavesNothingStored() {
        OperationContext request = OperationContext.background();
        Manifest cancelsWhileSerializing = new TestManifest(TestManifest.MEDIA_TYPE, new byte[]{7}, List.of()) {
            @Override
            public io.piddle.distribution.core.Payload payload() {
                request.cancel("client disconnected");
                return super.payload();
            }
        };

        assertThatThrownBy(() -> store.put(request, cancelsWhileSerializing))
                .isInstanceOf(DistributionException.Cancelled.class);
        assertThat(store.size()).isZero();
    }

    @Test
    void recordsCreationTime() throws Exception {
        Instant now = Instant.parse("2025-01-01T00:00:00Z");
        InMemoryManifestService clocked = new InMemoryManifestService(
                ManifestSchemaRegistry.builder().register(TestManifest.schema()).build(),
                ManifestStoreConfig.builder().clock(Clock.fixed(now, ZoneId.of("UTC"))).build());

        Digest digest = clocked.put(ctx, TestManifest.of("timed"));

        assertThat(clocked.createdAt(digest)).contains(now);
        assertThat(clocked.createdAt(LAYER.digest())).isEmpty();
    }

    @Test
    void concurrentPutsOfSameBytesStoreOneEntry() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Digest>> futures = new ArrayList<>();
            CountDownLatch go = new CountDownLatch(1);
            for (int i = 0; i < 32; i++) {
                String body = "manifest-" + (i % 4);
                futures.add(executor.submit(() -> {
                    go.await();
                    return store.put(ctx, TestManifest.of(body));
                }));
            }
            go.countDown();

            Set<Digest> digests = ConcurrentHashMap.newKeySet();
            for (Future<Digest> f : futures) {
                digests.add(f.get(5, TimeUnit.SECONDS));
            }

            assertThat(digests).hasSize(4);
            assertThat(store.size()).isEqualTo(4);
            for (Digest d : digests) {
                assertThat(d.verifies(store.get(ctx, d).payload().bytes())).isTrue();
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
