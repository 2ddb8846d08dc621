package io.piddle.distribution.spi;

import io.piddle.distribution.core.Digest;
import io.piddle.distribution.core.DistributionException;
import io.piddle.distribution.core.Manifest;
import io.piddle.distribution.core.OperationContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AsyncManifestService} via {@link BlockingToAsyncAdapter}.
 */
class BlockingToAsyncAdapterTest {

    private static final String MT = "application/vnd.x+json";

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void roundTripsThroughDelegate() throws Exception {
        MapManifestService blocking = new MapManifestService();
        AsyncManifestService async = new BlockingToAsyncAdapter(blocking, executor);
        OperationContext ctx = OperationContext.background();
        Manifest manifest = new RawManifest(MT, "{}".getBytes(StandardCharsets.UTF_8));

        Digest digest = async.put(ctx, manifest).get(5, TimeUnit.SECONDS);

        assertThat(digest).isEqualTo(Digest.fromBytes("{}".getBytes(StandardCharsets.UTF_8)));
        assertThat(async.exists(ctx, digest).get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(async.get(ctx, digest).get(5, TimeUnit.SECONDS)).isSameAs(manifest);

        async.delete(ctx, digest).get(5, TimeUnit.SECONDS);
        assertThat(async.exists(ctx, digest).get(5, TimeUnit.SECONDS)).isFalse();
    }

    @Test
    void propagatesDistributionExceptionsUnwrapped() {
        AsyncManifestService async = new BlockingToAsyncAdapter(new MapManifestService(), executor);
        Digest missing = Digest.fromBytes(new byte[0]);

        assertThatThrownBy(() -> async.get(OperationContext.background(), missing).get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(DistributionException.ManifestNotFound.class);
    }

    @Test
    void wrapsCheckedExceptions() {
        ManifestService failing = new MapManifestService() {
            @Override
            public boolean exists(OperationContext ctx, Digest digest) throws Exception {
                throw new IOException("disk on fire");
            }
        };
        AsyncManifestService async = new BlockingToAsyncAdapter(failing, executor);

        assertThatThrownBy(() -> async.exists(OperationContext.background(), Digest.fromBytes(new byte[0])).get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOf(BlockingToAsyncAdapter.AsyncManifestException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void cancellingFutureCancelsDelegateContext() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<OperationContext> seen = new CompletableFuture<>();
        ManifestService blocking = new MapManifestService() {
            @Override
            public Digest put(OperationContext ctx, Manifest manifest, ManifestServiceOption... options) throws Exception {
                started.countDown();
                while (!ctx.isCancelled()) {
                    Thread.sleep(5);
                }
                seen.complete(ctx);
                ctx.checkActive();
                return super.put(ctx, manifest, options);
            }
        };
        OperationContext parent = OperationContext.background();
        AsyncManifestService async = new BlockingToAsyncAdapter(blocking, executor);

        CompletableFuture<Digest> future = async.put(parent, new RawManifest(MT, new byte[]{1}));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        future.cancel(true);

        OperationContext delegateCtx = seen.get(5, TimeUnit.SECONDS);
        assertThat(delegateCtx.isCancelled()).isTrue();
        assertThat(parent.isCancelled()).isFalse();
        assertThat(((MapManifestService) blocking).stored).isEmpty();
    }

    private static class MapManifestService implements ManifestService {
        final Map<Digest, Manifest> stored = new ConcurrentHashMap<>();

        @Override
        public boolean exists(OperationContext ctx, Digest digest) throws Exception {
            return stored.containsKey(digest);
        }

        @Override
        public Manifest get(OperationContext ctx, Digest digest, ManifestServiceOption... options) throws Exception {
            Manifest m = stored.get(digest);
            if (m == null) throw new DistributionException.ManifestNotFound(digest);
            return m;
        }

        @Override
        public Digest put(OperationContext ctx, Manifest manifest, ManifestServiceOption... options) throws Exception {
            Digest digest = manifest.payload().digest();
            stored.put(digest, manifest);
            return digest;
        }

        @Override
        public void delete(OperationContext ctx, Digest digest) throws Exception {
            if (stored.remove(digest) == null) throw new DistributionException.ManifestNotFound(digest);
        }
    }
}
