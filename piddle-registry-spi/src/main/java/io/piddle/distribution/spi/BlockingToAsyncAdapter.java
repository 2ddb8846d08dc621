package io.piddle.distribution.spi;

import io.piddle.distribution.core.Digest;
import io.piddle.distribution.core.Manifest;
import io.piddle.distribution.core.OperationContext;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Adapter that wraps a blocking {@link ManifestService} to provide the
 * {@link AsyncManifestService} interface.
 *
 * <p>Each call runs on the provided {@link Executor} with a child of the caller's
 * {@link OperationContext}. Cancelling the returned future cancels that child context, so the
 * delegate abandons the call at its next check instead of completing a write.
 *
 * <p>Example usage:
 * <pre>{@code
 * ManifestService blocking = new InMemoryManifestService(registry);
 * AsyncManifestService async = new BlockingToAsyncAdapter(blocking, Executors.newFixedThreadPool(8));
 *
 * async.put(ctx, manifest)
 *      .thenAccept(digest -> respondCreated(digest));
 * }</pre>
 */
public final class BlockingToAsyncAdapter implements AsyncManifestService {

    private final ManifestService delegate;
    private final Executor executor;

    /**
     * Creates an async adapter for the given blocking service.
     *
     * @param delegate the blocking service to wrap
     * @param executor executor to run blocking operations on
     */
    public BlockingToAsyncAdapter(ManifestService delegate, Executor executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<Boolean> exists(OperationContext ctx, Digest digest) {
        return submit(ctx, scoped -> delegate.exists(scoped, digest));
    }

    @Override
    public CompletableFuture<Manifest> get(OperationContext ctx, Digest digest, ManifestServiceOption... options) {
        return submit(ctx, scoped -> delegate.get(scoped, digest, options));
    }

    @Override
    public CompletableFuture<Digest> put(OperationContext ctx, Manifest manifest, ManifestServiceOption... options) {
        return submit(ctx, scoped -> delegate.put(scoped, manifest, options));
    }

    @Override
    public CompletableFuture<Void> delete(OperationContext ctx, Digest digest) {
        return submit(ctx, scoped -> {
            delegate.delete(scoped, digest);
            return null;
        });
    }

    /**
     * Returns the underlying blocking service.
     */
    public ManifestService delegate() {
        return delegate;
    }

    /**
     * Returns the executor used for async operations.
     */
    public Executor executor() {
        return executor;
    }

    private <T> CompletableFuture<T> submit(OperationContext ctx, BlockingCall<T> call) {
        Objects.requireNonNull(ctx, "ctx");
        OperationContext scoped = ctx.child();
        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            try {
                return call.run(scoped);
            } catch (Exception e) {
                throw wrapException(e);
            }
        }, executor);
        future.whenComplete((result, error) -> {
            if (error instanceof CancellationException) {
                scoped.cancel("future cancelled");
            }
        });
        return future;
    }

    private static RuntimeException wrapException(Exception e) {
        if (e instanceof RuntimeException re) {
            return re;
        }
        return new AsyncManifestException(e);
    }

    @FunctionalInterface
    private interface BlockingCall<T> {
        T run(OperationContext ctx) throws Exception;
    }

    /**
     * Exception wrapper for checked exceptions from blocking service operations.
     */
    public static final class AsyncManifestException extends RuntimeException {
        public AsyncManifestException(Throwable cause) {
            super(cause.getMessage(), cause);
        }
    }
}
