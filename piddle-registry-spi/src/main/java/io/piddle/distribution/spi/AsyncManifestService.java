package io.piddle.distribution.spi;

import io.piddle.distribution.core.Digest;
import io.piddle.distribution.core.Manifest;
import io.piddle.distribution.core.OperationContext;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous counterpart to {@link ManifestService}.
 *
 * <p>All operations return {@link CompletableFuture} and complete without blocking the calling
 * thread. Cancelling a returned future cancels the work behind it.
 *
 * <p>For adapting a blocking {@link ManifestService} to this interface, use
 * {@link BlockingToAsyncAdapter}.
 *
 * @see ManifestService
 * @see BlockingToAsyncAdapter
 */
public interface AsyncManifestService {

    CompletableFuture<Boolean> exists(OperationContext ctx, Digest digest);

    CompletableFuture<Manifest> get(OperationContext ctx, Digest digest, ManifestServiceOption... options);

    CompletableFuture<Digest> put(OperationContext ctx, Manifest manifest, ManifestServiceOption... options);

    CompletableFuture<Void> delete(OperationContext ctx, Digest digest);
}
