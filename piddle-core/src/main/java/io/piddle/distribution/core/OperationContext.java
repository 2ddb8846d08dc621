package io.piddle.distribution.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Request-scoped execution context: cancellation, an optional deadline and the identity an
 * auth layer attached to the request.
 *
 * <p>Derived contexts share the cancellation state of their parent, so cancelling a parent
 * cancels every context derived from it. Manifest values never look at the identity.
 */
public final class OperationContext {

    private final OperationContext parent;
    private final AtomicReference<String> cancelReason = new AtomicReference<>();
    private final Instant deadline;
    private final String identity;
    private final Clock clock;

    private OperationContext(OperationContext parent, Instant deadline, String identity, Clock clock) {
        this.parent = parent;
        this.deadline = deadline;
        this.identity = identity;
        this.clock = clock;
    }

    /**
     * A context that is never cancelled by itself and has no deadline.
     */
    public static OperationContext background() {
        return new OperationContext(null, null, null, Clock.systemUTC());
    }

    public static OperationContext background(Clock clock) {
        return new OperationContext(null, null, null, Objects.requireNonNull(clock, "clock"));
    }

    /**
     * Derives a context that expires {@code timeout} from now, or earlier if this one does.
     */
    public OperationContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        return withDeadline(clock.instant().plus(timeout));
    }

    public OperationContext withDeadline(Instant deadline) {
        Objects.requireNonNull(deadline, "deadline");
        Instant effective = this.deadline != null && this.deadline.isBefore(deadline) ? this.deadline : deadline;
        return new OperationContext(this, effective, identity, clock);
    }

    /**
     * Derives a context with the same deadline and identity that can be cancelled on its own.
     */
    public OperationContext child() {
        return new OperationContext(this, deadline, identity, clock);
    }

    public OperationContext withIdentity(String identity) {
        return new OperationContext(this, deadline, Objects.requireNonNull(identity, "identity"), clock);
    }

    /**
     * Cancels this context and every context derived from it. The first reason wins.
     */
    public void cancel(String reason) {
        cancelReason.compareAndSet(null, reason == null ? "cancelled" : reason);
    }

    public boolean isCancelled() {
        return cancellation().isPresent();
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    public Optional<String> identity() {
        return Optional.ofNullable(identity);
    }

    /**
     * @throws DistributionException.Cancelled if this context was cancelled or its deadline passed
     */
    public void checkActive() {
        Optional<String> reason = cancellation();
        if (reason.isPresent()) {
            throw new DistributionException.Cancelled(reason.get());
        }
    }

    private Optional<String> cancellation() {
        for (OperationContext c = this; c != null; c = c.parent) {
            String reason = c.cancelReason.get();
            if (reason != null) return Optional.of(reason);
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            return Optional.of("deadline exceeded");
        }
        return Optional.empty();
    }
}
