package io.wrabber.runtime;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One-shot readiness signal per connection epoch.
 * <p>
 * Only the connection supervisor calls {@link #signal}, {@link #reset} and {@link #release};
 * any thread may await or {@link #expire} an epoch whose channel it found closed.
 */
public final class ReadinessGate {

    private final AtomicReference<CompletableFuture<ConnectionEpoch>> current =
        new AtomicReference<>(new CompletableFuture<>());

    /**
     * Completes the pending gate with the epoch that just finished topology setup.
     */
    void signal(ConnectionEpoch epoch) {
        Objects.requireNonNull(epoch, "epoch");
        CompletableFuture<ConnectionEpoch> gate = current.get();
        if (!gate.complete(epoch)) {
            current.set(CompletableFuture.completedFuture(epoch));
        }
    }

    /**
     * Starts a new unsatisfied gate for the next epoch. Callers already waiting keep waiting.
     */
    void reset() {
        current.updateAndGet(gate -> gate.isDone() ? new CompletableFuture<>() : gate);
    }

    /**
     * Starts a new gate if {@code epoch} is still the one on offer. Publishers call this when they
     * find the epoch's channel already closed before the supervisor has reacted.
     */
    void expire(ConnectionEpoch epoch) {
        current.updateAndGet(gate -> gate.isDone() && !gate.isCompletedExceptionally() && gate.getNow(null) == epoch
            ? new CompletableFuture<>()
            : gate);
    }

    /**
     * Wakes every waiter with {@code cause} and starts a fresh gate. Used on shutdown.
     */
    void release(Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        CompletableFuture<ConnectionEpoch> previous = current.getAndSet(new CompletableFuture<>());
        previous.completeExceptionally(cause);
    }

    public boolean isReady() {
        CompletableFuture<ConnectionEpoch> gate = current.get();
        return gate.isDone() && !gate.isCompletedExceptionally();
    }

    public CompletableFuture<ConnectionEpoch> whenReady() {
        return current.get();
    }

    /**
     * Waits for the current epoch without a time limit.
     */
    public ConnectionEpoch awaitReady() throws InterruptedException, ExecutionException {
        return current.get().get();
    }

    /**
     * Waits for the current epoch at most {@code timeout}.
     */
    public ConnectionEpoch awaitReady(Duration timeout)
        throws InterruptedException, ExecutionException, TimeoutException {
        Objects.requireNonNull(timeout, "timeout");
        return current.get().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
