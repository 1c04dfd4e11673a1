package io.wrabber.broker.rabbit;

import java.util.function.BooleanSupplier;

/**
 * Tracks the broker's connection.blocked / connection.unblocked notifications.
 */
final class FlowControl {

    private static final long RECHECK_MILLIS = 250;

    private final Object lock = new Object();
    private boolean blocked;

    void block() {
        synchronized (lock) {
            blocked = true;
        }
    }

    void unblock() {
        synchronized (lock) {
            blocked = false;
            lock.notifyAll();
        }
    }

    boolean isBlocked() {
        synchronized (lock) {
            return blocked;
        }
    }

    /**
     * Waits while blocked, returning early once {@code stillOpen} reports the resource closed.
     */
    void awaitUnblocked(BooleanSupplier stillOpen) throws InterruptedException {
        synchronized (lock) {
            while (blocked && stillOpen.getAsBoolean()) {
                lock.wait(RECHECK_MILLIS);
            }
        }
    }
}
