package io.wrabber.runtime;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Wait sequence between reconnect attempts, capped at its last entry.
 */
public final class ReconnectBackoff {

    private final List<Duration> sequence;

    public ReconnectBackoff(List<Duration> sequence) {
        Objects.requireNonNull(sequence, "sequence");
        if (sequence.isEmpty()) {
            throw new IllegalArgumentException("sequence must not be empty");
        }
        this.sequence = List.copyOf(sequence);
    }

    /**
     * Delay after the given failed attempt (1-based).
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        return sequence.get(Math.min(attempt - 1, sequence.size() - 1));
    }
}
