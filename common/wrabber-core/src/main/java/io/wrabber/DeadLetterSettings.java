package io.wrabber;

import java.time.Duration;

/**
 * Dead-letter policy for the service queue.
 *
 * @param enabled   whether rejected messages are routed to {@code namespace.serviceName.dlq}
 * @param ttl       optional time-to-live for dead-lettered messages
 * @param maxLength optional maximum number of messages kept in the dead-letter queue
 */
public record DeadLetterSettings(boolean enabled, Duration ttl, Integer maxLength) {

    private static final DeadLetterSettings DISABLED = new DeadLetterSettings(false, null, null);

    public DeadLetterSettings {
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new IllegalArgumentException("deadLetter.ttl must be positive");
        }
        if (maxLength != null && maxLength <= 0) {
            throw new IllegalArgumentException("deadLetter.maxLength must be positive");
        }
    }

    public static DeadLetterSettings disabled() {
        return DISABLED;
    }

    public static DeadLetterSettings active() {
        return new DeadLetterSettings(true, null, null);
    }

    public DeadLetterSettings withTtl(Duration ttl) {
        return new DeadLetterSettings(enabled, ttl, maxLength);
    }

    public DeadLetterSettings withMaxLength(Integer maxLength) {
        return new DeadLetterSettings(enabled, ttl, maxLength);
    }
}
