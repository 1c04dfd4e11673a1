package io.wrabber;

/**
 * What the consumer does with a message whose event has no registered handler.
 */
public enum UnhandledMessagePolicy {
    /** Acknowledge and drop the message. */
    ACKNOWLEDGE,
    /** Reject without requeue so the message is dead-lettered when a dead-letter queue exists. */
    REJECT
}
