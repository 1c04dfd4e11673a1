package io.wrabber;

/**
 * How the service's primary queue is shared between instances.
 */
public enum QueueMode {
    /**
     * All instances of a service consume from one durable queue named {@code namespace.serviceName},
     * so each event is handled by exactly one instance.
     */
    SHARED,
    /**
     * Every instance declares its own exclusive, auto-delete queue with a random suffix, so each
     * instance receives every event.
     */
    BROADCAST
}
