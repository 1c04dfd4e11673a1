package io.wrabber.runtime;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;

/**
 * Micrometer meters for publish, consume and connection activity.
 */
public final class MessagingMetrics {

    private final MeterRegistry registry;
    private final String service;

    public MessagingMetrics(MeterRegistry registry, String service) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.service = Objects.requireNonNull(service, "service");
    }

    void published() {
        counter("wrabber.messages.published", "Events written to the broker").increment();
    }

    void dropped(String reason) {
        Counter.builder("wrabber.messages.dropped")
            .description("Events dropped before reaching the broker")
            .tag("service", service)
            .tag("reason", reason)
            .register(registry)
            .increment();
    }

    void consumed(ConsumeOutcome outcome) {
        Counter.builder("wrabber.messages.consumed")
            .description("Delivered messages by settlement outcome")
            .tag("service", service)
            .tag("outcome", outcome.tag())
            .register(registry)
            .increment();
    }

    void connectionAttempt(boolean success) {
        Counter.builder("wrabber.connection.attempts")
            .description("Broker connection attempts")
            .tag("service", service)
            .tag("outcome", success ? "success" : "failure")
            .register(registry)
            .increment();
    }

    Timer.Sample startHandler() {
        return Timer.start(registry);
    }

    void stopHandler(Timer.Sample sample, String event, boolean success) {
        sample.stop(Timer.builder("wrabber.handler.duration")
            .description("Latency of event handler invocations")
            .tag("service", service)
            .tag("event", event)
            .tag("outcome", success ? "success" : "error")
            .register(registry));
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name)
            .description(description)
            .tag("service", service)
            .register(registry);
    }

    enum ConsumeOutcome {
        ACKNOWLEDGED("acknowledged"),
        REJECTED("rejected"),
        UNHANDLED_ACKNOWLEDGED("unhandled-acknowledged"),
        UNHANDLED_REJECTED("unhandled-rejected"),
        MALFORMED("malformed");

        private final String tag;

        ConsumeOutcome(String tag) {
            this.tag = tag;
        }

        String tag() {
            return tag;
        }
    }
}
