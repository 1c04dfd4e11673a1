package io.wrabber;

import java.util.Locale;

/**
 * Type of the namespace exchange events are published to.
 */
public enum ExchangeType {
    FANOUT(""),
    TOPIC("#");

    private final String bindingKey;

    ExchangeType(String bindingKey) {
        this.bindingKey = bindingKey;
    }

    /**
     * Binding key used to attach the primary queue so it receives every event.
     */
    public String bindingKey() {
        return bindingKey;
    }

    /**
     * Routing key used when publishing the given event.
     */
    public String routingKey(String event) {
        return this == TOPIC ? event : "";
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
