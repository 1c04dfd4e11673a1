package io.wrabber;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Broker object names derived from the namespace and service name.
 *
 * @param exchange               namespace exchange every event is published to
 * @param primaryQueue           queue the service consumes from
 * @param deadLetterExchange     namespace-wide dead-letter exchange
 * @param deadLetterQueue        per-service dead-letter queue
 * @param deadLetterRoutingKey   routing key binding the dead-letter queue to the dead-letter exchange
 */
public record TopologyNames(String exchange,
                            String primaryQueue,
                            String deadLetterExchange,
                            String deadLetterQueue,
                            String deadLetterRoutingKey) {

    private static final SecureRandom RANDOM = new SecureRandom();

    public TopologyNames {
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(primaryQueue, "primaryQueue");
        Objects.requireNonNull(deadLetterExchange, "deadLetterExchange");
        Objects.requireNonNull(deadLetterQueue, "deadLetterQueue");
        Objects.requireNonNull(deadLetterRoutingKey, "deadLetterRoutingKey");
    }

    static TopologyNames of(String namespace, String serviceName, QueueMode queueMode) {
        String serviceQueue = namespace + "." + serviceName;
        String primary = queueMode == QueueMode.BROADCAST
            ? serviceQueue + "." + shortRandomId(8)
            : serviceQueue;
        return new TopologyNames(
            namespace,
            primary,
            namespace + ".dlx",
            serviceQueue + ".dlq",
            serviceQueue);
    }

    static String shortRandomId(int length) {
        byte[] bytes = new byte[(length + 1) / 2];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes).substring(0, length);
    }
}
