package io.wrabber.runtime;

import io.wrabber.DeadLetterSettings;
import io.wrabber.QueueMode;
import io.wrabber.TopologyNames;
import io.wrabber.WrabberSettings;
import io.wrabber.broker.BrokerChannel;
import io.wrabber.broker.BrokerConnection;
import io.wrabber.broker.BrokerPreconditionException;
import io.wrabber.broker.QueueDeclaration;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares the service's messaging topology: namespace exchange, optional dead-letter
 * exchange/queue pair, and the primary queue bound to the exchange.
 * <p>
 * When the primary queue exists on the broker with different arguments (for example after the
 * dead-letter policy changed), the declaration fails with a precondition error and closes the
 * channel. The conflicting queue is then deleted through a temporary channel and the original
 * error is rethrown, so the supervisor reconnects and declares the queue afresh.
 */
public final class TopologyManager {

    private static final Logger log = LoggerFactory.getLogger(TopologyManager.class);

    static final String DEAD_LETTER_EXCHANGE_TYPE = "direct";
    static final String ARG_DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
    static final String ARG_DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";
    static final String ARG_MESSAGE_TTL = "x-message-ttl";
    static final String ARG_MAX_LENGTH = "x-max-length";

    private final WrabberSettings settings;
    private final TopologyNames names;

    public TopologyManager(WrabberSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.names = settings.names();
    }

    public void ensureTopology(BrokerConnection connection, BrokerChannel channel) throws IOException {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(channel, "channel");
        channel.declareExchange(names.exchange(), settings.exchangeType().wireName(), settings.durable());
        log.debug("declared exchange {} ({})", names.exchange(), settings.exchangeType().wireName());

        if (settings.deadLetter().enabled()) {
            channel.declareExchange(names.deadLetterExchange(), DEAD_LETTER_EXCHANGE_TYPE, settings.durable());
            channel.declareQueue(deadLetterQueue());
            channel.bindQueue(names.deadLetterQueue(), names.deadLetterExchange(), names.deadLetterRoutingKey());
            log.debug("declared dead-letter queue {} on {}", names.deadLetterQueue(), names.deadLetterExchange());
        }

        QueueDeclaration primary = primaryQueue();
        try {
            channel.declareQueue(primary);
        } catch (BrokerPreconditionException conflict) {
            log.warn("Queue {} exists with a conflicting definition; deleting it so the next attempt can redeclare it: {}",
                primary.name(), conflict.getMessage());
            deleteConflictingQueue(connection, primary.name(), conflict);
            throw conflict;
        }
        channel.bindQueue(primary.name(), names.exchange(), settings.exchangeType().bindingKey());
        log.info("topology ready: exchange={} queue={} deadLetter={}",
            names.exchange(), primary.name(), settings.deadLetter().enabled() ? names.deadLetterQueue() : "disabled");
    }

    QueueDeclaration primaryQueue() {
        boolean broadcast = settings.queueMode() == QueueMode.BROADCAST;
        QueueDeclaration.Builder builder = QueueDeclaration.named(names.primaryQueue())
            .durable(!broadcast && settings.durable())
            .exclusive(broadcast)
            .autoDelete(broadcast);
        if (settings.deadLetter().enabled()) {
            builder.argument(ARG_DEAD_LETTER_EXCHANGE, names.deadLetterExchange())
                .argument(ARG_DEAD_LETTER_ROUTING_KEY, names.deadLetterRoutingKey());
        }
        if (settings.messageTtl() != null) {
            builder.argument(ARG_MESSAGE_TTL, settings.messageTtl().toMillis());
        }
        return builder.build();
    }

    QueueDeclaration deadLetterQueue() {
        DeadLetterSettings deadLetter = settings.deadLetter();
        QueueDeclaration.Builder builder = QueueDeclaration.named(names.deadLetterQueue())
            .durable(settings.durable());
        if (deadLetter.ttl() != null) {
            builder.argument(ARG_MESSAGE_TTL, deadLetter.ttl().toMillis());
        }
        if (deadLetter.maxLength() != null) {
            builder.argument(ARG_MAX_LENGTH, deadLetter.maxLength());
        }
        return builder.build();
    }

    private void deleteConflictingQueue(BrokerConnection connection, String queue, IOException conflict) {
        BrokerChannel temporary = null;
        try {
            temporary = connection.createChannel();
            temporary.deleteQueue(queue);
            log.warn("Deleted conflicting queue {}", queue);
        } catch (IOException | RuntimeException ex) {
            log.warn("Failed to delete conflicting queue {}", queue, ex);
            conflict.addSuppressed(ex);
        } finally {
            if (temporary != null) {
                try {
                    temporary.close();
                } catch (IOException | RuntimeException ex) {
                    log.debug("Failed to close temporary channel after deleting {}", queue, ex);
                }
            }
        }
    }
}
