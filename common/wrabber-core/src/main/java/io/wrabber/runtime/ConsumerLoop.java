package io.wrabber.runtime;

import io.micrometer.core.instrument.Timer;
import io.wrabber.UnhandledMessagePolicy;
import io.wrabber.WrabberSettings;
import io.wrabber.broker.BrokerChannel;
import io.wrabber.broker.BrokerDelivery;
import io.wrabber.envelope.EventEnvelope;
import io.wrabber.envelope.EventEnvelopeCodec;
import io.wrabber.envelope.MalformedEnvelopeException;
import io.wrabber.handler.AsyncEventHandler;
import io.wrabber.handler.HandlerRegistry;
import io.wrabber.runtime.MessagingMetrics.ConsumeOutcome;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Subscribes to the primary queue and settles each delivery.
 * <ul>
 *   <li>undecodable body: reject without requeue</li>
 *   <li>handler completes normally: acknowledge</li>
 *   <li>handler throws or completes exceptionally: reject without requeue</li>
 *   <li>no handler: acknowledge or reject according to {@link UnhandledMessagePolicy}</li>
 * </ul>
 * Deliveries on one channel are dispatched one at a time by the driver; the loop waits for the
 * handler to finish before settling, so settlement order matches delivery order.
 */
public final class ConsumerLoop {

    private static final Logger log = LoggerFactory.getLogger(ConsumerLoop.class);

    static final String MDC_EVENT = "wrabber.event";
    static final String MDC_SERVICE = "wrabber.service";

    private final WrabberSettings settings;
    private final HandlerRegistry registry;
    private final EventEnvelopeCodec codec;
    private final MessagingMetrics metrics;

    private volatile Subscription subscription;

    public ConsumerLoop(WrabberSettings settings,
                        HandlerRegistry registry,
                        EventEnvelopeCodec codec,
                        MessagingMetrics metrics) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public void listen(BrokerChannel channel) throws IOException {
        Objects.requireNonNull(channel, "channel");
        Subscription previous = subscription;
        if (previous != null && previous.channel() == channel) {
            cancelQuietly(previous);
        }
        String queue = settings.names().primaryQueue();
        String consumerTag = channel.consume(queue, delivery -> dispatch(channel, delivery));
        subscription = new Subscription(channel, consumerTag);
        log.info("Listening on queue {} (consumerTag={}, prefetch={})", queue, consumerTag, settings.prefetch());
    }

    /**
     * Cancels the active subscription, if any. Failures are logged and ignored.
     */
    public void cancel() {
        Subscription current = subscription;
        subscription = null;
        if (current != null) {
            cancelQuietly(current);
        }
    }

    /**
     * Drops the reference to a subscription whose channel is gone.
     */
    void forget() {
        subscription = null;
    }

    void dispatch(BrokerChannel channel, BrokerDelivery delivery) {
        if (delivery.redelivered()) {
            log.warn("Message {} on {} is a redelivery; a previous consumer crashed or failed to settle it",
                delivery.deliveryTag(), settings.names().primaryQueue());
        }
        EventEnvelope envelope;
        try {
            envelope = codec.decode(delivery.body());
        } catch (MalformedEnvelopeException ex) {
            log.warn("Rejecting malformed message {}: {}", delivery.deliveryTag(), ex.getMessage());
            reject(channel, delivery);
            metrics.consumed(ConsumeOutcome.MALFORMED);
            return;
        }
        logReceived(envelope, delivery);

        Optional<AsyncEventHandler> handler = registry.lookup(envelope.event());
        if (handler.isEmpty()) {
            settleUnhandled(channel, delivery, envelope);
            return;
        }
        MDC.put(MDC_EVENT, envelope.event());
        MDC.put(MDC_SERVICE, settings.serviceName());
        Timer.Sample sample = metrics.startHandler();
        boolean success = false;
        try {
            invoke(handler.get(), envelope);
            success = true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while handling {}; leaving message {} unsettled for redelivery",
                envelope.event(), delivery.deliveryTag());
            return;
        } catch (Throwable ex) {
            log.error("Handler for event {} failed; rejecting message {}", envelope.event(), delivery.deliveryTag(), ex);
        } finally {
            metrics.stopHandler(sample, envelope.event(), success);
            MDC.remove(MDC_EVENT);
            MDC.remove(MDC_SERVICE);
        }
        if (success) {
            ack(channel, delivery);
            metrics.consumed(ConsumeOutcome.ACKNOWLEDGED);
        } else {
            reject(channel, delivery);
            metrics.consumed(ConsumeOutcome.REJECTED);
        }
    }

    private static void invoke(AsyncEventHandler handler, EventEnvelope envelope) throws Throwable {
        CompletionStage<?> stage = handler.handle(envelope.data());
        if (stage == null) {
            return;
        }
        try {
            stage.toCompletableFuture().get();
        } catch (ExecutionException ex) {
            throw ex.getCause() != null ? ex.getCause() : ex;
        }
    }

    private void settleUnhandled(BrokerChannel channel, BrokerDelivery delivery, EventEnvelope envelope) {
        if (settings.unhandledMessagePolicy() == UnhandledMessagePolicy.REJECT) {
            log.info("No handler for event {}; rejecting message {}", envelope.event(), delivery.deliveryTag());
            reject(channel, delivery);
            metrics.consumed(ConsumeOutcome.UNHANDLED_REJECTED);
        } else {
            if (log.isDebugEnabled()) {
                log.debug("No handler for event {}; acknowledging message {}", envelope.event(), delivery.deliveryTag());
            }
            ack(channel, delivery);
            metrics.consumed(ConsumeOutcome.UNHANDLED_ACKNOWLEDGED);
        }
    }

    private void ack(BrokerChannel channel, BrokerDelivery delivery) {
        try {
            channel.ack(delivery.deliveryTag());
        } catch (IOException ex) {
            log.warn("Failed to acknowledge message {}; the broker will redeliver it: {}",
                delivery.deliveryTag(), ex.getMessage());
        }
    }

    private void reject(BrokerChannel channel, BrokerDelivery delivery) {
        try {
            channel.nack(delivery.deliveryTag(), false);
        } catch (IOException ex) {
            log.warn("Failed to reject message {}; the broker will redeliver it: {}",
                delivery.deliveryTag(), ex.getMessage());
        }
    }

    private void cancelQuietly(Subscription current) {
        try {
            current.channel().cancel(current.consumerTag());
        } catch (IOException | RuntimeException ex) {
            log.debug("Ignoring failure cancelling consumer {}: {}", current.consumerTag(), ex.getMessage());
        }
    }

    private void logReceived(EventEnvelope envelope, BrokerDelivery delivery) {
        if (settings.debug()) {
            log.info("Event received: {} (deliveryTag={}) data={}", envelope.event(), delivery.deliveryTag(), envelope.data());
        } else if (log.isDebugEnabled()) {
            log.debug("Event received: {} (deliveryTag={})", envelope.event(), delivery.deliveryTag());
        }
    }

    private record Subscription(BrokerChannel channel, String consumerTag) {
    }
}
