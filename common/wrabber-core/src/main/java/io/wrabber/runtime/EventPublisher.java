package io.wrabber.runtime;

import io.wrabber.ClientMode;
import io.wrabber.NotStartedPolicy;
import io.wrabber.WrabberSettings;
import io.wrabber.broker.OutboundMessage;
import io.wrabber.envelope.EventEnvelope;
import io.wrabber.envelope.EventEnvelopeCodec;
import io.wrabber.envelope.EventNames;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes event envelopes to the namespace exchange once the current connection epoch is ready.
 */
public final class EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    private final WrabberSettings settings;
    private final EventEnvelopeCodec codec;
    private final ConnectionSupervisor supervisor;
    private final MessagingMetrics metrics;

    /**
     * @param supervisor live connection owner, may be {@code null} in {@link ClientMode#SIMULATED} mode
     */
    public EventPublisher(WrabberSettings settings,
                          EventEnvelopeCodec codec,
                          ConnectionSupervisor supervisor,
                          MessagingMetrics metrics) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (settings.mode() == ClientMode.LIVE) {
            Objects.requireNonNull(supervisor, "supervisor");
        }
        this.supervisor = supervisor;
    }

    /**
     * Publishes {@code data} under {@code event}.
     *
     * @return {@code true} when the message was handed to the broker (or logged in simulated mode),
     *     {@code false} when it was dropped, including when {@code data} cannot be converted to JSON
     * @throws IllegalArgumentException when {@code event} is not a qualified event name
     * @throws IllegalStateException when the client is not started and the policy is
     *     {@link NotStartedPolicy#FAIL}
     */
    public boolean publish(String event, Object data) {
        EventNames.requireValid(event);
        EventEnvelope envelope;
        try {
            envelope = codec.envelope(event, data);
        } catch (IllegalArgumentException ex) {
            log.warn("Cannot convert payload of {} to JSON; dropping it: {}", event, ex.getMessage());
            metrics.dropped("serialization");
            return false;
        }
        if (settings.mode() == ClientMode.SIMULATED) {
            if (settings.debug()) {
                log.info("[simulated] would publish {} data={}", envelope.event(), envelope.data());
            } else {
                log.debug("[simulated] would publish {}", envelope.event());
            }
            metrics.published();
            return true;
        }

        ReadinessGate readiness = supervisor.readiness();
        ConnectionEpoch epoch = null;
        do {
            if (epoch != null) {
                log.debug("Channel of epoch {} is closed; waiting for the next connection", epoch.id());
                readiness.expire(epoch);
            }
            CompletableFuture<ConnectionEpoch> ready = readiness.whenReady();
            if (!supervisor.isRunning()) {
                return notStarted(envelope);
            }
            epoch = awaitEpoch(ready, envelope);
            if (epoch == null) {
                return false;
            }
        } while (!epoch.channel().isOpen());

        OutboundMessage message = new OutboundMessage(
            codec.encode(envelope),
            EventEnvelopeCodec.CONTENT_TYPE,
            EventEnvelopeCodec.CONTENT_ENCODING,
            envelope.event(),
            UUID.randomUUID().toString(),
            true);
        String exchange = settings.names().exchange();
        try {
            boolean writable = epoch.channel().publish(
                exchange, settings.exchangeType().routingKey(envelope.event()), message);
            if (!writable) {
                log.debug("Broker applied backpressure after publishing {}; waiting until writable", envelope.event());
                epoch.channel().awaitWritable();
            }
        } catch (IOException | RuntimeException ex) {
            log.warn("Failed to publish {} to {} (epoch {}): {}", envelope.event(), exchange, epoch.id(), ex.getMessage());
            metrics.dropped("publish-failed");
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for broker backpressure to clear after publishing {}", envelope.event());
        }
        metrics.published();
        logPublished(envelope);
        return true;
    }

    private boolean notStarted(EventEnvelope envelope) {
        if (settings.notStartedPolicy() == NotStartedPolicy.FAIL) {
            throw new IllegalStateException("Cannot publish " + envelope.event() + ": client is not started");
        }
        log.warn("Client not started; dropping event {}", envelope.event());
        metrics.dropped("not-started");
        return false;
    }

    private ConnectionEpoch awaitEpoch(CompletableFuture<ConnectionEpoch> ready, EventEnvelope envelope) {
        Duration timeout = settings.readyTimeout();
        try {
            return timeout == null ? ready.get() : ready.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for broker readiness; dropping event {}", envelope.event());
            metrics.dropped("interrupted");
        } catch (TimeoutException ex) {
            log.warn("Broker not ready within {} ms; dropping event {}", timeout.toMillis(), envelope.event());
            metrics.dropped("ready-timeout");
        } catch (ExecutionException ex) {
            log.warn("Client stopped while waiting for broker readiness; dropping event {}", envelope.event());
            metrics.dropped("stopped");
        }
        return null;
    }

    private void logPublished(EventEnvelope envelope) {
        if (settings.debug()) {
            log.info("Event emitted: {} data={}", envelope.event(), envelope.data());
        } else if (log.isDebugEnabled()) {
            log.debug("Event emitted: {}", envelope.event());
        }
    }
}
