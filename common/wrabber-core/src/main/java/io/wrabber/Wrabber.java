package io.wrabber;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.wrabber.broker.BrokerConnector;
import io.wrabber.broker.rabbit.RabbitBrokerConnector;
import io.wrabber.envelope.EventEnvelopeCodec;
import io.wrabber.handler.AsyncEventHandler;
import io.wrabber.handler.EventHandler;
import io.wrabber.handler.HandlerRegistry;
import io.wrabber.handler.TypedEventHandler;
import io.wrabber.runtime.ConnectionState;
import io.wrabber.runtime.ConnectionSupervisor;
import io.wrabber.runtime.ConsumerLoop;
import io.wrabber.runtime.EventPublisher;
import io.wrabber.runtime.MessagingMetrics;
import io.wrabber.runtime.ReadinessGate;
import io.wrabber.runtime.TopologyManager;
import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event client for one service: publishes to the namespace exchange and dispatches events from the
 * service queue to registered handlers, reconnecting and re-declaring topology as needed.
 *
 * <pre>{@code
 * Wrabber events = Wrabber.builder(settings).build();
 * events.on("Users.ProfileUpdated", data -> refresh(data.get("userId").asText()));
 * events.start();
 * events.publish("Users.ProfileUpdated", Map.of("userId", "u-1"));
 * }</pre>
 */
public final class Wrabber implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Wrabber.class);

    private final WrabberSettings settings;
    private final HandlerRegistry handlers;
    private final ConnectionSupervisor supervisor;
    private final EventPublisher publisher;
    private final AtomicBoolean shutdownHookRegistered = new AtomicBoolean();

    private Wrabber(Builder builder) {
        this.settings = builder.settings;
        ObjectMapper mapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        MeterRegistry meterRegistry = builder.meterRegistry != null ? builder.meterRegistry : new SimpleMeterRegistry();
        EventEnvelopeCodec codec = new EventEnvelopeCodec(mapper);
        MessagingMetrics metrics = new MessagingMetrics(meterRegistry, settings.serviceName());
        this.handlers = new HandlerRegistry(mapper);
        if (settings.mode() == ClientMode.LIVE) {
            BrokerConnector connector = builder.connector != null ? builder.connector : new RabbitBrokerConnector();
            ConsumerLoop consumer = settings.listening()
                ? new ConsumerLoop(settings, handlers, codec, metrics)
                : null;
            this.supervisor = new ConnectionSupervisor(
                settings, connector, new TopologyManager(settings), consumer, new ReadinessGate(), metrics);
        } else {
            this.supervisor = null;
        }
        this.publisher = new EventPublisher(settings, codec, supervisor, metrics);
        log.debug("Created client {} (queue={})", settings, settings.names().primaryQueue());
    }

    public static Builder builder(WrabberSettings settings) {
        return new Builder(settings);
    }

    /**
     * Starts connecting in the background; returns immediately. Use {@link #awaitReady(Duration)} to
     * wait for the first successful connect.
     */
    public void start() {
        if (supervisor == null) {
            log.info("Running in simulated mode; no broker connection will be opened");
            return;
        }
        supervisor.start();
    }

    /**
     * Stops consuming and closes the broker connection. Waits up to the configured shutdown timeout;
     * handlers already running are allowed to finish on their own.
     */
    public void stop() {
        if (supervisor == null) {
            log.debug("Simulated mode; nothing to stop");
            return;
        }
        Duration timeout = settings.shutdownTimeout();
        try {
            supervisor.stop().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping broker connection");
        } catch (ExecutionException | TimeoutException ex) {
            log.warn("Broker connection did not stop within {} ms", timeout.toMillis());
        }
    }

    /**
     * Stops the client and releases its supervisor thread. The client cannot be restarted afterwards.
     */
    @Override
    public void close() {
        if (supervisor != null) {
            supervisor.close();
        }
    }

    /**
     * Registers a JVM shutdown hook that closes this client on interrupt or termination.
     */
    public Wrabber registerShutdownHook() {
        if (shutdownHookRegistered.compareAndSet(false, true)) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::close, "wrabber-shutdown-" + settings.serviceName()));
        }
        return this;
    }

    public boolean publish(String event, Object data) {
        return publisher.publish(event, data);
    }

    public Wrabber on(String event, EventHandler handler) {
        handlers.register(event, handler);
        return this;
    }

    public Wrabber on(Collection<String> events, EventHandler handler) {
        handlers.register(events, handler);
        return this;
    }

    public <T> Wrabber on(String event, Class<T> type, TypedEventHandler<T> handler) {
        handlers.register(event, type, handler);
        return this;
    }

    public Wrabber onAsync(String event, AsyncEventHandler handler) {
        handlers.registerAsync(event, handler);
        return this;
    }

    public Wrabber onAsync(Collection<String> events, AsyncEventHandler handler) {
        handlers.registerAsync(events, handler);
        return this;
    }

    /**
     * Waits until the current connection epoch has finished topology setup.
     *
     * @return {@code true} when ready, {@code false} on timeout or when the client was stopped
     */
    public boolean awaitReady(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        if (supervisor == null) {
            return true;
        }
        try {
            supervisor.readiness().awaitReady(timeout);
            return true;
        } catch (ExecutionException | TimeoutException ex) {
            return false;
        }
    }

    public boolean isReady() {
        return supervisor == null || supervisor.readiness().isReady();
    }

    public ConnectionState state() {
        return supervisor == null ? ConnectionState.DISCONNECTED : supervisor.state();
    }

    public WrabberSettings settings() {
        return settings;
    }

    public TopologyNames names() {
        return settings.names();
    }

    public HandlerRegistry handlers() {
        return handlers;
    }

    public static final class Builder {
        private final WrabberSettings settings;
        private BrokerConnector connector;
        private ObjectMapper objectMapper;
        private MeterRegistry meterRegistry;

        private Builder(WrabberSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings");
        }

        public Builder connector(BrokerConnector connector) {
            this.connector = connector;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Wrabber build() {
            return new Wrabber(this);
        }
    }
}
