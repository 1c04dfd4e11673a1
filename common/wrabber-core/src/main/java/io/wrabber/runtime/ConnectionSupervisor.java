package io.wrabber.runtime;

import io.wrabber.WrabberSettings;
import io.wrabber.broker.BrokerChannel;
import io.wrabber.broker.BrokerCloseEvent;
import io.wrabber.broker.BrokerConnection;
import io.wrabber.broker.BrokerConnector;
import io.wrabber.broker.BrokerUris;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the broker connection and channel and drives the connect / reconnect state machine.
 * <p>
 * All state transitions run on one supervisor thread. {@link #start()}, {@link #stop()} and the
 * broker's close notifications are posted to that thread as tasks, and backoff waits are scheduled
 * tasks on it, so the retry loop never runs concurrently with itself. Close notifications carry
 * the epoch they were registered for and are ignored once that epoch is over.
 */
public final class ConnectionSupervisor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    private final WrabberSettings settings;
    private final BrokerConnector connector;
    private final TopologyManager topology;
    private final ConsumerLoop consumer;
    private final ReadinessGate readiness;
    private final ReconnectBackoff backoff;
    private final MessagingMetrics metrics;
    private final ScheduledExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    // confined to the supervisor thread
    private BrokerConnection connection;
    private BrokerChannel channel;
    private ScheduledFuture<?> pendingAttempt;
    private int attempt;
    private long epoch;

    /**
     * @param consumer consumer loop to start on every connect, or {@code null} for publish-only clients
     */
    public ConnectionSupervisor(WrabberSettings settings,
                                BrokerConnector connector,
                                TopologyManager topology,
                                ConsumerLoop consumer,
                                ReadinessGate readiness,
                                MessagingMetrics metrics) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.topology = Objects.requireNonNull(topology, "topology");
        this.consumer = consumer;
        this.readiness = Objects.requireNonNull(readiness, "readiness");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.backoff = new ReconnectBackoff(settings.reconnectBackoff());
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "wrabber-supervisor-" + settings.serviceName());
            thread.setDaemon(true);
            return thread;
        });
    }

    public ConnectionState state() {
        return state;
    }

    /**
     * {@code true} between {@link #start()} and {@link #stop()}, whether or not a connection is up.
     */
    public boolean isRunning() {
        return running.get();
    }

    public ReadinessGate readiness() {
        return readiness;
    }

    /**
     * Begins connecting in the background. No-op while already connecting or connected.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("start ignored; supervisor already running");
            return;
        }
        try {
            executor.execute(this::onStart);
        } catch (RejectedExecutionException ex) {
            running.set(false);
            throw new IllegalStateException("Connection supervisor has been closed", ex);
        }
    }

    /**
     * Cancels consumption, closes the channel and connection, and disables reconnection.
     *
     * @return completes once cleanup has been attempted; cleanup failures are logged
     */
    public CompletableFuture<Void> stop() {
        running.set(false);
        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    onStop();
                } finally {
                    done.complete(null);
                }
            });
        } catch (RejectedExecutionException ex) {
            done.complete(null);
        }
        return done;
    }

    @Override
    public void close() {
        Duration timeout = settings.shutdownTimeout();
        try {
            stop().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException ex) {
            log.warn("Supervisor did not stop within {} ms; forcing shutdown", timeout.toMillis());
        } finally {
            executor.shutdownNow();
        }
    }

    private void onStart() {
        if (state != ConnectionState.DISCONNECTED) {
            log.debug("start ignored; state is {}", state);
            return;
        }
        state = ConnectionState.CONNECTING;
        attempt = 1;
        log.info("Connecting to broker {} as {}", BrokerUris.redact(settings.url()), settings.connectionName());
        attemptConnect();
    }

    private void attemptConnect() {
        pendingAttempt = null;
        if (state != ConnectionState.CONNECTING) {
            return;
        }
        BrokerConnection newConnection = null;
        BrokerChannel newChannel = null;
        try {
            newConnection = connector.connect(settings.url(), settings.connectionName(), settings.heartbeatSeconds());
            newChannel = newConnection.createChannel();
            newChannel.setPrefetch(settings.prefetch());
            topology.ensureTopology(newConnection, newChannel);
            if (consumer != null) {
                consumer.listen(newChannel);
            }
        } catch (IOException | RuntimeException ex) {
            closeQuietly(newChannel, newConnection, false);
            metrics.connectionAttempt(false);
            scheduleRetry(ex);
            return;
        }

        long id = ++epoch;
        connection = newConnection;
        channel = newChannel;
        state = ConnectionState.CONNECTED;
        metrics.connectionAttempt(true);
        if (attempt > 1) {
            log.info("Connected to broker after {} attempts (epoch {})", attempt, id);
        } else {
            log.info("Connected to broker (epoch {})", id);
        }
        attempt = 1;
        newConnection.addCloseListener(event -> post(() -> onClosed(id, "connection", event)));
        newChannel.addCloseListener(event -> post(() -> onClosed(id, "channel", event)));
        readiness.signal(new ConnectionEpoch(id, newChannel));
        if (!newConnection.isOpen() || !newChannel.isOpen()) {
            post(() -> onClosed(id, "connection", BrokerCloseEvent.unexpected("closed during setup", null)));
        }
    }

    private void scheduleRetry(Exception failure) {
        Duration delay = backoff.delayFor(attempt);
        log.warn("Broker connection attempt {} failed: {}; retrying in {} ms",
            attempt, describe(failure), delay.toMillis());
        if (log.isDebugEnabled()) {
            log.debug("Connection attempt {} failure detail", attempt, failure);
        }
        attempt++;
        pendingAttempt = executor.schedule(this::attemptConnect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void onClosed(long closedEpoch, String source, BrokerCloseEvent event) {
        if (closedEpoch != epoch || state != ConnectionState.CONNECTED) {
            return;
        }
        log.warn("Broker {} closed unexpectedly (code={}, reason={}); reconnecting",
            source, event.replyCode(), event.reason());
        readiness.reset();
        if (consumer != null) {
            consumer.forget();
        }
        closeQuietly(channel, connection, false);
        channel = null;
        connection = null;
        state = ConnectionState.CONNECTING;
        attempt = 1;
        attemptConnect();
    }

    private void onStop() {
        if (state == ConnectionState.DISCONNECTED) {
            return;
        }
        state = ConnectionState.CLOSING;
        log.info("Stopping broker connection {}", settings.connectionName());
        if (pendingAttempt != null) {
            pendingAttempt.cancel(false);
            pendingAttempt = null;
        }
        epoch++;
        readiness.release(new ClientStoppedException("client stopped"));
        if (consumer != null) {
            consumer.cancel();
        }
        closeQuietly(channel, connection, true);
        channel = null;
        connection = null;
        attempt = 0;
        state = ConnectionState.DISCONNECTED;
        log.info("Broker connection {} stopped", settings.connectionName());
    }

    private void post(Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException ex) {
            log.debug("Supervisor closed; dropping broker notification");
        }
    }

    private void closeQuietly(BrokerChannel staleChannel, BrokerConnection staleConnection, boolean warn) {
        if (staleChannel != null) {
            try {
                staleChannel.close();
            } catch (IOException | RuntimeException ex) {
                logCleanupFailure(warn, "channel", ex);
            }
        }
        if (staleConnection != null) {
            try {
                staleConnection.close();
            } catch (IOException | RuntimeException ex) {
                logCleanupFailure(warn, "connection", ex);
            }
        }
    }

    private static void logCleanupFailure(boolean warn, String resource, Exception ex) {
        if (warn) {
            log.warn("Failed to close broker {}: {}", resource, ex.getMessage());
        } else {
            log.debug("Failed to close broker {}: {}", resource, ex.getMessage());
        }
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return failure.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
