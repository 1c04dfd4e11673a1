package io.wrabber.spring;

import io.wrabber.Wrabber;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the client once the application context is refreshed and stops it on shutdown, after
 * applying every {@link WrabberHandlerConfigurer}.
 */
public final class WrabberLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WrabberLifecycle.class);

    private final Wrabber wrabber;
    private final List<WrabberHandlerConfigurer> configurers;
    private final AtomicBoolean handlersRegistered = new AtomicBoolean();
    private volatile boolean running;

    public WrabberLifecycle(Wrabber wrabber, List<WrabberHandlerConfigurer> configurers) {
        this.wrabber = Objects.requireNonNull(wrabber, "wrabber");
        this.configurers = List.copyOf(Objects.requireNonNull(configurers, "configurers"));
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        if (handlersRegistered.compareAndSet(false, true)) {
            configurers.forEach(configurer -> configurer.registerHandlers(wrabber));
            if (log.isInfoEnabled()) {
                log.info("Registered handlers for events {}", wrabber.handlers().registeredEvents());
            }
        }
        wrabber.start();
        running = true;
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        wrabber.stop();
        running = false;
        log.info("Wrabber lifecycle stopped");
    }

    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public int getPhase() {
        return 0;
    }
}
