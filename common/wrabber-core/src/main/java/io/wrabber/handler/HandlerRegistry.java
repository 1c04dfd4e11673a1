package io.wrabber.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.wrabber.envelope.EventNames;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps exact event names to handlers. Registration overwrites; the latest handler for a name wins.
 * <p>
 * Lookups happen per delivered message, so handlers registered after the consumer started are
 * picked up for subsequent messages.
 */
public final class HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final ObjectMapper mapper;
    private final Map<String, AsyncEventHandler> handlers = new ConcurrentHashMap<>();

    public HandlerRegistry(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public void register(String event, EventHandler handler) {
        register(List.of(event), handler);
    }

    public void register(Collection<String> events, EventHandler handler) {
        Objects.requireNonNull(handler, "handler");
        registerAsync(events, data -> {
            try {
                handler.handle(data);
                return CompletableFuture.completedFuture(null);
            } catch (Throwable ex) {
                return CompletableFuture.failedFuture(ex);
            }
        });
    }

    public void registerAsync(String event, AsyncEventHandler handler) {
        registerAsync(List.of(event), handler);
    }

    public void registerAsync(Collection<String> events, AsyncEventHandler handler) {
        Objects.requireNonNull(events, "events");
        Objects.requireNonNull(handler, "handler");
        if (events.isEmpty()) {
            throw new IllegalArgumentException("events must not be empty");
        }
        for (String event : events) {
            EventNames.requireValid(event);
        }
        for (String event : events) {
            AsyncEventHandler previous = handlers.put(event, handler);
            if (previous != null) {
                log.debug("Replaced handler for event {}", event);
            } else {
                log.debug("Registered handler for event {}", event);
            }
        }
    }

    /**
     * Registers a handler whose payload is converted to {@code type} with the registry's mapper.
     * A payload that cannot be converted fails the handler, which rejects the message.
     */
    public <T> void register(String event, Class<T> type, TypedEventHandler<T> handler) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        register(event, data -> handler.handle(mapper.treeToValue(data, type)));
    }

    public Optional<AsyncEventHandler> lookup(String event) {
        if (event == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(event));
    }

    public Set<String> registeredEvents() {
        return Set.copyOf(handlers.keySet());
    }
}
