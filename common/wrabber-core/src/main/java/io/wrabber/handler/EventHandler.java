package io.wrabber.handler;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Synchronous handler; returning normally acknowledges the message, throwing rejects it.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(JsonNode data) throws Exception;
}
