package io.wrabber.handler;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.concurrent.CompletionStage;

/**
 * Handler that completes asynchronously. The message is acknowledged once the returned stage
 * completes normally and rejected when it completes exceptionally.
 */
@FunctionalInterface
public interface AsyncEventHandler {

    CompletionStage<?> handle(JsonNode data);
}
