package io.wrabber.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Wire representation of every published event: {@code {"event": ..., "data": ...}}.
 * <p>
 * The shape of {@code data} is owned by the publisher and the handler; the client never inspects it.
 */
public record EventEnvelope(String event, JsonNode data) {

    public EventEnvelope {
        EventNames.requireValid(event);
        data = data == null ? NullNode.getInstance() : data.deepCopy();
    }
}
