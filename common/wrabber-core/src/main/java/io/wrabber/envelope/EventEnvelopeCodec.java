package io.wrabber.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.Objects;

/**
 * Serialises {@link EventEnvelope} instances to UTF-8 JSON and back.
 */
public final class EventEnvelopeCodec {

    public static final String CONTENT_TYPE = "application/json";
    public static final String CONTENT_ENCODING = "utf-8";

    private static final String EVENT_FIELD = "event";
    private static final String DATA_FIELD = "data";

    private final ObjectMapper mapper;

    public EventEnvelopeCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Builds an envelope from an arbitrary payload object, converting it with the codec's mapper.
     */
    public EventEnvelope envelope(String event, Object data) {
        JsonNode node = data instanceof JsonNode json ? json : mapper.valueToTree(data);
        return new EventEnvelope(event, node);
    }

    public byte[] encode(EventEnvelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        ObjectNode node = mapper.createObjectNode();
        node.put(EVENT_FIELD, envelope.event());
        node.set(DATA_FIELD, envelope.data());
        try {
            return mapper.writeValueAsBytes(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Unable to serialise event " + envelope.event(), ex);
        }
    }

    public EventEnvelope decode(byte[] body) {
        if (body == null || body.length == 0) {
            throw new MalformedEnvelopeException("message body is empty");
        }
        JsonNode node;
        try {
            node = mapper.readTree(body);
        } catch (IOException ex) {
            throw new MalformedEnvelopeException("message body is not valid JSON", ex);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedEnvelopeException("message body must be a JSON object");
        }
        JsonNode event = node.get(EVENT_FIELD);
        if (event == null || !event.isTextual()) {
            throw new MalformedEnvelopeException("envelope is missing a textual 'event' field");
        }
        if (!EventNames.isValid(event.asText())) {
            throw new MalformedEnvelopeException("envelope event '" + event.asText() + "' is not a qualified event name");
        }
        return new EventEnvelope(event.asText(), node.get(DATA_FIELD));
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
