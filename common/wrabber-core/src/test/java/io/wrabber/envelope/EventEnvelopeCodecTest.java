package io.wrabber.envelope;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventEnvelopeCodecTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EventEnvelopeCodec codec;

    @BeforeEach
    void setUp() {
        codec = new EventEnvelopeCodec(MAPPER);
    }

    @Test
    void encodeWritesEventAndDataFields() throws Exception {
        EventEnvelope envelope = codec.envelope("Users.ProfileUpdated", Map.of("userId", "u-1", "tags", List.of("a", "b")));

        JsonNode written = MAPPER.readTree(codec.encode(envelope));

        assertThat(written.fieldNames()).toIterable().containsExactly("event", "data");
        assertThat(written.path("event").asText()).isEqualTo("Users.ProfileUpdated");
        assertThat(written.path("data").path("userId").asText()).isEqualTo("u-1");
        assertThat(written.path("data").path("tags").get(1).asText()).isEqualTo("b");
    }

    @Test
    void decodeReadsEnvelopeAndIgnoresUnknownFields() {
        byte[] body = """
            {"event":"Billing.InvoicePaid","data":{"amount":12.5},"extra":true}
            """.getBytes(StandardCharsets.UTF_8);

        EventEnvelope envelope = codec.decode(body);

        assertThat(envelope.event()).isEqualTo("Billing.InvoicePaid");
        assertThat(envelope.data().path("amount").asDouble()).isEqualTo(12.5);
    }

    @Test
    void missingOrNullDataBecomesJsonNull() {
        EventEnvelope missing = codec.decode("{\"event\":\"Users.Deleted\"}".getBytes(StandardCharsets.UTF_8));
        EventEnvelope fromNull = codec.envelope("Users.Deleted", null);

        assertThat(missing.data().isNull()).isTrue();
        assertThat(fromNull.data().isNull()).isTrue();
        assertThat(new String(codec.encode(fromNull), StandardCharsets.UTF_8))
            .isEqualTo("{\"event\":\"Users.Deleted\",\"data\":null}");
    }

    @Test
    void scalarPayloadsAreCarriedAsIs() {
        EventEnvelope envelope = codec.decode(codec.encode(codec.envelope("Clock.Tick", 42)));

        assertThat(envelope.data().asInt()).isEqualTo(42);
    }

    @Test
    void rejectsMalformedBodies() {
        assertThatThrownBy(() -> codec.decode(new byte[0]))
            .isInstanceOf(MalformedEnvelopeException.class)
            .hasMessageContaining("empty");
        assertThatThrownBy(() -> codec.decode("not json".getBytes(StandardCharsets.UTF_8)))
            .isInstanceOf(MalformedEnvelopeException.class)
            .hasMessageContaining("JSON");
        assertThatThrownBy(() -> codec.decode("[1,2]".getBytes(StandardCharsets.UTF_8)))
            .isInstanceOf(MalformedEnvelopeException.class)
            .hasMessageContaining("object");
        assertThatThrownBy(() -> codec.decode("{\"data\":{}}".getBytes(StandardCharsets.UTF_8)))
            .isInstanceOf(MalformedEnvelopeException.class)
            .hasMessageContaining("event");
        assertThatThrownBy(() -> codec.decode("{\"event\":7}".getBytes(StandardCharsets.UTF_8)))
            .isInstanceOf(MalformedEnvelopeException.class);
        assertThatThrownBy(() -> codec.decode("{\"event\":\"NoNamespace\"}".getBytes(StandardCharsets.UTF_8)))
            .isInstanceOf(MalformedEnvelopeException.class)
            .hasMessageContaining("NoNamespace");
    }

    @Test
    void envelopeRejectsUnqualifiedEventNames() {
        assertThatThrownBy(() -> codec.envelope("ProfileUpdated", Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
