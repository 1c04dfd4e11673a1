package io.wrabber.broker;

import java.util.Objects;

/**
 * Message body plus the AMQP basic properties the client sets on publish.
 */
public record OutboundMessage(byte[] body,
                              String contentType,
                              String contentEncoding,
                              String type,
                              String messageId,
                              boolean persistent) {

    public OutboundMessage {
        Objects.requireNonNull(body, "body");
    }
}
