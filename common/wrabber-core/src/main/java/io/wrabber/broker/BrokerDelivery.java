package io.wrabber.broker;

import java.util.Objects;

/**
 * A message handed to a consumer.
 *
 * @param consumerTag  subscription the message was delivered to
 * @param deliveryTag  channel-scoped tag used to ack/nack the message
 * @param redelivered  broker flag set when the message was delivered before and not acknowledged
 * @param routingKey   routing key the message was published with
 * @param body         raw message body
 */
public record BrokerDelivery(String consumerTag,
                             long deliveryTag,
                             boolean redelivered,
                             String routingKey,
                             byte[] body) {

    public BrokerDelivery {
        Objects.requireNonNull(body, "body");
    }
}
