package io.wrabber.broker;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Logical sub-connection used for topology, publish and consume work.
 * <p>
 * A channel becomes unusable after the broker closes it with a protocol error (for example a
 * declaration that conflicts with an existing queue); callers must open a new channel afterwards.
 */
public interface BrokerChannel {

    void declareExchange(String name, String type, boolean durable) throws IOException;

    void declareQueue(QueueDeclaration declaration) throws IOException;

    void bindQueue(String queue, String exchange, String routingKey) throws IOException;

    void deleteQueue(String name) throws IOException;

    void setPrefetch(int prefetch) throws IOException;

    /**
     * Publishes a message.
     *
     * @return {@code false} when the broker has asked the client to stop writing; callers should
     *     then wait on {@link #awaitWritable()} before publishing more
     */
    boolean publish(String exchange, String routingKey, OutboundMessage message) throws IOException;

    /**
     * Blocks until the channel accepts writes again or is closed.
     */
    void awaitWritable() throws InterruptedException;

    /**
     * Subscribes to a queue with manual acknowledgement.
     *
     * @return the consumer tag assigned by the broker
     */
    String consume(String queue, DeliveryCallback callback) throws IOException;

    void cancel(String consumerTag) throws IOException;

    void ack(long deliveryTag) throws IOException;

    void nack(long deliveryTag, boolean requeue) throws IOException;

    boolean isOpen();

    void addCloseListener(Consumer<BrokerCloseEvent> listener);

    void close() throws IOException;

    /**
     * Receives deliveries for one subscription. Invocations for a channel never overlap.
     */
    @FunctionalInterface
    interface DeliveryCallback {
        void onDelivery(BrokerDelivery delivery);
    }
}
