package io.wrabber.broker.rabbit;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import io.wrabber.broker.BrokerChannel;
import io.wrabber.broker.BrokerCloseEvent;
import io.wrabber.broker.BrokerDelivery;
import io.wrabber.broker.BrokerPreconditionException;
import io.wrabber.broker.OutboundMessage;
import io.wrabber.broker.QueueDeclaration;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class RabbitBrokerChannel implements BrokerChannel {

    private static final Logger log = LoggerFactory.getLogger(RabbitBrokerChannel.class);

    private static final int PERSISTENT = 2;
    private static final int TRANSIENT = 1;

    private final Channel delegate;
    private final FlowControl flowControl;
    private final Object publishLock = new Object();

    RabbitBrokerChannel(Channel delegate, FlowControl flowControl) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.flowControl = Objects.requireNonNull(flowControl, "flowControl");
    }

    @Override
    public void declareExchange(String name, String type, boolean durable) throws IOException {
        invoke("declare exchange " + name, () -> delegate.exchangeDeclare(name, type, durable));
    }

    @Override
    public void declareQueue(QueueDeclaration declaration) throws IOException {
        Objects.requireNonNull(declaration, "declaration");
        invoke("declare queue " + declaration.name(), () -> delegate.queueDeclare(
            declaration.name(),
            declaration.durable(),
            declaration.exclusive(),
            declaration.autoDelete(),
            declaration.arguments()));
    }

    @Override
    public void bindQueue(String queue, String exchange, String routingKey) throws IOException {
        invoke("bind queue " + queue + " to " + exchange, () -> delegate.queueBind(queue, exchange, routingKey));
    }

    @Override
    public void deleteQueue(String name) throws IOException {
        invoke("delete queue " + name, () -> delegate.queueDelete(name));
    }

    @Override
    public void setPrefetch(int prefetch) throws IOException {
        invoke("set prefetch", () -> {
            delegate.basicQos(prefetch);
            return null;
        });
    }

    @Override
    public boolean publish(String exchange, String routingKey, OutboundMessage message) throws IOException {
        Objects.requireNonNull(message, "message");
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
            .contentType(message.contentType())
            .contentEncoding(message.contentEncoding())
            .type(message.type())
            .messageId(message.messageId())
            .deliveryMode(message.persistent() ? PERSISTENT : TRANSIENT)
            .build();
        // AMQP channels must not interleave frames from concurrent publishers
        synchronized (publishLock) {
            invoke("publish to " + exchange, () -> {
                delegate.basicPublish(exchange, routingKey, properties, message.body());
                return null;
            });
        }
        return !flowControl.isBlocked();
    }

    @Override
    public void awaitWritable() throws InterruptedException {
        flowControl.awaitUnblocked(delegate::isOpen);
    }

    @Override
    public String consume(String queue, DeliveryCallback callback) throws IOException {
        Objects.requireNonNull(callback, "callback");
        return invoke("consume " + queue, () -> delegate.basicConsume(
            queue,
            false,
            (consumerTag, delivery) -> callback.onDelivery(new BrokerDelivery(
                consumerTag,
                delivery.getEnvelope().getDeliveryTag(),
                delivery.getEnvelope().isRedeliver(),
                delivery.getEnvelope().getRoutingKey(),
                delivery.getBody() == null ? new byte[0] : delivery.getBody())),
            consumerTag -> log.warn("Consumer {} on queue {} was cancelled by the broker", consumerTag, queue)));
    }

    @Override
    public void cancel(String consumerTag) throws IOException {
        invoke("cancel consumer " + consumerTag, () -> {
            delegate.basicCancel(consumerTag);
            return null;
        });
    }

    @Override
    public void ack(long deliveryTag) throws IOException {
        invoke("ack " + deliveryTag, () -> {
            delegate.basicAck(deliveryTag, false);
            return null;
        });
    }

    @Override
    public void nack(long deliveryTag, boolean requeue) throws IOException {
        invoke("nack " + deliveryTag, () -> {
            delegate.basicNack(deliveryTag, false, requeue);
            return null;
        });
    }

    @Override
    public boolean isOpen() {
        return delegate.isOpen();
    }

    @Override
    public void addCloseListener(Consumer<BrokerCloseEvent> listener) {
        Objects.requireNonNull(listener, "listener");
        delegate.addShutdownListener(cause -> listener.accept(RabbitCloseEvents.from(cause)));
    }

    @Override
    public void close() throws IOException {
        if (!delegate.isOpen()) {
            return;
        }
        try {
            delegate.close();
        } catch (AlreadyClosedException ex) {
            log.debug("Channel {} already closed", delegate.getChannelNumber());
        } catch (TimeoutException ex) {
            throw new IOException("Timed out closing channel " + delegate.getChannelNumber(), ex);
        }
    }

    private <T> T invoke(String operation, ChannelCall<T> call) throws IOException {
        try {
            return call.call();
        } catch (IOException ex) {
            throw translate(operation, ex);
        } catch (ShutdownSignalException ex) {
            throw translate(operation, new IOException("Cannot " + operation + ": channel is closed", ex));
        }
    }

    static IOException translate(String operation, IOException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof ShutdownSignalException signal
            && RabbitCloseEvents.replyCode(signal.getReason()) == AMQP.PRECONDITION_FAILED) {
            String replyText = signal.getReason() instanceof AMQP.Channel.Close close
                ? close.getReplyText()
                : signal.getMessage();
            return new BrokerPreconditionException("Cannot " + operation + ": " + replyText, ex);
        }
        return ex;
    }

    @FunctionalInterface
    private interface ChannelCall<T> {
        T call() throws IOException;
    }
}
