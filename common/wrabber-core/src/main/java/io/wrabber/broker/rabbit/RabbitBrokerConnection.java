package io.wrabber.broker.rabbit;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import io.wrabber.broker.BrokerChannel;
import io.wrabber.broker.BrokerCloseEvent;
import io.wrabber.broker.BrokerConnection;
import java.io.IOException;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class RabbitBrokerConnection implements BrokerConnection {

    private static final Logger log = LoggerFactory.getLogger(RabbitBrokerConnection.class);

    private final Connection delegate;
    private final FlowControl flowControl = new FlowControl();

    RabbitBrokerConnection(Connection delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        delegate.addBlockedListener(
            reason -> {
                log.warn("Broker blocked publishing on connection {}: {}", delegate.getClientProvidedName(), reason);
                flowControl.block();
            },
            () -> {
                log.info("Broker unblocked publishing on connection {}", delegate.getClientProvidedName());
                flowControl.unblock();
            });
        delegate.addShutdownListener(cause -> flowControl.unblock());
    }

    @Override
    public BrokerChannel createChannel() throws IOException {
        try {
            Channel channel = delegate.createChannel();
            if (channel == null) {
                throw new IOException("Broker refused to open a channel (channel limit reached)");
            }
            return new RabbitBrokerChannel(channel, flowControl);
        } catch (AlreadyClosedException ex) {
            throw new IOException("Cannot open channel, connection is closed", ex);
        }
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
            log.debug("Connection {} already closed", delegate.getClientProvidedName());
        }
    }
}
