package io.wrabber.broker;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * One live connection to the broker.
 */
public interface BrokerConnection {

    BrokerChannel createChannel() throws IOException;

    boolean isOpen();

    /**
     * Registers a listener invoked once when the connection closes for any reason. Registering on
     * an already closed connection invokes the listener immediately.
     */
    void addCloseListener(Consumer<BrokerCloseEvent> listener);

    void close() throws IOException;
}
