package io.wrabber.broker;

import java.io.IOException;

/**
 * Opens connections to the message broker. Implementations wrap a wire-protocol driver.
 */
@FunctionalInterface
public interface BrokerConnector {

    /**
     * Opens a new connection.
     *
     * @param uri              broker URI, including credentials and virtual host
     * @param connectionName   client-provided name shown in the broker's management tools
     * @param heartbeatSeconds requested heartbeat interval, {@code 0} disables heartbeats
     */
    BrokerConnection connect(String uri, String connectionName, int heartbeatSeconds) throws IOException;
}
