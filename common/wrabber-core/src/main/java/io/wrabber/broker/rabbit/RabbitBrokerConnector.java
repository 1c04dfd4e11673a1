package io.wrabber.broker.rabbit;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import io.wrabber.broker.BrokerConnection;
import io.wrabber.broker.BrokerConnector;
import io.wrabber.broker.BrokerUris;
import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BrokerConnector} backed by the RabbitMQ Java client.
 * <p>
 * The client's own automatic recovery is switched off: reconnection and topology re-declaration
 * are owned by the connection supervisor, which needs to observe every close.
 */
public final class RabbitBrokerConnector implements BrokerConnector {

    private static final Logger log = LoggerFactory.getLogger(RabbitBrokerConnector.class);

    private final Supplier<ConnectionFactory> factorySupplier;

    public RabbitBrokerConnector() {
        this(ConnectionFactory::new);
    }

    /**
     * @param factorySupplier supplies a pre-configured factory per connect attempt, e.g. with TLS
     *     or a custom thread factory
     */
    public RabbitBrokerConnector(Supplier<ConnectionFactory> factorySupplier) {
        this.factorySupplier = Objects.requireNonNull(factorySupplier, "factorySupplier");
    }

    @Override
    public BrokerConnection connect(String uri, String connectionName, int heartbeatSeconds) throws IOException {
        Objects.requireNonNull(uri, "uri");
        String effectiveUri = BrokerUris.withHeartbeat(uri, heartbeatSeconds);
        ConnectionFactory factory = Objects.requireNonNull(factorySupplier.get(), "connection factory");
        try {
            factory.setUri(effectiveUri);
        } catch (URISyntaxException | GeneralSecurityException ex) {
            throw new IOException("Invalid broker URI " + BrokerUris.redact(uri), ex);
        }
        factory.setRequestedHeartbeat(BrokerUris.heartbeatSeconds(effectiveUri, heartbeatSeconds));
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);
        try {
            Connection connection = factory.newConnection(connectionName);
            log.debug("Opened broker connection {} to {}:{}{}",
                connectionName, factory.getHost(), factory.getPort(), factory.getVirtualHost());
            return new RabbitBrokerConnection(connection);
        } catch (TimeoutException ex) {
            throw new IOException("Timed out connecting to " + BrokerUris.redact(uri), ex);
        }
    }
}
