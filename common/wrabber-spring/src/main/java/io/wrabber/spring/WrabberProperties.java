package io.wrabber.spring;

import io.wrabber.ClientMode;
import io.wrabber.DeadLetterSettings;
import io.wrabber.ExchangeType;
import io.wrabber.NotStartedPolicy;
import io.wrabber.QueueMode;
import io.wrabber.UnhandledMessagePolicy;
import io.wrabber.WrabberSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties bound from {@code wrabber.*}.
 */
@Validated
@ConfigurationProperties(prefix = "wrabber")
public class WrabberProperties {

    private boolean enabled = true;
    private String url;
    @NotBlank
    private String serviceName;
    @NotBlank
    private String namespace;
    private boolean durable = true;
    @Positive
    private int prefetch = WrabberSettings.DEFAULT_PREFETCH;
    @PositiveOrZero
    private int heartbeatSeconds = WrabberSettings.DEFAULT_HEARTBEAT_SECONDS;
    private Duration messageTtl;
    @NotEmpty
    private List<Duration> reconnectBackoff = new ArrayList<>(WrabberSettings.DEFAULT_RECONNECT_BACKOFF);
    @NotNull
    private UnhandledMessagePolicy unhandledMessagePolicy = UnhandledMessagePolicy.ACKNOWLEDGE;
    private String connectionName;
    @NotNull
    private ClientMode mode = ClientMode.LIVE;
    private boolean listening = true;
    @NotNull
    private QueueMode queueMode = QueueMode.SHARED;
    @NotNull
    private ExchangeType exchangeType = ExchangeType.FANOUT;
    @NotNull
    private NotStartedPolicy notStartedPolicy = NotStartedPolicy.DROP;
    private Duration readyTimeout;
    @NotNull
    private Duration shutdownTimeout = WrabberSettings.DEFAULT_SHUTDOWN_TIMEOUT;
    private boolean debug;
    @Valid
    private final DeadLetterProperties deadLetter = new DeadLetterProperties();

    public WrabberSettings toSettings() {
        DeadLetterSettings deadLetterSettings = deadLetter.isEnabled()
            ? new DeadLetterSettings(true, deadLetter.getTtl(), deadLetter.getMaxLength())
            : DeadLetterSettings.disabled();
        return WrabberSettings.builder()
            .url(url)
            .serviceName(serviceName)
            .namespace(namespace)
            .durable(durable)
            .prefetch(prefetch)
            .heartbeatSeconds(heartbeatSeconds)
            .deadLetter(deadLetterSettings)
            .messageTtl(messageTtl)
            .reconnectBackoff(reconnectBackoff)
            .unhandledMessagePolicy(unhandledMessagePolicy)
            .connectionName(connectionName)
            .mode(mode)
            .listening(listening)
            .queueMode(queueMode)
            .exchangeType(exchangeType)
            .notStartedPolicy(notStartedPolicy)
            .readyTimeout(readyTimeout)
            .shutdownTimeout(shutdownTimeout)
            .debug(debug)
            .build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getServiceName() {
        return serviceName;
    }

    public void setServiceName(String serviceName) {
        this.serviceName = serviceName;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public boolean isDurable() {
        return durable;
    }

    public void setDurable(boolean durable) {
        this.durable = durable;
    }

    public int getPrefetch() {
        return prefetch;
    }

    public void setPrefetch(int prefetch) {
        this.prefetch = prefetch;
    }

    public int getHeartbeatSeconds() {
        return heartbeatSeconds;
    }

    public void setHeartbeatSeconds(int heartbeatSeconds) {
        this.heartbeatSeconds = heartbeatSeconds;
    }

    public Duration getMessageTtl() {
        return messageTtl;
    }

    public void setMessageTtl(Duration messageTtl) {
        this.messageTtl = messageTtl;
    }

    public List<Duration> getReconnectBackoff() {
        return reconnectBackoff;
    }

    public void setReconnectBackoff(List<Duration> reconnectBackoff) {
        this.reconnectBackoff = reconnectBackoff;
    }

    public UnhandledMessagePolicy getUnhandledMessagePolicy() {
        return unhandledMessagePolicy;
    }

    public void setUnhandledMessagePolicy(UnhandledMessagePolicy unhandledMessagePolicy) {
        this.unhandledMessagePolicy = unhandledMessagePolicy;
    }

    public String getConnectionName() {
        return connectionName;
    }

    public void setConnectionName(String connectionName) {
        this.connectionName = connectionName;
    }

    public ClientMode getMode() {
        return mode;
    }

    public void setMode(ClientMode mode) {
        this.mode = mode;
    }

    public boolean isListening() {
        return listening;
    }

    public void setListening(boolean listening) {
        this.listening = listening;
    }

    public QueueMode getQueueMode() {
        return queueMode;
    }

    public void setQueueMode(QueueMode queueMode) {
        this.queueMode = queueMode;
    }

    public ExchangeType getExchangeType() {
        return exchangeType;
    }

    public void setExchangeType(ExchangeType exchangeType) {
        this.exchangeType = exchangeType;
    }

    public NotStartedPolicy getNotStartedPolicy() {
        return notStartedPolicy;
    }

    public void setNotStartedPolicy(NotStartedPolicy notStartedPolicy) {
        this.notStartedPolicy = notStartedPolicy;
    }

    public Duration getReadyTimeout() {
        return readyTimeout;
    }

    public void setReadyTimeout(Duration readyTimeout) {
        this.readyTimeout = readyTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    public DeadLetterProperties getDeadLetter() {
        return deadLetter;
    }

    public static final class DeadLetterProperties {
        private boolean enabled;
        private Duration ttl;
        @Positive
        private Integer maxLength;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Integer getMaxLength() {
            return maxLength;
        }

        public void setMaxLength(Integer maxLength) {
            this.maxLength = maxLength;
        }
    }
}
