package io.wrabber;

import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable client configuration, validated once by {@link Builder#build()}.
 */
public final class WrabberSettings {

    public static final int DEFAULT_PREFETCH = 50;
    public static final int DEFAULT_HEARTBEAT_SECONDS = 30;
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);
    public static final List<Duration> DEFAULT_RECONNECT_BACKOFF = List.of(
        Duration.ofMillis(500),
        Duration.ofMillis(1000),
        Duration.ofMillis(2000),
        Duration.ofMillis(5000),
        Duration.ofMillis(10000),
        Duration.ofMillis(15000),
        Duration.ofMillis(30000));

    private static final Pattern NAME_SEGMENT = Pattern.compile("[A-Za-z0-9_.-]+");

    private final String url;
    private final String serviceName;
    private final String namespace;
    private final boolean durable;
    private final int prefetch;
    private final int heartbeatSeconds;
    private final DeadLetterSettings deadLetter;
    private final Duration messageTtl;
    private final List<Duration> reconnectBackoff;
    private final UnhandledMessagePolicy unhandledMessagePolicy;
    private final String connectionName;
    private final ClientMode mode;
    private final boolean listening;
    private final QueueMode queueMode;
    private final ExchangeType exchangeType;
    private final NotStartedPolicy notStartedPolicy;
    private final Duration readyTimeout;
    private final Duration shutdownTimeout;
    private final boolean debug;
    private final TopologyNames names;

    private WrabberSettings(Builder builder) {
        this.mode = Objects.requireNonNull(builder.mode, "mode");
        this.serviceName = requireName(builder.serviceName, "serviceName");
        this.namespace = requireName(builder.namespace, "namespace");
        this.url = mode == ClientMode.LIVE ? requireBrokerUri(builder.url) : builder.url;
        this.durable = builder.durable;
        this.prefetch = requirePositive(builder.prefetch, "prefetch");
        if (builder.heartbeatSeconds < 0) {
            throw new IllegalArgumentException("heartbeatSeconds must be >= 0");
        }
        this.heartbeatSeconds = builder.heartbeatSeconds;
        this.deadLetter = Objects.requireNonNull(builder.deadLetter, "deadLetter");
        this.messageTtl = requirePositiveOrNull(builder.messageTtl, "messageTtl");
        this.reconnectBackoff = requireBackoff(builder.reconnectBackoff);
        this.unhandledMessagePolicy = Objects.requireNonNull(builder.unhandledMessagePolicy, "unhandledMessagePolicy");
        this.listening = builder.listening;
        this.queueMode = Objects.requireNonNull(builder.queueMode, "queueMode");
        this.exchangeType = Objects.requireNonNull(builder.exchangeType, "exchangeType");
        this.notStartedPolicy = Objects.requireNonNull(builder.notStartedPolicy, "notStartedPolicy");
        this.readyTimeout = requirePositiveOrNull(builder.readyTimeout, "readyTimeout");
        this.shutdownTimeout = Objects.requireNonNull(
            requirePositiveOrNull(builder.shutdownTimeout, "shutdownTimeout"), "shutdownTimeout");
        this.debug = builder.debug;
        this.connectionName = builder.connectionName == null || builder.connectionName.isBlank()
            ? defaultConnectionName(namespace, serviceName)
            : builder.connectionName;
        this.names = TopologyNames.of(namespace, serviceName, queueMode);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String url() {
        return url;
    }

    public String serviceName() {
        return serviceName;
    }

    public String namespace() {
        return namespace;
    }

    public boolean durable() {
        return durable;
    }

    public int prefetch() {
        return prefetch;
    }

    public int heartbeatSeconds() {
        return heartbeatSeconds;
    }

    public DeadLetterSettings deadLetter() {
        return deadLetter;
    }

    /**
     * Per-message time-to-live applied to the primary queue, or {@code null}.
     */
    public Duration messageTtl() {
        return messageTtl;
    }

    public List<Duration> reconnectBackoff() {
        return reconnectBackoff;
    }

    public UnhandledMessagePolicy unhandledMessagePolicy() {
        return unhandledMessagePolicy;
    }

    public String connectionName() {
        return connectionName;
    }

    public ClientMode mode() {
        return mode;
    }

    public boolean listening() {
        return listening;
    }

    public QueueMode queueMode() {
        return queueMode;
    }

    public ExchangeType exchangeType() {
        return exchangeType;
    }

    public NotStartedPolicy notStartedPolicy() {
        return notStartedPolicy;
    }

    /**
     * Upper bound for a publish waiting on readiness, or {@code null} to wait indefinitely.
     */
    public Duration readyTimeout() {
        return readyTimeout;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    public boolean debug() {
        return debug;
    }

    public TopologyNames names() {
        return names;
    }

    public Builder toBuilder() {
        return new Builder()
            .url(url)
            .serviceName(serviceName)
            .namespace(namespace)
            .durable(durable)
            .prefetch(prefetch)
            .heartbeatSeconds(heartbeatSeconds)
            .deadLetter(deadLetter)
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
            .debug(debug);
    }

    @Override
    public String toString() {
        return "WrabberSettings{"
            + "namespace='" + namespace + '\''
            + ", serviceName='" + serviceName + '\''
            + ", mode=" + mode
            + ", durable=" + durable
            + ", prefetch=" + prefetch
            + ", heartbeatSeconds=" + heartbeatSeconds
            + ", deadLetter=" + deadLetter
            + ", queueMode=" + queueMode
            + ", exchangeType=" + exchangeType
            + ", listening=" + listening
            + ", connectionName='" + connectionName + '\''
            + '}';
    }

    static String defaultConnectionName(String namespace, String serviceName) {
        return namespace + "." + serviceName + "@" + hostName() + "#" + ProcessHandle.current().pid();
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException ex) {
            String env = System.getenv("HOSTNAME");
            return env == null || env.isBlank() ? "unknown-host" : env;
        }
    }

    private static String requireName(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
        if (!NAME_SEGMENT.matcher(value).matches()) {
            throw new IllegalArgumentException(
                field + " may only contain letters, digits, '.', '_' and '-' (was '" + value + "')");
        }
        return value;
    }

    private static String requireBrokerUri(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("url must not be null or blank");
        }
        URI uri;
        try {
            uri = URI.create(value);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("url is not a valid URI: " + ex.getMessage(), ex);
        }
        String scheme = uri.getScheme();
        if (!"amqp".equalsIgnoreCase(scheme) && !"amqps".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("url must use the amqp or amqps scheme");
        }
        return value;
    }

    private static int requirePositive(int value, String field) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be positive");
        }
        return value;
    }

    private static Duration requirePositiveOrNull(Duration value, String field) {
        if (value != null && (value.isZero() || value.isNegative())) {
            throw new IllegalArgumentException(field + " must be positive");
        }
        return value;
    }

    private static List<Duration> requireBackoff(List<Duration> sequence) {
        if (sequence == null || sequence.isEmpty()) {
            throw new IllegalArgumentException("reconnectBackoff must contain at least one delay");
        }
        for (Duration delay : sequence) {
            if (delay == null || delay.isNegative()) {
                throw new IllegalArgumentException("reconnectBackoff delays must be >= 0");
            }
        }
        return List.copyOf(sequence);
    }

    public static final class Builder {
        private String url;
        private String serviceName;
        private String namespace;
        private boolean durable = true;
        private int prefetch = DEFAULT_PREFETCH;
        private int heartbeatSeconds = DEFAULT_HEARTBEAT_SECONDS;
        private DeadLetterSettings deadLetter = DeadLetterSettings.disabled();
        private Duration messageTtl;
        private List<Duration> reconnectBackoff = DEFAULT_RECONNECT_BACKOFF;
        private UnhandledMessagePolicy unhandledMessagePolicy = UnhandledMessagePolicy.ACKNOWLEDGE;
        private String connectionName;
        private ClientMode mode = ClientMode.LIVE;
        private boolean listening = true;
        private QueueMode queueMode = QueueMode.SHARED;
        private ExchangeType exchangeType = ExchangeType.FANOUT;
        private NotStartedPolicy notStartedPolicy = NotStartedPolicy.DROP;
        private Duration readyTimeout;
        private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
        private boolean debug;

        private Builder() {
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder durable(boolean durable) {
            this.durable = durable;
            return this;
        }

        public Builder prefetch(int prefetch) {
            this.prefetch = prefetch;
            return this;
        }

        public Builder heartbeatSeconds(int heartbeatSeconds) {
            this.heartbeatSeconds = heartbeatSeconds;
            return this;
        }

        public Builder deadLetter(DeadLetterSettings deadLetter) {
            this.deadLetter = deadLetter;
            return this;
        }

        public Builder messageTtl(Duration messageTtl) {
            this.messageTtl = messageTtl;
            return this;
        }

        public Builder reconnectBackoff(List<Duration> reconnectBackoff) {
            this.reconnectBackoff = reconnectBackoff;
            return this;
        }

        public Builder unhandledMessagePolicy(UnhandledMessagePolicy unhandledMessagePolicy) {
            this.unhandledMessagePolicy = unhandledMessagePolicy;
            return this;
        }

        public Builder connectionName(String connectionName) {
            this.connectionName = connectionName;
            return this;
        }

        public Builder mode(ClientMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder listening(boolean listening) {
            this.listening = listening;
            return this;
        }

        public Builder queueMode(QueueMode queueMode) {
            this.queueMode = queueMode;
            return this;
        }

        public Builder exchangeType(ExchangeType exchangeType) {
            this.exchangeType = exchangeType;
            return this;
        }

        public Builder notStartedPolicy(NotStartedPolicy notStartedPolicy) {
            this.notStartedPolicy = notStartedPolicy;
            return this;
        }

        public Builder readyTimeout(Duration readyTimeout) {
            this.readyTimeout = readyTimeout;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public WrabberSettings build() {
            return new WrabberSettings(this);
        }
    }
}
