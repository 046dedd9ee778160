package io.navi.mq.config;

/**
 * Immutable broker settings shared by every publisher and listener of a process.
 *
 * @param host              broker host
 * @param port              broker port (default 5672)
 * @param username          AMQP username
 * @param password          AMQP password
 * @param virtualHost       AMQP virtual host (default "/")
 * @param exchangeName      exchange messages are published to and queues are bound to
 * @param exchangeType      type of {@code exchangeName}
 * @param ssl               enable SSL/TLS
 * @param connectionTimeout connection timeout in milliseconds
 * @param heartbeat         AMQP heartbeat interval in seconds
 * @param prefetchCount     unacknowledged deliveries allowed per listener channel
 */
public record BrokerConfig(
        String host,
        int port,
        String username,
        String password,
        String virtualHost,
        String exchangeName,
        ExchangeType exchangeType,
        boolean ssl,
        int connectionTimeout,
        int heartbeat,
        int prefetchCount
) {

    public static final int DEFAULT_PORT = 5672;
    public static final String DEFAULT_VHOST = "/";
    public static final String DEFAULT_EXCHANGE = "amq.topic";
    public static final ExchangeType DEFAULT_EXCHANGE_TYPE = ExchangeType.topic;
    public static final int DEFAULT_CONNECTION_TIMEOUT = 10_000;
    public static final int DEFAULT_HEARTBEAT = 30;
    public static final int DEFAULT_PREFETCH_COUNT = 10;

    public BrokerConfig {
        requireText(host, "host");
        requireText(username, "username");
        requireText(password, "password");
        requireText(virtualHost, "virtualHost");
        requireText(exchangeName, "exchangeName");
        if (port < 1 || port > 65_535) {
            throw new ConfigException("Invalid port: " + port);
        }
        if (exchangeType == null) {
            throw new ConfigException("exchangeType is required");
        }
        if (connectionTimeout < 0) {
            throw new ConfigException("connectionTimeout must not be negative: " + connectionTimeout);
        }
        if (heartbeat < 0) {
            throw new ConfigException("heartbeat must not be negative: " + heartbeat);
        }
        if (prefetchCount < 1) {
            throw new ConfigException("prefetchCount must be positive: " + prefetchCount);
        }
    }

    /**
     * Settings with the default exchange ({@code amq.topic}, type topic).
     */
    public BrokerConfig(String host, int port, String username, String password) {
        this(host, port, username, password, DEFAULT_EXCHANGE, DEFAULT_EXCHANGE_TYPE);
    }

    public BrokerConfig(String host, int port, String username, String password,
                        String exchangeName, ExchangeType exchangeType) {
        this(host, port, username, password, DEFAULT_VHOST, exchangeName, exchangeType,
                false, DEFAULT_CONNECTION_TIMEOUT, DEFAULT_HEARTBEAT, DEFAULT_PREFETCH_COUNT);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ConfigException(name + " is required");
        }
    }

    @Override
    public String toString() {
        return "BrokerConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", username='" + username + '\'' +
                ", password='****'" +
                ", virtualHost='" + virtualHost + '\'' +
                ", exchangeName='" + exchangeName + '\'' +
                ", exchangeType=" + exchangeType +
                ", ssl=" + ssl +
                ", prefetchCount=" + prefetchCount +
                '}';
    }
}
