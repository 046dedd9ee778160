package io.navi.mq.transport;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import io.navi.mq.config.BrokerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Opens broker sessions for one {@link BrokerConfig}.
 *
 * <p>Two strategies, one per resource lifetime:</p>
 * <ul>
 *   <li>{@link #openBlocking(String)}: connects on the calling thread and returns a ready
 *       session, or throws {@link ConnectionException}</li>
 *   <li>{@link #openEventDriven(String, SessionCallbacks)}: returns immediately and reports
 *       readiness, failure or later closure through {@link SessionCallbacks}</li>
 * </ul>
 *
 * <p>Both declare the configured exchange (durable, idempotent) as part of readiness.
 * Automatic connection recovery is disabled: neither strategy retries on its own.</p>
 */
public class ConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final BrokerConfig config;
    private final Supplier<ConnectionFactory> factorySupplier;

    public ConnectionManager(BrokerConfig config) {
        this(config, ConnectionFactory::new);
    }

    public ConnectionManager(BrokerConfig config, Supplier<ConnectionFactory> factorySupplier) {
        this.config = config;
        this.factorySupplier = factorySupplier;
    }

    public BrokerConfig getConfig() {
        return config;
    }

    /**
     * Open a session synchronously.
     *
     * @param name connection name shown in the broker's management UI
     * @throws ConnectionException if the broker is unreachable, rejects the credentials,
     *                             refuses the channel or the exchange declaration
     */
    public BrokerSession openBlocking(String name) {
        ConnectionFactory factory = createConnectionFactory();
        Connection connection = null;
        Channel channel = null;
        try {
            connection = factory.newConnection(name);
            channel = connection.createChannel();
            if (channel == null) {
                throw new IOException("No channel available on connection " + name);
            }
            declareExchange(channel);
            return new BlockingSession(name, connection, channel);
        } catch (IOException | TimeoutException | RuntimeException e) {
            SessionResources.release(name, channel, connection);
            throw new ConnectionException("Failed to open connection " + name
                    + " to " + config.host() + ":" + config.port(), e);
        }
    }

    /**
     * Start opening a session on its own event loop.
     *
     * @param name      connection name, also names the loop thread ({@code navi-<name>})
     * @param callbacks receives the outcome, always on the loop thread
     * @return session handle; not usable until {@link SessionCallbacks#onReady} fires
     */
    public EventDrivenSession openEventDriven(String name, SessionCallbacks callbacks) {
        EventDrivenSession session = new EventDrivenSession(name, callbacks);
        ConnectionFactory factory;
        try {
            factory = createConnectionFactory();
        } catch (ConnectionException e) {
            session.close();
            throw e;
        }
        session.connect(factory, this::declareExchange);
        return session;
    }

    void declareExchange(Channel channel) throws IOException {
        channel.exchangeDeclare(config.exchangeName(), config.exchangeType().getBuiltinType(), true);
        log.debug("Exchange {} ({}) declared", config.exchangeName(), config.exchangeType());
    }

    ConnectionFactory createConnectionFactory() {
        ConnectionFactory factory = factorySupplier.get();
        factory.setHost(config.host());
        factory.setPort(config.port());
        factory.setUsername(config.username());
        factory.setPassword(config.password());
        factory.setVirtualHost(config.virtualHost());
        factory.setConnectionTimeout(config.connectionTimeout());
        factory.setRequestedHeartbeat(config.heartbeat());

        // Callers decide on retries
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);

        if (config.ssl()) {
            try {
                factory.useSslProtocol();
            } catch (NoSuchAlgorithmException | KeyManagementException e) {
                throw new ConnectionException("Failed to configure SSL", e);
            }
        }

        return factory;
    }
}
