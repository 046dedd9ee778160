package io.navi.mq;

import io.navi.mq.config.BrokerConfig;
import io.navi.mq.config.NaviConfigLoader;
import io.navi.mq.envelope.EnvelopeCodec;
import io.navi.mq.listener.MessageHandler;
import io.navi.mq.listener.NaviListener;
import io.navi.mq.publisher.NaviPublisher;
import io.navi.mq.topology.TopologyRegistrar;
import io.navi.mq.transport.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Main entry point: publish messages and listen on queues of one broker.
 *
 * <h3>Usage with environment variables:</h3>
 * <pre>
 * Navi navi = Navi.fromEnvironment();
 * navi.listen("from_listen_func", "demo.hello_world", (headers, message) ->
 *         System.out.println(message.get("name") + " via " + headers.get("listener_name")));
 * navi.publish("demo.hello_world", Map.of("name", "Sonic"));
 * // ...
 * navi.close();
 * </pre>
 *
 * <h3>Usage with YAML config:</h3>
 * <pre>
 * Navi navi = Navi.fromYaml(Path.of("navi.yml"));
 * </pre>
 *
 * <p>Publishing opens a short-lived connection per call. Each listener owns one
 * long-lived connection. {@link #close()} stops every listener created through this
 * instance.</p>
 */
public class Navi implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(Navi.class);

    private final BrokerConfig config;
    private final ConnectionManager connectionManager;
    private final EnvelopeCodec codec;
    private final TopologyRegistrar registrar;
    private final NaviPublisher publisher;

    private final List<NaviListener> listeners = new CopyOnWriteArrayList<>();

    // ========== Factory methods ==========

    public static Navi fromEnvironment() {
        return new Navi(NaviConfigLoader.fromEnvironment());
    }

    public static Navi fromYaml(Path path) {
        return new Navi(NaviConfigLoader.fromYaml(path));
    }

    public static Navi fromClasspath(String resource) {
        return new Navi(NaviConfigLoader.fromClasspath(resource));
    }

    // ========== Constructor ==========

    public Navi(BrokerConfig config) {
        this(new ConnectionManager(config), new EnvelopeCodec());
    }

    public Navi(ConnectionManager connectionManager, EnvelopeCodec codec) {
        this.config = connectionManager.getConfig();
        this.connectionManager = connectionManager;
        this.codec = codec;
        this.registrar = new TopologyRegistrar();
        this.publisher = new NaviPublisher(connectionManager, codec);
    }

    // ========== Publishing ==========

    /**
     * Publish {@code message} to the configured exchange with {@code routingKey}.
     *
     * @throws io.navi.mq.publisher.PublishException if the broker round trip fails
     */
    public void publish(String routingKey, Map<String, ?> message) {
        publisher.publish(routingKey, message);
    }

    public void publish(String routingKey, Map<String, ?> message, Map<String, String> headers) {
        publisher.publish(routingKey, message, headers);
    }

    public void publishAll(String routingKey, Collection<? extends Map<String, ?>> messages) {
        publisher.publishAll(routingKey, messages);
    }

    // ========== Listening ==========

    /**
     * Create and start a listener named after its queue.
     */
    public NaviListener listen(String queueName, String routingKey, MessageHandler handler) {
        return listen(queueName, routingKey, queueName, handler);
    }

    /**
     * Create and start a listener.
     *
     * @param listenerName value of the {@code listener_name} header on its deliveries
     */
    public NaviListener listen(String queueName, String routingKey, String listenerName, MessageHandler handler) {
        NaviListener listener = newListener(queueName, routingKey, listenerName, handler);
        listener.listen();
        return listener;
    }

    /**
     * Create a listener without starting it. It is still stopped by {@link #close()}.
     * Listeners that have stopped or failed are dropped from {@link #getListeners()}.
     */
    public NaviListener newListener(String queueName, String routingKey, MessageHandler handler) {
        return newListener(queueName, routingKey, queueName, handler);
    }

    public NaviListener newListener(String queueName, String routingKey, String listenerName,
                                    MessageHandler handler) {
        NaviListener listener = new NaviListener(queueName, routingKey, listenerName, handler,
                connectionManager, registrar, codec);
        pruneTerminated();
        listeners.add(listener);
        return listener;
    }

    private void pruneTerminated() {
        listeners.removeIf(listener -> listener.getState().isTerminal());
    }

    // ========== Lifecycle ==========

    @Override
    public void close() {
        for (NaviListener listener : listeners) {
            try {
                listener.stop();
            } catch (Exception e) {
                log.warn("Error stopping listener {}: {}", listener.getListenerName(), e.getMessage());
            }
        }
        listeners.clear();
        log.info("Navi closed ({}:{}, exchange {})", config.host(), config.port(), config.exchangeName());
    }

    // ========== Status ==========

    /**
     * @return listeners created through this instance that have not stopped or failed yet
     */
    public List<NaviListener> getListeners() {
        pruneTerminated();
        return Collections.unmodifiableList(listeners);
    }

    public BrokerConfig getConfig() {
        return config;
    }
}
