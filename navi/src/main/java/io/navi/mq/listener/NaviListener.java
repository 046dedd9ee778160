package io.navi.mq.listener;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import io.navi.mq.NaviException;
import io.navi.mq.config.BrokerConfig;
import io.navi.mq.envelope.EnvelopeCodec;
import io.navi.mq.envelope.EnvelopeCodec.DecodeException;
import io.navi.mq.envelope.MessageHeaders;
import io.navi.mq.envelope.ReceivedMessage;
import io.navi.mq.topology.TopologyException;
import io.navi.mq.topology.TopologyRegistrar;
import io.navi.mq.transport.ConnectionException;
import io.navi.mq.transport.ConnectionManager;
import io.navi.mq.transport.EventDrivenSession;
import io.navi.mq.transport.SessionCallbacks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Consumes one queue bound to the shared exchange and hands every message to a
 * {@link MessageHandler}.
 *
 * <p>Each listener owns its connection and a single event loop thread
 * ({@code navi-<listenerName>}) on which setup, deliveries, handler calls and
 * acknowledgements run.</p>
 *
 * <h3>Delivery outcome:</h3>
 * <ul>
 *   <li>handler returns: message acknowledged</li>
 *   <li>handler throws: message rejected, not requeued; listener keeps consuming</li>
 *   <li>body is not a JSON object: message rejected, not requeued; listener keeps consuming</li>
 * </ul>
 *
 * <h3>Lifecycle:</h3>
 * <ol>
 *   <li>{@link #listen()}: connect, declare exchange, queue and binding, start consuming</li>
 *   <li>{@link #stop()}: finish the current message, close channel and connection</li>
 * </ol>
 *
 * <p>A listener that ends up {@link ListenerState#FAILED} (setup error, broker closed the
 * connection) does not reconnect. Create a new listener to resume consuming.</p>
 */
public class NaviListener implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(NaviListener.class);

    private final String queueName;
    private final String routingKey;
    private final String listenerName;
    private final MessageHandler handler;

    private final ConnectionManager connectionManager;
    private final TopologyRegistrar registrar;
    private final EnvelopeCodec codec;

    private final AtomicReference<ListenerState> state = new AtomicReference<>(ListenerState.CREATED);
    private final CompletableFuture<Void> consuming = new CompletableFuture<>();
    private final AtomicBoolean stopCompleted = new AtomicBoolean();

    private volatile EventDrivenSession session;
    private volatile String consumerTag;
    private volatile NaviException failureCause;

    public NaviListener(String queueName, String routingKey, MessageHandler handler,
                        ConnectionManager connectionManager) {
        this(queueName, routingKey, queueName, handler, connectionManager,
                new TopologyRegistrar(), new EnvelopeCodec());
    }

    /**
     * @param queueName         queue to declare and consume from
     * @param routingKey        binding key between the exchange and {@code queueName}
     * @param listenerName      value of the {@code listener_name} header on every delivery;
     *                          defaults to {@code queueName} when null
     * @param handler           receives each message
     * @param connectionManager opens the listener's connection
     * @param registrar         declares the queue and binding
     * @param codec             decodes delivery bodies
     */
    public NaviListener(String queueName, String routingKey, String listenerName, MessageHandler handler,
                        ConnectionManager connectionManager, TopologyRegistrar registrar, EnvelopeCodec codec) {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("queueName must not be blank");
        }
        if (routingKey == null) {
            throw new IllegalArgumentException("routingKey must not be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        this.queueName = queueName;
        this.routingKey = routingKey;
        this.listenerName = listenerName == null || listenerName.isBlank() ? queueName : listenerName;
        this.handler = handler;
        this.connectionManager = connectionManager;
        this.registrar = registrar;
        this.codec = codec;
    }

    // ========== Lifecycle ==========

    /**
     * Start connecting in the background.
     *
     * @return completes when the listener is consuming; completes exceptionally if it fails
     *         or is stopped first
     * @throws ListenerException if the listener was already started
     */
    public CompletableFuture<Void> listen() {
        if (!state.compareAndSet(ListenerState.CREATED, ListenerState.CONNECTING)) {
            throw new ListenerException("Listener " + listenerName + " cannot listen from state " + state.get());
        }
        log.info("Starting listener {} on queue {}...", listenerName, queueName);

        try {
            session = connectionManager.openEventDriven(listenerName, new SessionHandler());
        } catch (ConnectionException e) {
            fail(e);
            return consuming;
        }

        // stop() may have run before the session handle was assigned
        if (state.get() == ListenerState.STOPPING) {
            completeStop();
        }
        return consuming;
    }

    /**
     * Stop consuming and release the connection. Idempotent; a no-op on a stopped
     * or failed listener.
     *
     * <p>When called from another thread, returns once the listener is
     * {@link ListenerState#STOPPED}. When called from within the handler, the listener
     * is {@link ListenerState#STOPPING} until the handler returns.</p>
     */
    public void stop() {
        while (true) {
            ListenerState current = state.get();
            if (current == ListenerState.CREATED) {
                if (state.compareAndSet(current, ListenerState.STOPPED)) {
                    consuming.completeExceptionally(stoppedBeforeConsuming());
                    log.info("Listener {} stopped before it was started", listenerName);
                    return;
                }
            } else if (current.isActive()) {
                if (state.compareAndSet(current, ListenerState.STOPPING)) {
                    log.info("Stopping listener {} on queue {}...", listenerName, queueName);
                    completeStop();
                    return;
                }
            } else {
                log.debug("Listener {} already {}", listenerName, current);
                return;
            }
        }
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * @return completes when the listener reaches {@link ListenerState#CONSUMING}
     */
    public CompletableFuture<Void> whenConsuming() {
        return consuming;
    }

    // ========== Internal ==========

    private void completeStop() {
        EventDrivenSession current = session;
        if (current == null) {
            // listen() finishes the stop once the session handle exists
            return;
        }
        if (current.isLoopThread()) {
            current.closeAsync().thenRun(this::markStopped);
        } else {
            current.close();
            markStopped();
        }
    }

    private void markStopped() {
        if (stopCompleted.compareAndSet(false, true)) {
            state.set(ListenerState.STOPPED);
            consuming.completeExceptionally(stoppedBeforeConsuming());
            log.info("Listener {} stopped", listenerName);
        }
    }

    private ListenerException stoppedBeforeConsuming() {
        return new ListenerException("Listener " + listenerName + " stopped before consuming");
    }

    private void fail(NaviException cause) {
        ListenerState current;
        do {
            current = state.get();
            if (!current.isActive()) {
                log.debug("Listener {} is {}, ignoring failure: {}", listenerName, current, cause.getMessage());
                return;
            }
        } while (!state.compareAndSet(current, ListenerState.FAILED));

        failureCause = cause;
        log.error("Error while listening on {}: {}. Closing connection.", queueName, cause.getMessage(), cause);

        EventDrivenSession active = session;
        if (active != null) {
            active.close();
        }
        consuming.completeExceptionally(cause);
    }

    private void startConsuming(EventDrivenSession readySession) {
        session = readySession;
        if (!state.compareAndSet(ListenerState.CONNECTING, ListenerState.DECLARING_TOPOLOGY)) {
            log.debug("Listener {} left CONNECTING before the connection was ready", listenerName);
            return;
        }

        BrokerConfig config = connectionManager.getConfig();
        Channel channel = readySession.getChannel();
        try {
            channel.basicQos(config.prefetchCount());
            registrar.declareAndBind(channel, queueName, routingKey, config.exchangeName());
            consumerTag = channel.basicConsume(queueName, false, "navi-" + listenerName, new DeliveryConsumer(channel));
        } catch (TopologyException e) {
            fail(e);
            return;
        } catch (IOException | RuntimeException e) {
            fail(new ListenerException("Failed to start consuming from " + queueName, e));
            return;
        }

        if (state.compareAndSet(ListenerState.DECLARING_TOPOLOGY, ListenerState.CONSUMING)) {
            log.info("Listener {} consuming from queue {} (exchange={}, routingKey={})",
                    listenerName, queueName, config.exchangeName(), routingKey);
            consuming.complete(null);
        }
    }

    void dispatch(Channel channel, long deliveryTag, AMQP.BasicProperties properties, byte[] body) {
        if (state.get() != ListenerState.CONSUMING) {
            log.debug("Listener {} is {}, leaving delivery {} for redelivery", listenerName, state.get(), deliveryTag);
            return;
        }

        Map<String, Object> rawHeaders = properties != null ? properties.getHeaders() : null;
        ReceivedMessage received;
        try {
            received = codec.decode(body, rawHeaders);
        } catch (DecodeException e) {
            log.error("Message {} with invalid body on {}: {}", messageId(rawHeaders), queueName, e.getMessage());
            reject(channel, deliveryTag);
            return;
        }

        Map<String, String> headers = new LinkedHashMap<>(received.headers());
        headers.put(MessageHeaders.QUEUE_NAME, queueName);
        headers.put(MessageHeaders.LISTENER_NAME, listenerName);

        try {
            handler.handle(Collections.unmodifiableMap(headers), received.message());
        } catch (Exception e) {
            log.error("Error while handling message {} on {}: {}", messageId(rawHeaders), queueName, e.getMessage(), e);
            reject(channel, deliveryTag);
            return;
        }

        try {
            channel.basicAck(deliveryTag, false);
        } catch (IOException | ShutdownSignalException e) {
            log.warn("Failed to ack delivery {} on {}: {}", deliveryTag, queueName, e.getMessage());
        }
    }

    private void reject(Channel channel, long deliveryTag) {
        try {
            channel.basicNack(deliveryTag, false, false);
        } catch (IOException | ShutdownSignalException e) {
            log.warn("Failed to reject delivery {} on {}: {}", deliveryTag, queueName, e.getMessage());
        }
    }

    private static String messageId(Map<String, Object> rawHeaders) {
        Object id = rawHeaders != null ? rawHeaders.get(MessageHeaders.MESSAGE_ID) : null;
        return id != null ? id.toString() : "<no message_id>";
    }

    // ========== Status ==========

    public ListenerState getState() {
        return state.get();
    }

    public boolean isConsuming() {
        return state.get() == ListenerState.CONSUMING;
    }

    /**
     * @return the error that moved the listener to {@link ListenerState#FAILED}, or null
     */
    public NaviException getFailureCause() {
        return failureCause;
    }

    public String getQueueName() { return queueName; }
    public String getRoutingKey() { return routingKey; }
    public String getListenerName() { return listenerName; }
    public String getConsumerTag() { return consumerTag; }

    @Override
    public String toString() {
        return "NaviListener{" +
                "listenerName='" + listenerName + '\'' +
                ", queueName='" + queueName + '\'' +
                ", routingKey='" + routingKey + '\'' +
                ", state=" + state.get() +
                '}';
    }

    // ========== Inner: session callbacks and consumer ==========

    private class SessionHandler implements SessionCallbacks {

        @Override
        public void onReady(EventDrivenSession readySession) {
            startConsuming(readySession);
        }

        @Override
        public void onError(EventDrivenSession failedSession, ConnectionException error) {
            session = failedSession;
            fail(error);
        }

        @Override
        public void onClosed(EventDrivenSession closedSession, ShutdownSignalException cause) {
            fail(new ConnectionException("Connection of listener " + listenerName
                    + " closed by broker: " + cause.getMessage(), cause));
        }
    }

    private class DeliveryConsumer extends DefaultConsumer {

        DeliveryConsumer(Channel channel) {
            super(channel);
        }

        @Override
        public void handleDelivery(String tag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
            dispatch(getChannel(), envelope.getDeliveryTag(), properties, body);
        }

        @Override
        public void handleCancel(String tag) {
            fail(new ListenerException("Consumer " + tag + " on queue " + queueName + " was cancelled by the broker"));
        }

        /**
         * Covers a channel closed on its own while the connection stays up
         * (e.g. delivery acknowledgement timeout).
         */
        @Override
        public void handleShutdownSignal(String tag, ShutdownSignalException sig) {
            if (sig.isInitiatedByApplication()) {
                return;
            }
            fail(new ConnectionException("Channel of listener " + listenerName
                    + " closed by broker: " + sig.getMessage(), sig));
        }
    }
}
