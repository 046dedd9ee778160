package io.navi.mq.publisher;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.ShutdownSignalException;
import io.navi.mq.config.BrokerConfig;
import io.navi.mq.envelope.Envelope;
import io.navi.mq.envelope.EnvelopeCodec;
import io.navi.mq.envelope.MessageHeaders;
import io.navi.mq.transport.BrokerSession;
import io.navi.mq.transport.ConnectionException;
import io.navi.mq.transport.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes messages to the configured exchange.
 *
 * <p>Every call opens its own connection, declares the exchange, publishes and closes the
 * connection again, on success or failure. Concurrent calls therefore never share
 * connection state. Publishing is fire-and-forget: not mandatory, no publisher confirms.</p>
 *
 * <p>Each message carries {@code message_id}, {@code published_at} and {@code from_host}
 * headers; caller-supplied headers take precedence over them.</p>
 */
public class NaviPublisher {

    private static final Logger log = LoggerFactory.getLogger(NaviPublisher.class);

    private final ConnectionManager connectionManager;
    private final EnvelopeCodec codec;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public NaviPublisher(ConnectionManager connectionManager, EnvelopeCodec codec) {
        this(connectionManager, codec, Clock.systemUTC());
    }

    public NaviPublisher(ConnectionManager connectionManager, EnvelopeCodec codec, Clock clock) {
        this.connectionManager = connectionManager;
        this.codec = codec;
        this.clock = clock;
    }

    public void publish(String routingKey, Map<String, ?> message) {
        publish(routingKey, message, Collections.emptyMap());
    }

    /**
     * Publish one message.
     *
     * @throws IllegalArgumentException        if {@code routingKey} is null
     * @throws EnvelopeCodec.EncodeException if the message cannot be serialized; nothing is sent
     * @throws PublishException               if connecting or publishing fails
     */
    public void publish(String routingKey, Map<String, ?> message, Map<String, String> headers) {
        requireRoutingKey(routingKey);
        send(routingKey, List.of(encode(message, headers)));
    }

    /**
     * Publish several messages over a single connection.
     *
     * <p>All messages are encoded before connecting; if any of them cannot be serialized,
     * none is sent.</p>
     */
    public void publishAll(String routingKey, Collection<? extends Map<String, ?>> messages) {
        requireRoutingKey(routingKey);
        List<Envelope> envelopes = new ArrayList<>(messages.size());
        for (Map<String, ?> message : messages) {
            envelopes.add(encode(message, Collections.emptyMap()));
        }
        if (envelopes.isEmpty()) {
            log.debug("Nothing to publish for routing key {}", routingKey);
            return;
        }
        send(routingKey, envelopes);
    }

    private Envelope encode(Map<String, ?> message, Map<String, String> headers) {
        Map<String, String> merged = new LinkedHashMap<>(MessageHeaders.publishMetadata(clock));
        if (headers != null) {
            merged.putAll(headers);
        }
        return codec.encode(message, merged);
    }

    private void send(String routingKey, List<Envelope> envelopes) {
        BrokerConfig config = connectionManager.getConfig();
        String connectionName = "navi-publisher-" + sequence.incrementAndGet();

        try (BrokerSession session = connectionManager.openBlocking(connectionName)) {
            for (Envelope envelope : envelopes) {
                session.getChannel().basicPublish(
                        config.exchangeName(), routingKey, false, toProperties(envelope), envelope.getBody());
            }
        } catch (ConnectionException | IOException | ShutdownSignalException e) {
            log.error("Error while publishing. Exchange: {}; routing key: {}; error: {}",
                    config.exchangeName(), routingKey, e.getMessage());
            throw new PublishException("Failed to publish to exchange " + config.exchangeName()
                    + " with routing key " + routingKey, e);
        }

        log.info("Exchange {}: {} message(s) sent with routing key {}",
                config.exchangeName(), envelopes.size(), routingKey);
    }

    private AMQP.BasicProperties toProperties(Envelope envelope) {
        return new AMQP.BasicProperties.Builder()
                .contentType(EnvelopeCodec.CONTENT_TYPE)
                .contentEncoding(EnvelopeCodec.CONTENT_ENCODING)
                .messageId(envelope.getHeaders().get(MessageHeaders.MESSAGE_ID))
                .headers(envelope.getAmqpHeaders())
                .build();
    }

    private static void requireRoutingKey(String routingKey) {
        if (routingKey == null) {
            throw new IllegalArgumentException("routingKey must not be null");
        }
    }
}
