package io.navi.mq.publisher;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import io.navi.mq.MockBroker;
import io.navi.mq.MockBroker.MockConnection;
import io.navi.mq.config.BrokerConfig;
import io.navi.mq.config.ExchangeType;
import io.navi.mq.envelope.EnvelopeCodec;
import io.navi.mq.envelope.EnvelopeCodec.EncodeException;
import io.navi.mq.envelope.MessageHeaders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class NaviPublisherTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:30:00Z"), ZoneOffset.UTC);

    private final BrokerConfig config = new BrokerConfig("localhost", 5672, "guest", "guest",
            "navi.events", ExchangeType.topic);

    private MockBroker broker;
    private NaviPublisher publisher;

    @BeforeEach
    void setUp() {
        broker = new MockBroker();
        publisher = new NaviPublisher(broker.connectionManager(config), new EnvelopeCodec(), CLOCK);
    }

    @Test
    void publishSendsJsonToConfiguredExchange() throws Exception {
        publisher.publish("demo.hello_world", Map.of("name", "Sonic"));

        MockConnection used = broker.connection("navi-publisher-1");
        ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(used.channel).basicPublish(eq("navi.events"), eq("demo.hello_world"), eq(false),
                props.capture(), body.capture());

        assertThat(new String(body.getValue(), StandardCharsets.UTF_8)).isEqualTo("{\"name\":\"Sonic\"}");
        assertThat(props.getValue().getContentType()).isEqualTo("application/json");
        assertThat(props.getValue().getContentEncoding()).isEqualTo("UTF-8");
        assertThat(props.getValue().getHeaders())
                .containsEntry(MessageHeaders.PUBLISHED_AT, "2024-05-01T12:30:00Z")
                .containsKeys(MessageHeaders.MESSAGE_ID, MessageHeaders.FROM_HOST);
        assertThat(props.getValue().getMessageId())
                .isEqualTo(props.getValue().getHeaders().get(MessageHeaders.MESSAGE_ID));
    }

    @Test
    void publishClosesItsConnection() {
        publisher.publish("demo.hello_world", Map.of("name", "Sonic"));

        MockConnection used = broker.connection("navi-publisher-1");
        assertThat(used.isOpen()).isFalse();
        assertThat(used.isChannelOpen()).isFalse();
    }

    @Test
    void callerHeadersOverrideMetadata() throws Exception {
        publisher.publish("demo.hello_world", Map.of("name", "Tails"),
                Map.of(MessageHeaders.MESSAGE_ID, "fixed-id", "trace_id", "t-1"));

        ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(broker.connection("navi-publisher-1").channel)
                .basicPublish(anyString(), anyString(), anyBoolean(), props.capture(), any(byte[].class));

        assertThat(props.getValue().getMessageId()).isEqualTo("fixed-id");
        assertThat(props.getValue().getHeaders())
                .containsEntry(MessageHeaders.MESSAGE_ID, "fixed-id")
                .containsEntry("trace_id", "t-1");
    }

    @Test
    void nullRoutingKeyIsRejectedBeforeConnecting() {
        assertThatThrownBy(() -> publisher.publish(null, Map.of("name", "Sonic")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(broker.connections()).isEmpty();
    }

    @Test
    void emptyRoutingKeyIsAllowed() throws Exception {
        publisher.publish("", Map.of("name", "Sonic"));

        verify(broker.connection("navi-publisher-1").channel)
                .basicPublish(eq("navi.events"), eq(""), eq(false), any(), any(byte[].class));
    }

    @Test
    void unserializableMessageNeverOpensConnection() {
        assertThatThrownBy(() -> publisher.publish("demo.hello_world", Map.of("value", new Object())))
                .isInstanceOf(EncodeException.class);
        assertThat(broker.connections()).isEmpty();
    }

    @Test
    void unreachableBrokerIsPublishError() {
        broker.failConnections(new ConnectException("Connection refused"));

        assertThatThrownBy(() -> publisher.publish("demo.hello_world", Map.of("name", "Sonic")))
                .isInstanceOf(PublishException.class)
                .hasMessageContaining("navi.events")
                .hasMessageContaining("demo.hello_world");
    }

    @Test
    void failedPublishStillClosesConnection() throws Exception {
        broker.onNewChannel(channel -> failPublish(channel));

        assertThatThrownBy(() -> publisher.publish("demo.hello_world", Map.of("name", "Sonic")))
                .isInstanceOf(PublishException.class)
                .hasCauseInstanceOf(IOException.class);

        MockConnection used = broker.connection("navi-publisher-1");
        assertThat(used.isOpen()).isFalse();
    }

    @Test
    void publishAllUsesOneConnection() throws Exception {
        List<Map<String, Object>> messages = List.of(
                Map.of("name", "Sonic"), Map.of("name", "Tails"), Map.of("name", "Knuckles"));

        publisher.publishAll("demo.hello_world", messages);

        assertThat(broker.connections()).hasSize(1);
        verify(broker.connection("navi-publisher-1").channel, times(3))
                .basicPublish(eq("navi.events"), eq("demo.hello_world"), eq(false), any(), any(byte[].class));
    }

    @Test
    void publishAllSendsNothingIfAnyMessageFailsToEncode() {
        List<Map<String, Object>> messages = List.of(Map.of("name", "Sonic"), Map.of("value", new Object()));

        assertThatThrownBy(() -> publisher.publishAll("demo.hello_world", messages))
                .isInstanceOf(EncodeException.class);
        assertThat(broker.connections()).isEmpty();
    }

    @Test
    void publishAllWithNoMessagesDoesNotConnect() {
        publisher.publishAll("demo.hello_world", Collections.emptyList());

        assertThat(broker.connections()).isEmpty();
    }

    @Test
    void concurrentPublishesUseSeparateConnections() throws Exception {
        int count = 8;
        ExecutorService pool = Executors.newFixedThreadPool(count);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                int n = i;
                futures.add(pool.submit(() -> publisher.publish("demo.count", Map.of("n", n))));
            }
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<MockConnection> used = broker.connections();
        assertThat(used).hasSize(count);
        assertThat(used.stream().map(c -> c.name).distinct().count()).isEqualTo(count);

        List<String> bodies = new ArrayList<>();
        for (MockConnection connection : used) {
            ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
            verify(connection.channel).basicPublish(anyString(), anyString(), anyBoolean(), any(), body.capture());
            bodies.add(new String(body.getValue(), StandardCharsets.UTF_8));
            assertThat(connection.isOpen()).isFalse();
        }
        assertThat(bodies).containsExactlyInAnyOrder(
                "{\"n\":0}", "{\"n\":1}", "{\"n\":2}", "{\"n\":3}",
                "{\"n\":4}", "{\"n\":5}", "{\"n\":6}", "{\"n\":7}");
    }

    @Test
    void failedPublishDoesNotAffectTheNextOne() throws Exception {
        broker.failConnections(new ConnectException("Connection refused"));
        assertThatThrownBy(() -> publisher.publish("demo.hello_world", Map.of("name", "Sonic")))
                .isInstanceOf(PublishException.class);

        broker.failConnections(null);
        publisher.publish("demo.hello_world", Map.of("name", "Tails"));

        verify(broker.connection("navi-publisher-2").channel)
                .basicPublish(eq("navi.events"), eq("demo.hello_world"), eq(false), any(), any(byte[].class));
    }

    private static void failPublish(Channel channel) {
        try {
            doThrow(new IOException("channel closed"))
                    .when(channel).basicPublish(anyString(), anyString(), anyBoolean(), any(), any(byte[].class));
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
