package io.navi.mq.topology;

import com.rabbitmq.client.Channel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TopologyRegistrarTest {

    @Mock
    private Channel channel;

    private final TopologyRegistrar registrar = new TopologyRegistrar();

    @Test
    void declaresDurableQueueThenBindsIt() throws Exception {
        registrar.declareAndBind(channel, "orders", "orders.created", "amq.topic");

        InOrder order = inOrder(channel);
        order.verify(channel).queueDeclare("orders", true, false, false, null);
        order.verify(channel).queueBind("orders", "amq.topic", "orders.created");
    }

    @Test
    void registeringTwiceIssuesTheSameDeclarations() throws Exception {
        registrar.declareAndBind(channel, "orders", "orders.created", "amq.topic");
        registrar.declareAndBind(channel, "orders", "orders.created", "amq.topic");

        verify(channel, times(2)).queueDeclare("orders", true, false, false, null);
        verify(channel, times(2)).queueBind("orders", "amq.topic", "orders.created");
    }

    @Test
    void declareFailureIsTopologyErrorAndSkipsBinding() throws Exception {
        doThrow(new IOException("PRECONDITION_FAILED"))
                .when(channel).queueDeclare(anyString(), anyBoolean(), anyBoolean(), anyBoolean(), any());

        assertThatThrownBy(() -> registrar.declareAndBind(channel, "orders", "orders.created", "amq.topic"))
                .isInstanceOf(TopologyException.class)
                .hasMessageContaining("orders")
                .hasCauseInstanceOf(IOException.class);
        verify(channel, never()).queueBind(anyString(), anyString(), anyString());
    }

    @Test
    void bindFailureIsTopologyError() throws Exception {
        doThrow(new IOException("NOT_FOUND - no exchange"))
                .when(channel).queueBind("orders", "missing", "orders.created");

        assertThatThrownBy(() -> registrar.declareAndBind(channel, "orders", "orders.created", "missing"))
                .isInstanceOf(TopologyException.class)
                .hasMessageContaining("missing");
    }
}
