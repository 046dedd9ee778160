package io.navi.mq.transport;

import com.rabbitmq.client.Channel;

import java.io.IOException;

/**
 * Work done on a freshly opened channel before the session is considered ready.
 */
@FunctionalInterface
interface ChannelInitializer {

    void initialize(Channel channel) throws IOException;
}
