package io.navi.mq.transport;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Releases the channel and connection of a session.
 */
final class SessionResources {

    private static final Logger log = LoggerFactory.getLogger(SessionResources.class);

    private SessionResources() {
    }

    /**
     * Close {@code channel} then {@code connection}. Either may be null.
     * Failures are logged and never stop the second close.
     */
    static void release(String name, Channel channel, Connection connection) {
        try { if (channel != null && channel.isOpen()) channel.close(); }
        catch (Exception e) { log.debug("Error closing channel of {}: {}", name, e.getMessage()); }
        try { if (connection != null && connection.isOpen()) connection.close(); }
        catch (Exception e) { log.debug("Error closing connection {}: {}", name, e.getMessage()); }
    }
}
