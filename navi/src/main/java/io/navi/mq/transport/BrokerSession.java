package io.navi.mq.transport;

import com.rabbitmq.client.Channel;

import java.io.Closeable;

/**
 * An open broker connection together with the single channel navi uses on it.
 *
 * <p>Two implementations exist, selected by {@link ConnectionManager} according to
 * how long the session lives:</p>
 * <ul>
 *   <li>{@link BlockingSession}: opened on the caller's thread, used for one publish
 *       (or batch) and closed right after</li>
 *   <li>{@link EventDrivenSession}: opened on its own event loop and held for the
 *       lifetime of a listener</li>
 * </ul>
 *
 * <p>By the time a session is handed out, the configured exchange has been declared.</p>
 */
public interface BrokerSession extends Closeable {

    /**
     * @return connection name, also used as the AMQP client-provided name
     */
    String getName();

    /**
     * @return the channel of this session
     */
    Channel getChannel();

    /**
     * @return true while both connection and channel are open
     */
    boolean isOpen();

    /**
     * Close the channel, then the connection. Each step runs even if the previous one failed.
     * Idempotent.
     */
    @Override
    void close();
}
