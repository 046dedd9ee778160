package io.navi.mq.transport;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Short-lived session opened synchronously on the caller's thread.
 *
 * <p>Meant for try-with-resources: one unit of work, then {@link #close()}.</p>
 */
public class BlockingSession implements BrokerSession {

    private final String name;
    private final Connection connection;
    private final Channel channel;
    private final AtomicBoolean closed = new AtomicBoolean();

    BlockingSession(String name, Connection connection, Channel channel) {
        this.name = name;
        this.connection = connection;
        this.channel = channel;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Channel getChannel() {
        return channel;
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && connection.isOpen() && channel.isOpen();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            SessionResources.release(name, channel, connection);
        }
    }
}
