package io.navi.mq.transport;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Long-lived session driven by its own single-threaded event loop.
 *
 * <p>The loop thread ({@code navi-<name>}) opens the connection, runs the ready/error
 * callbacks and is also handed to the AMQP client as the consumer dispatch pool, so
 * every delivery of this session is processed on that same thread, one at a time.</p>
 *
 * <p>Created through {@link ConnectionManager#openEventDriven(String, SessionCallbacks)};
 * the handle is returned before the connection is established.</p>
 */
public class EventDrivenSession implements BrokerSession {

    private static final Logger log = LoggerFactory.getLogger(EventDrivenSession.class);

    private final String name;
    private final SessionCallbacks callbacks;
    private final ExecutorService loop;

    private final AtomicBoolean released = new AtomicBoolean();

    private volatile Thread loopThread;
    private volatile Connection connection;
    private volatile Channel channel;

    EventDrivenSession(String name, SessionCallbacks callbacks) {
        this.name = name;
        this.callbacks = callbacks;
        this.loop = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "navi-" + name);
            loopThread = thread;
            return thread;
        });
    }

    /**
     * Schedule connection establishment on the event loop.
     */
    void connect(ConnectionFactory factory, ChannelInitializer initializer) {
        loop.execute(() -> {
            try {
                Connection conn = factory.newConnection(loop, name);
                connection = conn;
                conn.addShutdownListener(this::onShutdown);

                Channel ch = conn.createChannel();
                if (ch == null) {
                    throw new IOException("No channel available on connection " + name);
                }
                channel = ch;
                initializer.initialize(ch);
            } catch (IOException | TimeoutException | RuntimeException e) {
                releaseResources();
                callbacks.onError(this, new ConnectionException("Failed to open connection " + name, e));
                return;
            }
            log.debug("Event-driven session {} ready", name);
            callbacks.onReady(this);
        });
    }

    private void onShutdown(ShutdownSignalException cause) {
        if (released.get()) {
            return;
        }
        log.debug("Connection {} shut down: {}", name, cause.getMessage());
        try {
            loop.execute(() -> {
                if (!released.get()) {
                    callbacks.onClosed(this, cause);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Event loop of {} already stopped, dropping shutdown notification", name);
        }
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
        Connection conn = connection;
        Channel ch = channel;
        return !released.get() && conn != null && conn.isOpen() && ch != null && ch.isOpen();
    }

    /**
     * @return true if the calling thread is this session's event loop
     */
    public boolean isLoopThread() {
        return Thread.currentThread() == loopThread;
    }

    /**
     * Queue the release of channel and connection behind the work already scheduled on
     * the event loop, then stop the loop.
     *
     * @return completes once the session is released
     */
    public CompletableFuture<Void> closeAsync() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            loop.execute(() -> {
                try {
                    releaseResources();
                    loop.shutdown();
                } finally {
                    done.complete(null);
                }
            });
        } catch (RejectedExecutionException e) {
            releaseResources();
            done.complete(null);
        }
        return done;
    }

    /**
     * Close the session after the task currently running on the event loop completes.
     *
     * <p>Blocks until channel and connection are released unless called from the
     * event loop itself, in which case the release happens inline.</p>
     */
    @Override
    public void close() {
        if (isLoopThread()) {
            releaseResources();
            loop.shutdown();
            return;
        }
        try {
            closeAsync().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            releaseResources();
            loop.shutdown();
        } catch (ExecutionException e) {
            log.debug("Error closing session {}: {}", name, e.getCause().getMessage());
        }
    }

    private void releaseResources() {
        if (released.compareAndSet(false, true)) {
            SessionResources.release(name, channel, connection);
        }
    }
}
