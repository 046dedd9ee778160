package io.navi.mq.transport;

import com.rabbitmq.client.ShutdownSignalException;

/**
 * Completion callbacks of an {@link EventDrivenSession}.
 *
 * <p>All methods are invoked on the session's event loop thread.</p>
 */
public interface SessionCallbacks {

    /**
     * Connection and channel are open and the exchange has been declared.
     */
    void onReady(EventDrivenSession session);

    /**
     * The session could not be established. Any partially opened resources
     * have already been released.
     */
    void onError(EventDrivenSession session, ConnectionException error);

    /**
     * The connection was shut down by the broker or the network, after
     * {@link #onReady(EventDrivenSession)}. Not called for closes requested
     * through {@link EventDrivenSession#close()}.
     */
    void onClosed(EventDrivenSession session, ShutdownSignalException cause);
}
