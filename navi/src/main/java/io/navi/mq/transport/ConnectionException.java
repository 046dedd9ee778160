package io.navi.mq.transport;

import io.navi.mq.NaviException;

/**
 * Raised when a broker connection or its channel cannot be established,
 * including failure to declare the shared exchange.
 */
public class ConnectionException extends NaviException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
