package io.navi.mq.listener;

import io.navi.mq.NaviException;

/**
 * Raised on listener lifecycle errors, e.g. calling {@code listen()} twice or a consumer
 * that could not be started.
 */
public class ListenerException extends NaviException {

    public ListenerException(String message) {
        super(message);
    }

    public ListenerException(String message, Throwable cause) {
        super(message, cause);
    }
}
