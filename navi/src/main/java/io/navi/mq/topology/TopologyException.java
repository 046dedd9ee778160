package io.navi.mq.topology;

import io.navi.mq.NaviException;

/**
 * Raised when a queue cannot be declared or bound, e.g. because a queue with the same
 * name already exists with incompatible arguments. Not retryable without fixing the conflict.
 */
public class TopologyException extends NaviException {

    public TopologyException(String message, Throwable cause) {
        super(message, cause);
    }
}
