package io.navi.mq.publisher;

import io.navi.mq.NaviException;

/**
 * Raised when a publish round trip fails. Nothing is retried.
 */
public class PublishException extends NaviException {

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
