package io.navi.mq;

/**
 * Base class for every error raised by navi.
 *
 * <p>Unchecked, so callers handle broker problems where they can act on
 * them instead of at every call site.</p>
 */
public class NaviException extends RuntimeException {

    public NaviException(String message) {
        super(message);
    }

    public NaviException(String message, Throwable cause) {
        super(message, cause);
    }
}
