package io.navi.mq.config;

import io.navi.mq.NaviException;

import java.util.List;

/**
 * Raised when navi is configured with missing or invalid values.
 */
public class ConfigException extends NaviException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @param invalidEntries one description per rejected entry, e.g. "NAVI_AMQP_HOST=null"
     */
    public ConfigException(List<String> invalidEntries) {
        super("Invalid navi configuration: " + invalidEntries);
    }
}
