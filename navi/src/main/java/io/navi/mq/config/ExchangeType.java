package io.navi.mq.config;

import com.rabbitmq.client.BuiltinExchangeType;

import java.util.Locale;

/**
 * Exchange types navi is allowed to declare.
 */
public enum ExchangeType {

    direct(BuiltinExchangeType.DIRECT),
    fanout(BuiltinExchangeType.FANOUT),
    topic(BuiltinExchangeType.TOPIC);

    private final BuiltinExchangeType builtinType;

    ExchangeType(BuiltinExchangeType builtinType) {
        this.builtinType = builtinType;
    }

    public BuiltinExchangeType getBuiltinType() {
        return builtinType;
    }

    /**
     * Resolve an exchange type from its configured name, case-insensitively.
     *
     * @throws ConfigException if the value is blank or not one of direct, fanout, topic
     */
    public static ExchangeType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigException("Exchange type must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ExchangeType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new ConfigException("Unsupported exchange type: " + value
                + " (expected one of direct, fanout, topic)");
    }
}
