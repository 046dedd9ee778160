package io.navi.mq.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.navi.mq.NaviException;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts application messages to and from their JSON wire form.
 *
 * <p>Encoding sorts map entries by key, so equal messages always produce identical bytes.
 * Decoding only accepts a JSON object at the top level; anything else is a
 * {@link DecodeException}.</p>
 *
 * <p>Decoding restores JSON values, not Java types: integral numbers come back as the
 * smallest of {@code Integer}, {@code Long} or {@code BigInteger} that fits, and fractional
 * numbers as {@code Double}. A {@code 5L}, {@code 2.5f} or {@code BigDecimal} sent in a
 * message is therefore not {@code equals} to the decoded value.</p>
 */
public class EnvelopeCodec {

    public static final String CONTENT_TYPE = "application/json";
    public static final String CONTENT_ENCODING = "UTF-8";

    private static final TypeReference<LinkedHashMap<String, Object>> MESSAGE_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public Envelope encode(Map<String, ?> message) {
        return encode(message, Collections.emptyMap());
    }

    /**
     * Serialize {@code message} and attach {@code headers} unchanged.
     *
     * @throws EncodeException if the message is null or holds a value that cannot be serialized
     */
    public Envelope encode(Map<String, ?> message, Map<String, String> headers) {
        if (message == null) {
            throw new EncodeException("Message must not be null", null);
        }
        try {
            byte[] body = objectMapper.writeValueAsBytes(message);
            return new Envelope(headers == null ? Collections.emptyMap() : headers, body);
        } catch (JsonProcessingException e) {
            throw new EncodeException("Failed to serialize message: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Deserialize a delivery.
     *
     * @param body       raw message body
     * @param rawHeaders AMQP headers table, may be null
     * @throws DecodeException if the body is not a JSON object
     */
    public ReceivedMessage decode(byte[] body, Map<String, Object> rawHeaders) {
        if (body == null) {
            throw new DecodeException("Message body is missing", null);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new DecodeException("Message body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new DecodeException("Message body must be a JSON object, got "
                    + (root == null || root.isMissingNode() ? "nothing" : root.getNodeType()), null);
        }
        Map<String, Object> message = objectMapper.convertValue(root, MESSAGE_TYPE);
        return new ReceivedMessage(toStringHeaders(rawHeaders), message);
    }

    /**
     * Stringify an AMQP headers table. Null values are dropped.
     */
    public static Map<String, String> toStringHeaders(Map<String, Object> rawHeaders) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (rawHeaders != null) {
            rawHeaders.forEach((key, value) -> {
                if (value != null) {
                    headers.put(key, String.valueOf(value));
                }
            });
        }
        return headers;
    }

    public static class DecodeException extends NaviException {
        public DecodeException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class EncodeException extends NaviException {
        public EncodeException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
