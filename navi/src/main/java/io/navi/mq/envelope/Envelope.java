package io.navi.mq.envelope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire form of one message: a string headers table plus the serialized body.
 */
public final class Envelope {

    private final Map<String, String> headers;
    private final byte[] body;

    public Envelope(Map<String, String> headers, byte[] body) {
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body.clone();
    }

    public Map<String, String> getHeaders() { return headers; }

    public byte[] getBody() { return body.clone(); }

    /**
     * Headers in the form the AMQP client expects for {@code BasicProperties}.
     */
    public Map<String, Object> getAmqpHeaders() {
        return new LinkedHashMap<>(headers);
    }

    @Override
    public String toString() {
        return "Envelope{headers=" + headers + ", bodyLength=" + body.length + '}';
    }
}
