package io.navi.mq.envelope;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Header names navi reads or writes.
 */
public final class MessageHeaders {

    /** Name of the listener a delivery was handed to. Set on every delivery. */
    public static final String LISTENER_NAME = "listener_name";

    /** Queue a delivery was consumed from. Set on every delivery. */
    public static final String QUEUE_NAME = "queue_name";

    /** Random UUID assigned at publish time. */
    public static final String MESSAGE_ID = "message_id";

    /** UTC instant of the publish, ISO-8601. */
    public static final String PUBLISHED_AT = "published_at";

    /** Host name of the publishing process. */
    public static final String FROM_HOST = "from_host";

    private static volatile String localHost;

    private MessageHeaders() {
    }

    /**
     * Metadata attached to every published message.
     */
    public static Map<String, String> publishMetadata(Clock clock) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(MESSAGE_ID, UUID.randomUUID().toString());
        headers.put(PUBLISHED_AT, clock.instant().toString());
        headers.put(FROM_HOST, localHostName());
        return headers;
    }

    static String localHostName() {
        String host = localHost;
        if (host == null) {
            try {
                host = InetAddress.getLocalHost().getCanonicalHostName();
            } catch (UnknownHostException e) {
                host = "unknown";
            }
            localHost = host;
        }
        return host;
    }
}
