package io.navi.mq.envelope;

import java.util.Map;

/**
 * A decoded delivery.
 *
 * @param headers string headers of the delivery
 * @param message deserialized message body
 */
public record ReceivedMessage(Map<String, String> headers, Map<String, Object> message) {
}
