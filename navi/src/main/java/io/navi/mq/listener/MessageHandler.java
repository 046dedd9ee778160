package io.navi.mq.listener;

import java.util.Map;

/**
 * Receives the messages delivered to a {@link NaviListener}.
 *
 * <p>Called on the listener's event loop thread, one message at a time. A slow handler
 * delays every later delivery of the same listener.</p>
 *
 * <p>Example usage:</p>
 * <pre>
 * navi.listen("greetings", "demo.hello_world", (headers, message) ->
 *         System.out.println("Hey " + message.get("name") + "! Listening from "
 *                 + headers.get("listener_name")));
 * </pre>
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Handle one message. Returning normally acknowledges it; throwing rejects it
     * without requeue.
     *
     * @param headers delivery headers, always including {@code listener_name} and {@code queue_name}
     * @param message deserialized message body
     */
    void handle(Map<String, String> headers, Map<String, Object> message) throws Exception;
}
