package demo;

import io.navi.mq.Navi;
import io.navi.mq.listener.NaviListener;

import java.util.Map;

/**
 * Simplest usage: configuration from NAVI_* environment variables.
 *
 * Run: NAVI_AMQP_HOST=localhost NAVI_AMQP_PORT=5672 NAVI_AMQP_USERNAME=guest \
 *      NAVI_AMQP_PASSWORD=guest java -cp "lib/*" demo.BasicExample
 */
public class BasicExample {

    public static void main(String[] args) throws Exception {
        Navi navi = Navi.fromEnvironment();

        // 1. A listener created and started in one call
        navi.listen("from_listen_func", "demo.hello_world", BasicExample::helloWorld).whenConsuming().join();

        // 2. A listener created first and started explicitly
        NaviListener listener = navi.newListener("from_initialized_listener", "demo.hello_world",
                BasicExample::helloWorld);
        listener.listen().join();

        // 3. Both queues are bound to the same routing key, so each gets a copy
        for (String name : new String[]{"Sonic", "Tails", "Knuckles"}) {
            navi.publish("demo.hello_world", Map.of("name", name));
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("Shutting down...");
            navi.close();
        }));

        System.out.println("Listening on demo.hello_world... (Ctrl+C to stop)");
        Thread.currentThread().join();
    }

    private static void helloWorld(Map<String, String> headers, Map<String, Object> message) {
        System.out.printf("Hey %s! Listening from %s%n", message.get("name"), headers.get("listener_name"));
    }
}
