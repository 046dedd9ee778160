package demo;

import io.navi.mq.Navi;
import io.navi.mq.config.BrokerConfig;
import io.navi.mq.config.ExchangeType;
import io.navi.mq.listener.ListenerState;
import io.navi.mq.listener.NaviListener;

import java.util.List;
import java.util.Map;

/**
 * Configuration built in code, no environment or YAML.
 * Shows a failing handler, batch publishing and stopping a listener at runtime.
 */
public class ProgrammaticExample {

    public static void main(String[] args) throws InterruptedException {

        // ========== 1. Configuration ==========

        var config = new BrokerConfig("localhost", 5672, "guest", "guest",
                "navi.demo", ExchangeType.topic);

        try (var navi = new Navi(config)) {

            // ========== 2. Listeners ==========

            NaviListener audit = navi.listen("demo-audit", "orders.#", (headers, message) ->
                    System.out.printf("[audit] %s from %s (message_id=%s)%n",
                            message, headers.get("from_host"), headers.get("message_id")));

            // Throws for orders without an amount: those are rejected, the listener keeps going
            NaviListener billing = navi.listen("demo-billing", "orders.created", (headers, message) -> {
                Object amount = message.get("amount");
                if (amount == null) {
                    throw new IllegalArgumentException("order without amount");
                }
                System.out.printf("[billing] charging %s%n", amount);
            });

            audit.whenConsuming().join();
            billing.whenConsuming().join();

            // ========== 3. Publish ==========

            navi.publishAll("orders.created", List.of(
                    Map.of("order", 1, "amount", 10),
                    Map.of("order", 2),
                    Map.of("order", 3, "amount", 30)));
            navi.publish("orders.cancelled", Map.of("order", 1), Map.of("reason", "customer request"));

            Thread.sleep(2_000);

            // ========== 4. Stop one listener at runtime ==========

            billing.stop();
            System.out.println("billing: " + billing.getState());
            billing.stop(); // no-op

            navi.publish("orders.created", Map.of("order", 4, "amount", 40));
            Thread.sleep(2_000);

            System.out.println("audit: " + audit.getState()
                    + (audit.getState() == ListenerState.FAILED ? " " + audit.getFailureCause() : ""));
        }
    }
}
