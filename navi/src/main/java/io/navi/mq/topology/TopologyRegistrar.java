package io.navi.mq.topology;

import com.rabbitmq.client.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Declares a listener's queue and binds it to the shared exchange.
 *
 * <p>Queues are durable, non-exclusive and never auto-deleted. Declaring and binding are
 * both idempotent on the broker, so registering the same (queue, routing key, exchange)
 * again neither fails nor adds a second binding.</p>
 */
public class TopologyRegistrar {

    private static final Logger log = LoggerFactory.getLogger(TopologyRegistrar.class);

    /**
     * Declare {@code queueName} and bind it to {@code exchangeName} with {@code routingKey}.
     *
     * @throws TopologyException if the broker refuses the declaration or the binding;
     *                           the channel is closed by the broker in that case
     */
    public void declareAndBind(Channel channel, String queueName, String routingKey, String exchangeName) {
        try {
            channel.queueDeclare(queueName, true, false, false, null);
        } catch (IOException e) {
            throw new TopologyException("Failed to declare queue " + queueName, e);
        }

        try {
            channel.queueBind(queueName, exchangeName, routingKey);
        } catch (IOException e) {
            throw new TopologyException("Failed to bind queue " + queueName
                    + " to exchange " + exchangeName + " with routing key " + routingKey, e);
        }

        log.info("Queue {} bound to exchange {} with routing key {}", queueName, exchangeName, routingKey);
    }
}
