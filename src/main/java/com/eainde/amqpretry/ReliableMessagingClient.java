package com.eainde.amqpretry;

import com.eainde.amqpretry.consumer.MessageDispatcher;
import com.eainde.amqpretry.service.MessageFactory;
import com.eainde.amqpretry.service.MessageHandler;
import com.eainde.amqpretry.service.MessagePublisher;
import com.eainde.amqpretry.topology.RetryTopologyManager;

import java.util.Collection;
import java.util.Map;

/**
 * The entry point for consuming applications: declare broker objects, publish messages, and register
 * handlers whose failures are retried through the backoff ladder.
 *
 * <pre>{@code
 * client.ensureRetryConsumer();
 * client.handleFunc("orders.created", "orders", "orders.created", OrderCreated::new,
 *         (order, headers) -> orderService.process(order));
 * client.publish("orders", "orders.created", new OrderCreated(42));
 * }</pre>
 */
public class ReliableMessagingClient {

    private final RetryTopologyManager topology;
    private final MessagePublisher publisher;
    private final MessageDispatcher dispatcher;

    public ReliableMessagingClient(RetryTopologyManager topology, MessagePublisher publisher, MessageDispatcher dispatcher) {
        this.topology = topology;
        this.publisher = publisher;
        this.dispatcher = dispatcher;
    }

    /**
     * Ensures that the exchange with the given name exists.
     * Not needed before {@link #handleFunc}, which declares its exchange itself.
     */
    public void ensureExchange(String exchangeName) {
        topology.ensureExchange(exchangeName);
    }

    /**
     * Ensures that the queue with the given name exists.
     * Not needed before {@link #handleFunc}, which declares its queue itself.
     */
    public void ensureQueue(String queueName) {
        topology.ensureQueue(queueName);
    }

    public void publish(String exchangeName, String routingKey, Object message) {
        topology.ensureTopology();
        publisher.publish(exchangeName, routingKey, message);
    }

    public void publish(String exchangeName, String routingKey, Object message, Map<String, Object> headers) {
        topology.ensureTopology();
        publisher.publish(exchangeName, routingKey, message, headers);
    }

    public <T> String handleFunc(String queueName, String exchangeName, String routingKey,
                                 MessageFactory<T> messageFactory, MessageHandler<T> handler) {
        return dispatcher.handleFunc(queueName, exchangeName, routingKey, messageFactory, handler);
    }

    public boolean cancel(String consumerTag) {
        return dispatcher.cancel(consumerTag);
    }

    public String ensureRetryConsumer() {
        topology.ensureTopology();
        return dispatcher.ensureRetryConsumer();
    }

    /**
     * Sum of the pending messages in the given queues, for monitoring.
     */
    public int queueTotalMessages(Collection<String> queueNames) {
        topology.ensureTopology();
        return topology.queueTotalMessages(queueNames);
    }

    public int purgeQueue(String queueName) {
        return topology.purgeQueue(queueName);
    }
}
