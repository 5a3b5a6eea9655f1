package com.eainde.amqpretry.topology;

import com.eainde.amqpretry.connection.BrokerConnectionManager;
import com.eainde.amqpretry.connection.BrokerSetupException;
import com.eainde.amqpretry.model.BackoffLadder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueInformation;
import org.springframework.amqp.core.TopicExchange;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Declares the exchanges and queues behind the retry ladder: one ready queue bound to the retry
 * exchange, and one delay queue per ladder tier that dead-letters expired messages back into
 * the retry exchange.
 */
public class RetryTopologyManager {

    private static final Logger logger = LoggerFactory.getLogger(RetryTopologyManager.class);

    static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
    static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";
    static final String MESSAGE_TTL = "x-message-ttl";

    private final BrokerConnectionManager connections;
    private final BackoffLadder ladder;
    private final String readyQueue;
    private final String retryExchange;
    private final String retryRoutingKey;
    private final Object lock = new Object();

    private volatile boolean declared;
    private volatile BrokerSetupException failure;

    public RetryTopologyManager(BrokerConnectionManager connections, BackoffLadder ladder,
                                String readyQueue, String retryExchange, String retryRoutingKey) {
        this.connections = connections;
        this.ladder = ladder;
        this.readyQueue = readyQueue;
        this.retryExchange = retryExchange;
        this.retryRoutingKey = retryRoutingKey;
    }

    /**
     * Declares the retry topology the first time it is called. Concurrent first callers wait for the
     * declarations to finish; every later call returns immediately. A failed run is not repeated, the
     * original failure is rethrown instead.
     *
     * @throws BrokerSetupException if any declaration fails.
     */
    public void ensureTopology() {
        if (declared) {
            rethrowFailure();
            return;
        }
        synchronized (lock) {
            if (!declared) {
                try {
                    declareRetryTopology();
                } catch (BrokerSetupException e) {
                    failure = e;
                } catch (AmqpException e) {
                    failure = new BrokerSetupException("Failed to declare the RabbitMQ retry topology", e);
                } finally {
                    declared = true;
                }
            }
        }
        rethrowFailure();
    }

    /**
     * Ensures that a durable topic exchange with the given name exists.
     */
    public void ensureExchange(String exchangeName) {
        ensureTopology();
        try {
            connections.admin().declareExchange(new TopicExchange(exchangeName, true, false));
        } catch (AmqpException e) {
            throw new BrokerSetupException("Failed to declare RabbitMQ exchange " + exchangeName, e);
        }
    }

    /**
     * Ensures that a durable queue with the given name exists.
     */
    public void ensureQueue(String queueName) {
        ensureTopology();
        try {
            connections.admin().declareQueue(new Queue(queueName, true, false, false));
        } catch (AmqpException e) {
            throw new BrokerSetupException("Failed to declare RabbitMQ queue " + queueName, e);
        }
    }

    public void bindQueue(String queueName, String exchangeName, String routingKey) {
        try {
            connections.admin().declareBinding(
                    new Binding(queueName, Binding.DestinationType.QUEUE, exchangeName, routingKey, null));
        } catch (AmqpException e) {
            throw new BrokerSetupException("Failed to bind RabbitMQ queue " + queueName + " to " + exchangeName, e);
        }
    }

    /**
     * Removes all pending messages from a queue.
     *
     * @return the number of messages removed.
     */
    public int purgeQueue(String queueName) {
        try {
            return connections.admin().purgeQueue(queueName);
        } catch (AmqpException e) {
            throw new BrokerSetupException("Failed to purge RabbitMQ queue " + queueName, e);
        }
    }

    /**
     * Sums the pending message counts of the given queues. Queues that cannot be inspected count as empty.
     */
    public int queueTotalMessages(Collection<String> queueNames) {
        AmqpAdmin admin = connections.admin();
        int total = 0;
        for (String queueName : queueNames) {
            QueueInformation info = admin.getQueueInfo(queueName);
            if (info == null) {
                logger.debug("Queue '{}' could not be inspected, counting it as empty.", queueName);
                continue;
            }
            total += info.getMessageCount();
        }
        return total;
    }

    public BackoffLadder ladder() {
        return ladder;
    }

    public String readyQueue() {
        return readyQueue;
    }

    public String retryExchange() {
        return retryExchange;
    }

    public String retryRoutingKey() {
        return retryRoutingKey;
    }

    private void declareRetryTopology() {
        AmqpAdmin admin = connections.admin();

        Queue ready = new Queue(readyQueue, true, false, false);
        TopicExchange exchange = new TopicExchange(retryExchange, true, false);
        admin.declareQueue(ready);
        admin.declareExchange(exchange);
        admin.declareBinding(BindingBuilder.bind(ready).to(exchange).with(retryRoutingKey));

        for (int i = 0; i < ladder.size(); i++) {
            Map<String, Object> args = new HashMap<>();
            args.put(DEAD_LETTER_EXCHANGE, retryExchange);
            args.put(DEAD_LETTER_ROUTING_KEY, retryRoutingKey);
            args.put(MESSAGE_TTL, ladder.ttlMillis(i));
            admin.declareQueue(new Queue(ladder.queueName(i), true, false, false, args));
        }
        logger.info("Declared retry topology: ready queue '{}', exchange '{}', {} delay queues.",
                readyQueue, retryExchange, ladder.size());
    }

    private void rethrowFailure() {
        BrokerSetupException current = failure;
        if (current != null) {
            throw current;
        }
    }
}
