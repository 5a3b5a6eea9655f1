package com.eainde.amqpretry.consumer;

import com.eainde.amqpretry.ExceptionRetryabilityChecker;
import com.eainde.amqpretry.RetryOrchestrator;
import com.eainde.amqpretry.connection.BrokerConnectionManager;
import com.eainde.amqpretry.model.RetryHeaders;
import com.eainde.amqpretry.service.MessageFactory;
import com.eainde.amqpretry.service.MessageHandler;
import com.eainde.amqpretry.service.MessagePublisher;
import com.eainde.amqpretry.topology.RetryTopologyManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.listener.MessageListenerContainer;
import org.springframework.beans.factory.DisposableBean;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Binds handlers to queues and runs one consumer per binding.
 * Failed deliveries on ordinary bindings are sent up the retry ladder; the retry consumer registered by
 * {@link #ensureRetryConsumer()} drains the ready queue and returns each message to its original
 * exchange and routing key.
 */
@Slf4j
public class MessageDispatcher implements DisposableBean {

    static final String CONSUMER_TAG_PREFIX = "ctag-";

    private final RetryTopologyManager topology;
    private final BrokerConnectionManager connections;
    private final MessagePublisher publisher;
    private final RetryOrchestrator retryOrchestrator;
    private final ExceptionRetryabilityChecker retryabilityChecker;
    private final ObjectMapper objectMapper;
    private final ConsumerContainerFactory containerFactory;

    private final AtomicLong consumerSeq = new AtomicLong();
    private final Map<String, MessageListenerContainer> containers = new ConcurrentHashMap<>();
    private final Object retryConsumerLock = new Object();
    private volatile String retryConsumerTag;

    public MessageDispatcher(RetryTopologyManager topology,
                             BrokerConnectionManager connections,
                             MessagePublisher publisher,
                             RetryOrchestrator retryOrchestrator,
                             ExceptionRetryabilityChecker retryabilityChecker,
                             ObjectMapper objectMapper,
                             ConsumerContainerFactory containerFactory) {
        this.topology = topology;
        this.connections = connections;
        this.publisher = publisher;
        this.retryOrchestrator = retryOrchestrator;
        this.retryabilityChecker = retryabilityChecker;
        this.objectMapper = objectMapper;
        this.containerFactory = containerFactory;
        connections.addCloseListener(this::cancelAll);
    }

    /**
     * Sets up a handler for the given queue, exchange and routing key. The exchange and queue are declared
     * if needed and bound together, then a consumer starts delivering to the handler.
     *
     * @param queueName The queue to consume from.
     * @param exchangeName The topic exchange the queue is bound to.
     * @param routingKey The binding's routing key.
     * @param messageFactory Produces a fresh instance for every payload to be decoded into.
     * @param handler The business logic. Throwing sends the delivery up the retry ladder.
     * @return The consumer tag, used to {@link #cancel(String) cancel} the consumer.
     * @throws com.eainde.amqpretry.connection.BrokerSetupException if the broker objects cannot be declared.
     */
    public <T> String handleFunc(String queueName, String exchangeName, String routingKey,
                                 MessageFactory<T> messageFactory, MessageHandler<T> handler) {
        topology.ensureTopology();
        topology.ensureExchange(exchangeName);
        topology.ensureQueue(queueName);
        topology.bindQueue(queueName, exchangeName, routingKey);

        String consumerTag = CONSUMER_TAG_PREFIX + consumerSeq.incrementAndGet();
        // Failures on the ready queue must not feed back into the ladder.
        boolean retryEligible = !queueName.equals(topology.readyQueue());
        HandlerBinding<T> binding = new HandlerBinding<>(queueName, exchangeName, routingKey,
                messageFactory, handler, consumerTag, retryEligible);

        DeliveryListener<T> listener = new DeliveryListener<>(binding, objectMapper, retryOrchestrator, retryabilityChecker);
        MessageListenerContainer container = containerFactory.create(binding, listener, this::consumerTerminated);
        containers.put(consumerTag, container);
        container.start();

        log.debug("[{}] Handler waiting for messages.", binding);
        return consumerTag;
    }

    /**
     * Registers the consumer that returns expired retry messages to their original destination.
     * Only the first call registers anything.
     *
     * @return The retry consumer's tag.
     */
    public String ensureRetryConsumer() {
        String tag = retryConsumerTag;
        if (tag != null) {
            return tag;
        }
        synchronized (retryConsumerLock) {
            if (retryConsumerTag == null) {
                retryConsumerTag = handleFunc(topology.readyQueue(), topology.retryExchange(), topology.retryRoutingKey(),
                        RetryCarrier::new, this::returnToOrigin);
            }
            return retryConsumerTag;
        }
    }

    /**
     * Stops the consumer with the given tag. Other consumers and the shared connection keep running unless
     * the connection policy decides otherwise.
     *
     * @return false if no consumer with that tag is running.
     */
    public boolean cancel(String consumerTag) {
        MessageListenerContainer container = containers.remove(consumerTag);
        if (container == null) {
            return false;
        }
        container.stop();
        onCancelled(consumerTag);
        return true;
    }

    public Set<String> activeConsumerTags() {
        return Set.copyOf(containers.keySet());
    }

    /**
     * Stops every consumer without applying the cancellation policy.
     */
    public void cancelAll() {
        for (String consumerTag : List.copyOf(containers.keySet())) {
            MessageListenerContainer container = containers.remove(consumerTag);
            if (container != null) {
                container.stop();
            }
        }
    }

    @Override
    public void destroy() {
        cancelAll();
    }

    void returnToOrigin(RetryCarrier carrier, Map<String, Object> headers) {
        int retryNumber = RetryHeaders.retryNumber(headers);
        if (retryOrchestrator.ladder().isExhausted(retryNumber)) {
            log.error("Permanent task failure after {} retries, dropping message. Headers: {}", retryNumber, headers);
            return;
        }

        String exchangeName = RetryHeaders.exchangeName(headers);
        String routingKey = RetryHeaders.routingKey(headers);
        if (exchangeName == null || routingKey == null) {
            log.error("Retry message carries no original destination, dropping it. Headers: {}", headers);
            return;
        }

        publisher.publishRaw(exchangeName, routingKey, carrier.body(), headers);
    }

    private void consumerTerminated(String consumerTag) {
        if (containers.remove(consumerTag) != null) {
            onCancelled(consumerTag);
        }
    }

    private void onCancelled(String consumerTag) {
        log.info("AMQP consumer {} was cancelled.", consumerTag);
        connections.onConsumerCancelled(consumerTag);
    }
}
