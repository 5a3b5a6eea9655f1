package com.eainde.amqpretry.consumer;

import com.eainde.amqpretry.connection.BrokerConnectionManager;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.rabbit.listener.ListenerContainerConsumerFailedEvent;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;
import org.springframework.amqp.rabbit.listener.MessageListenerContainer;

import java.util.function.Consumer;

/**
 * Builds the listener container behind a {@link HandlerBinding}: a single consumer on the shared
 * connection, manual acknowledgement, the binding's consumer tag and the configured prefetch.
 * Deliveries of one binding are therefore processed one at a time, in broker order.
 */
public class ConsumerContainerFactory {

    private final BrokerConnectionManager connections;

    public ConsumerContainerFactory(BrokerConnectionManager connections) {
        this.connections = connections;
    }

    /**
     * Creates an unstarted container.
     *
     * @param onTerminated Receives the consumer tag when the container reports that its consumer died
     *                     and will not be restarted.
     */
    public MessageListenerContainer create(HandlerBinding<?> binding, ChannelAwareMessageListener listener,
                                           Consumer<String> onTerminated) {
        SimpleMessageListenerContainer container = new SimpleMessageListenerContainer(connections.connectionFactory());
        container.setQueueNames(binding.queueName());
        container.setMessageListener(listener);
        container.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        container.setPrefetchCount(connections.prefetchCount());
        container.setConcurrentConsumers(1);
        container.setConsumerTagStrategy(queue -> binding.consumerTag());
        container.setDefaultRequeueRejected(false);
        container.setBeanName(binding.consumerTag());
        container.setApplicationEventPublisher(event -> {
            if (event instanceof ListenerContainerConsumerFailedEvent failed && failed.isFatal()) {
                onTerminated.accept(binding.consumerTag());
            }
        });
        container.afterPropertiesSet();
        return container;
    }
}
