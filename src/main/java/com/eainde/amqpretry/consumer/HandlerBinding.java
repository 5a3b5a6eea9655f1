package com.eainde.amqpretry.consumer;

import com.eainde.amqpretry.service.MessageFactory;
import com.eainde.amqpretry.service.MessageHandler;

/**
 * A handler registered on a queue, together with the exchange and routing key the queue is bound by.
 * Lives until its consumer is cancelled.
 *
 * @param retryEligible false for the consumer draining the ready queue, whose failures must not feed
 *                      back into the ladder.
 */
public record HandlerBinding<T>(String queueName,
                                String exchangeName,
                                String routingKey,
                                MessageFactory<T> messageFactory,
                                MessageHandler<T> handler,
                                String consumerTag,
                                boolean retryEligible) {

    @Override
    public String toString() {
        return "ctag=" + consumerTag + " queue=" + queueName + " exchange=" + exchangeName + " routing=" + routingKey;
    }
}
