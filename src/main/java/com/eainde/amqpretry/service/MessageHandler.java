package com.eainde.amqpretry.service;

import java.util.Map;

/**
 * Business logic run for every decoded delivery.
 *
 * @param <T> The message type produced by the binding's {@link MessageFactory}.
 */
@FunctionalInterface
public interface MessageHandler<T> {

    /**
     * Processes one message. Throwing marks the attempt as failed, and the delivery then climbs the
     * retry ladder.
     *
     * @param message The decoded payload.
     * @param headers The AMQP headers of the delivery, including any retry headers.
     * @throws Exception if processing fails.
     */
    void handle(T message, Map<String, Object> headers) throws Exception;
}
