package com.eainde.amqpretry.service;

/**
 * Produces the empty instance that an incoming payload is decoded into.
 * It is called once per delivery and must return a new instance every time: a reused instance would
 * keep field values from an earlier message whose payload set fields the current one omits.
 *
 * @param <T> The message type.
 */
@FunctionalInterface
public interface MessageFactory<T> {

    T newEmpty();
}
