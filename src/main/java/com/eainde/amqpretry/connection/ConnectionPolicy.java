package com.eainde.amqpretry.connection;

import com.rabbitmq.client.ShutdownSignalException;

/**
 * Decides what happens to the process when a consumer stops or the broker connection goes away.
 * Define a bean of this type to replace the configured default.
 */
public interface ConnectionPolicy {

    /**
     * Called after the consumer identified by {@code consumerTag} has stopped, whether it was
     * cancelled by the application or by the broker.
     *
     * @param consumerTag The tag returned when the handler was registered.
     * @param connections The connection owner, so the policy can close it.
     */
    void onConsumerCancelled(String consumerTag, BrokerConnectionManager connections);

    /**
     * Called when the broker connection shuts down without the application asking for it.
     *
     * @param cause The shutdown signal reported by the client.
     */
    void onUnsolicitedClose(ShutdownSignalException cause);
}
