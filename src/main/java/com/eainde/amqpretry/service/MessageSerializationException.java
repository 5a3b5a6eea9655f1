package com.eainde.amqpretry.service;

/**
 * Thrown when a message object cannot be serialized to JSON. This points at a message type that can
 * never be published, so it is a programming error rather than a per-message condition.
 */
public class MessageSerializationException extends RuntimeException {

    public MessageSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
