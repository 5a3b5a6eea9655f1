package com.eainde.amqpretry.connection;

/**
 * Thrown when the broker connection cannot be opened or when the retry topology cannot be declared.
 * Nothing in this library can run without either, so callers should treat it as fatal.
 */
public class BrokerSetupException extends RuntimeException {

    public BrokerSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
