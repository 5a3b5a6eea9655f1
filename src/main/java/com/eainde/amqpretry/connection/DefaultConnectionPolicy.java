package com.eainde.amqpretry.connection;

import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs by default. {@code closeOnCancel} closes the shared connection when any consumer stops;
 * {@code exitOnClose} terminates the process on an unsolicited connection close.
 */
@Slf4j
public class DefaultConnectionPolicy implements ConnectionPolicy {

    static final int EXIT_STATUS = 1;

    private final boolean closeOnCancel;
    private final boolean exitOnClose;
    private final ProcessTerminator terminator;

    public DefaultConnectionPolicy(boolean closeOnCancel, boolean exitOnClose, ProcessTerminator terminator) {
        this.closeOnCancel = closeOnCancel;
        this.exitOnClose = exitOnClose;
        this.terminator = terminator;
    }

    @Override
    public void onConsumerCancelled(String consumerTag, BrokerConnectionManager connections) {
        if (closeOnCancel) {
            log.warn("Consumer {} was cancelled, closing the AMQP connection.", consumerTag);
            connections.close();
        }
    }

    @Override
    public void onUnsolicitedClose(ShutdownSignalException cause) {
        if (exitOnClose) {
            log.error("AMQP connection closed unexpectedly, terminating the process.", cause);
            terminator.terminate(EXIT_STATUS);
        }
    }

    public boolean isCloseOnCancel() {
        return closeOnCancel;
    }

    public boolean isExitOnClose() {
        return exitOnClose;
    }
}
