package com.eainde.amqpretry.consumer;

/**
 * Implemented by decoded messages that also keep the delivery body exactly as it arrived.
 * Called after a successful decode, before the handler runs.
 */
interface RawBodyReceiver {

    void receiveRawBody(byte[] body);
}
