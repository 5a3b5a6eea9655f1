package com.eainde.amqpretry.model;

public enum DeliveryOutcome {
    /**
     * The handler completed without throwing.
     */
    PROCESSED,

    /**
     * The payload could not be decoded. Such deliveries are acknowledged and never retried.
     */
    DECODE_FAILED,

    /**
     * The handler failed and the delivery was republished into a delay queue.
     */
    RETRY_SCHEDULED,

    /**
     * The handler failed and the delivery was published nowhere, either because the backoff
     * ladder is exhausted or because the failure is not retryable.
     */
    PERMANENT_FAILURE,

    /**
     * The handler failed and the republish into the delay queue failed as well. The delivery is lost.
     */
    RETRY_PUBLISH_FAILED,

    /**
     * The handler failed on a binding that does not feed the retry ladder.
     */
    FAILED
}
