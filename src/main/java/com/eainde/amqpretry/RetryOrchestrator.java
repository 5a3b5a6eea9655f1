package com.eainde.amqpretry;

import com.eainde.amqpretry.model.BackoffLadder;
import com.eainde.amqpretry.model.RetryHeaders;
import com.eainde.amqpretry.service.MessagePublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Moves a failed delivery one step up the backoff ladder.
 * The message is published through the default exchange straight into the delay queue of its current
 * tier; when that queue's TTL expires the broker dead-letters it to the retry exchange, where the retry
 * consumer sends it back to its original destination.
 * Stateless and safe to call from any consumer thread.
 */
public class RetryOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(RetryOrchestrator.class);

    static final String DEFAULT_EXCHANGE = "";

    private final MessagePublisher publisher;
    private final BackoffLadder ladder;

    public RetryOrchestrator(MessagePublisher publisher, BackoffLadder ladder) {
        this.publisher = publisher;
        this.ladder = ladder;
    }

    /**
     * Republishes a failed delivery into the delay queue matching its retry number.
     * The original exchange and routing key are recorded the first time only, so that later hops
     * still return to the original destination rather than to the retry exchange.
     *
     * @param delivery The delivery whose handler failed.
     * @return true if the message was republished, false if the ladder is exhausted.
     * @throws org.springframework.amqp.AmqpException if the republish fails.
     */
    public boolean publishRetry(Message delivery) {
        MessageProperties properties = delivery.getMessageProperties();
        Map<String, Object> headers = properties.getHeaders() != null
                ? new HashMap<>(properties.getHeaders())
                : new HashMap<>();

        int retryNumber = RetryHeaders.retryNumber(headers);
        if (ladder.isExhausted(retryNumber)) {
            logger.error("Permanent task failure: message from exchange '{}' with routing key '{}' failed {} retries.",
                    properties.getReceivedExchange(), properties.getReceivedRoutingKey(), retryNumber);
            return false;
        }

        headers.putIfAbsent(RetryHeaders.EXCHANGE_NAME, nullToEmpty(properties.getReceivedExchange()));
        headers.putIfAbsent(RetryHeaders.ROUTING_KEY, nullToEmpty(properties.getReceivedRoutingKey()));
        headers.put(RetryHeaders.RETRY_NUMBER, Integer.toString(retryNumber + 1));

        String delayQueue = ladder.queueName(retryNumber);
        publisher.publishRaw(DEFAULT_EXCHANGE, delayQueue, delivery.getBody(), headers);
        logger.info("Scheduled retry {} of {} for exchange '{}' with routing key '{}' in {}s via '{}'.",
                retryNumber + 1, ladder.size(), headers.get(RetryHeaders.EXCHANGE_NAME),
                headers.get(RetryHeaders.ROUTING_KEY), ladder.delaySeconds(retryNumber), delayQueue);
        return true;
    }

    public BackoffLadder ladder() {
        return ladder;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
