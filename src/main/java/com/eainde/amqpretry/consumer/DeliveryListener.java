package com.eainde.amqpretry.consumer;

import com.eainde.amqpretry.ExceptionRetryabilityChecker;
import com.eainde.amqpretry.RetryOrchestrator;
import com.eainde.amqpretry.model.DeliveryOutcome;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Processes the deliveries of one {@link HandlerBinding}: decode, run the handler, route failures to the
 * retry ladder, then acknowledge. Every delivery is acknowledged exactly once whatever happens, so a
 * failure is never redelivered by the broker itself.
 */
@Slf4j
public class DeliveryListener<T> implements ChannelAwareMessageListener {

    private final HandlerBinding<T> binding;
    private final ObjectMapper objectMapper;
    private final RetryOrchestrator retryOrchestrator;
    private final ExceptionRetryabilityChecker retryabilityChecker;

    public DeliveryListener(HandlerBinding<T> binding, ObjectMapper objectMapper,
                            RetryOrchestrator retryOrchestrator, ExceptionRetryabilityChecker retryabilityChecker) {
        this.binding = binding;
        this.objectMapper = objectMapper;
        this.retryOrchestrator = retryOrchestrator;
        this.retryabilityChecker = retryabilityChecker;
    }

    @Override
    public void onMessage(Message message, Channel channel) {
        try {
            DeliveryOutcome outcome = process(message);
            log.debug("[{}] Delivery {} finished with outcome {}.", binding, deliveryTag(message), outcome);
        } finally {
            acknowledge(message, channel);
        }
    }

    /**
     * Runs a delivery through decoding, the handler and, on failure, the retry ladder.
     * Only an {@link Error} raised by the handler escapes.
     */
    DeliveryOutcome process(Message message) {
        T decoded;
        try {
            decoded = decode(message.getBody());
        } catch (IOException | IllegalArgumentException e) {
            // Decode failures never enter the ladder.
            log.error("[{}] Could not unmarshal AMQP message: {}. Body: {}", binding, e.getMessage(),
                    new String(message.getBody(), StandardCharsets.UTF_8));
            return DeliveryOutcome.DECODE_FAILED;
        }
        if (decoded instanceof RawBodyReceiver receiver) {
            receiver.receiveRawBody(message.getBody());
        }

        try {
            binding.handler().handle(decoded, message.getMessageProperties().getHeaders());
            return DeliveryOutcome.PROCESSED;
        } catch (Exception e) {
            log.error("[{}] Error while processing message: {}", binding, e.getMessage(), e);
            return handleFailure(message, e);
        }
    }

    private T decode(byte[] body) throws IOException {
        T target = binding.messageFactory().newEmpty();
        if (target == null) {
            throw new IllegalArgumentException("Message factory returned null");
        }
        return objectMapper.readerForUpdating(target)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .readValue(body);
    }

    private DeliveryOutcome handleFailure(Message message, Exception cause) {
        if (!binding.retryEligible()) {
            return DeliveryOutcome.FAILED;
        }
        if (!retryabilityChecker.isRetryable(cause)) {
            log.error("[{}] Permanent task failure: {} is not retryable.", binding, cause.getClass().getName());
            return DeliveryOutcome.PERMANENT_FAILURE;
        }
        try {
            return retryOrchestrator.publishRetry(message)
                    ? DeliveryOutcome.RETRY_SCHEDULED
                    : DeliveryOutcome.PERMANENT_FAILURE;
        } catch (RuntimeException e) {
            // Acknowledged regardless, the retry is lost.
            log.error("[{}] Error while trying to publish to retry queue: {}", binding, e.getMessage(), e);
            return DeliveryOutcome.RETRY_PUBLISH_FAILED;
        }
    }

    private void acknowledge(Message message, Channel channel) {
        try {
            channel.basicAck(deliveryTag(message), false);
        } catch (IOException | RuntimeException e) {
            log.error("[{}] Could not ack message: {}", binding, e.getMessage(), e);
        }
    }

    private static long deliveryTag(Message message) {
        return message.getMessageProperties().getDeliveryTag();
    }

    public HandlerBinding<T> binding() {
        return binding;
    }
}
