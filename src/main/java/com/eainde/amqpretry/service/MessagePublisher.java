package com.eainde.amqpretry.service;

import com.eainde.amqpretry.connection.BrokerConnectionManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Publishes JSON messages to an exchange. Delivery is non-mandatory: a message routed to no queue is
 * dropped by the broker, so callers are responsible for their topology.
 */
public class MessagePublisher {

    private static final Logger logger = LoggerFactory.getLogger(MessagePublisher.class);

    private final BrokerConnectionManager connections;
    private final ObjectMapper objectMapper;

    public MessagePublisher(BrokerConnectionManager connections, ObjectMapper objectMapper) {
        this.connections = connections;
        this.objectMapper = objectMapper;
    }

    /**
     * Serializes the message to JSON and publishes it.
     *
     * @param exchangeName The target exchange, or "" for the default exchange.
     * @param routingKey The routing key.
     * @param message Any object Jackson can serialize.
     * @throws MessageSerializationException if the message cannot be serialized.
     * @throws org.springframework.amqp.AmqpException if the broker rejects the publish.
     */
    public void publish(String exchangeName, String routingKey, Object message) {
        publish(exchangeName, routingKey, message, null);
    }

    public void publish(String exchangeName, String routingKey, Object message, Map<String, Object> headers) {
        publishRaw(exchangeName, routingKey, serialize(message), headers);
    }

    /**
     * Publishes an already encoded JSON body as is.
     */
    public void publishRaw(String exchangeName, String routingKey, byte[] body, Map<String, Object> headers) {
        MessageProperties properties = new MessageProperties();
        properties.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        properties.setContentEncoding(StandardCharsets.UTF_8.name());
        if (headers != null) {
            headers.forEach(properties::setHeader);
        }
        connections.template().send(exchangeName, routingKey, new Message(body, properties));
        logger.debug("Published {} bytes to exchange '{}' with routing key '{}'.", body.length, exchangeName, routingKey);
    }

    private byte[] serialize(Object message) {
        try {
            return objectMapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            String type = message != null ? message.getClass().getName() : "null";
            throw new MessageSerializationException("Failed to marshal JSON data for RabbitMQ message of type " + type, e);
        }
    }
}
