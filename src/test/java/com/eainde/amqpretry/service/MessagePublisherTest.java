package com.eainde.amqpretry.service;

import com.eainde.amqpretry.connection.BrokerConnectionManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpTemplate;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class MessagePublisherTest {

    private final BrokerConnectionManager connections = mock(BrokerConnectionManager.class);
    private final AmqpTemplate template = mock(AmqpTemplate.class);
    private MessagePublisher publisher;

    record OrderCreated(int id, String customer) {}

    @BeforeEach
    void setUp() {
        when(connections.template()).thenReturn(template);
        publisher = new MessagePublisher(connections, new ObjectMapper());
    }

    @Test
    void publishesJsonWithContentType() {
        publisher.publish("orders", "orders.created", new OrderCreated(42, "ada"));

        ArgumentCaptor<Message> sent = ArgumentCaptor.forClass(Message.class);
        verify(template).send(eq("orders"), eq("orders.created"), sent.capture());
        Message message = sent.getValue();
        assertThat(new String(message.getBody(), StandardCharsets.UTF_8)).isEqualTo("{\"id\":42,\"customer\":\"ada\"}");
        assertThat(message.getMessageProperties().getContentType()).isEqualTo(MessageProperties.CONTENT_TYPE_JSON);
        assertThat(message.getMessageProperties().getHeaders()).isEmpty();
    }

    @Test
    void publishesHeadersAlongside() {
        publisher.publish("orders", "orders.created", Map.of("id", 1), Map.of("_retryNumber", "2"));

        ArgumentCaptor<Message> sent = ArgumentCaptor.forClass(Message.class);
        verify(template).send(eq("orders"), eq("orders.created"), sent.capture());
        assertThat(sent.getValue().getMessageProperties().getHeaders()).containsEntry("_retryNumber", "2");
    }

    @Test
    void serializationFailureIsAProgrammingError() {
        assertThatThrownBy(() -> publisher.publish("orders", "orders.created", new Object()))
                .isInstanceOf(MessageSerializationException.class)
                .hasMessageContaining("java.lang.Object");
        verifyNoInteractions(template);
    }

    @Test
    void brokerErrorsPropagateUnchanged() {
        AmqpException closed = new AmqpException("channel closed");
        doThrow(closed).when(template).send(anyString(), anyString(), any(Message.class));

        assertThatThrownBy(() -> publisher.publish("orders", "orders.created", Map.of("id", 1)))
                .isSameAs(closed);
    }
}
