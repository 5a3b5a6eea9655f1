package com.eainde.amqpretry.config;

import com.eainde.amqpretry.ExceptionRetryabilityChecker;
import com.eainde.amqpretry.ReliableMessagingClient;
import com.eainde.amqpretry.RetryOrchestrator;
import com.eainde.amqpretry.connection.BrokerConnectionManager;
import com.eainde.amqpretry.connection.ConnectionPolicy;
import com.eainde.amqpretry.connection.DefaultConnectionPolicy;
import com.eainde.amqpretry.connection.ProcessTerminator;
import com.eainde.amqpretry.consumer.ConsumerContainerFactory;
import com.eainde.amqpretry.consumer.MessageDispatcher;
import com.eainde.amqpretry.model.BackoffLadder;
import com.eainde.amqpretry.service.MessagePublisher;
import com.eainde.amqpretry.topology.RetryTopologyManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Wires the retry library when {@code amqp.retry.enabled=true}. Every bean backs off when the application
 * defines its own, so for instance a custom {@link ConnectionPolicy} replaces the default one.
 * Nothing touches the broker until the first call on {@link ReliableMessagingClient}.
 */
@AutoConfiguration
@ConditionalOnProperty(name = "amqp.retry.enabled", havingValue = "true")
@EnableConfigurationProperties(AmqpRetryProperties.class)
public class AmqpRetryAutoConfiguration {

    static final String URL_VARIABLE = "RABBITMQ_URL";
    static final String FALLBACK_URL_VARIABLE = "CLOUDAMQP_URL";

    @Bean
    @ConditionalOnMissingBean
    public BackoffLadder backoffLadder(AmqpRetryProperties properties) {
        return properties.backoffLadder();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessTerminator processTerminator() {
        return ProcessTerminator.SYSTEM_EXIT;
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectionPolicy connectionPolicy(AmqpRetryProperties properties, ProcessTerminator processTerminator) {
        return new DefaultConnectionPolicy(properties.isCloseOnCancel(), properties.isExitOnClose(), processTerminator);
    }

    /**
     * The broker URL is taken from {@code amqp.retry.url}, then from the RABBITMQ_URL variable, then from the
     * CLOUDAMQP_URL variable.
     */
    @Bean
    @ConditionalOnMissingBean
    public BrokerConnectionManager brokerConnectionManager(AmqpRetryProperties properties,
                                                           ConnectionPolicy connectionPolicy,
                                                           Environment environment) {
        return new BrokerConnectionManager(resolveUrl(properties, environment), properties.getPrefetchCount(), connectionPolicy);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryTopologyManager retryTopologyManager(BrokerConnectionManager connections,
                                                     BackoffLadder backoffLadder,
                                                     AmqpRetryProperties properties) {
        return new RetryTopologyManager(connections, backoffLadder,
                properties.getReadyQueue(), properties.getRetryExchange(), properties.getRetryRoutingKey());
    }

    @Bean
    @ConditionalOnMissingBean
    public MessagePublisher messagePublisher(BrokerConnectionManager connections, ObjectProvider<ObjectMapper> objectMapper) {
        return new MessagePublisher(connections, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ExceptionRetryabilityChecker exceptionRetryabilityChecker(AmqpRetryProperties properties) {
        return new ExceptionRetryabilityChecker(properties.getNonRetryableExceptions(), properties.getRetryableExceptions());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryOrchestrator retryOrchestrator(MessagePublisher publisher, BackoffLadder backoffLadder) {
        return new RetryOrchestrator(publisher, backoffLadder);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConsumerContainerFactory consumerContainerFactory(BrokerConnectionManager connections) {
        return new ConsumerContainerFactory(connections);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageDispatcher messageDispatcher(RetryTopologyManager topology,
                                               BrokerConnectionManager connections,
                                               MessagePublisher publisher,
                                               RetryOrchestrator retryOrchestrator,
                                               ExceptionRetryabilityChecker retryabilityChecker,
                                               ObjectProvider<ObjectMapper> objectMapper,
                                               ConsumerContainerFactory containerFactory) {
        return new MessageDispatcher(topology, connections, publisher, retryOrchestrator, retryabilityChecker,
                objectMapper.getIfAvailable(ObjectMapper::new), containerFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReliableMessagingClient reliableMessagingClient(RetryTopologyManager topology,
                                                           MessagePublisher publisher,
                                                           MessageDispatcher dispatcher) {
        return new ReliableMessagingClient(topology, publisher, dispatcher);
    }

    static String resolveUrl(AmqpRetryProperties properties, Environment environment) {
        if (StringUtils.hasText(properties.getUrl())) {
            return properties.getUrl();
        }
        String url = environment.getProperty(URL_VARIABLE);
        if (StringUtils.hasText(url)) {
            return url;
        }
        return environment.getProperty(FALLBACK_URL_VARIABLE);
    }
}
