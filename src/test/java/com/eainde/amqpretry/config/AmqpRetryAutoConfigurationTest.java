package com.eainde.amqpretry.config;

import com.eainde.amqpretry.ReliableMessagingClient;
import com.eainde.amqpretry.connection.BrokerConnectionManager;
import com.eainde.amqpretry.connection.ConnectionPolicy;
import com.eainde.amqpretry.connection.DefaultConnectionPolicy;
import com.eainde.amqpretry.model.BackoffLadder;
import com.eainde.amqpretry.topology.RetryTopologyManager;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class AmqpRetryAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(AmqpRetryAutoConfiguration.class));

    @Test
    void disabledByDefault() {
        contextRunner.run(context -> assertThat(context).doesNotHaveBean(ReliableMessagingClient.class));
    }

    @Test
    void enabledWiresTheClientWithoutConnecting() {
        contextRunner.withPropertyValues("amqp.retry.enabled=true").run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(ReliableMessagingClient.class);
            assertThat(context).hasSingleBean(RetryTopologyManager.class);
            assertThat(context.getBean(BrokerConnectionManager.class).isInitialized()).isFalse();
            assertThat(context.getBean(BrokerConnectionManager.class).prefetchCount()).isEqualTo(20);
            assertThat(context.getBean(BackoffLadder.class).tiers()).containsExactly(1, 5, 10, 30, 60, 300, 600);
        });
    }

    @Test
    void propertiesShapeTheTopology() {
        contextRunner.withPropertyValues(
                "amqp.retry.enabled=true",
                "amqp.retry.ready-queue=orders.retry.ready",
                "amqp.retry.retry-exchange=orders.retry",
                "amqp.retry.ladder=2,4",
                "amqp.retry.delay-queue-template=orders.waiting-%d",
                "amqp.retry.prefetch-count=5",
                "amqp.retry.close-on-cancel=true").run(context -> {
            RetryTopologyManager topology = context.getBean(RetryTopologyManager.class);
            assertThat(topology.readyQueue()).isEqualTo("orders.retry.ready");
            assertThat(topology.retryExchange()).isEqualTo("orders.retry");
            assertThat(topology.ladder().queueName(1)).isEqualTo("orders.waiting-4");
            assertThat(context.getBean(BrokerConnectionManager.class).prefetchCount()).isEqualTo(5);
            DefaultConnectionPolicy policy = context.getBean(DefaultConnectionPolicy.class);
            assertThat(policy.isCloseOnCancel()).isTrue();
            assertThat(policy.isExitOnClose()).isFalse();
        });
    }

    @Test
    void customConnectionPolicyReplacesTheDefault() {
        contextRunner.withPropertyValues("amqp.retry.enabled=true")
                .withUserConfiguration(CustomPolicyConfiguration.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(ConnectionPolicy.class);
                    assertThat(context).doesNotHaveBean(DefaultConnectionPolicy.class);
                });
    }

    @Test
    void urlPropertyWinsOverEnvironment() {
        AmqpRetryProperties properties = new AmqpRetryProperties();
        properties.setUrl("amqp://configured");
        MockEnvironment environment = new MockEnvironment()
                .withProperty("RABBITMQ_URL", "amqp://rabbitmq");

        assertThat(AmqpRetryAutoConfiguration.resolveUrl(properties, environment)).isEqualTo("amqp://configured");
    }

    @Test
    void urlFallsBackToRabbitmqThenCloudamqpVariable() {
        AmqpRetryProperties properties = new AmqpRetryProperties();

        assertThat(AmqpRetryAutoConfiguration.resolveUrl(properties, new MockEnvironment()
                .withProperty("RABBITMQ_URL", "amqp://rabbitmq")
                .withProperty("CLOUDAMQP_URL", "amqp://cloud"))).isEqualTo("amqp://rabbitmq");
        assertThat(AmqpRetryAutoConfiguration.resolveUrl(properties, new MockEnvironment()
                .withProperty("CLOUDAMQP_URL", "amqp://cloud"))).isEqualTo("amqp://cloud");
        assertThat(AmqpRetryAutoConfiguration.resolveUrl(properties, new MockEnvironment())).isNull();
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomPolicyConfiguration {

        @Bean
        ConnectionPolicy connectionPolicy() {
            return mock(ConnectionPolicy.class);
        }
    }
}
