package com.eainde.amqpretry.connection;

import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.AmqpTemplate;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.connection.ConnectionListener;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Owns the single broker connection of the process together with the admin and template built on it.
 * Everything is created on first use, exactly once, even when several threads get there at the same time.
 * Channels are cached by the underlying {@link CachingConnectionFactory}.
 */
@Slf4j
public class BrokerConnectionManager implements DisposableBean {

    private final Supplier<CachingConnectionFactory> factorySupplier;
    private final int prefetchCount;
    private final ConnectionPolicy policy;
    private final Object lock = new Object();
    private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();

    private volatile Resources resources;
    private volatile boolean closed;

    private record Resources(CachingConnectionFactory connectionFactory, RabbitAdmin admin, RabbitTemplate template) {}

    public BrokerConnectionManager(String url, int prefetchCount, ConnectionPolicy policy) {
        this(() -> createConnectionFactory(url), prefetchCount, policy);
    }

    public BrokerConnectionManager(Supplier<CachingConnectionFactory> factorySupplier, int prefetchCount,
                                   ConnectionPolicy policy) {
        if (prefetchCount <= 0) {
            throw new IllegalArgumentException("Prefetch count must be positive, got " + prefetchCount);
        }
        this.factorySupplier = factorySupplier;
        this.prefetchCount = prefetchCount;
        this.policy = policy;
    }

    public ConnectionFactory connectionFactory() {
        return resources().connectionFactory();
    }

    public AmqpAdmin admin() {
        return resources().admin();
    }

    public AmqpTemplate template() {
        return resources().template();
    }

    /**
     * The quality-of-service limit applied to every consumer: the broker never pushes more than this many
     * unacknowledged deliveries to one consumer.
     */
    public int prefetchCount() {
        return prefetchCount;
    }

    public boolean isInitialized() {
        return resources != null;
    }

    public void onConsumerCancelled(String consumerTag) {
        policy.onConsumerCancelled(consumerTag, this);
    }

    /**
     * Stops the registered consumers, then closes the connection. Further use of this manager fails.
     * Safe to call more than once.
     */
    public void close() {
        Resources current;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            current = resources;
        }
        // Consumers are stopped before the factory is destroyed.
        for (Runnable listener : closeListeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.error("Error while stopping consumers before closing the AMQP connection: {}", e.getMessage(), e);
            }
        }
        if (current != null) {
            log.info("Closing AMQP connection.");
            current.connectionFactory().destroy();
        }
    }

    /**
     * Registers an action run by {@link #close()} before the connection goes away.
     */
    public void addCloseListener(Runnable listener) {
        closeListeners.add(listener);
    }

    @Override
    public void destroy() {
        close();
    }

    private Resources resources() {
        Resources current = resources;
        if (current == null) {
            synchronized (lock) {
                current = resources;
                if (current == null) {
                    if (closed) {
                        throw new IllegalStateException("AMQP connection manager has been closed");
                    }
                    current = open();
                    resources = current;
                }
            }
        }
        if (closed) {
            throw new IllegalStateException("AMQP connection manager has been closed");
        }
        return current;
    }

    private Resources open() {
        CachingConnectionFactory factory = factorySupplier.get();
        factory.addConnectionListener(new ShutdownListener());

        try {
            factory.createConnection();
        } catch (AmqpException e) {
            factory.destroy();
            throw new BrokerSetupException("Failed to connect to RabbitMQ", e);
        }

        return new Resources(factory, new RabbitAdmin(factory), new RabbitTemplate(factory));
    }

    void handleShutdown(ShutdownSignalException signal) {
        if (signal.isInitiatedByApplication()) {
            log.debug("AMQP connection closed by the application.");
            return;
        }
        log.info("AMQP received close message: {}", signal.getMessage());
        policy.onUnsolicitedClose(signal);
    }

    class ShutdownListener implements ConnectionListener {

        @Override
        public void onCreate(Connection connection) {
            log.debug("AMQP connection established: {}", connection);
        }

        @Override
        public void onShutDown(ShutdownSignalException signal) {
            handleShutdown(signal);
        }
    }

    static CachingConnectionFactory createConnectionFactory(String url) {
        CachingConnectionFactory factory = new CachingConnectionFactory();
        if (StringUtils.hasText(url)) {
            factory.setUri(url);
        } else {
            log.warn("No AMQP URL configured, using the client defaults ({}:{}).", factory.getHost(), factory.getPort());
        }
        return factory;
    }
}
