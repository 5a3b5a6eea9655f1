package com.eainde.amqpretry.connection;

import com.rabbitmq.client.ShutdownSignalException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class DefaultConnectionPolicyTest {

    private final List<Integer> exitStatuses = new ArrayList<>();
    private final BrokerConnectionManager connections = mock(BrokerConnectionManager.class);
    private final ShutdownSignalException signal = new ShutdownSignalException(true, false, null, null);

    @Test
    void defaultPolicyOnlyLogs() {
        DefaultConnectionPolicy policy = new DefaultConnectionPolicy(false, false, exitStatuses::add);

        policy.onConsumerCancelled("ctag-1", connections);
        policy.onUnsolicitedClose(signal);

        verifyNoInteractions(connections);
        assertThat(exitStatuses).isEmpty();
    }

    @Test
    void closeOnCancelClosesTheConnection() {
        DefaultConnectionPolicy policy = new DefaultConnectionPolicy(true, false, exitStatuses::add);

        policy.onConsumerCancelled("ctag-1", connections);

        verify(connections).close();
    }

    @Test
    void exitOnCloseTerminatesWithStatusOne() {
        DefaultConnectionPolicy policy = new DefaultConnectionPolicy(false, true, exitStatuses::add);

        policy.onUnsolicitedClose(signal);

        assertThat(exitStatuses).containsExactly(1);
    }
}
