/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.receiver;

import com.rmqguard.common.model.ReceiverOptions;
import com.rmqguard.messaging.core.BrokerHost;
import com.rmqguard.messaging.core.EndpointRegistry;
import com.rmqguard.messaging.core.MessageInterceptor;
import com.rmqguard.messaging.topology.DeadLetterConfig;
import com.rmqguard.messaging.topology.EndpointConfig;
import com.rmqguard.messaging.topology.ReceiverConfig;
import com.rmqguard.messaging.topology.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReceiverConnector")
class ReceiverConnectorTest {

    @Mock private BrokerHost host;
    @Mock private MessageInterceptor interceptor;

    private EndpointRegistry registry;
    private ReceiverConnector connector;

    @BeforeEach
    void setUp() {
        registry = new EndpointRegistry();
        connector = new ReceiverConnector(host, interceptor, registry);
    }

    private static ReceiverOptions options(String queue, String pattern) {
        return ReceiverOptions.builder()
                .url("amqp://localhost")
                .exchange("events_exchange")
                .exchangeType("topic")
                .queue(queue)
                .pattern(pattern)
                .build();
    }

    @Test
    @DisplayName("global setup connects main, retry and dead-letter queues and installs the interceptor")
    void globalSetup() {
        connector.connect(options("orders", "orders.*"), false);

        ArgumentCaptor<EndpointConfig> endpoints = ArgumentCaptor.forClass(EndpointConfig.class);
        verify(host, times(3)).connectEndpoint(endpoints.capture());
        verify(host).useGlobalInterceptor(interceptor);

        assertThat(endpoints.getAllValues())
                .extracting(EndpointConfig::queue)
                .containsExactly("orders", "orders.retry", "global.dlx");
        assertThat(endpoints.getAllValues().get(0)).isInstanceOf(ReceiverConfig.class);
        assertThat(endpoints.getAllValues().get(1)).isInstanceOf(RetryConfig.class);
        assertThat(endpoints.getAllValues().get(2)).isInstanceOf(DeadLetterConfig.class);
        assertThat(registry.isRegistered("global.dlx")).isTrue();
    }

    @Test
    @DisplayName("skipping global setup connects only main and retry")
    void skipGlobalSetup() {
        connector.connect(options("payments", "payments.*"), true);

        verify(host, times(2)).connectEndpoint(any());
        verify(host, never()).useGlobalInterceptor(any());
        assertThat(registry.isRegistered("global.dlx")).isFalse();
        assertThat(registry.isRegistered("payments.retry")).isTrue();
    }

    @Test
    @DisplayName("an already registered dead-letter queue is not connected again")
    void dlxAlreadyRegistered() {
        connector.connect(options("orders", "orders.*"), false);
        connector.connect(options("payments", "payments.*"), false);

        ArgumentCaptor<EndpointConfig> endpoints = ArgumentCaptor.forClass(EndpointConfig.class);
        verify(host, times(5)).connectEndpoint(endpoints.capture());
        assertThat(endpoints.getAllValues())
                .filteredOn(e -> e instanceof DeadLetterConfig)
                .hasSize(1);
    }
}
