/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.receiver;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.rmqguard.common.model.ReceiverSubscription;
import com.rmqguard.common.model.ReceiversConfig;
import com.rmqguard.messaging.core.BrokerHost;
import com.rmqguard.messaging.core.EndpointRegistry;
import com.rmqguard.messaging.core.MessageInterceptor;
import com.rmqguard.messaging.topology.DeadLetterConfig;
import com.rmqguard.messaging.topology.EndpointConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReceiversConnector")
class ReceiversConnectorTest {

    @Mock private BrokerHost host;
    @Mock private MessageInterceptor interceptor;

    private ReceiversConnector connector;
    private Logger logger;
    private ListAppender<ILoggingEvent> logAppender;

    @BeforeEach
    void setUp() {
        connector = new ReceiversConnector(new ReceiverConnector(host, interceptor, new EndpointRegistry()));
        logger = (Logger) LoggerFactory.getLogger(ReceiversConnector.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    private static ReceiversConfig config(ReceiverSubscription... subscriptions) {
        ReceiversConfig config = new ReceiversConfig();
        config.setUrl("amqp://localhost");
        config.setExchange("events_exchange");
        config.setExchangeType("topic");
        config.setSubscriptions(List.of(subscriptions));
        return config;
    }

    @Test
    @DisplayName("interceptor and dead-letter queue are set up once across all subscriptions")
    void globalSetupOnce() {
        connector.connectAll(config(
                new ReceiverSubscription("orders", "orders", "orders.*"),
                new ReceiverSubscription("payments", "payments", "payments.*"),
                new ReceiverSubscription("refunds", "refunds", "refunds.*")));

        ArgumentCaptor<EndpointConfig> endpoints = ArgumentCaptor.forClass(EndpointConfig.class);
        verify(host, times(7)).connectEndpoint(endpoints.capture());
        verify(host, times(1)).useGlobalInterceptor(interceptor);
        assertThat(endpoints.getAllValues()).filteredOn(e -> e instanceof DeadLetterConfig).hasSize(1);
        assertThat(endpoints.getAllValues()).extracting(EndpointConfig::queue)
                .containsExactly("orders", "orders.retry", "global.dlx",
                        "payments", "payments.retry", "refunds", "refunds.retry");
    }

    @Test
    @DisplayName("logs each subscription and a final count")
    void logsProgress() {
        connector.connectAll(config(
                new ReceiverSubscription("orders", "orders", "orders.*"),
                new ReceiverSubscription("payments", "payments", "payments.*")));

        assertThat(logAppender.list).extracting(ILoggingEvent::getFormattedMessage)
                .anyMatch(m -> m.startsWith("RabbitMQ subscription connected [name: payments"))
                .contains("All RabbitMQ subscriptions connected [count: 2]");
    }

    @Test
    @DisplayName("an empty list connects nothing")
    void empty() {
        connector.connectAll(config());

        verify(host, never()).connectEndpoint(any());
        verify(host, never()).useGlobalInterceptor(any());
        assertThat(logAppender.list).extracting(ILoggingEvent::getFormattedMessage)
                .contains("All RabbitMQ subscriptions connected [count: 0]");
    }
}
