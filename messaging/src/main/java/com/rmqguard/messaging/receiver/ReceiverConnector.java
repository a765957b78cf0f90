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
import com.rmqguard.messaging.topology.TopologyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Connects one subscription to the broker host: its main queue, its retry queue and,
 * on the global setup call, the shared dead-letter queue and the idempotency interceptor.
 *
 * <p>Not thread-safe; call sequentially during startup.</p>
 */
public class ReceiverConnector {

    private static final Logger log = LoggerFactory.getLogger(ReceiverConnector.class);

    private final BrokerHost host;
    private final MessageInterceptor idempotencyInterceptor;
    private final EndpointRegistry registry;

    public ReceiverConnector(BrokerHost host, MessageInterceptor idempotencyInterceptor, EndpointRegistry registry) {
        this.host = Objects.requireNonNull(host, "host must not be null");
        this.idempotencyInterceptor = Objects.requireNonNull(idempotencyInterceptor, "idempotencyInterceptor must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * @param skipGlobalSetup {@code true} for every call after the first one in this process;
     *                        the interceptor and the global dead-letter queue are then left alone
     */
    public void connect(ReceiverOptions options, boolean skipGlobalSetup) {
        ReceiverConfig receiverConfig = TopologyFactory.createReceiverConfig(options);
        RetryConfig retryConfig = TopologyFactory.createRetryConfig(options);
        DeadLetterConfig dlxConfig = TopologyFactory.createDLXConfig(options);

        if (!skipGlobalSetup) {
            host.useGlobalInterceptor(idempotencyInterceptor);
        }

        connectEndpoint(receiverConfig);
        connectEndpoint(retryConfig);

        if (!skipGlobalSetup) {
            if (registry.isRegistered(dlxConfig.queue())) {
                log.debug("Dead-letter queue '{}' already connected", dlxConfig.queue());
            } else {
                connectEndpoint(dlxConfig);
            }
        }

        log.info("RabbitMQ receiver connected [queue: {}, pattern: {}, exchange: {}, exchangeType: {}]",
                options.getQueue(), options.getPattern(), options.getExchange(), options.getExchangeType());
    }

    private void connectEndpoint(EndpointConfig endpoint) {
        host.connectEndpoint(endpoint);
        registry.register(endpoint);
    }

    public EndpointRegistry getRegistry() { return registry; }
}
