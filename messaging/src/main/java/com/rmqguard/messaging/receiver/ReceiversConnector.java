/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.receiver;

import com.rmqguard.common.model.ReceiverOptions;
import com.rmqguard.common.model.ReceiversConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Connects several subscriptions one after another. Only the first performs the
 * process-wide setup (interceptor, global dead-letter queue), so the interceptor is
 * installed before any queue starts consuming.
 */
public class ReceiversConnector {

    private static final Logger log = LoggerFactory.getLogger(ReceiversConnector.class);

    private final ReceiverConnector receiverConnector;

    public ReceiversConnector(ReceiverConnector receiverConnector) {
        this.receiverConnector = Objects.requireNonNull(receiverConnector, "receiverConnector must not be null");
    }

    public void connectAll(ReceiversConfig config) {
        connectAll(config.toReceiverOptions());
    }

    public void connectAll(List<ReceiverOptions> receiverOptionsList) {
        for (int i = 0; i < receiverOptionsList.size(); i++) {
            ReceiverOptions options = receiverOptionsList.get(i);
            boolean isFirstSubscription = i == 0;

            receiverConnector.connect(options, !isFirstSubscription);

            log.info("RabbitMQ subscription connected [name: {}, queue: {}, pattern: {}, exchange: {}, exchangeType: {}]",
                    options.getName(), options.getQueue(), options.getPattern(),
                    options.getExchange(), options.getExchangeType());
        }

        log.info("All RabbitMQ subscriptions connected [count: {}]", receiverOptionsList.size());
    }
}
