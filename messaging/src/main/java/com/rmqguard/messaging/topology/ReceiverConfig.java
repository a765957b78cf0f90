/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.topology;

import java.util.List;

/**
 * Main queue of a subscription. Rejected or failed deliveries dead-letter into the retry exchange.
 */
public record ReceiverConfig(
        Transport transport,
        List<String> urls,
        String queue,
        QueueOptions queueOptions,
        String exchange,
        String exchangeType,
        boolean wildcards,
        String pattern,
        int prefetchCount,
        boolean noAck
) implements EndpointConfig {

    public ReceiverConfig {
        urls = List.copyOf(urls);
    }

    @Override
    public EndpointRole role() { return EndpointRole.RECEIVER; }

    @Override
    public String bindingKey() { return pattern; }
}
