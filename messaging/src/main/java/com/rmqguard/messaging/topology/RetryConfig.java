/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.topology;

import java.util.List;

/**
 * Delay queue of a subscription. Messages sit here for the queue TTL and are then
 * dead-lettered back to the original exchange with the original pattern.
 */
public record RetryConfig(
        Transport transport,
        List<String> urls,
        String queue,
        QueueOptions queueOptions,
        String exchange,
        String exchangeType,
        boolean wildcards
) implements EndpointConfig {

    public RetryConfig {
        urls = List.copyOf(urls);
    }

    @Override
    public EndpointRole role() { return EndpointRole.RETRY; }

    /** Failed messages keep the routing key they were dead-lettered with: the receiver pattern. */
    @Override
    public String bindingKey() { return queueOptions.deadLetterRoutingKey(); }
}
