/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.topology;

import java.util.List;

/**
 * Process-wide dead-letter queue. Declared once and shared by every subscription.
 */
public record DeadLetterConfig(
        Transport transport,
        List<String> urls,
        String queue,
        QueueOptions queueOptions,
        String exchange,
        String exchangeType,
        boolean wildcards
) implements EndpointConfig {

    public DeadLetterConfig {
        urls = List.copyOf(urls);
    }

    @Override
    public EndpointRole role() { return EndpointRole.DEAD_LETTER; }

    @Override
    public String bindingKey() { return "topic".equalsIgnoreCase(exchangeType) ? "#" : ""; }
}
