/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.topology;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publisher side of the topology: target exchange, reply queue settings and the
 * routing-key table every send is resolved through.
 */
public record SenderConfig(
        Transport transport,
        List<String> urls,
        String exchange,
        String exchangeType,
        boolean wildcards,
        boolean durable,
        ReplyQueue replyQueueOptions,
        Map<String, String> routingKeys
) {

    public SenderConfig {
        urls = List.copyOf(urls);
        routingKeys = Collections.unmodifiableMap(new LinkedHashMap<>(routingKeys));
    }

    public record ReplyQueue(boolean durable, boolean autoDelete) {}
}
