/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.topology;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Queue durability plus the AMQP queue arguments passed to {@code queue.declare}.
 * The argument names are the broker's wire contract and must not change.
 */
public record QueueOptions(boolean durable, Map<String, Object> arguments) {

    public static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
    public static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";
    public static final String MESSAGE_TTL = "x-message-ttl";

    public QueueOptions {
        arguments = arguments == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static QueueOptions durableNoArguments() {
        return new QueueOptions(true, Collections.emptyMap());
    }

    public String deadLetterExchange() { return (String) arguments.get(DEAD_LETTER_EXCHANGE); }

    public String deadLetterRoutingKey() { return (String) arguments.get(DEAD_LETTER_ROUTING_KEY); }

    /** Message TTL in milliseconds, or {@code null} when the queue has none. */
    public Integer messageTtl() { return (Integer) arguments.get(MESSAGE_TTL); }
}
