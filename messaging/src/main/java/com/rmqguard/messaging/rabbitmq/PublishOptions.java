/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.rabbitmq;

import java.util.Map;

/**
 * Per-message AMQP properties for outbound messages.
 *
 * @param headers    application headers, may be {@code null}
 * @param priority   message priority, {@code null} for none
 * @param expiration per-message TTL in milliseconds as a string, {@code null} for none
 */
public record PublishOptions(Map<String, Object> headers, Integer priority, String expiration) {

    private static final PublishOptions NONE = new PublishOptions(null, null, null);

    public static PublishOptions none() { return NONE; }
}
