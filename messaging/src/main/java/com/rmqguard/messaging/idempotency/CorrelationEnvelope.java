/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.idempotency;

import com.rmqguard.common.util.JsonUtil;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Adds {@code correlationId} and {@code correlationTimestamp} to outbound request payloads.
 * Object payloads get the fields merged in; anything else is wrapped under {@code data}.
 */
public final class CorrelationEnvelope {

    public static final String CORRELATION_ID = "correlationId";
    public static final String CORRELATION_TIMESTAMP = "correlationTimestamp";
    public static final String DATA = "data";

    private CorrelationEnvelope() {}

    public static Map<String, Object> wrap(Object data) {
        return wrap(data, UUID.randomUUID().toString(), System.currentTimeMillis());
    }

    public static Map<String, Object> wrap(Object data, String correlationId, long correlationTimestamp) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        Object tree = data == null ? null : JsonUtil.mapper().convertValue(data, Object.class);
        if (tree instanceof Map<?, ?> fields) {
            fields.forEach((k, v) -> envelope.put(String.valueOf(k), v));
        } else {
            envelope.put(DATA, tree);
        }
        envelope.put(CORRELATION_ID, correlationId);
        envelope.put(CORRELATION_TIMESTAMP, correlationTimestamp);
        return envelope;
    }
}
