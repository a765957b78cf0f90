/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.idempotency;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Classifies inbound payloads. A payload takes part in deduplication only when it
 * is a JSON object whose {@code correlationId} is a string.
 */
public final class MessageDecoder {

    private MessageDecoder() {}

    public static DecodedMessage decode(Object payload) {
        if (payload instanceof Map<?, ?> map
                && map.get(CorrelationEnvelope.CORRELATION_ID) instanceof String correlationId) {
            return new DecodedMessage.Correlated(correlationId,
                    map.get(CorrelationEnvelope.CORRELATION_TIMESTAMP), payload);
        }
        if (payload instanceof JsonNode node && node.isObject()
                && node.path(CorrelationEnvelope.CORRELATION_ID).isTextual()) {
            JsonNode ts = node.get(CorrelationEnvelope.CORRELATION_TIMESTAMP);
            return new DecodedMessage.Correlated(node.get(CorrelationEnvelope.CORRELATION_ID).asText(),
                    ts == null || ts.isNull() ? null : ts.asText(), payload);
        }
        return new DecodedMessage.Bare(payload);
    }
}
