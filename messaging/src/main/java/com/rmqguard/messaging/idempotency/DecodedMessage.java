/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.idempotency;

/**
 * An inbound payload after shape inspection: either it carries a correlation
 * identifier and takes part in deduplication, or it does not.
 */
public sealed interface DecodedMessage permits DecodedMessage.Correlated, DecodedMessage.Bare {

    Object payload();

    /**
     * @param correlationTimestamp raw timestamp value from the payload, {@code null} if absent
     */
    record Correlated(String correlationId, Object correlationTimestamp, Object payload) implements DecodedMessage {

        /** Timestamp as stored in the deduplication record. */
        public String timestampValue() {
            return correlationTimestamp != null ? String.valueOf(correlationTimestamp) : "unknown";
        }
    }

    record Bare(Object payload) implements DecodedMessage {}
}
