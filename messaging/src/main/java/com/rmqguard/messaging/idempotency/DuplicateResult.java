/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.idempotency;

/**
 * Returned in place of the handler result when a message was recognised as a duplicate.
 * The delivery has already been acknowledged by the time this is returned.
 */
public record DuplicateResult(boolean duplicate, String correlationId) {

    public static DuplicateResult of(String correlationId) {
        return new DuplicateResult(true, correlationId);
    }
}
