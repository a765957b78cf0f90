/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.idempotency;

import com.rmqguard.common.exception.StoreUnavailableException;

import java.util.Optional;

/**
 * Key-value store holding "already seen" markers. Per-key operations are assumed
 * atomic at the store; no ordering is required across keys.
 *
 * <p>Every method throws {@link StoreUnavailableException} when the store cannot be used.</p>
 */
public interface DeduplicationStore {

    Optional<String> get(String key);

    /**
     * Writes {@code value} with a TTL only if {@code key} holds nothing yet.
     *
     * @return {@code true} if this call wrote the key, {@code false} if it was already held
     */
    boolean claim(String key, String value, long ttlSeconds);

    void delete(String key);
}
