/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.idempotency;

import com.rmqguard.common.exception.StoreUnavailableException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link DeduplicationStore} over Redis strings. Any client or connection failure
 * is reported as {@link StoreUnavailableException}.
 */
public class RedisDeduplicationStore implements DeduplicationStore {

    private final StringRedisTemplate redisTemplate;

    public RedisDeduplicationStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate must not be null");
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Redis GET failed for key " + key, e);
        }
    }

    /** {@code SET key value EX ttl NX}. */
    @Override
    public boolean claim(String key, String value, long ttlSeconds) {
        try {
            Boolean wasSet = redisTemplate.opsForValue().setIfAbsent(key, value, Duration.ofSeconds(ttlSeconds));
            return Boolean.TRUE.equals(wasSet);
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Redis SET NX failed for key " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Redis DEL failed for key " + key, e);
        }
    }
}
