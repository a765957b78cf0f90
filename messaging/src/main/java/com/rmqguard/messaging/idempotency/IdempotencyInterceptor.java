/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.idempotency;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import com.rmqguard.messaging.core.CallHandler;
import com.rmqguard.messaging.core.CallKind;
import com.rmqguard.messaging.core.DeliveryContext;
import com.rmqguard.messaging.core.InvocationContext;
import com.rmqguard.messaging.core.MessageInterceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Skips broker deliveries whose correlation id was already processed.
 *
 * <pre>
 *   not RPC / no correlationId ──▶ handler
 *   store.get(idempotency:&lt;id&gt;)
 *     ├─ error    ──▶ log, handler                       (fail-open)
 *     ├─ present  ──▶ basicAck, DuplicateResult          (handler not called)
 *     └─ absent   ──▶ store.claim(ts, 24h)
 *                        ├─ lost  ──▶ basicAck, DuplicateResult
 *                        └─ won   ──▶ handler
 *                                      ├─ ok    ──▶ record expires on its own
 *                                      └─ error ──▶ store.delete, rethrow
 * </pre>
 *
 * <p>The marker is claimed before the handler runs, so a redelivery arriving while the
 * first copy is still in flight is treated as a duplicate. When two copies both read
 * "absent", only the one whose set-if-absent wins runs the handler. No further locking
 * is done: the store's per-key claim is the only synchronization point.</p>
 */
public class IdempotencyInterceptor implements MessageInterceptor {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyInterceptor.class);

    public static final String KEY_PREFIX = "idempotency:";
    public static final long IDEMPOTENCY_TTL_SECONDS = 24 * 60 * 60;
    private static final String UNKNOWN_ID = "unknown";

    private final DeduplicationStore store;

    public IdempotencyInterceptor(DeduplicationStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    public static String keyFor(String correlationId) {
        return KEY_PREFIX + correlationId;
    }

    @Override
    public Object intercept(InvocationContext context, CallHandler next) throws Exception {
        if (context.getKind() != CallKind.RPC) {
            return next.handle();
        }
        if (!(MessageDecoder.decode(context.getPayload()) instanceof DecodedMessage.Correlated message)) {
            return next.handle();
        }

        String correlationId = message.correlationId();
        String key = keyFor(correlationId);

        boolean duplicate;
        try {
            Optional<String> seen = store.get(key);
            duplicate = seen.isPresent()
                    || !store.claim(key, message.timestampValue(), IDEMPOTENCY_TTL_SECONDS);
        } catch (RuntimeException e) {
            log.error("Failed to check idempotency [correlationId={}]: {}",
                    correlationId != null ? correlationId : UNKNOWN_ID, e.getMessage());
            return next.handle();
        }

        if (duplicate) {
            log.warn("Duplicate message detected and skipped [correlationId={}, correlationTimestamp={}]",
                    correlationId, message.correlationTimestamp());
            acknowledge(context, correlationId);
            return DuplicateResult.of(correlationId);
        }

        Object result;
        try {
            result = next.handle();
        } catch (Exception e) {
            release(key, correlationId);
            throw e;
        }
        log.info("Message processed successfully [correlationId={}]", correlationId);
        return result;
    }

    /** Removes the marker so a retried delivery of a failed message is processed again. */
    private void release(String key, String correlationId) {
        try {
            store.delete(key);
        } catch (RuntimeException e) {
            log.error("Failed to delete idempotency key [correlationId={}]: {}", correlationId, e.getMessage());
        }
    }

    /** Acks a skipped duplicate so it does not stay unacked on the broker. Never throws. */
    private void acknowledge(InvocationContext context, String correlationId) {
        try {
            Optional<DeliveryContext> delivery = context.getDeliveryContext();
            if (delivery.isEmpty()) {
                log.warn("Cannot acknowledge duplicate message, no delivery context [correlationId={}]",
                        correlationId);
                return;
            }
            Channel channel = delivery.get().getChannel();
            Delivery message = delivery.get().getMessage();
            if (channel == null || message == null || message.getEnvelope() == null) {
                log.warn("Cannot acknowledge duplicate message, channel or message unavailable [correlationId={}]",
                        correlationId);
                return;
            }
            channel.basicAck(message.getEnvelope().getDeliveryTag(), false);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to acknowledge duplicate message [correlationId={}]: {}",
                    correlationId, e.getMessage());
        }
    }
}
