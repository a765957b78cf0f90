/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.topology;

import com.rmqguard.common.exception.ConfigurationException;
import com.rmqguard.common.model.ReceiverOptions;
import com.rmqguard.common.model.SenderOptions;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the wire-level configuration of the three-queue retry topology.
 *
 * <pre>
 *   exchange ──pattern──▶ queue ──(nack)──▶ exchange.retry ──▶ queue.retry
 *       ▲                                                        │
 *       └──────────────── x-message-ttl expires ─────────────────┘
 *
 *   events_exchange.dlx ──▶ global.dlx   (one per process)
 * </pre>
 *
 * <p>Every method is a pure function of its arguments: nothing is cached between
 * calls, so changed options take effect on the next call.</p>
 */
public final class TopologyFactory {

    public static final String RETRY_SUFFIX = ".retry";
    public static final int DEFAULT_RETRY_TTL_MS = 5000;
    public static final int DEFAULT_PREFETCH_COUNT = 10;
    public static final String GLOBAL_DLX_QUEUE = "global.dlx";
    public static final String GLOBAL_DLX_EXCHANGE = "events_exchange.dlx";

    private TopologyFactory() {}

    /**
     * Publisher configuration. Always durable and wildcard-bound; reply queues are
     * ephemeral (non-durable, auto-delete) unless overridden.
     *
     * @throws ConfigurationException if no routing-key table is supplied
     */
    public static SenderConfig createSenderConfig(SenderOptions options) {
        Map<String, String> routingKeys = options.getRoutingKeys();
        if (routingKeys == null || routingKeys.isEmpty()) {
            throw new ConfigurationException("routingKeys is required in RabbitMQ sender configuration");
        }

        SenderOptions.ReplyQueueOptions reply = options.getReplyQueueOptions();
        boolean replyDurable = reply != null && reply.durable() != null ? reply.durable() : false;
        boolean replyAutoDelete = reply != null && reply.autoDelete() != null ? reply.autoDelete() : true;

        return new SenderConfig(
                Transport.RMQ,
                List.of(options.getUrl()),
                options.getExchange(),
                options.getExchangeType(),
                true,
                true,
                new SenderConfig.ReplyQueue(replyDurable, replyAutoDelete),
                routingKeys);
    }

    public static ReceiverConfig createReceiverConfig(ReceiverOptions options) {
        return createReceiverConfig(options, null);
    }

    /**
     * Main queue configuration. Failed deliveries dead-letter into the retry exchange
     * with the receiver pattern as routing key.
     *
     * @param pattern optional pattern override; the options pattern is used when absent
     */
    public static ReceiverConfig createReceiverConfig(ReceiverOptions options, String pattern) {
        String receiverPattern = orDefault(pattern, options.getPattern());
        String retryExchange = orDefault(options.getRetryExchange(), options.getExchange() + RETRY_SUFFIX);

        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put(QueueOptions.DEAD_LETTER_EXCHANGE, retryExchange);
        arguments.put(QueueOptions.DEAD_LETTER_ROUTING_KEY, receiverPattern);

        return new ReceiverConfig(
                Transport.RMQ,
                List.of(options.getUrl()),
                options.getQueue(),
                new QueueOptions(true, arguments),
                options.getExchange(),
                options.getExchangeType(),
                true,
                receiverPattern,
                positiveOrDefault(options.getPrefetchCount(), DEFAULT_PREFETCH_COUNT),
                options.getNoAck() != null ? options.getNoAck() : false);
    }

    /**
     * Retry queue configuration. Its dead-letter target is the original exchange and
     * pattern, so expiry of {@code x-message-ttl} returns the message to the main flow.
     */
    public static RetryConfig createRetryConfig(ReceiverOptions options) {
        String retryQueue = orDefault(options.getRetryQueue(), options.getQueue() + RETRY_SUFFIX);
        String retryExchange = orDefault(options.getRetryExchange(), options.getExchange() + RETRY_SUFFIX);
        String retryExchangeType = orDefault(options.getRetryExchangeType(), options.getExchangeType());
        int retryTtl = positiveOrDefault(options.getRetryTtl(), DEFAULT_RETRY_TTL_MS);

        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put(QueueOptions.DEAD_LETTER_EXCHANGE, options.getExchange());
        arguments.put(QueueOptions.DEAD_LETTER_ROUTING_KEY, options.getPattern());
        arguments.put(QueueOptions.MESSAGE_TTL, retryTtl);

        return new RetryConfig(
                Transport.RMQ,
                List.of(options.getUrl()),
                retryQueue,
                new QueueOptions(true, arguments),
                retryExchange,
                retryExchangeType,
                true);
    }

    /**
     * Global dead-letter queue configuration. Names default to process-wide constants,
     * not to anything derived from the subscription.
     */
    public static DeadLetterConfig createDLXConfig(ReceiverOptions options) {
        String dlxQueue = orDefault(options.getDlxQueue(), GLOBAL_DLX_QUEUE);
        String dlxExchange = orDefault(options.getDlxExchange(), GLOBAL_DLX_EXCHANGE);
        String dlxExchangeType = orDefault(options.getDlxExchangeType(), options.getExchangeType());

        return new DeadLetterConfig(
                Transport.RMQ,
                List.of(options.getUrl()),
                dlxQueue,
                QueueOptions.durableNoArguments(),
                dlxExchange,
                dlxExchangeType,
                true);
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }

    private static int positiveOrDefault(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }
}
