/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.common.model;

import com.rmqguard.common.exception.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for the outbound publisher: where to connect, which exchange to publish to,
 * and the routing-key table mapping logical keys to broker routing keys.
 *
 * <p>The routing-key table is not validated here; the topology factory rejects a
 * missing table when the sender configuration is derived.</p>
 */
public final class SenderOptions {

    private final String url;
    private final String exchange;
    private final String exchangeType;
    private final ReplyQueueOptions replyQueueOptions;
    private final Map<String, String> routingKeys;

    private SenderOptions(Builder b) {
        this.url = b.url;
        this.exchange = b.exchange;
        this.exchangeType = b.exchangeType;
        this.replyQueueOptions = b.replyQueueOptions;
        this.routingKeys = b.routingKeys == null ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(b.routingKeys));
    }

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private String url;
        private String exchange;
        private String exchangeType;
        private ReplyQueueOptions replyQueueOptions;
        private Map<String, String> routingKeys;

        public Builder url(String url) { this.url = url; return this; }
        public Builder exchange(String exchange) { this.exchange = exchange; return this; }
        public Builder exchangeType(String exchangeType) { this.exchangeType = exchangeType; return this; }
        public Builder replyQueueOptions(ReplyQueueOptions options) { this.replyQueueOptions = options; return this; }
        public Builder routingKeys(Map<String, String> routingKeys) { this.routingKeys = routingKeys; return this; }

        public SenderOptions build() {
            require(url, "url");
            require(exchange, "exchange");
            require(exchangeType, "exchangeType");
            return new SenderOptions(this);
        }

        private static void require(String value, String field) {
            if (value == null || value.isBlank()) {
                throw new ConfigurationException(field + " is required in RabbitMQ sender configuration");
            }
        }
    }

    public String getUrl() { return url; }
    public String getExchange() { return exchange; }
    public String getExchangeType() { return exchangeType; }
    /** Reply queue overrides; {@code null} when defaults apply. */
    public ReplyQueueOptions getReplyQueueOptions() { return replyQueueOptions; }
    /** Logical key to routing key; {@code null} when not configured. */
    public Map<String, String> getRoutingKeys() { return routingKeys; }

    /**
     * Overrides for the private reply queue used by request/response sends.
     * Either flag may be {@code null} to keep its default.
     */
    public record ReplyQueueOptions(Boolean durable, Boolean autoDelete) {}
}
