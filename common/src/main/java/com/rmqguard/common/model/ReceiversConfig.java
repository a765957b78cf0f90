/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared connection parameters plus a list of subscriptions, each of which may
 * override the shared values.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReceiversConfig {

    private String url;
    private String exchange;
    private String exchangeType;
    private Integer prefetchCount;
    private Boolean noAck;
    private Integer retryTtl;
    private String dlxQueue;
    private String dlxExchange;
    private String dlxExchangeType;
    private List<ReceiverSubscription> subscriptions = new ArrayList<>();

    public ReceiversConfig() {}

    /**
     * Merge every subscription over the shared parameters, preserving order.
     * A value set on the subscription wins; otherwise the shared value applies.
     */
    public List<ReceiverOptions> toReceiverOptions() {
        List<ReceiverOptions> result = new ArrayList<>();
        if (subscriptions == null) return result;
        for (ReceiverSubscription s : subscriptions) {
            result.add(ReceiverOptions.builder()
                    .name(s.getName())
                    .url(url)
                    .exchange(exchange)
                    .exchangeType(exchangeType)
                    .queue(s.getQueue())
                    .pattern(s.getPattern())
                    .prefetchCount(firstNonNull(s.getPrefetchCount(), prefetchCount))
                    .noAck(firstNonNull(s.getNoAck(), noAck))
                    .retryQueue(s.getRetryQueue())
                    .retryExchange(s.getRetryExchange())
                    .retryExchangeType(s.getRetryExchangeType())
                    .retryTtl(firstNonNull(s.getRetryTtl(), retryTtl))
                    .dlxQueue(firstNonNull(s.getDlxQueue(), dlxQueue))
                    .dlxExchange(firstNonNull(s.getDlxExchange(), dlxExchange))
                    .dlxExchangeType(firstNonNull(s.getDlxExchangeType(), dlxExchangeType))
                    .build());
        }
        return result;
    }

    private static <T> T firstNonNull(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getExchange() { return exchange; }
    public void setExchange(String exchange) { this.exchange = exchange; }
    public String getExchangeType() { return exchangeType; }
    public void setExchangeType(String exchangeType) { this.exchangeType = exchangeType; }
    public Integer getPrefetchCount() { return prefetchCount; }
    public void setPrefetchCount(Integer prefetchCount) { this.prefetchCount = prefetchCount; }
    public Boolean getNoAck() { return noAck; }
    public void setNoAck(Boolean noAck) { this.noAck = noAck; }
    public Integer getRetryTtl() { return retryTtl; }
    public void setRetryTtl(Integer retryTtl) { this.retryTtl = retryTtl; }
    public String getDlxQueue() { return dlxQueue; }
    public void setDlxQueue(String dlxQueue) { this.dlxQueue = dlxQueue; }
    public String getDlxExchange() { return dlxExchange; }
    public void setDlxExchange(String dlxExchange) { this.dlxExchange = dlxExchange; }
    public String getDlxExchangeType() { return dlxExchangeType; }
    public void setDlxExchangeType(String dlxExchangeType) { this.dlxExchangeType = dlxExchangeType; }
    public List<ReceiverSubscription> getSubscriptions() { return subscriptions; }
    public void setSubscriptions(List<ReceiverSubscription> subscriptions) { this.subscriptions = subscriptions; }
}
