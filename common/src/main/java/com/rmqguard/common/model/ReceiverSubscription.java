/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One entry of a multi-subscription setup. Only the queue and pattern are required;
 * every other field, when set, overrides the shared value in {@link ReceiversConfig}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReceiverSubscription {

    private String name;
    private String queue;
    private String pattern;
    private Integer prefetchCount;
    private Boolean noAck;
    private String retryQueue;
    private String retryExchange;
    private String retryExchangeType;
    private Integer retryTtl;
    private String dlxQueue;
    private String dlxExchange;
    private String dlxExchangeType;

    public ReceiverSubscription() {}

    public ReceiverSubscription(String name, String queue, String pattern) {
        this.name = name;
        this.queue = queue;
        this.pattern = pattern;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getQueue() { return queue; }
    public void setQueue(String queue) { this.queue = queue; }
    public String getPattern() { return pattern; }
    public void setPattern(String pattern) { this.pattern = pattern; }
    public Integer getPrefetchCount() { return prefetchCount; }
    public void setPrefetchCount(Integer prefetchCount) { this.prefetchCount = prefetchCount; }
    public Boolean getNoAck() { return noAck; }
    public void setNoAck(Boolean noAck) { this.noAck = noAck; }
    public String getRetryQueue() { return retryQueue; }
    public void setRetryQueue(String retryQueue) { this.retryQueue = retryQueue; }
    public String getRetryExchange() { return retryExchange; }
    public void setRetryExchange(String retryExchange) { this.retryExchange = retryExchange; }
    public String getRetryExchangeType() { return retryExchangeType; }
    public void setRetryExchangeType(String retryExchangeType) { this.retryExchangeType = retryExchangeType; }
    public Integer getRetryTtl() { return retryTtl; }
    public void setRetryTtl(Integer retryTtl) { this.retryTtl = retryTtl; }
    public String getDlxQueue() { return dlxQueue; }
    public void setDlxQueue(String dlxQueue) { this.dlxQueue = dlxQueue; }
    public String getDlxExchange() { return dlxExchange; }
    public void setDlxExchange(String dlxExchange) { this.dlxExchange = dlxExchange; }
    public String getDlxExchangeType() { return dlxExchangeType; }
    public void setDlxExchangeType(String dlxExchangeType) { this.dlxExchangeType = dlxExchangeType; }
}
