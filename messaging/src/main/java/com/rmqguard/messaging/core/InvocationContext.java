/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.core;

import java.util.Optional;

/**
 * Everything an interceptor may inspect about one handler invocation.
 */
public final class InvocationContext {

    private final CallKind kind;
    private final String routingKey;
    private final Object payload;
    private final DeliveryContext deliveryContext;

    public InvocationContext(CallKind kind, String routingKey, Object payload, DeliveryContext deliveryContext) {
        this.kind = kind;
        this.routingKey = routingKey;
        this.payload = payload;
        this.deliveryContext = deliveryContext;
    }

    /** Invocation triggered by a broker delivery. */
    public static InvocationContext rpc(String routingKey, Object payload, DeliveryContext deliveryContext) {
        return new InvocationContext(CallKind.RPC, routingKey, payload, deliveryContext);
    }

    public CallKind getKind() { return kind; }
    public String getRoutingKey() { return routingKey; }
    public Object getPayload() { return payload; }

    /** Broker context of the delivery; empty when the invocation has none. */
    public Optional<DeliveryContext> getDeliveryContext() { return Optional.ofNullable(deliveryContext); }
}
