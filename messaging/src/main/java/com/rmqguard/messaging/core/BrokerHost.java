/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.core;

import com.rmqguard.messaging.topology.EndpointConfig;

import java.util.List;

/**
 * Broker connection layer the receiver wiring talks to. Accepts endpoint
 * configurations, global interceptors and handlers, then starts consuming.
 *
 * <p>Setup methods are meant to be called sequentially at process start.</p>
 */
public interface BrokerHost extends AutoCloseable {

    /** Register an endpoint; declared (and consumed, for receivers) on {@link #start()}, or immediately if already started. */
    void connectEndpoint(EndpointConfig endpoint);

    /** Endpoints connected so far, in connection order. */
    List<EndpointConfig> getEndpoints();

    /** Queues connected so far, used to avoid connecting shared queues twice. */
    EndpointRegistry getRegistry();

    /** Install an interceptor around every handler invocation. Interceptors run in install order. */
    void useGlobalInterceptor(MessageInterceptor interceptor);

    /** Register the handler for routing keys matching an AMQP topic pattern. */
    void registerHandler(String pattern, MessageHandler handler);

    void start();

    boolean isConnected();

    @Override
    void close();
}
