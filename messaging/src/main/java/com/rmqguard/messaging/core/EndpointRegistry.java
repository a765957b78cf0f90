/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.core;

import com.rmqguard.messaging.topology.EndpointConfig;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Names of the queues connected in this process. Used to keep shared queues such
 * as the global dead-letter queue from being connected twice.
 */
public class EndpointRegistry {

    private final Set<String> queueNames = ConcurrentHashMap.newKeySet();

    /** Returns {@code true} if no endpoint was yet registered for this queue. */
    public boolean register(EndpointConfig endpoint) {
        return queueNames.add(endpoint.queue());
    }

    public boolean isRegistered(String queueName) {
        return queueNames.contains(queueName);
    }
}
