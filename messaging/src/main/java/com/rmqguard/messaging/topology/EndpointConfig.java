/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.topology;

import java.util.List;

/**
 * Wire-level description of one consumer endpoint: the queue, its declaration
 * arguments, and the exchange it is bound to.
 */
public interface EndpointConfig {

    EndpointRole role();

    Transport transport();

    List<String> urls();

    String queue();

    QueueOptions queueOptions();

    String exchange();

    String exchangeType();

    boolean wildcards();

    /** Routing key used to bind {@link #queue()} to {@link #exchange()}. */
    String bindingKey();
}
