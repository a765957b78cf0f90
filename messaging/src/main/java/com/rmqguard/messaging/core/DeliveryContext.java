/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.core;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;

/**
 * Broker-side view of a single delivery: the channel it arrived on and the raw message.
 * Either may be {@code null} when the delivery did not come from a live channel;
 * callers that acknowledge must tolerate that.
 */
public interface DeliveryContext {

    Channel getChannel();

    Delivery getMessage();
}
