/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.rabbitmq;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import com.rmqguard.messaging.core.DeliveryContext;

/**
 * Delivery context handed to interceptors. The channel is {@code null} for auto-ack
 * endpoints, where an explicit acknowledgement would close the channel.
 */
public class RabbitMQDeliveryContext implements DeliveryContext {

    private final Channel channel;
    private final Delivery message;

    public RabbitMQDeliveryContext(Channel channel, Delivery message) {
        this.channel = channel;
        this.message = message;
    }

    @Override
    public Channel getChannel() { return channel; }

    @Override
    public Delivery getMessage() { return message; }
}
