/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.core;

/**
 * Lifecycle of {@code RabbitMQConsumerHost} and {@code RabbitMQSender}. {@code ERROR} is entered when
 * connecting or declaring topology fails; {@code close()} always ends in {@code CLOSED}.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    CLOSING,
    CLOSED,
    ERROR
}
