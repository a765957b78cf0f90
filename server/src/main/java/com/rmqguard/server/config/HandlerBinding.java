/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.server.config;

import com.rmqguard.messaging.core.MessageHandler;

/**
 * Declares a message handler as a bean. Every binding in the context is registered
 * on the consumer host before it starts.
 *
 * @param pattern AMQP topic pattern matched against the delivery routing key
 */
public record HandlerBinding(String pattern, MessageHandler handler) {}
