/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.core;

/**
 * Business handler for messages matching a routing pattern.
 * Implementations must be thread-safe. Throwing routes the message into the retry queue.
 */
@FunctionalInterface
public interface MessageHandler {
    /**
     * @param payload decoded JSON body (map, list, string, number, boolean or null)
     * @param context invocation details, including the delivery
     * @return reply payload for request/response messages; ignored for events
     */
    Object handle(Object payload, InvocationContext context) throws Exception;
}
