/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.core;

/**
 * The remainder of an invocation chain: the next interceptor, or the handler itself.
 */
@FunctionalInterface
public interface CallHandler {
    Object handle() throws Exception;
}
