/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.core;

/**
 * Middleware around message handlers. An interceptor either calls {@code next.handle()}
 * exactly once and returns (or rethrows) its outcome, or short-circuits with its own result.
 * Implementations must be thread-safe.
 */
@FunctionalInterface
public interface MessageInterceptor {
    Object intercept(InvocationContext context, CallHandler next) throws Exception;
}
