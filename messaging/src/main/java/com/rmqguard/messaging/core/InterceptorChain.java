/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.core;

import java.util.List;

/**
 * Runs a handler through a list of interceptors; the first interceptor in the list is the outermost.
 */
public final class InterceptorChain {

    private InterceptorChain() {}

    public static Object invoke(List<MessageInterceptor> interceptors, InvocationContext context,
                                MessageHandler handler) throws Exception {
        CallHandler call = () -> handler.handle(context.getPayload(), context);
        for (int i = interceptors.size() - 1; i >= 0; i--) {
            MessageInterceptor interceptor = interceptors.get(i);
            CallHandler next = call;
            call = () -> interceptor.intercept(context, next);
        }
        return call.handle();
    }
}
