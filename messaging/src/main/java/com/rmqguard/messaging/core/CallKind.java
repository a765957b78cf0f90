/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.core;

/**
 * Origin of a handler invocation. Only {@link #RPC} invocations come from broker deliveries.
 */
public enum CallKind {
    RPC,
    EVENT,
    HTTP
}
