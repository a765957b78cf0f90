/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.topology;

/**
 * The part an endpoint plays in the retry topology.
 */
public enum EndpointRole {
    /** Main queue; consumed, dead-letters into the retry exchange. */
    RECEIVER,
    /** Delay queue; not consumed, its TTL returns messages to the original exchange. */
    RETRY,
    /** Process-wide dead-letter queue shared by all subscriptions. */
    DEAD_LETTER
}
