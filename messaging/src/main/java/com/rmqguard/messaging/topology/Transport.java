/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.topology;

/**
 * Transport discriminator carried by every derived endpoint configuration.
 */
public enum Transport {
    RMQ
}
