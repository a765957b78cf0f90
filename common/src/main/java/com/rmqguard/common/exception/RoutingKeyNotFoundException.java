/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.common.exception;

public class RoutingKeyNotFoundException extends RmqGuardException {
    private final String key;

    public RoutingKeyNotFoundException(String key) {
        super("RMQ_ROUTING_KEY_NOT_FOUND", "Routing key \"" + key + "\" not found in configuration");
        this.key = key;
    }

    public String getKey() { return key; }
}
