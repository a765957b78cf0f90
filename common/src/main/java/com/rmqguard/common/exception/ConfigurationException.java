/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.common.exception;

/**
 * Invalid or incomplete broker configuration. Raised at setup time and never retried.
 */
public class ConfigurationException extends RmqGuardException {
    public ConfigurationException(String message) {
        super("RMQ_CONFIG_INVALID", message);
    }
}
