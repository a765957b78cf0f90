/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.common.exception;

public class BrokerConnectionException extends RmqGuardException {
    public BrokerConnectionException(String message) {
        super("RMQ_CONNECTION_FAILED", message);
    }

    public BrokerConnectionException(String message, Throwable cause) {
        super("RMQ_CONNECTION_FAILED", message, cause);
    }
}
