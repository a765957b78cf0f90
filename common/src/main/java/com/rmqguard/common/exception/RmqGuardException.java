/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.common.exception;

/**
 * Base exception for all RMQGuard errors.
 */
public class RmqGuardException extends RuntimeException {
    private final String errorCode;

    public RmqGuardException(String message) {
        super(message);
        this.errorCode = "RMQ_GENERIC";
    }

    public RmqGuardException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RmqGuardException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
