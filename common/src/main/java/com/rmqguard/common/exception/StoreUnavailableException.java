/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.common.exception;

/**
 * The deduplication store could not be reached or rejected an operation.
 * Callers on the message path recover from this locally.
 */
public class StoreUnavailableException extends RmqGuardException {
    public StoreUnavailableException(String message, Throwable cause) {
        super("RMQ_STORE_UNAVAILABLE", message, cause);
    }
}
