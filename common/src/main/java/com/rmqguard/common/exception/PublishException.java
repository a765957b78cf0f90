/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.common.exception;

public class PublishException extends RmqGuardException {
    public PublishException(String message, Throwable cause) {
        super("RMQ_PUBLISH_FAILED", message, cause);
    }
}
