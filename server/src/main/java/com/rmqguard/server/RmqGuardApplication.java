/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.rmqguard")
public class RmqGuardApplication {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(RmqGuardApplication.class);
        app.setRegisterShutdownHook(true);
        app.run(args);
    }
}
