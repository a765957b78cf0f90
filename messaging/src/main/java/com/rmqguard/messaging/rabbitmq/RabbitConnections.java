/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.rabbitmq;

import com.rabbitmq.client.Address;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rmqguard.common.exception.BrokerConnectionException;
import com.rmqguard.common.exception.ConfigurationException;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Opens AMQP connections from {@code amqp://} / {@code amqps://} URLs.
 * Credentials, virtual host and TLS come from the first URL; every URL contributes a host to fail over to.
 */
final class RabbitConnections {

    static final int DEFAULT_PORT = 5672;
    static final int DEFAULT_TLS_PORT = 5671;

    private RabbitConnections() {}

    static Connection open(ConnectionFactory factory, List<String> urls, String connectionName) {
        if (urls == null || urls.isEmpty()) {
            throw new ConfigurationException("At least one RabbitMQ URL is required");
        }
        try {
            factory.setUri(urls.get(0));
        } catch (URISyntaxException | NoSuchAlgorithmException | KeyManagementException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid RabbitMQ URL: " + urls.get(0));
        }
        // Connection recovery: automatic reconnection on connection loss
        factory.setAutomaticRecoveryEnabled(true);
        factory.setTopologyRecoveryEnabled(true);

        try {
            return factory.newConnection(addresses(urls), connectionName);
        } catch (IOException | TimeoutException e) {
            throw new BrokerConnectionException("Failed to connect to RabbitMQ at " + hosts(urls), e);
        }
    }

    static List<Address> addresses(List<String> urls) {
        List<Address> addresses = new ArrayList<>();
        for (String url : urls) {
            URI uri = URI.create(url);
            int port = uri.getPort();
            if (port <= 0) {
                port = "amqps".equalsIgnoreCase(uri.getScheme()) ? DEFAULT_TLS_PORT : DEFAULT_PORT;
            }
            addresses.add(new Address(uri.getHost(), port));
        }
        return addresses;
    }

    private static String hosts(List<String> urls) {
        List<String> hosts = new ArrayList<>();
        for (Address a : addresses(urls)) hosts.add(a.getHost() + ":" + a.getPort());
        return String.join(",", hosts);
    }
}
