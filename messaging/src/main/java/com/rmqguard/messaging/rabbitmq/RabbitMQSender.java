/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import com.rmqguard.common.exception.BrokerConnectionException;
import com.rmqguard.common.exception.PublishException;
import com.rmqguard.common.exception.RoutingKeyNotFoundException;
import com.rmqguard.common.model.SenderOptions;
import com.rmqguard.common.util.JsonUtil;
import com.rmqguard.messaging.core.ConnectionState;
import com.rmqguard.messaging.idempotency.CorrelationEnvelope;
import com.rmqguard.messaging.topology.SenderConfig;
import com.rmqguard.messaging.topology.TopologyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Publishes to the configured exchange through logical routing keys.
 *
 * <p>{@link #emit} is fire-and-forget. {@link #send} wraps the payload with a fresh
 * correlation id and timestamp, sets {@code replyTo} to a private server-named queue
 * and completes the returned future when the reply carrying the same correlation id
 * arrives. Replies that match no pending request are dropped.</p>
 *
 * <p>Logical keys are resolved before anything touches the network, so an unknown key
 * fails with {@link RoutingKeyNotFoundException} even when the sender is not connected.</p>
 */
public class RabbitMQSender implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RabbitMQSender.class);

    private static final String CONNECTION_NAME = "rmqguard-publisher";
    private static final String CONTENT_TYPE = "application/json";
    private static final int PERSISTENT = 2;

    private final SenderConfig config;
    private final ConnectionFactory connectionFactory;
    private final Map<String, CompletableFuture<byte[]>> pendingReplies = new ConcurrentHashMap<>();

    private Connection connection;
    private Channel channel;
    private String replyQueue;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    public RabbitMQSender(SenderOptions options) {
        this(options, new ConnectionFactory());
    }

    public RabbitMQSender(SenderOptions options, ConnectionFactory connectionFactory) {
        this.config = TopologyFactory.createSenderConfig(options);
        this.connectionFactory = connectionFactory;
        log.info("Routing keys initialized: {} keys", config.routingKeys().size());
    }

    public synchronized void connect() {
        if (state == ConnectionState.CONNECTED) return;
        state = ConnectionState.CONNECTING;
        try {
            connection = RabbitConnections.open(connectionFactory, config.urls(), CONNECTION_NAME);
            channel = connection.createChannel();
            channel.exchangeDeclare(config.exchange(), config.exchangeType(), config.durable());

            SenderConfig.ReplyQueue reply = config.replyQueueOptions();
            replyQueue = channel.queueDeclare("", reply.durable(), true, reply.autoDelete(), null).getQueue();
            channel.basicConsume(replyQueue, true, new DefaultConsumer(channel) {
                @Override
                public void handleDelivery(String consumerTag, Envelope envelope,
                                           AMQP.BasicProperties properties, byte[] body) {
                    completeReply(properties.getCorrelationId(), body);
                }
            });
        } catch (IOException e) {
            state = ConnectionState.ERROR;
            throw new BrokerConnectionException("Failed to set up RabbitMQ publisher on '" + config.exchange() + "'", e);
        } catch (RuntimeException e) {
            state = ConnectionState.ERROR;
            throw e;
        }
        state = ConnectionState.CONNECTED;
        log.info("RabbitMQ sender connected [exchange: {}, exchangeType: {}, replyQueue: {}]",
                config.exchange(), config.exchangeType(), replyQueue);
    }

    /**
     * Publishes {@code data} as-is under the routing key mapped to {@code key}.
     *
     * @throws RoutingKeyNotFoundException if {@code key} is not in the routing-key table
     */
    public CompletableFuture<Void> emit(String key, Object data) {
        String routingKey = resolve(key);
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .contentType(CONTENT_TYPE)
                .deliveryMode(PERSISTENT)
                .build();
        try {
            publish(routingKey, properties, encode(data, key));
        } catch (PublishException e) {
            return CompletableFuture.failedFuture(e);
        }
        log.debug("Emitted '{}' to {} with routing key '{}'", key, config.exchange(), routingKey);
        return CompletableFuture.completedFuture(null);
    }

    public <T> CompletableFuture<T> send(String key, Object data, Class<T> replyType) {
        return send(key, data, PublishOptions.none(), replyType);
    }

    /**
     * Request/response publish. The future fails with {@link PublishException} when the
     * payload cannot be serialized, the publish fails or the sender is closed before
     * the reply arrives.
     *
     * @throws RoutingKeyNotFoundException if {@code key} is not in the routing-key table
     */
    public <T> CompletableFuture<T> send(String key, Object data, PublishOptions options, Class<T> replyType) {
        String routingKey = resolve(key);
        Map<String, Object> message;
        byte[] body;
        try {
            message = CorrelationEnvelope.wrap(data);
            body = encode(message, key);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                    new PublishException("Failed to serialize payload for '" + key + "'", e));
        } catch (PublishException e) {
            return CompletableFuture.failedFuture(e);
        }
        String correlationId = (String) message.get(CorrelationEnvelope.CORRELATION_ID);

        AMQP.BasicProperties.Builder properties = new AMQP.BasicProperties.Builder()
                .contentType(CONTENT_TYPE)
                .deliveryMode(PERSISTENT)
                .correlationId(correlationId)
                .replyTo(replyQueue);
        if (options != null) {
            properties.headers(options.headers()).priority(options.priority()).expiration(options.expiration());
        }

        CompletableFuture<byte[]> reply = new CompletableFuture<>();
        pendingReplies.put(correlationId, reply);
        try {
            publish(routingKey, properties.build(), body);
        } catch (PublishException e) {
            pendingReplies.remove(correlationId);
            return CompletableFuture.failedFuture(e);
        }
        log.debug("Sent '{}' to {} with routing key '{}' [correlationId={}]",
                key, config.exchange(), routingKey, correlationId);

        return reply.thenApply(bytes -> decodeReply(bytes, replyType, correlationId));
    }

    String resolve(String key) {
        String routingKey = config.routingKeys().get(key);
        if (routingKey == null) {
            throw new RoutingKeyNotFoundException(key);
        }
        return routingKey;
    }

    private static byte[] encode(Object data, String key) {
        try {
            return JsonUtil.toBytes(data);
        } catch (IllegalArgumentException e) {
            throw new PublishException("Failed to serialize payload for '" + key + "'", e);
        }
    }

    private void publish(String routingKey, AMQP.BasicProperties properties, byte[] body) {
        Channel ch = channel;
        if (ch == null || state != ConnectionState.CONNECTED) {
            throw new PublishException("RabbitMQ sender is not connected", null);
        }
        try {
            synchronized (ch) {
                ch.basicPublish(config.exchange(), routingKey, properties, body);
            }
        } catch (IOException | ShutdownSignalException e) {
            throw new PublishException("Failed to publish to '" + config.exchange() + "' with routing key '"
                    + routingKey + "'", e);
        }
    }

    void completeReply(String correlationId, byte[] body) {
        if (correlationId == null) {
            log.warn("Dropping reply without correlationId");
            return;
        }
        CompletableFuture<byte[]> pending = pendingReplies.remove(correlationId);
        if (pending == null) {
            log.warn("Dropping reply with no pending request [correlationId={}]", correlationId);
            return;
        }
        pending.complete(body);
    }

    private static <T> T decodeReply(byte[] body, Class<T> replyType, String correlationId) {
        try {
            if (body == null || body.length == 0) return null;
            return JsonUtil.fromBytes(body, replyType);
        } catch (IOException e) {
            throw new PublishException("Undecodable reply [correlationId=" + correlationId + "]", e);
        }
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED && connection != null && connection.isOpen();
    }

    public ConnectionState getState() { return state; }

    String getReplyQueue() { return replyQueue; }

    int pendingReplyCount() { return pendingReplies.size(); }

    @Override
    public synchronized void close() {
        state = ConnectionState.CLOSING;
        PublishException closed = new PublishException("RabbitMQ sender closed before reply arrived", null);
        pendingReplies.values().forEach(f -> f.completeExceptionally(closed));
        pendingReplies.clear();
        try {
            if (channel != null && channel.isOpen()) channel.close();
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            log.warn("Error closing RabbitMQ channel", e);
        }
        try {
            if (connection != null && connection.isOpen()) connection.close();
        } catch (IOException | ShutdownSignalException e) {
            log.warn("Error closing RabbitMQ connection", e);
        }
        channel = null;
        connection = null;
        state = ConnectionState.CLOSED;
        log.info("RabbitMQ sender closed");
    }
}
