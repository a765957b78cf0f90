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
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import com.rmqguard.common.exception.BrokerConnectionException;
import com.rmqguard.common.util.JsonUtil;
import com.rmqguard.messaging.core.BrokerHost;
import com.rmqguard.messaging.core.ConnectionState;
import com.rmqguard.messaging.core.EndpointRegistry;
import com.rmqguard.messaging.core.InterceptorChain;
import com.rmqguard.messaging.core.InvocationContext;
import com.rmqguard.messaging.core.MessageHandler;
import com.rmqguard.messaging.core.MessageInterceptor;
import com.rmqguard.messaging.core.TopicPatternMatcher;
import com.rmqguard.messaging.idempotency.DuplicateResult;
import com.rmqguard.messaging.topology.EndpointConfig;
import com.rmqguard.messaging.topology.ReceiverConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

/**
 * RabbitMQ broker host using AMQP 0-9-1.
 *
 * <p>For every connected endpoint it declares the exchange, the queue with its
 * dead-letter arguments, and the binding. Only receiver endpoints are consumed:
 * retry queues are left unconsumed so their TTL alone decides when a failed
 * message returns to the main exchange, and the global dead-letter queue is
 * declared for inspection only.</p>
 *
 * <p>Deliveries are dispatched on the client's consumer threads, one channel per
 * endpoint. With manual acknowledgement a successful handler call is acked and a
 * failed one is nacked without requeue, which dead-letters it into the retry exchange.</p>
 */
public class RabbitMQConsumerHost implements BrokerHost {

    private static final Logger log = LoggerFactory.getLogger(RabbitMQConsumerHost.class);

    private static final String CONNECTION_NAME = "rmqguard-consumer";
    private static final String CONSUMER_TAG_PREFIX = "rmqguard-";
    private static final String X_DEATH = "x-death";

    private final ConnectionFactory connectionFactory;
    private final EndpointRegistry registry = new EndpointRegistry();
    private final List<EndpointConfig> endpoints = new CopyOnWriteArrayList<>();
    private final List<MessageInterceptor> interceptors = new CopyOnWriteArrayList<>();
    private final Map<String, MessageHandler> handlers = new LinkedHashMap<>();
    private final Map<List<String>, Connection> connections = new LinkedHashMap<>();
    private final List<Channel> channels = new CopyOnWriteArrayList<>();
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    public RabbitMQConsumerHost() {
        this(new ConnectionFactory());
    }

    public RabbitMQConsumerHost(ConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
    }

    @Override
    public synchronized void connectEndpoint(EndpointConfig endpoint) {
        endpoints.add(endpoint);
        registry.register(endpoint);
        if (state == ConnectionState.CONNECTED) {
            open(endpoint);
        }
        log.debug("Endpoint registered [role={}, queue={}, exchange={}]",
                endpoint.role(), endpoint.queue(), endpoint.exchange());
    }

    @Override
    public List<EndpointConfig> getEndpoints() {
        return Collections.unmodifiableList(new ArrayList<>(endpoints));
    }

    @Override
    public EndpointRegistry getRegistry() { return registry; }

    @Override
    public void useGlobalInterceptor(MessageInterceptor interceptor) {
        interceptors.add(interceptor);
        log.info("Global interceptor installed: {}", interceptor.getClass().getSimpleName());
    }

    @Override
    public void registerHandler(String pattern, MessageHandler handler) {
        synchronized (handlers) {
            handlers.put(pattern, handler);
        }
        log.info("Handler registered for pattern '{}'", pattern);
    }

    @Override
    public synchronized void start() {
        if (state == ConnectionState.CONNECTED) return;
        state = ConnectionState.CONNECTING;
        try {
            for (EndpointConfig endpoint : endpoints) {
                open(endpoint);
            }
        } catch (RuntimeException e) {
            state = ConnectionState.ERROR;
            throw e;
        }
        state = ConnectionState.CONNECTED;
        long consuming = endpoints.stream().filter(e -> e instanceof ReceiverConfig).count();
        int handlerCount;
        synchronized (handlers) {
            handlerCount = handlers.size();
        }
        log.info("RabbitMQ consumer host started [endpoints: {}, consuming: {}, handlers: {}]",
                endpoints.size(), consuming, handlerCount);
    }

    private void open(EndpointConfig endpoint) {
        try {
            Channel channel = connectionFor(endpoint.urls()).createChannel();
            channels.add(channel);
            declare(channel, endpoint);
            if (endpoint instanceof ReceiverConfig receiver) {
                consume(channel, receiver);
            }
        } catch (IOException e) {
            throw new BrokerConnectionException("Failed to set up RabbitMQ endpoint '" + endpoint.queue() + "'", e);
        }
    }

    private Connection connectionFor(List<String> urls) {
        Connection connection = connections.get(urls);
        if (connection == null) {
            connection = RabbitConnections.open(connectionFactory, urls, CONNECTION_NAME);
            connections.put(urls, connection);
        }
        return connection;
    }

    void declare(Channel channel, EndpointConfig endpoint) throws IOException {
        channel.exchangeDeclare(endpoint.exchange(), endpoint.exchangeType(), true);
        channel.queueDeclare(endpoint.queue(), endpoint.queueOptions().durable(), false, false,
                endpoint.queueOptions().arguments());
        String bindingKey = endpoint.bindingKey() != null ? endpoint.bindingKey() : "";
        channel.queueBind(endpoint.queue(), endpoint.exchange(), bindingKey);
        log.info("Declared {} queue '{}' bound to '{}' ({}) with key '{}' args={}",
                endpoint.role(), endpoint.queue(), endpoint.exchange(), endpoint.exchangeType(),
                bindingKey, endpoint.queueOptions().arguments());
    }

    private void consume(Channel channel, ReceiverConfig receiver) throws IOException {
        channel.basicQos(receiver.prefetchCount());
        channel.basicConsume(receiver.queue(), receiver.noAck(), CONSUMER_TAG_PREFIX + receiver.queue(),
                new DefaultConsumer(channel) {
                    @Override
                    public void handleDelivery(String consumerTag, Envelope envelope,
                                               AMQP.BasicProperties properties, byte[] body) {
                        dispatch(receiver, channel, new Delivery(envelope, properties, body));
                    }
                });
        log.info("Consuming queue '{}' (prefetch={}, noAck={})",
                receiver.queue(), receiver.prefetchCount(), receiver.noAck());
    }

    /** Runs one delivery through the interceptors and its handler, then settles it. */
    void dispatch(ReceiverConfig endpoint, Channel channel, Delivery delivery) {
        Envelope envelope = delivery.getEnvelope();
        String routingKey = originalRoutingKey(endpoint, delivery);
        boolean manualAck = !endpoint.noAck();

        Object payload;
        try {
            payload = JsonUtil.fromBytes(delivery.getBody());
        } catch (IOException e) {
            log.error("Undecodable message on queue '{}' [routingKey={}]: {}",
                    endpoint.queue(), routingKey, e.getMessage());
            reject(channel, envelope, manualAck);
            return;
        }

        MessageHandler handler = resolveHandler(routingKey);
        if (handler == null) {
            log.warn("No handler for routing key '{}' on queue '{}'", routingKey, endpoint.queue());
            reject(channel, envelope, manualAck);
            return;
        }

        InvocationContext context = InvocationContext.rpc(routingKey, payload,
                new RabbitMQDeliveryContext(manualAck ? channel : null, delivery));
        Object result;
        try {
            result = InterceptorChain.invoke(interceptors, context, handler);
        } catch (Exception e) {
            log.error("Handler failed for routing key '{}' on queue '{}', dead-lettering to retry",
                    routingKey, endpoint.queue(), e);
            reject(channel, envelope, manualAck);
            return;
        }

        // Duplicates were acknowledged by the idempotency interceptor
        if (manualAck && !(result instanceof DuplicateResult)) {
            try {
                channel.basicAck(envelope.getDeliveryTag(), false);
            } catch (IOException | ShutdownSignalException e) {
                log.error("Failed to acknowledge message on queue '{}' [routingKey={}]: {}",
                        endpoint.queue(), routingKey, e.getMessage());
            }
        }
        reply(channel, delivery, result);
    }

    /**
     * Routing key the message was first published with. Dead-lettering through the
     * retry exchange rewrites the envelope key to the retry pattern, so for a
     * redelivered message the key is read from the {@code x-death} entry recorded
     * when it left this endpoint's queue, falling back to the oldest entry.
     */
    static String originalRoutingKey(ReceiverConfig endpoint, Delivery delivery) {
        String envelopeKey = delivery.getEnvelope().getRoutingKey();
        AMQP.BasicProperties properties = delivery.getProperties();
        if (properties == null || properties.getHeaders() == null) return envelopeKey;
        if (!(properties.getHeaders().get(X_DEATH) instanceof List<?> deaths) || deaths.isEmpty()) {
            return envelopeKey;
        }

        Map<?, ?> origin = null;
        for (Object death : deaths) {
            if (death instanceof Map<?, ?> entry) {
                origin = entry;
                if (endpoint.queue().equals(String.valueOf(entry.get("queue")))) break;
            }
        }
        if (origin != null && origin.get("routing-keys") instanceof List<?> keys && !keys.isEmpty()) {
            return String.valueOf(keys.get(0));
        }
        return envelopeKey;
    }

    /** Exact match first, then the first matching pattern in registration order. */
    MessageHandler resolveHandler(String routingKey) {
        synchronized (handlers) {
            MessageHandler exact = handlers.get(routingKey);
            if (exact != null) return exact;
            for (Map.Entry<String, MessageHandler> entry : handlers.entrySet()) {
                if (TopicPatternMatcher.matches(entry.getKey(), routingKey)) {
                    return entry.getValue();
                }
            }
            return null;
        }
    }

    private void reply(Channel channel, Delivery delivery, Object result) {
        AMQP.BasicProperties properties = delivery.getProperties();
        if (properties == null || properties.getReplyTo() == null) return;
        AMQP.BasicProperties replyProperties = new AMQP.BasicProperties.Builder()
                .correlationId(properties.getCorrelationId())
                .contentType("application/json")
                .build();
        try {
            synchronized (channel) {
                channel.basicPublish("", properties.getReplyTo(), replyProperties, JsonUtil.toBytes(result));
            }
        } catch (IOException | ShutdownSignalException e) {
            log.error("Failed to publish reply to '{}' [correlationId={}]: {}",
                    properties.getReplyTo(), properties.getCorrelationId(), e.getMessage());
        }
    }

    private void reject(Channel channel, Envelope envelope, boolean manualAck) {
        if (!manualAck) return;
        try {
            channel.basicNack(envelope.getDeliveryTag(), false, false);
        } catch (IOException | ShutdownSignalException e) {
            log.error("Failed to reject message [routingKey={}]: {}", envelope.getRoutingKey(), e.getMessage());
        }
    }

    @Override
    public boolean isConnected() {
        if (state != ConnectionState.CONNECTED) return false;
        synchronized (this) {
            return connections.values().stream().allMatch(Connection::isOpen);
        }
    }

    public ConnectionState getState() { return state; }

    @Override
    public synchronized void close() {
        state = ConnectionState.CLOSING;
        for (Channel channel : channels) {
            try {
                if (channel.isOpen()) channel.close();
            } catch (IOException | TimeoutException | ShutdownSignalException e) {
                log.warn("Error closing RabbitMQ channel", e);
            }
        }
        channels.clear();
        for (Connection connection : connections.values()) {
            try {
                if (connection.isOpen()) connection.close();
            } catch (IOException | ShutdownSignalException e) {
                log.warn("Error closing RabbitMQ connection", e);
            }
        }
        connections.clear();
        state = ConnectionState.CLOSED;
        log.info("RabbitMQ consumer host closed");
    }
}
