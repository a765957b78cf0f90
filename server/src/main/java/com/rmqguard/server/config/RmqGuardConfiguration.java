/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.server.config;

import com.rmqguard.messaging.core.MessageInterceptor;
import com.rmqguard.messaging.idempotency.DeduplicationStore;
import com.rmqguard.messaging.idempotency.IdempotencyInterceptor;
import com.rmqguard.messaging.idempotency.RedisDeduplicationStore;
import com.rmqguard.messaging.rabbitmq.RabbitMQConsumerHost;
import com.rmqguard.messaging.rabbitmq.RabbitMQSender;
import com.rmqguard.messaging.receiver.ReceiverConnector;
import com.rmqguard.messaging.receiver.ReceiversConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@EnableConfigurationProperties(RmqGuardProperties.class)
public class RmqGuardConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RmqGuardConfiguration.class);

    @Bean(destroyMethod = "close")
    public RabbitMQConsumerHost rabbitMQConsumerHost() {
        return new RabbitMQConsumerHost();
    }

    @Bean
    public DeduplicationStore deduplicationStore(StringRedisTemplate redisTemplate) {
        return new RedisDeduplicationStore(redisTemplate);
    }

    @Bean
    public MessageInterceptor idempotencyInterceptor(RmqGuardProperties properties, DeduplicationStore store) {
        if (!properties.getIdempotency().isEnabled()) {
            log.warn("Idempotency guard disabled: redelivered messages will be processed again");
            return (context, next) -> next.handle();
        }
        return new IdempotencyInterceptor(store);
    }

    @Bean
    public ReceiverConnector receiverConnector(RabbitMQConsumerHost host, MessageInterceptor idempotencyInterceptor) {
        return new ReceiverConnector(host, idempotencyInterceptor, host.getRegistry());
    }

    @Bean
    public ReceiversConnector receiversConnector(ReceiverConnector receiverConnector) {
        return new ReceiversConnector(receiverConnector);
    }

    @Bean(initMethod = "connect", destroyMethod = "close")
    @ConditionalOnProperty(prefix = "rmqguard.sender", name = "enabled", havingValue = "true")
    public RabbitMQSender rabbitMQSender(RmqGuardProperties properties) {
        return new RabbitMQSender(properties.getSender().toSenderOptions());
    }
}
