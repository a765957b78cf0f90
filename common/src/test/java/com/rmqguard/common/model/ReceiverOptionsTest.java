/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.common.model;

import com.rmqguard.common.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReceiverOptionsTest {

    private static ReceiverOptions.Builder valid() {
        return ReceiverOptions.builder()
                .url("amqp://localhost")
                .exchange("events_exchange")
                .exchangeType("topic")
                .queue("orders")
                .pattern("orders.*");
    }

    @Test
    @DisplayName("required fields are enforced with the field name in the message")
    void requiredFields() {
        assertThatThrownBy(() -> valid().url(null).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("url is required in RabbitMQ receiver configuration");
        assertThatThrownBy(() -> valid().pattern(" ").build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("pattern");
        assertThatThrownBy(() -> valid().exchangeType(null).build())
                .extracting("errorCode").isEqualTo("RMQ_CONFIG_INVALID");
    }

    @Test
    @DisplayName("optional values stay null until the topology fills in defaults")
    void optionalsNull() {
        ReceiverOptions options = valid().build();

        assertThat(options.getPrefetchCount()).isNull();
        assertThat(options.getRetryTtl()).isNull();
        assertThat(options.getDlxQueue()).isNull();
        assertThat(options.getName()).isEqualTo("orders");
    }

    @Test
    @DisplayName("toBuilder copies every field")
    void toBuilderCopies() {
        ReceiverOptions options = valid().name("orders-sub").retryTtl(1000).dlxExchange("dlx").build();

        assertThat(options.toBuilder().build()).isEqualTo(options).hasSameHashCodeAs(options);
        assertThat(options.toBuilder().queue("other").build()).isNotEqualTo(options);
    }
}
