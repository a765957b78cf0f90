/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.idempotency;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationEnvelopeTest {

    @Test
    @DisplayName("object payloads get the correlation fields merged in")
    void mergesIntoObjects() {
        Map<String, Object> wrapped = CorrelationEnvelope.wrap(Map.of("orderId", 7), "abc", 1000L);

        assertThat(wrapped)
                .containsEntry("orderId", 7)
                .containsEntry("correlationId", "abc")
                .containsEntry("correlationTimestamp", 1000L)
                .doesNotContainKey("data");
    }

    @Test
    @DisplayName("non-object payloads are wrapped under data")
    void wrapsOthers() {
        assertThat(CorrelationEnvelope.wrap("hello", "abc", 1000L)).containsEntry("data", "hello");
        assertThat(CorrelationEnvelope.wrap(List.of(1, 2), "abc", 1000L)).containsEntry("data", List.of(1, 2));
        assertThat(CorrelationEnvelope.wrap(null, "abc", 1000L)).containsEntry("data", null);
    }

    @Test
    @DisplayName("generates a UUID correlationId and a current timestamp")
    void generatesIdentity() {
        long before = System.currentTimeMillis();

        Map<String, Object> wrapped = CorrelationEnvelope.wrap(Map.of("orderId", 7));

        String id = (String) wrapped.get("correlationId");
        assertThat(UUID.fromString(id).toString()).isEqualTo(id);
        assertThat((Long) wrapped.get("correlationTimestamp")).isBetween(before, System.currentTimeMillis());
        assertThat(MessageDecoder.decode(wrapped)).isInstanceOf(DecodedMessage.Correlated.class);
    }
}
