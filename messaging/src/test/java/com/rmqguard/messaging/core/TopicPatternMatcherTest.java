/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TopicPatternMatcherTest {

    @Test
    @DisplayName("* matches exactly one word")
    void star() {
        assertThat(TopicPatternMatcher.matches("orders.*", "orders.created")).isTrue();
        assertThat(TopicPatternMatcher.matches("orders.*", "orders")).isFalse();
        assertThat(TopicPatternMatcher.matches("orders.*", "orders.created.eu")).isFalse();
        assertThat(TopicPatternMatcher.matches("*.created", "payments.created")).isTrue();
    }

    @Test
    @DisplayName("# matches zero or more words")
    void hash() {
        assertThat(TopicPatternMatcher.matches("orders.#", "orders")).isTrue();
        assertThat(TopicPatternMatcher.matches("orders.#", "orders.created.eu")).isTrue();
        assertThat(TopicPatternMatcher.matches("#", "anything.at.all")).isTrue();
        assertThat(TopicPatternMatcher.matches("#.eu", "orders.created.eu")).isTrue();
        assertThat(TopicPatternMatcher.matches("#.eu", "orders.created.us")).isFalse();
    }

    @Test
    @DisplayName("literal words must match exactly")
    void literals() {
        assertThat(TopicPatternMatcher.matches("orders.created", "orders.created")).isTrue();
        assertThat(TopicPatternMatcher.matches("orders.created", "orders.cancelled")).isFalse();
        assertThat(TopicPatternMatcher.matches(null, "orders")).isFalse();
    }
}
