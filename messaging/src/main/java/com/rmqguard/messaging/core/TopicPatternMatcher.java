/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.messaging.core;

/**
 * AMQP topic-exchange matching: words are separated by {@code .},
 * {@code *} matches exactly one word and {@code #} matches zero or more words.
 */
public final class TopicPatternMatcher {

    private TopicPatternMatcher() {}

    public static boolean matches(String pattern, String routingKey) {
        if (pattern == null || routingKey == null) return false;
        if (pattern.equals(routingKey)) return true;
        return matches(pattern.split("\\.", -1), 0, routingKey.split("\\.", -1), 0);
    }

    private static boolean matches(String[] pattern, int p, String[] key, int k) {
        if (p == pattern.length) return k == key.length;
        String word = pattern[p];
        if (word.equals("#")) {
            for (int skip = k; skip <= key.length; skip++) {
                if (matches(pattern, p + 1, key, skip)) return true;
            }
            return false;
        }
        if (k == key.length) return false;
        if (word.equals("*") || word.equals(key[k])) {
            return matches(pattern, p + 1, key, k + 1);
        }
        return false;
    }
}
