package com.eventfunnel.analytics.util;

/**
 * Shared string semantics for blank handling and label fallbacks.
 */
public final class StringSemantics {
    private StringSemantics() {}

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public static String trimToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }

    public static String orDefault(String value, String fallback) {
        return isBlank(value) ? fallback : value;
    }
}
