package com.eventfunnel.analytics.config;

import java.util.Locale;

/**
 * Activity measure used to rank groups for the top-N cohort.
 */
public enum RankingMetric {
    /** Number of deduplicated events attributed to the group. */
    EVENT_COUNT,
    /** Number of distinct users with at least one deduplicated event in the group. */
    UNIQUE_USERS;

    public static RankingMetric parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("Ranking metric must not be blank");
        }
        try {
            return RankingMetric.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Unsupported ranking metric: " + raw, ex);
        }
    }
}
