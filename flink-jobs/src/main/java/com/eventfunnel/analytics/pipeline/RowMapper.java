package com.eventfunnel.analytics.pipeline;

/**
 * Converts a report payload into a single JSON row.
 */
@FunctionalInterface
public interface RowMapper<T> extends java.io.Serializable {
    String map(T payload);
}
