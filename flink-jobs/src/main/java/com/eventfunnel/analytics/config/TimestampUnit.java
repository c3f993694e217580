package com.eventfunnel.analytics.config;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Locale;

/**
 * Unit of numeric timestamps in the raw event log. Text timestamps carry their own precision.
 */
public enum TimestampUnit {
    SECONDS(1L),
    MILLIS(1_000L),
    MICROS(1_000_000L);

    private static final long NANOS_PER_SECOND = 1_000_000_000L;
    private static final BigDecimal BIG_NANOS_PER_SECOND = BigDecimal.valueOf(NANOS_PER_SECOND);

    private final long unitsPerSecond;

    TimestampUnit(long unitsPerSecond) {
        this.unitsPerSecond = unitsPerSecond;
    }

    /**
     * @throws java.time.DateTimeException if the value is outside the supported instant range
     */
    public Instant toInstant(long value) {
        long nanosPerUnit = NANOS_PER_SECOND / unitsPerSecond;
        return Instant.ofEpochSecond(Math.floorDiv(value, unitsPerSecond), Math.floorMod(value, unitsPerSecond) * nanosPerUnit);
    }

    /** Fractional values keep nanosecond precision; digits below a nanosecond are floored. */
    public Instant toInstant(BigDecimal value) {
        BigDecimal nanos = value.multiply(BIG_NANOS_PER_SECOND)
                .divide(BigDecimal.valueOf(unitsPerSecond))
                .setScale(0, RoundingMode.FLOOR);
        BigDecimal[] secondsAndNanos = nanos.divideAndRemainder(BIG_NANOS_PER_SECOND);
        return Instant.ofEpochSecond(secondsAndNanos[0].longValueExact(), secondsAndNanos[1].longValueExact());
    }

    public static TimestampUnit parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("Timestamp unit must not be blank");
        }
        try {
            return TimestampUnit.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Unsupported timestamp unit: " + raw, ex);
        }
    }
}
