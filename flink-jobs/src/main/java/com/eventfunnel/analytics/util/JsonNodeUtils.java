package com.eventfunnel.analytics.util;

import com.fasterxml.jackson.databind.JsonNode;

import com.eventfunnel.analytics.config.TimestampUnit;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.regex.Pattern;

/**
 * Shared JSON helper methods for reading optional row fields with safe fallbacks.
 */
public final class JsonNodeUtils {
    private static final Pattern NUMERIC = Pattern.compile("-?\\d+(\\.\\d+)?");

    // Export format of warehouse TIMESTAMP columns, e.g. "2024-03-09 16:00:00.123456 UTC".
    private static final DateTimeFormatter WAREHOUSE_TIMESTAMP = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .appendLiteral(" UTC")
            .toFormatter();

    private JsonNodeUtils() {}

    public static String asNullableText(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isContainerNode()) {
            return null;
        }
        return StringSemantics.trimToNull(node.asText());
    }

    /**
     * Parses a timestamp at full precision. Numbers and numeric strings are read in {@code unit};
     * text is read as an ISO-8601 instant, an ISO-8601 offset date-time, or a warehouse UTC timestamp.
     *
     * @return the instant, or null when the node is absent or unparsable
     */
    public static Instant parseTimestamp(JsonNode node, TimestampUnit unit) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        try {
            if (node.isIntegralNumber()) {
                return unit.toInstant(node.longValue());
            }
            if (node.isNumber()) {
                return unit.toInstant(node.decimalValue());
            }
            if (!node.isTextual()) {
                return null;
            }
            String raw = node.asText().trim();
            if (raw.isEmpty()) {
                return null;
            }
            if (NUMERIC.matcher(raw).matches()) {
                return raw.indexOf('.') >= 0
                        ? unit.toInstant(new BigDecimal(raw))
                        : unit.toInstant(Long.parseLong(raw));
            }
            return parseInstant(raw);
        } catch (ArithmeticException | NumberFormatException | DateTimeException ex) {
            return null;
        }
    }

    public static Instant fromMicros(long epochMicros) {
        return Instant.ofEpochSecond(Math.floorDiv(epochMicros, 1_000_000L), Math.floorMod(epochMicros, 1_000_000L) * 1_000L);
    }

    private static Instant parseInstant(String raw) {
        if (raw.endsWith(" UTC")) {
            return LocalDateTime.parse(raw, WAREHOUSE_TIMESTAMP).toInstant(ZoneOffset.UTC);
        }
        if (raw.endsWith("Z")) {
            return Instant.parse(raw);
        }
        return OffsetDateTime.parse(raw).toInstant();
    }
}
