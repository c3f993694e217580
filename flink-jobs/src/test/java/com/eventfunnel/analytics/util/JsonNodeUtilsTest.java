package com.eventfunnel.analytics.util;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import com.eventfunnel.analytics.config.TimestampUnit;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JsonNodeUtilsTest {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @Test
    void numericTimestampsAreReadInConfiguredUnit() {
        Instant expected = Instant.ofEpochSecond(1_710_000_000L);

        assertEquals(expected, JsonNodeUtils.parseTimestamp(NODES.numberNode(1_710_000_000_000L), TimestampUnit.MILLIS));
        assertEquals(expected, JsonNodeUtils.parseTimestamp(NODES.numberNode(1_710_000_000L), TimestampUnit.SECONDS));
        assertEquals(expected.plusNanos(123_000L),
                JsonNodeUtils.parseTimestamp(NODES.textNode("1710000000000123"), TimestampUnit.MICROS));
    }

    @Test
    void fractionalValuesKeepNanosecondPrecision() {
        assertEquals(Instant.ofEpochSecond(1_710_000_000L, 250_000_000L),
                JsonNodeUtils.parseTimestamp(NODES.numberNode(new BigDecimal("1710000000.25")), TimestampUnit.SECONDS));
        assertEquals(Instant.ofEpochSecond(1_710_000_000L, 123_456_789L),
                JsonNodeUtils.parseTimestamp(NODES.textNode("1710000000123.456789"), TimestampUnit.MILLIS));
        assertEquals(Instant.ofEpochSecond(1_710_000_000L, 100L),
                JsonNodeUtils.parseTimestamp(NODES.textNode("1710000000000000.1"), TimestampUnit.MICROS));
    }

    @Test
    void negativeNumericTimestampsFloorIntoTheEarlierSecond() {
        assertEquals(Instant.parse("1969-12-31T23:59:59.999Z"),
                JsonNodeUtils.parseTimestamp(NODES.numberNode(-1L), TimestampUnit.MILLIS));
        assertEquals(Instant.parse("1969-12-31T23:59:59.500Z"),
                JsonNodeUtils.parseTimestamp(NODES.textNode("-0.5"), TimestampUnit.SECONDS));
    }

    @Test
    void textTimestampsAcceptIsoAndWarehouseFormats() {
        Instant expected = Instant.parse("2024-03-09T16:00:00.123456789Z");

        assertEquals(expected, JsonNodeUtils.parseTimestamp(NODES.textNode("2024-03-09T16:00:00.123456789Z"), TimestampUnit.MILLIS));
        assertEquals(expected, JsonNodeUtils.parseTimestamp(NODES.textNode("2024-03-09T17:00:00.123456789+01:00"), TimestampUnit.MILLIS));
        assertEquals(expected, JsonNodeUtils.parseTimestamp(NODES.textNode("2024-03-09 16:00:00.123456789 UTC"), TimestampUnit.MILLIS));
    }

    @Test
    void unparsableTimestampsYieldNull() {
        assertNull(JsonNodeUtils.parseTimestamp(NODES.textNode("yesterday"), TimestampUnit.MILLIS));
        assertNull(JsonNodeUtils.parseTimestamp(NODES.textNode(" "), TimestampUnit.MILLIS));
        assertNull(JsonNodeUtils.parseTimestamp(NODES.booleanNode(true), TimestampUnit.MILLIS));
        assertNull(JsonNodeUtils.parseTimestamp(NODES.nullNode(), TimestampUnit.MILLIS));
        assertNull(JsonNodeUtils.parseTimestamp(NODES.numberNode(Long.MAX_VALUE), TimestampUnit.SECONDS));
        assertNull(JsonNodeUtils.parseTimestamp(NODES.textNode("99999999999999999999"), TimestampUnit.MILLIS));
    }

    @Test
    void microsRoundTripThroughInstantForPreEpochValues() {
        assertEquals(Instant.parse("1969-12-31T23:59:59.999999Z"), JsonNodeUtils.fromMicros(-1L));
    }

    @Test
    void nullableTextSkipsContainersAndBlanks() {
        assertNull(JsonNodeUtils.asNullableText(NODES.objectNode()));
        assertNull(JsonNodeUtils.asNullableText(NODES.textNode("  ")));
        assertEquals("42", JsonNodeUtils.asNullableText(NODES.numberNode(42)));
    }
}
