package com.eventfunnel.analytics.quality;

import com.fasterxml.jackson.databind.JsonNode;

import com.eventfunnel.analytics.config.TimestampUnit;
import com.eventfunnel.analytics.util.JsonNodeUtils;

import java.time.Instant;

/**
 * Lightweight row validator that enforces the required event fields and coerces them into canonical values.
 */
public class RecordValidator {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(RecordValidator.class);

    public static final String USER_ID_FIELD = "user_id";
    public static final String EVENT_TYPE_FIELD = "event_type";
    public static final String TIMESTAMP_FIELD = "timestamp";
    public static final String GROUP_FIELD = "group";

    static final String FAILURE_CLASS = "RECORD_INVALID";

    private final TimestampUnit timestampUnit;

    public RecordValidator(TimestampUnit timestampUnit) {
        this.timestampUnit = timestampUnit;
    }

    public ValidationResult validate(JsonNode root) {
        if (root == null || !root.isObject()) {
            LOG.debug("Record validation failed: row is null or not an object");
            return ValidationResult.invalid("row_not_object", "Row is missing or not an object");
        }

        JsonNode userNode = root.get(USER_ID_FIELD);
        if (userNode != null && !userNode.isValueNode()) {
            LOG.debug("Record validation failed: user_id is not a scalar");
            return ValidationResult.invalid("invalid_user_id", "user_id must be a string or number");
        }
        String userId = JsonNodeUtils.asNullableText(userNode);
        if (userId == null) {
            LOG.debug("Record validation failed: missing user_id");
            return ValidationResult.invalid("missing_user_id", "Missing required field: " + USER_ID_FIELD);
        }

        JsonNode typeNode = root.get(EVENT_TYPE_FIELD);
        if (typeNode != null && !typeNode.isNull() && !typeNode.isTextual()) {
            LOG.debug("Record validation failed: event_type is not a string");
            return ValidationResult.invalid("invalid_event_type", "event_type must be a string");
        }
        String eventType = JsonNodeUtils.asNullableText(typeNode);
        if (eventType == null) {
            LOG.debug("Record validation failed: missing event_type");
            return ValidationResult.invalid("missing_event_type", "Missing required field: " + EVENT_TYPE_FIELD);
        }

        JsonNode timestampNode = root.get(TIMESTAMP_FIELD);
        if (timestampNode == null || timestampNode.isNull()) {
            LOG.debug("Record validation failed: missing timestamp for type {}", eventType);
            return ValidationResult.invalid("missing_timestamp", "Missing required field: " + TIMESTAMP_FIELD);
        }
        Instant timestamp = JsonNodeUtils.parseTimestamp(timestampNode, timestampUnit);
        if (timestamp == null) {
            LOG.debug("Record validation failed: unparsable timestamp {} for type {}", timestampNode, eventType);
            return ValidationResult.invalid("invalid_timestamp", "Unparsable timestamp: " + timestampNode);
        }

        JsonNode groupNode = root.get(GROUP_FIELD);
        if (groupNode != null && groupNode.isContainerNode()) {
            LOG.debug("Record validation failed: group is not a scalar");
            return ValidationResult.invalid("invalid_group", "group must be a string, number or null");
        }
        String group = JsonNodeUtils.asNullableText(groupNode);

        return ValidationResult.valid(userId, eventType, timestamp, group);
    }

    public static class ValidationResult {
        public final boolean valid;
        public final String failureClass;
        public final String reason;
        public final String details;
        public final String userId;
        public final String eventType;
        public final Instant timestamp;
        public final String group;

        private ValidationResult(
                boolean valid,
                String failureClass,
                String reason,
                String details,
                String userId,
                String eventType,
                Instant timestamp,
                String group) {
            this.valid = valid;
            this.failureClass = failureClass;
            this.reason = reason;
            this.details = details;
            this.userId = userId;
            this.eventType = eventType;
            this.timestamp = timestamp;
            this.group = group;
        }

        public static ValidationResult valid(String userId, String eventType, Instant timestamp, String group) {
            return new ValidationResult(true, null, null, null, userId, eventType, timestamp, group);
        }

        public static ValidationResult invalid(String reason, String details) {
            return new ValidationResult(false, FAILURE_CLASS, reason, details, null, null, null, null);
        }
    }
}
