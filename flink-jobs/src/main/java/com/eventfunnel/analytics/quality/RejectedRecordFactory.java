package com.eventfunnel.analytics.quality;

import com.fasterxml.jackson.databind.JsonNode;

import com.eventfunnel.analytics.model.RejectedRecord;
import com.eventfunnel.analytics.util.JsonNodeUtils;

/**
 * Builds rejection envelopes for the failure modes of the normalization stage.
 */
public final class RejectedRecordFactory {
    static final String STAGE_DESERIALIZATION = "DESERIALIZATION";
    static final String STAGE_VALIDATION = "VALIDATION";

    private RejectedRecordFactory() {}

    public static RejectedRecord forParseFailure(long rowIndex, String rawLine, Exception ex) {
        String details = ex == null ? "Unknown parse error"
                : (ex.getMessage() == null || ex.getMessage().isBlank()
                ? ex.getClass().getName()
                : ex.getClass().getName() + ": " + ex.getMessage());
        RejectedRecord rejected = baseRecord(rowIndex, rawLine);
        rejected.failure = buildFailure(STAGE_DESERIALIZATION, "DESERIALIZATION_FAILED", "json_parse_error", details);
        return rejected;
    }

    public static RejectedRecord forValidationFailure(
            long rowIndex,
            JsonNode root,
            RecordValidator.ValidationResult validation) {
        RejectedRecord rejected = baseRecord(rowIndex, root == null ? null : root.toString());
        if (root != null && root.isObject()) {
            rejected.identity.userId = JsonNodeUtils.asNullableText(root.get(RecordValidator.USER_ID_FIELD));
            rejected.identity.eventType = JsonNodeUtils.asNullableText(root.get(RecordValidator.EVENT_TYPE_FIELD));
        }
        rejected.failure = buildFailure(STAGE_VALIDATION, validation.failureClass, validation.reason, validation.details);
        return rejected;
    }

    private static RejectedRecord baseRecord(long rowIndex, String body) {
        RejectedRecord rejected = new RejectedRecord();
        rejected.schemaVersion = "v1";
        rejected.rowIndex = rowIndex;
        rejected.identity = new RejectedRecord.Identity();
        rejected.payload = new RejectedRecord.Payload();
        rejected.payload.encoding = "json";
        rejected.payload.body = body;
        return rejected;
    }

    private static RejectedRecord.FailureDetails buildFailure(String stage, String failureClass, String reason, String details) {
        RejectedRecord.FailureDetails failure = new RejectedRecord.FailureDetails();
        failure.stage = stage;
        failure.failureClass = failureClass;
        failure.reason = reason;
        failure.details = details;
        return failure;
    }
}
