package com.eventfunnel.analytics.pipeline;

import com.eventfunnel.analytics.model.ConversionRow;
import com.eventfunnel.analytics.model.FunnelCount;
import com.eventfunnel.analytics.model.RejectedRecord;

/**
 * Row mappers for the report tables. Column names are the external contract of the report files.
 */
public final class ReportRowMappers {
    private ReportRowMappers() {}

    public static String funnelCountRow(FunnelCount count) {
        return JsonRow.create()
                .addString("group", count.group())
                .addInt("step_index", count.stepIndex())
                .addString("event_type", count.eventType())
                .addLong("user_count", count.userCount())
                .build();
    }

    public static String conversionRow(ConversionRow row) {
        return JsonRow.create()
                .addString("group", row.group())
                .addInt("step_index", row.stepIndex())
                .addString("event_type", row.eventType())
                .addNullableDouble("step_conversion_rate", row.stepConversionRate())
                .addNullableDouble("cumulative_conversion_rate", row.cumulativeConversionRate())
                .addNullableDouble("drop_off_rate", row.dropOffRate())
                .build();
    }

    public static String rejectedRow(RejectedRecord rejected) {
        JsonRow row = JsonRow.create()
                .addString("schema_version", rejected.schemaVersion)
                .addLong("row_index", rejected.rowIndex);
        if (rejected.failure != null) {
            row.addString("stage", rejected.failure.stage)
                    .addString("failure_class", rejected.failure.failureClass)
                    .addString("reason", rejected.failure.reason)
                    .addNullableString("details", rejected.failure.details);
        }
        if (rejected.identity != null) {
            row.addNullableString("user_id", rejected.identity.userId)
                    .addNullableString("event_type", rejected.identity.eventType);
        }
        if (rejected.payload != null) {
            row.addString("payload_encoding", rejected.payload.encoding)
                    .addNullableString("payload_body", rejected.payload.body);
        }
        return row.build();
    }
}
