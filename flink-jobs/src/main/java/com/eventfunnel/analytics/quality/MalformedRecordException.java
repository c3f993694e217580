package com.eventfunnel.analytics.quality;

import com.eventfunnel.analytics.model.RejectedRecord;

import java.util.List;

/**
 * Raised once normalization has dropped more malformed rows than the configured budget allows.
 * Carries the drop count and the sample of rejected rows.
 */
public class MalformedRecordException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient NormalizationDiagnostics diagnostics;

    public MalformedRecordException(NormalizationDiagnostics diagnostics, int maxDroppedRecords) {
        super("Dropped " + diagnostics.droppedCount() + " of " + diagnostics.totalCount()
                + " rows, exceeding the budget of " + maxDroppedRecords + " (reasons=" + diagnostics.droppedByReason() + ")");
        this.diagnostics = diagnostics;
    }

    public long droppedCount() {
        return diagnostics.droppedCount();
    }

    public List<RejectedRecord> sample() {
        return diagnostics.sample();
    }

    public NormalizationDiagnostics diagnostics() {
        return diagnostics;
    }
}
