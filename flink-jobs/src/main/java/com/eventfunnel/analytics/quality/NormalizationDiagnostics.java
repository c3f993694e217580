package com.eventfunnel.analytics.quality;

import com.eventfunnel.analytics.model.RejectedRecord;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Running tally of a normalization pass: accepted rows, dropped rows per reason, and a bounded sample of
 * rejection envelopes in input order.
 */
public class NormalizationDiagnostics implements Serializable {
    private static final long serialVersionUID = 1L;

    private final int sampleSize;
    private final List<RejectedRecord> sample = new ArrayList<>();
    private final Map<String, Long> droppedByReason = new TreeMap<>();
    private long acceptedCount;
    private long droppedCount;

    public NormalizationDiagnostics(int sampleSize) {
        this.sampleSize = Math.max(0, sampleSize);
    }

    void recordAccepted() {
        acceptedCount++;
    }

    void recordDropped(RejectedRecord rejected) {
        droppedCount++;
        String reason = rejected.failure == null ? "unknown" : rejected.failure.reason;
        droppedByReason.merge(reason, 1L, Long::sum);
        if (sample.size() < sampleSize) {
            sample.add(rejected);
        }
    }

    public long acceptedCount() {
        return acceptedCount;
    }

    public long droppedCount() {
        return droppedCount;
    }

    public long totalCount() {
        return acceptedCount + droppedCount;
    }

    public double dropRate() {
        long total = totalCount();
        return total == 0 ? 0.0 : (double) droppedCount / total;
    }

    public Map<String, Long> droppedByReason() {
        return Collections.unmodifiableMap(droppedByReason);
    }

    public List<RejectedRecord> sample() {
        return Collections.unmodifiableList(sample);
    }

    /**
     * @param maxDroppedRecords drop budget, or a negative value for no budget
     * @throws MalformedRecordException if more rows were dropped than the budget allows
     */
    public void enforceBudget(int maxDroppedRecords) {
        if (maxDroppedRecords >= 0 && droppedCount > maxDroppedRecords) {
            throw new MalformedRecordException(this, maxDroppedRecords);
        }
    }

    @Override
    public String toString() {
        return "accepted=" + acceptedCount + ", dropped=" + droppedCount + ", reasons=" + droppedByReason;
    }
}
