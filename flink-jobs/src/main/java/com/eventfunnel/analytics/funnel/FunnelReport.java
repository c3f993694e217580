package com.eventfunnel.analytics.funnel;

import com.eventfunnel.analytics.model.ConversionRow;
import com.eventfunnel.analytics.model.FunnelCount;
import com.eventfunnel.analytics.quality.NormalizationDiagnostics;
import com.eventfunnel.analytics.ranking.GroupTotals;

import java.util.Collections;
import java.util.List;

/**
 * Result of one funnel run.
 */
public final class FunnelReport {
    private final List<String> topGroups;
    private final GroupTotals groupTotals;
    private final List<FunnelCount> funnelCounts;
    private final List<ConversionRow> conversionRows;
    private final NormalizationDiagnostics diagnostics;
    private final long dedupedEventCount;

    public FunnelReport(
            List<String> topGroups,
            GroupTotals groupTotals,
            List<FunnelCount> funnelCounts,
            List<ConversionRow> conversionRows,
            NormalizationDiagnostics diagnostics,
            long dedupedEventCount) {
        this.topGroups = Collections.unmodifiableList(topGroups);
        this.groupTotals = groupTotals;
        this.funnelCounts = Collections.unmodifiableList(funnelCounts);
        this.conversionRows = Collections.unmodifiableList(conversionRows);
        this.diagnostics = diagnostics;
        this.dedupedEventCount = dedupedEventCount;
    }

    public List<String> topGroups() {
        return topGroups;
    }

    public GroupTotals groupTotals() {
        return groupTotals;
    }

    public List<FunnelCount> funnelCounts() {
        return funnelCounts;
    }

    public List<ConversionRow> conversionRows() {
        return conversionRows;
    }

    /** Normalization tally; null when the run started from already-normalized records. */
    public NormalizationDiagnostics diagnostics() {
        return diagnostics;
    }

    public long dedupedEventCount() {
        return dedupedEventCount;
    }
}
