package com.eventfunnel.analytics.funnel;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eventfunnel.analytics.config.FunnelConfig;
import com.eventfunnel.analytics.dedup.EarliestEventDeduplicator;
import com.eventfunnel.analytics.model.ConversionRow;
import com.eventfunnel.analytics.model.EventRecord;
import com.eventfunnel.analytics.model.FunnelCount;
import com.eventfunnel.analytics.quality.EventRecordNormalizer;
import com.eventfunnel.analytics.quality.NormalizationDiagnostics;
import com.eventfunnel.analytics.ranking.GroupRanker;
import com.eventfunnel.analytics.ranking.GroupTotals;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Sequential funnel pipeline:
 * - Normalize raw rows (drop and report malformed ones)
 * - Keep the earliest event per (user, event type)
 * - Rank groups and select the top N
 * - Count distinct users per (top group, step)
 * - Derive conversion rates
 *
 * <p>Each run is a pure function of its input and the configuration; the engine keeps no state between runs.</p>
 */
public class FunnelEngine {
    private static final Logger LOG = LoggerFactory.getLogger(FunnelEngine.class);

    private final FunnelConfig config;
    private final GroupRanker ranker;
    private final FunnelAggregator aggregator;

    public FunnelEngine(FunnelConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.ranker = new GroupRanker(config);
        this.aggregator = new FunnelAggregator(config.funnelDefinition, config.unknownGroupLabel);
    }

    public FunnelReport run(Iterable<? extends JsonNode> rows) {
        return run(rows.iterator());
    }

    /**
     * @throws com.eventfunnel.analytics.quality.MalformedRecordException if the drop budget is exceeded
     */
    public FunnelReport run(Iterator<? extends JsonNode> rows) {
        EventRecordNormalizer normalizer = new EventRecordNormalizer(config);
        return runNormalized(normalizer.normalize(rows), normalizer.diagnostics());
    }

    /** Runs over JSON-encoded rows, one object per line. */
    public FunnelReport runLines(Iterator<String> lines) {
        EventRecordNormalizer normalizer = new EventRecordNormalizer(config);
        return runNormalized(normalizer.normalizeLines(lines), normalizer.diagnostics());
    }

    public FunnelReport runNormalized(Iterator<EventRecord> records, NormalizationDiagnostics diagnostics) {
        List<EventRecord> deduped = EarliestEventDeduplicator.deduplicate(records);
        if (diagnostics != null) {
            diagnostics.enforceBudget(config.maxDroppedRecords);
        }
        return summarize(deduped, diagnostics);
    }

    /**
     * Runs the stages after deduplication. The input must already hold at most one record per (user, event type),
     * e.g. the output of a partitioned deduplication.
     */
    public FunnelReport summarize(List<EventRecord> deduped, NormalizationDiagnostics diagnostics) {
        GroupTotals totals = ranker.totals(deduped);
        List<String> topGroups = ranker.selectTop(totals);
        List<FunnelCount> counts = aggregator.aggregate(deduped, topGroups);
        List<ConversionRow> conversions = ConversionCalculator.calculate(counts);

        LOG.info("Funnel run complete (funnel={}, dedupedEvents={}, groups={}, topGroups={}, rows={})",
                config.funnelDefinition.name(), deduped.size(), totals.size(), topGroups, counts.size());
        return new FunnelReport(topGroups, totals, counts, conversions, diagnostics, deduped.size());
    }
}
