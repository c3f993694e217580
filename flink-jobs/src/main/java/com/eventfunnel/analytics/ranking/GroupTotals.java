package com.eventfunnel.analytics.ranking;

import com.eventfunnel.analytics.config.RankingMetric;
import com.eventfunnel.analytics.model.EventRecord;
import com.eventfunnel.analytics.util.GroupLabels;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-group activity totals of one run.
 */
public final class GroupTotals implements Serializable {
    private static final long serialVersionUID = 1L;

    private final RankingMetric metric;
    private final Map<String, Long> counts;

    private GroupTotals(RankingMetric metric, Map<String, Long> counts) {
        this.metric = metric;
        this.counts = Collections.unmodifiableMap(counts);
    }

    /**
     * Totals deduplicated events per group. A missing group is counted under {@code unknownLabel}.
     */
    public static GroupTotals compute(Iterable<EventRecord> deduped, String unknownLabel, RankingMetric metric) {
        Map<String, Long> counts = new HashMap<>();
        if (metric == RankingMetric.UNIQUE_USERS) {
            Map<String, Set<String>> usersByGroup = new HashMap<>();
            for (EventRecord record : deduped) {
                usersByGroup.computeIfAbsent(GroupLabels.resolve(record.group(), unknownLabel), g -> new HashSet<>())
                        .add(record.userId());
            }
            usersByGroup.forEach((group, users) -> counts.put(group, (long) users.size()));
        } else {
            for (EventRecord record : deduped) {
                counts.merge(GroupLabels.resolve(record.group(), unknownLabel), 1L, Long::sum);
            }
        }
        return fromCounts(metric, counts);
    }

    /**
     * Wraps totals aggregated elsewhere, e.g. pre-aggregated by the caller or merged from partitions.
     */
    public static GroupTotals fromCounts(RankingMetric metric, Map<String, Long> counts) {
        return new GroupTotals(metric, new HashMap<>(counts));
    }

    public RankingMetric metric() {
        return metric;
    }

    /** Totals in no particular order. */
    public List<GroupTotal> entries() {
        List<GroupTotal> entries = new ArrayList<>(counts.size());
        counts.forEach((group, count) -> entries.add(new GroupTotal(group, count)));
        return entries;
    }

    /** All totals in rank order. Sorts the full group set; top-N selection does not need this. */
    public List<GroupTotal> ranked() {
        List<GroupTotal> ranked = entries();
        ranked.sort(GroupTotal.RANK_ORDER);
        return ranked;
    }

    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public long countOf(String group) {
        return counts.getOrDefault(group, 0L);
    }

    @Override
    public String toString() {
        return metric + ranked().toString();
    }
}
