package com.eventfunnel.analytics.ranking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eventfunnel.analytics.config.ConfigurationException;
import com.eventfunnel.analytics.config.FunnelConfig;
import com.eventfunnel.analytics.config.RankingMetric;
import com.eventfunnel.analytics.model.EventRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects the N most active groups. Ties rank by ascending group label, so the selection never depends on
 * input order, and the top k is always a prefix of the top k+1.
 */
public class GroupRanker {
    private static final Logger LOG = LoggerFactory.getLogger(GroupRanker.class);

    private final int topN;
    private final String unknownLabel;
    private final RankingMetric metric;

    public GroupRanker(FunnelConfig config) {
        this(config.topNGroups, config.unknownGroupLabel, config.rankingMetric);
    }

    public GroupRanker(int topN, String unknownLabel, RankingMetric metric) {
        if (topN <= 0) {
            throw new ConfigurationException("top_n_groups must be positive, got " + topN);
        }
        this.topN = topN;
        this.unknownLabel = unknownLabel;
        this.metric = metric;
    }

    public GroupTotals totals(Iterable<EventRecord> deduped) {
        return GroupTotals.compute(deduped, unknownLabel, metric);
    }

    public List<String> selectTop(Iterable<EventRecord> deduped) {
        return selectTop(totals(deduped));
    }

    public List<String> selectTop(GroupTotals totals) {
        TopNAccumulator accumulator = new TopNAccumulator(topN);
        for (GroupTotal total : totals.entries()) {
            accumulator.offer(total);
        }
        List<String> top = new ArrayList<>(topN);
        for (GroupTotal total : accumulator.ranked()) {
            top.add(total.group());
        }
        LOG.info("Selected top {} of {} groups by {}: {}", top.size(), totals.size(), metric, top);
        return top;
    }
}
