package com.eventfunnel.analytics.funnel;

import com.eventfunnel.analytics.config.FunnelDefinition;
import com.eventfunnel.analytics.model.EventRecord;
import com.eventfunnel.analytics.model.FunnelCount;
import com.eventfunnel.analytics.util.GroupLabels;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Counts distinct users per (group, step) over deduplicated events.
 *
 * <p>Output is dense over top groups x funnel steps and ordered by group (in the given top-group order), then by
 * step index. Events of types outside the funnel, or of groups outside the top groups, are ignored.</p>
 */
public class FunnelAggregator {
    private final FunnelDefinition funnel;
    private final String unknownLabel;

    public FunnelAggregator(FunnelDefinition funnel, String unknownLabel) {
        this.funnel = funnel;
        this.unknownLabel = unknownLabel;
    }

    public List<FunnelCount> aggregate(Iterable<EventRecord> deduped, List<String> topGroups) {
        Map<String, List<Set<String>>> usersByGroupStep = new HashMap<>();
        for (String group : topGroups) {
            List<Set<String>> steps = new ArrayList<>(funnel.size());
            for (int i = 0; i < funnel.size(); i++) {
                steps.add(new HashSet<>());
            }
            usersByGroupStep.put(group, steps);
        }

        for (EventRecord record : deduped) {
            int stepIndex = funnel.stepIndexOf(record.eventType());
            if (stepIndex < 0) {
                continue;
            }
            List<Set<String>> steps = usersByGroupStep.get(GroupLabels.resolve(record.group(), unknownLabel));
            if (steps == null) {
                continue;
            }
            steps.get(stepIndex - 1).add(record.userId());
        }

        List<FunnelCount> counts = new ArrayList<>(topGroups.size() * funnel.size());
        for (String group : topGroups) {
            List<Set<String>> steps = usersByGroupStep.get(group);
            for (int stepIndex = 1; stepIndex <= funnel.size(); stepIndex++) {
                counts.add(new FunnelCount(group, stepIndex, funnel.eventTypeAt(stepIndex), steps.get(stepIndex - 1).size()));
            }
        }
        return counts;
    }
}
