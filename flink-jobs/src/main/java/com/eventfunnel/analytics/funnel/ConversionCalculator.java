package com.eventfunnel.analytics.funnel;

import com.eventfunnel.analytics.model.ConversionRow;
import com.eventfunnel.analytics.model.FunnelCount;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Derives step, cumulative and drop-off rates from funnel counts, independently per group.
 *
 * <p>Expects the aggregator's ordering: rows of a group are contiguous and ascend by step index from 1.
 * Rates are plain ratios, neither clamped nor rounded; a zero denominator yields null.</p>
 */
public final class ConversionCalculator {
    private ConversionCalculator() {}

    public static List<ConversionRow> calculate(List<FunnelCount> counts) {
        List<ConversionRow> rows = new ArrayList<>(counts.size());
        FunnelCount first = null;
        FunnelCount previous = null;
        for (FunnelCount count : counts) {
            boolean newGroup = previous == null || !Objects.equals(previous.group(), count.group());
            if (newGroup) {
                if (count.stepIndex() != 1) {
                    throw new IllegalArgumentException("Funnel counts of group " + count.group()
                            + " must start at step 1, got step " + count.stepIndex());
                }
                first = count;
                rows.add(new ConversionRow(count.group(), 1, count.eventType(), null, 1.0, null));
            } else {
                if (count.stepIndex() != previous.stepIndex() + 1) {
                    throw new IllegalArgumentException("Funnel counts of group " + count.group()
                            + " are not in step order at step " + count.stepIndex());
                }
                Double stepRate = ratio(count.userCount(), previous.userCount());
                Double cumulativeRate = ratio(count.userCount(), first.userCount());
                Double dropOff = stepRate == null ? null : 1.0 - stepRate;
                rows.add(new ConversionRow(count.group(), count.stepIndex(), count.eventType(), stepRate, cumulativeRate, dropOff));
            }
            previous = count;
        }
        return rows;
    }

    static Double ratio(long numerator, long denominator) {
        return denominator > 0 ? (double) numerator / denominator : null;
    }
}
