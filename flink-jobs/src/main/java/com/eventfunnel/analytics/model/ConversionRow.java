package com.eventfunnel.analytics.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Conversion rates of one funnel step within one group. A null rate means the rate is undefined
 * (first step, or a zero denominator), never zero.
 */
public final class ConversionRow implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String group;
    private final int stepIndex;
    private final String eventType;
    private final Double stepConversionRate;
    private final Double cumulativeConversionRate;
    private final Double dropOffRate;

    public ConversionRow(
            String group,
            int stepIndex,
            String eventType,
            Double stepConversionRate,
            Double cumulativeConversionRate,
            Double dropOffRate) {
        this.group = group;
        this.stepIndex = stepIndex;
        this.eventType = eventType;
        this.stepConversionRate = stepConversionRate;
        this.cumulativeConversionRate = cumulativeConversionRate;
        this.dropOffRate = dropOffRate;
    }

    public String group() {
        return group;
    }

    public int stepIndex() {
        return stepIndex;
    }

    public String eventType() {
        return eventType;
    }

    public Double stepConversionRate() {
        return stepConversionRate;
    }

    public Double cumulativeConversionRate() {
        return cumulativeConversionRate;
    }

    public Double dropOffRate() {
        return dropOffRate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConversionRow)) {
            return false;
        }
        ConversionRow that = (ConversionRow) o;
        return stepIndex == that.stepIndex
                && Objects.equals(group, that.group)
                && Objects.equals(eventType, that.eventType)
                && Objects.equals(stepConversionRate, that.stepConversionRate)
                && Objects.equals(cumulativeConversionRate, that.cumulativeConversionRate)
                && Objects.equals(dropOffRate, that.dropOffRate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(group, stepIndex, eventType, stepConversionRate, cumulativeConversionRate, dropOffRate);
    }

    @Override
    public String toString() {
        return group + "/" + stepIndex + ":" + eventType
                + " step=" + stepConversionRate + " cumulative=" + cumulativeConversionRate + " dropOff=" + dropOffRate;
    }
}
