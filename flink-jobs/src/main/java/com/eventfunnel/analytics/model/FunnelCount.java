package com.eventfunnel.analytics.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Distinct users of one group that reached one funnel step. Counts are raw and may increase between steps.
 */
public final class FunnelCount implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String group;
    private final int stepIndex;
    private final String eventType;
    private final long userCount;

    public FunnelCount(String group, int stepIndex, String eventType, long userCount) {
        this.group = group;
        this.stepIndex = stepIndex;
        this.eventType = eventType;
        this.userCount = userCount;
    }

    public String group() {
        return group;
    }

    /** One-based position in the funnel. */
    public int stepIndex() {
        return stepIndex;
    }

    public String eventType() {
        return eventType;
    }

    public long userCount() {
        return userCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FunnelCount)) {
            return false;
        }
        FunnelCount that = (FunnelCount) o;
        return stepIndex == that.stepIndex
                && userCount == that.userCount
                && Objects.equals(group, that.group)
                && Objects.equals(eventType, that.eventType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(group, stepIndex, eventType, userCount);
    }

    @Override
    public String toString() {
        return group + "/" + stepIndex + ":" + eventType + "=" + userCount;
    }
}
