package com.eventfunnel.analytics.ranking;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Objects;

/**
 * Activity total of one group.
 */
public final class GroupTotal implements Serializable {
    private static final long serialVersionUID = 1L;

    /** Highest total first; equal totals by ascending group label. */
    public static final Comparator<GroupTotal> RANK_ORDER = Comparator
            .comparingLong(GroupTotal::count).reversed()
            .thenComparing(GroupTotal::group);

    private final String group;
    private final long count;

    public GroupTotal(String group, long count) {
        this.group = Objects.requireNonNull(group, "group");
        this.count = count;
    }

    public String group() {
        return group;
    }

    public long count() {
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GroupTotal)) {
            return false;
        }
        GroupTotal that = (GroupTotal) o;
        return count == that.count && group.equals(that.group);
    }

    @Override
    public int hashCode() {
        return Objects.hash(group, count);
    }

    @Override
    public String toString() {
        return group + "=" + count;
    }
}
