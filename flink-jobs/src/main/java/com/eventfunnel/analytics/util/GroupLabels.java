package com.eventfunnel.analytics.util;

/**
 * Group attribution shared by ranking and aggregation, so both stages agree on where unattributed activity goes.
 */
public final class GroupLabels {
    private GroupLabels() {}

    public static String resolve(String group, String unknownLabel) {
        return StringSemantics.orDefault(group, unknownLabel);
    }
}
