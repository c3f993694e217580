package com.eventfunnel.analytics.ranking;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Bounded ranked accumulator: keeps the best {@code capacity} totals seen so far in a heap whose head is the
 * weakest kept entry, so each offer costs O(log capacity) however many groups stream through.
 */
final class TopNAccumulator {
    private final int capacity;
    private final PriorityQueue<GroupTotal> kept;

    TopNAccumulator(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.kept = new PriorityQueue<>(capacity, GroupTotal.RANK_ORDER.reversed());
    }

    void offer(GroupTotal candidate) {
        if (kept.size() < capacity) {
            kept.add(candidate);
            return;
        }
        if (GroupTotal.RANK_ORDER.compare(candidate, kept.peek()) < 0) {
            kept.poll();
            kept.add(candidate);
        }
    }

    /** Kept entries, best first. */
    List<GroupTotal> ranked() {
        List<GroupTotal> ranked = new ArrayList<>(kept);
        ranked.sort(GroupTotal.RANK_ORDER);
        return ranked;
    }
}
