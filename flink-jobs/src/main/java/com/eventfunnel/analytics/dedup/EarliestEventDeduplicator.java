package com.eventfunnel.analytics.dedup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eventfunnel.analytics.model.EventRecord;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces a record stream to one record per (user, event type): the earliest by timestamp, and among equal
 * timestamps the one that appeared first in the input. Single pass, with state bounded by the number of
 * distinct pairs.
 */
public class EarliestEventDeduplicator {
    private static final Logger LOG = LoggerFactory.getLogger(EarliestEventDeduplicator.class);

    private final Map<DedupKey, EventRecord> best = new LinkedHashMap<>();
    private long acceptedCount;
    private long supersededCount;

    public static List<EventRecord> deduplicate(Iterator<EventRecord> records) {
        EarliestEventDeduplicator deduplicator = new EarliestEventDeduplicator();
        deduplicator.addAll(records);
        return deduplicator.result();
    }

    public static List<EventRecord> deduplicate(Iterable<EventRecord> records) {
        return deduplicate(records.iterator());
    }

    /**
     * Merges two partial results, each already deduplicated. The merge keeps the earliest candidate per pair,
     * so it is associative and commutative and partitions can be combined in any order.
     */
    public static List<EventRecord> merge(List<EventRecord> left, List<EventRecord> right) {
        EarliestEventDeduplicator deduplicator = new EarliestEventDeduplicator();
        deduplicator.addAll(left.iterator());
        deduplicator.addAll(right.iterator());
        return deduplicator.result();
    }

    public void addAll(Iterator<EventRecord> records) {
        while (records.hasNext()) {
            add(records.next());
        }
    }

    public void add(EventRecord record) {
        acceptedCount++;
        EventRecord current = best.putIfAbsent(DedupKey.of(record), record);
        if (current == null) {
            return;
        }
        if (record.isEarlierThan(current)) {
            supersededCount++;
            best.put(DedupKey.of(record), record);
        }
    }

    /** Deduplicated records in first-seen key order. */
    public List<EventRecord> result() {
        LOG.debug("Deduplicated {} records into {} (user, event type) pairs, {} superseded",
                acceptedCount, best.size(), supersededCount);
        return new ArrayList<>(best.values());
    }

    public int size() {
        return best.size();
    }

    /** Number of times a stored candidate was replaced by an earlier record. */
    long supersededCount() {
        return supersededCount;
    }
}
