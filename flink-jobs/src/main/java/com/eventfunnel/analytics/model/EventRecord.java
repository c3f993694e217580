package com.eventfunnel.analytics.model;

import com.eventfunnel.analytics.util.JsonNodeUtils;

import java.io.Serializable;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Immutable, normalized event row. The timestamp keeps the full precision of the source (epoch second plus
 * nano-of-second). {@code sequence} is the zero-based position of the raw row in the input and orders records
 * that share a timestamp.
 */
public final class EventRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    /** Earliest first: timestamp, then input position. */
    public static final Comparator<EventRecord> EARLIEST_FIRST = Comparator
            .comparingLong(EventRecord::epochSecond)
            .thenComparingInt(EventRecord::nano)
            .thenComparingLong(EventRecord::sequence);

    private final String userId;
    private final String eventType;
    private final long epochSecond;
    private final int nano;
    private final String group;
    private final long sequence;

    public EventRecord(String userId, String eventType, Instant timestamp, String group, long sequence) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.eventType = Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(timestamp, "timestamp");
        this.epochSecond = timestamp.getEpochSecond();
        this.nano = timestamp.getNano();
        this.group = group;
        this.sequence = sequence;
    }

    public EventRecord(String userId, String eventType, long epochMicros, String group, long sequence) {
        this(userId, eventType, JsonNodeUtils.fromMicros(epochMicros), group, sequence);
    }

    public String userId() {
        return userId;
    }

    public String eventType() {
        return eventType;
    }

    public long epochSecond() {
        return epochSecond;
    }

    public int nano() {
        return nano;
    }

    public Instant timestamp() {
        return Instant.ofEpochSecond(epochSecond, nano);
    }

    /** Group as reported by the source; null when unattributed. */
    public String group() {
        return group;
    }

    public long sequence() {
        return sequence;
    }

    public boolean isEarlierThan(EventRecord other) {
        return EARLIEST_FIRST.compare(this, other) < 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventRecord)) {
            return false;
        }
        EventRecord that = (EventRecord) o;
        return epochSecond == that.epochSecond
                && nano == that.nano
                && sequence == that.sequence
                && userId.equals(that.userId)
                && eventType.equals(that.eventType)
                && Objects.equals(group, that.group);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, eventType, epochSecond, nano, group, sequence);
    }

    @Override
    public String toString() {
        return "EventRecord{userId=" + userId + ", eventType=" + eventType + ", timestamp=" + timestamp()
                + ", group=" + group + ", sequence=" + sequence + "}";
    }
}
