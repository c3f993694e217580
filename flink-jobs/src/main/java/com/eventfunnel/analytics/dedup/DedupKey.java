package com.eventfunnel.analytics.dedup;

import com.eventfunnel.analytics.model.EventRecord;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identity of a (user, event type) pair. The string form is length-prefixed so that no pair of
 * distinct identities can collide, whatever characters the ids contain.
 */
public final class DedupKey implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String userId;
    private final String eventType;

    private DedupKey(String userId, String eventType) {
        this.userId = userId;
        this.eventType = eventType;
    }

    public static DedupKey of(EventRecord record) {
        return new DedupKey(record.userId(), record.eventType());
    }

    public static DedupKey of(String userId, String eventType) {
        return new DedupKey(Objects.requireNonNull(userId, "userId"), Objects.requireNonNull(eventType, "eventType"));
    }

    /** Stable string form used to partition keyed state. */
    public static String keyOf(EventRecord record) {
        return of(record).value();
    }

    public String userId() {
        return userId;
    }

    public String eventType() {
        return eventType;
    }

    public String value() {
        return userId.length() + ":" + userId + "|" + eventType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DedupKey)) {
            return false;
        }
        DedupKey that = (DedupKey) o;
        return userId.equals(that.userId) && eventType.equals(that.eventType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, eventType);
    }

    @Override
    public String toString() {
        return value();
    }
}
