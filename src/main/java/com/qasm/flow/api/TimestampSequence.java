package com.qasm.flow.api;

import java.util.Collection;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordered mapping from time-key to {@link GraphSnapshot}.
 *
 * <p>
 * Key 0 holds the declared bits with no edges. Every further key is the
 * line counter of an instruction line that added a gate. Keys enumerate in
 * ascending order.
 */
public final class TimestampSequence {
    private final NavigableMap<Integer, GraphSnapshot> snapshots;

    public TimestampSequence(NavigableMap<Integer, GraphSnapshot> snapshots) {
        if (!snapshots.containsKey(0))
            throw new IllegalArgumentException("Timestamp sequence must contain key 0");
        this.snapshots = Collections.unmodifiableNavigableMap(new TreeMap<>(snapshots));
    }

    @JsonValue
    public NavigableMap<Integer, GraphSnapshot> asMap() {
        return snapshots;
    }

    public NavigableSet<Integer> timeKeys() {
        return snapshots.navigableKeySet();
    }

    public Collection<GraphSnapshot> snapshots() {
        return snapshots.values();
    }

    /** Snapshot stored under {@code timeKey}; throws if no line changed the graph there. */
    public GraphSnapshot get(int timeKey) {
        GraphSnapshot s = snapshots.get(timeKey);
        if (s == null)
            throw new IllegalArgumentException("No snapshot at time-key " + timeKey + "; keys: " + timeKeys());
        return s;
    }

    public boolean contains(int timeKey) {
        return snapshots.containsKey(timeKey);
    }

    /** Latest snapshot at or before {@code timeKey}, i.e. the graph as a player would show it. */
    public GraphSnapshot at(int timeKey) {
        var entry = snapshots.floorEntry(timeKey);
        if (entry == null)
            throw new IllegalArgumentException("Negative time-key: " + timeKey);
        return entry.getValue();
    }

    public GraphSnapshot initial() {
        return snapshots.get(0);
    }

    public GraphSnapshot latest() {
        return snapshots.lastEntry().getValue();
    }

    public int size() {
        return snapshots.size();
    }
}
