package com.finplan.mgraph.trace;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded append-only history of {@link TraceEntry} records.
 *
 * <p>
 * Fixed-capacity ring buffer; once full, each append overwrites the oldest
 * entry. Appends and reads lock the buffer briefly and readers get a copy.
 */
public final class ExplainabilityLog {
    public static final int DEFAULT_CAPACITY = 1000;

    private final TraceEntry[] ring;
    private int head; // next write slot
    private int size;
    private long totalAppended;

    public ExplainabilityLog() {
        this(DEFAULT_CAPACITY);
    }

    public ExplainabilityLog(int capacity) {
        if (capacity < 1)
            throw new IllegalArgumentException("Trace capacity must be positive: " + capacity);
        this.ring = new TraceEntry[capacity];
    }

    public synchronized void append(TraceEntry entry) {
        ring[head] = entry;
        head = (head + 1) % ring.length;
        if (size < ring.length)
            size++;
        totalAppended++;
    }

    /** The most recent {@code limit} entries, oldest first. */
    public synchronized List<TraceEntry> recent(int limit) {
        int n = Math.max(0, Math.min(limit, size));
        List<TraceEntry> out = new ArrayList<>(n);
        int start = head - n;
        if (start < 0)
            start += ring.length;
        for (int i = 0; i < n; i++)
            out.add(ring[(start + i) % ring.length]);
        return out;
    }

    public synchronized int size() {
        return size;
    }

    public int capacity() {
        return ring.length;
    }

    /** Entries ever appended, including ones already overwritten. */
    public synchronized long totalAppended() {
        return totalAppended;
    }

    public synchronized void clear() {
        java.util.Arrays.fill(ring, null);
        head = 0;
        size = 0;
    }
}
