package com.finplan.mgraph.util;

import com.finplan.mgraph.api.RecomputeListener;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Aggregates evaluation statistics per metric to find expensive formulas. */
public class NodeProfileListener implements RecomputeListener {

    public static class NodeStats {
        public final String name;
        public long count;
        public long errors;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;
        public long lastDurationNanos;

        public NodeStats(String name) {
            this.name = name;
        }

        synchronized void update(long duration) {
            count++;
            totalDurationNanos += duration;
            lastDurationNanos = duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        synchronized void error() {
            errors++;
        }

        synchronized void reset() {
            count = 0;
            errors = 0;
            totalDurationNanos = 0;
            lastDurationNanos = 0;
            minDurationNanos = Long.MAX_VALUE;
            maxDurationNanos = Long.MIN_VALUE;
        }

        public synchronized double avgMicros() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1000.0;
        }
    }

    // Metrics of one tier report concurrently.
    private final Map<String, NodeStats> stats = new ConcurrentHashMap<>();

    /** Stats for one metric, or null if it never evaluated. */
    public NodeStats get(String metricId) {
        return stats.get(metricId);
    }

    @Override
    public void onRecomputeStart(long batch, String triggerId, int affectedCount) {
        // No-op
    }

    @Override
    public void onNodeEvaluated(long batch, String metricId, int tier, long durationNanos) {
        stats.computeIfAbsent(metricId, NodeStats::new).update(durationNanos);
    }

    @Override
    public void onNodeError(long batch, String metricId, Throwable error) {
        stats.computeIfAbsent(metricId, NodeStats::new).error();
    }

    @Override
    public void onRecomputeEnd(long batch, int evaluated, int failed) {
        // No-op
    }

    /** Resets all collected statistics. */
    public void reset() {
        for (NodeStats s : stats.values())
            s.reset();
    }

    /** Formatted table of node statistics, most expensive first. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-30s | %10s | %6s | %10s | %10s | %10s | %10s%n", "Metric", "Count", "Errors",
                "Recent(us)", "Avg (us)", "Min (us)", "Max (us)"));
        sb.append(
                "---------------------------------------------------------------------------------------------------------------\n");

        List<NodeStats> valid = new ArrayList<>();
        for (NodeStats s : stats.values())
            if (s.count > 0 || s.errors > 0)
                valid.add(s);
        valid.sort((s1, s2) -> Long.compare(s2.totalDurationNanos, s1.totalDurationNanos));

        for (NodeStats s : valid) {
            synchronized (s) {
                sb.append(String.format("%-30s | %10d | %6d | %10.2f | %10.2f | %10.2f | %10.2f%n",
                        truncate(s.name, 30),
                        s.count,
                        s.errors,
                        s.lastDurationNanos / 1000.0,
                        s.avgMicros(),
                        s.count == 0 ? 0 : s.minDurationNanos / 1000.0,
                        s.count == 0 ? 0 : s.maxDurationNanos / 1000.0));
            }
        }
        return sb.toString();
    }

    private String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return s.substring(0, len - 3) + "...";
    }
}
