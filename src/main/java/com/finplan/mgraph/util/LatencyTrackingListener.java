package com.finplan.mgraph.util;

import com.finplan.mgraph.api.RecomputeListener;

import lombok.extern.log4j.Log4j2;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks wall-clock latency of whole recompute passes.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> min, max and average time per pass (nanoseconds).</li>
 * <li><b>Throughput:</b> number of passes.</li>
 * <li><b>Workload:</b> nodes evaluated and failed in the last pass.</li>
 * </ul>
 *
 * <p>
 * Start and end run on the recompute caller's thread; only the failure
 * counter is touched from workers.
 */
@Log4j2
public final class LatencyTrackingListener implements RecomputeListener {
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private final AtomicLong totalNodeErrors = new AtomicLong();

    private long passStartNanos, lastLatencyNanos;
    private long totalPasses, totalLatencyNanos;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;
    private int lastNodesEvaluated, lastNodesFailed;

    @Override
    public synchronized void onRecomputeStart(long batch, String triggerId, int affectedCount) {
        passStartNanos = System.nanoTime();
    }

    @Override
    public void onNodeEvaluated(long batch, String metricId, int tier, long durationNanos) {
        // per-node timing is NodeProfileListener's job
    }

    @Override
    public void onNodeError(long batch, String metricId, Throwable error) {
        totalNodeErrors.incrementAndGet();
        errLimiter.log(String.format("Recompute failure at metric '%s': %s", metricId, error.getMessage()), null);
    }

    @Override
    public synchronized void onRecomputeEnd(long batch, int evaluated, int failed) {
        lastLatencyNanos = System.nanoTime() - passStartNanos;
        lastNodesEvaluated = evaluated;
        lastNodesFailed = failed;
        totalPasses++;
        totalLatencyNanos += lastLatencyNanos;
        if (lastLatencyNanos < minLatencyNanos)
            minLatencyNanos = lastLatencyNanos;
        if (lastLatencyNanos > maxLatencyNanos)
            maxLatencyNanos = lastLatencyNanos;
    }

    public synchronized long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public synchronized double lastLatencyMicros() {
        return lastLatencyNanos / 1000.0;
    }

    public synchronized int lastNodesEvaluated() {
        return lastNodesEvaluated;
    }

    public synchronized int lastNodesFailed() {
        return lastNodesFailed;
    }

    public synchronized long totalPasses() {
        return totalPasses;
    }

    public long totalNodeErrors() {
        return totalNodeErrors.get();
    }

    public synchronized double avgLatencyNanos() {
        return totalPasses > 0 ? (double) totalLatencyNanos / totalPasses : 0;
    }

    public double avgLatencyMicros() {
        return avgLatencyNanos() / 1000.0;
    }

    public synchronized long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public synchronized long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    public synchronized void reset() {
        totalPasses = 0;
        totalLatencyNanos = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
        totalNodeErrors.set(0);
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-20s | %10s | %10s | %10s | %10s%n", "Metric", "Value", "Avg (us)", "Min (us)",
                "Max (us)"));
        sb.append("------------------------------------------------------------------------------------------\n");
        sb.append(String.format("%-20s | %10d | %10.2f | %10.2f | %10.2f%n",
                "Recompute passes",
                totalPasses(),
                avgLatencyMicros(),
                minLatencyNanos() / 1000.0,
                maxLatencyNanos() / 1000.0));
        sb.append(String.format("%-20s | %10d |%n", "Node errors", totalNodeErrors()));
        return sb.toString();
    }
}
