package com.finplan.mgraph.api;

/**
 * Observability interface for monitoring recompute passes.
 *
 * <p>
 * Implementations are registered on the model and receive callbacks around
 * every incremental or full recompute. Typical uses are profiling (per-node
 * timings), tracing which metrics a change touched, and alerting on node
 * failures.
 *
 * <p>
 * Threading: {@link #onRecomputeStart} and {@link #onRecomputeEnd} run on the
 * caller's thread. {@link #onNodeEvaluated} and {@link #onNodeError} may run
 * concurrently on worker threads when a tier is evaluated in parallel, so
 * implementations must be thread-safe and cheap.
 */
public interface RecomputeListener {

    /**
     * Called once the affected set is known and before any node runs.
     *
     * @param batch         incrementing recompute counter
     * @param triggerId     metric whose change started the pass, or null for a
     *                      full recompute
     * @param affectedCount number of calculated metrics that will be evaluated
     */
    void onRecomputeStart(long batch, String triggerId, int affectedCount);

    /**
     * Called after a metric's formula was evaluated and its tensor written.
     *
     * @param tier          zero-based generation index within the pass
     * @param durationNanos evaluation time, including dimension alignment
     */
    void onNodeEvaluated(long batch, String metricId, int tier, long durationNanos);

    /**
     * Called when a metric's evaluation failed. The metric's tensor has been
     * zeroed and it is reported stale until it next evaluates cleanly.
     */
    void onNodeError(long batch, String metricId, Throwable error);

    /**
     * Called when a metric evaluated but some cells were not finite (0/0 in
     * months that have no data yet, for example). Those cells are stored as 0
     * and the metric is not considered failed.
     */
    default void onNodeWarning(long batch, String metricId, String message) {
    }

    /**
     * Called when the pass is complete, including on partial failure.
     *
     * @param evaluated metrics written successfully
     * @param failed    metrics that failed
     */
    void onRecomputeEnd(long batch, int evaluated, int failed);
}
