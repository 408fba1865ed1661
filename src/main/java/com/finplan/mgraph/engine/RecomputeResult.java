package com.finplan.mgraph.engine;

import java.util.List;

/**
 * Outcome of one recompute pass.
 *
 * @param affected      calculated metrics evaluated, in topological order
 * @param failed        subset of {@code affected} whose evaluation failed
 * @param tierCount     number of generations the pass was split into
 * @param durationNanos wall time of the whole pass
 */
public record RecomputeResult(List<String> affected, List<String> failed, int tierCount, long durationNanos) {

    public static final RecomputeResult EMPTY = new RecomputeResult(List.of(), List.of(), 0, 0);

    public boolean isEmpty() {
        return affected.isEmpty();
    }

    public double durationMillis() {
        return durationNanos / 1_000_000.0;
    }
}
