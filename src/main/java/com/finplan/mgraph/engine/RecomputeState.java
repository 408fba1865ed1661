package com.finplan.mgraph.engine;

/** Phase of the most recent recompute pass. */
public enum RecomputeState {
    IDLE,
    AFFECTED_SET_COMPUTED,
    TIERED,
    EVALUATING,
    DONE,
    /** Finished, but at least one node failed and is stale. */
    PARTIAL_FAILURE
}
