package com.finplan.mgraph.engine;

import java.util.Set;

/**
 * Stale metrics and pass state of a scheduler at one point in time.
 *
 * @see IncrementalScheduler#status()
 */
public record RecomputeStatus(Set<String> stale, RecomputeState state) {

    public RecomputeStatus {
        stale = Set.copyOf(stale);
    }
}
