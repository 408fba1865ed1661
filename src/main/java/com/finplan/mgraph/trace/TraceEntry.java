package com.finplan.mgraph.trace;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Provenance of one input-triggered recompute: who changed which metric, what
 * was recomputed as a result, and how long it took.
 *
 * @param affectedNodes recomputed metrics in evaluation order
 */
public record TraceEntry(UUID id, Instant createdAt, String triggerNodeId, String triggerUserId,
        List<String> affectedNodes, double durationMs) {

    public TraceEntry {
        affectedNodes = List.copyOf(affectedNodes);
    }

    public static TraceEntry of(String triggerNodeId, String triggerUserId, List<String> affectedNodes,
            double durationMs) {
        return new TraceEntry(UUID.randomUUID(), Instant.now(), triggerNodeId, triggerUserId, affectedNodes,
                durationMs);
    }
}
