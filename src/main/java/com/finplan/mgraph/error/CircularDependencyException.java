package com.finplan.mgraph.error;

import java.util.List;

/**
 * Raised when a formula assignment would close a loop in the dependency graph.
 * The graph is left exactly as it was before the rejected call.
 */
public final class CircularDependencyException extends ModelException {
    private final List<String> cycle;
    private final String suggestion;

    public CircularDependencyException(List<String> cycle, String suggestion) {
        super(ErrorKind.CIRCULAR_DEPENDENCY,
                "Circular dependency: " + String.join(" -> ", cycle) + " -> " + cycle.get(0) + ". " + suggestion);
        this.cycle = List.copyOf(cycle);
        this.suggestion = suggestion;
    }

    /** The offending loop in edge order; the last id feeds back into the first. */
    public List<String> cycle() {
        return cycle;
    }

    public String suggestion() {
        return suggestion;
    }
}
