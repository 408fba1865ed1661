package com.finplan.mgraph.model;

import java.util.List;

/** Whole-graph listing for visualization. */
public record DagMetadata(List<Node> nodes, List<Edge> edges) {

    public static final String TYPE_FORMULA = "formula";
    public static final String TYPE_INPUT = "input";

    public DagMetadata {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    /** @param type {@value #TYPE_FORMULA} or {@value #TYPE_INPUT} */
    public record Node(String id, String name, String type, String category) {
    }

    /** Dependency {@code source} feeds dependent {@code target}. */
    public record Edge(String source, String target) {
    }
}
