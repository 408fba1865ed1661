package com.finplan.mgraph.util;

import com.finplan.mgraph.engine.DependencyGraph;
import com.finplan.mgraph.engine.ModelContext;
import com.finplan.mgraph.engine.TopologicalOrder;
import com.finplan.mgraph.model.Metric;
import com.finplan.mgraph.tensor.Tensor;

import java.util.Arrays;
import java.util.Iterator;
import java.util.Set;

/**
 * Diagnostic utility for inspecting model state and topology.
 *
 * <p>
 * Generates human-readable descriptions of single metrics, a text dump of the
 * topological order, and a Mermaid diagram of the DAG.
 *
 * <p>
 * <b>Usage:</b> debugging sessions and error reports. Allocates freely; not
 * for use inside a recompute.
 */
public final class ModelExplain {
    private final ModelContext ctx;

    public ModelExplain(ModelContext ctx) {
        this.ctx = ctx;
    }

    /** Dumps the definition and current totals of one metric. */
    public String explainNode(String metricId) {
        Metric m = ctx.metrics().require(metricId);
        DependencyGraph graph = ctx.graph();
        Tensor t = ctx.tensors().get(metricId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Metric: ").append(metricId).append('\n')
                .append("  Name: ").append(m.displayName()).append('\n')
                .append("  Category: ").append(m.category()).append('\n')
                .append("  Type: ").append(m.isCalculated() ? "formula" : "input")
                .append(m.isPlaceholder() ? " (placeholder)" : "").append('\n')
                .append("  Dims: ").append(m.dims()).append('\n')
                .append("  Shape: ").append(t == null ? "unallocated" : Arrays.toString(t.shape())).append('\n');
        if (m.isCalculated())
            sb.append("  Formula: ").append(m.formula().source()).append('\n');
        if (t != null)
            sb.append("  Total: ").append(String.format("%.4f", t.sum())).append('\n');
        appendIds(sb.append("  Depends on: "), graph.predecessors(metricId));
        appendIds(sb.append("  Impacts: "), graph.successors(metricId));
        return sb.toString();
    }

    /** Dumps the topology in evaluation order. */
    public String dumpTopology() {
        TopologicalOrder topology = ctx.graph().order();
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Model ").append(ctx.name()).append(" (").append(topology.nodeCount()).append(" metrics):\n");
        for (int i = 0; i < topology.nodeCount(); i++) {
            sb.append("  [").append(i).append("] ").append(topology.node(i));
            if (topology.isSource(i))
                sb.append(" (INPUT)");
            int cc = topology.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append(topology.node(topology.child(i, j)));
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid flowchart of the DAG, inputs drawn as stadiums and
     * formulas as boxes, each labelled with the metric's current total.
     */
    public String toMermaid() {
        TopologicalOrder topology = ctx.graph().order();
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Nodes in topological order
        for (int i = 0; i < topology.nodeCount(); i++) {
            String id = topology.node(i);
            Metric m = ctx.metrics().get(id);
            String label = (m == null ? id : m.displayName()).replace("\"", "'");
            Tensor t = ctx.tensors().get(id);
            String value = String.format("%.4f", t == null ? 0.0 : t.sum());
            boolean input = m == null || !m.isCalculated();
            sb.append("  ").append(sanitize(id))
                    .append(input ? "([\"" : "[\"")
                    .append(label).append("<br/>").append(value)
                    .append(input ? "\"]);\n" : "\"];\n");
        }

        // 2. Edges afterwards
        for (int i = 0; i < topology.nodeCount(); i++) {
            String from = sanitize(topology.node(i));
            int cc = topology.childCount(i);
            for (int j = 0; j < cc; j++)
                sb.append("  ").append(from).append(" --> ").append(sanitize(topology.node(topology.child(i, j))))
                        .append(";\n");
        }
        return sb.toString();
    }

    private static void appendIds(StringBuilder sb, Set<String> ids) {
        sb.append('(').append(ids.size()).append(") ");
        for (Iterator<String> it = ids.iterator(); it.hasNext();) {
            sb.append(it.next());
            if (it.hasNext())
                sb.append(", ");
        }
        sb.append('\n');
    }

    static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
