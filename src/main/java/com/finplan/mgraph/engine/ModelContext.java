package com.finplan.mgraph.engine;

import com.finplan.mgraph.dim.DimensionCatalog;
import com.finplan.mgraph.formula.FormulaCompiler;
import com.finplan.mgraph.formula.SafeIdCache;
import com.finplan.mgraph.model.MetricRegistry;
import com.finplan.mgraph.tensor.TensorStore;

/**
 * The live state of one model.
 *
 * <p>
 * Groups the collaborators every layer needs: dimensions, metric metadata,
 * tensor values, the dependency structure and the formula compiler with its
 * model-scoped safe-id cache. One context per model instance; nothing here is
 * static or shared between models.
 */
public final class ModelContext {
    private final String name;
    private final DimensionCatalog dimensions = new DimensionCatalog();
    private final MetricRegistry metrics = new MetricRegistry();
    private final TensorStore tensors = new TensorStore(dimensions);
    private final DependencyGraph graph = new DependencyGraph();
    private final SafeIdCache safeIds = new SafeIdCache();
    private final FormulaCompiler compiler = new FormulaCompiler(safeIds);

    public ModelContext(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public DimensionCatalog dimensions() {
        return dimensions;
    }

    public MetricRegistry metrics() {
        return metrics;
    }

    public TensorStore tensors() {
        return tensors;
    }

    public DependencyGraph graph() {
        return graph;
    }

    public SafeIdCache safeIds() {
        return safeIds;
    }

    public FormulaCompiler compiler() {
        return compiler;
    }
}
