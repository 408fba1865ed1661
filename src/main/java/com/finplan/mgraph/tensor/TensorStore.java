package com.finplan.mgraph.tensor;

import com.finplan.mgraph.dim.DimensionCatalog;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sole owner of every metric's values.
 *
 * <p>
 * The map is concurrent so that tier workers can read dependency tensors while
 * other workers of the same tier write their own node's tensor. A worker only
 * ever writes the tensor of the node it evaluates.
 */
public final class TensorStore {
    private final DimensionCatalog catalog;
    private final Map<String, Tensor> tensors = new ConcurrentHashMap<>();
    private volatile TimeHorizon horizon = TimeHorizon.NONE;

    public TensorStore(DimensionCatalog catalog) {
        this.catalog = catalog;
    }

    public TimeHorizon horizon() {
        return horizon;
    }

    public void setHorizon(TimeHorizon horizon) {
        this.horizon = horizon;
    }

    /** Shape of a metric declaring {@code dims}: each dim's size, then the horizon. */
    public int[] shapeFor(List<String> dims) {
        int[] shape = new int[dims.size() + 1];
        for (int i = 0; i < dims.size(); i++)
            shape[i] = catalog.sizeOf(dims.get(i));
        shape[dims.size()] = horizon.length();
        return shape;
    }

    /** Allocates (or replaces) a zero-filled tensor for a metric. */
    public Tensor allocate(String metricId, List<String> dims) {
        Tensor t = Tensor.zeros(shapeFor(dims));
        tensors.put(metricId, t);
        return t;
    }

    /** The metric's tensor, or null if none has been allocated. */
    public Tensor get(String metricId) {
        return tensors.get(metricId);
    }

    /** The metric's tensor, or an all-zero tensor of its shape if none exists yet. */
    public Tensor read(String metricId, List<String> dims) {
        Tensor t = tensors.get(metricId);
        return t != null ? t : Tensor.zeros(shapeFor(dims));
    }

    public boolean contains(String metricId) {
        return tensors.containsKey(metricId);
    }

    public void remove(String metricId) {
        tensors.remove(metricId);
    }

    public void put(String metricId, Tensor tensor) {
        tensors.put(metricId, tensor);
    }

    public Set<String> ids() {
        return tensors.keySet();
    }
}
