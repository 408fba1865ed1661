package com.finplan.mgraph.model;

import com.finplan.mgraph.formula.CompiledFormula;

import java.util.List;

/**
 * Metadata of one node in the metric graph.
 *
 * <p>
 * Identity and declared dims are set at registration. A metric becomes
 * calculated when a formula is assigned; otherwise it is an input whose tensor
 * is written by coordinate-scoped updates. Placeholders are metrics created
 * implicitly (referenced by a formula or an update before being declared).
 */
public final class Metric {
    private final String id;
    private String displayName;
    private String category;
    private List<String> dims;
    private boolean placeholder;
    private volatile CompiledFormula formula;

    Metric(String id, String displayName, String category, List<String> dims, boolean placeholder) {
        this.id = id;
        this.displayName = displayName;
        this.category = category;
        this.dims = List.copyOf(dims);
        this.placeholder = placeholder;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public String category() {
        return category;
    }

    public List<String> dims() {
        return dims;
    }

    public boolean isPlaceholder() {
        return placeholder;
    }

    public boolean isCalculated() {
        return formula != null;
    }

    /** The compiled formula, or null for inputs. */
    public CompiledFormula formula() {
        return formula;
    }

    void describe(String displayName, String category, List<String> dims) {
        this.displayName = displayName;
        this.category = category;
        this.dims = List.copyOf(dims);
        this.placeholder = false;
    }

    public void setFormula(CompiledFormula formula) {
        this.formula = formula;
    }

    @Override
    public String toString() {
        return id + (dims.isEmpty() ? "" : dims.toString()) + (isCalculated() ? " = " + formula.source() : "");
    }
}
