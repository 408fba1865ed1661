package com.finplan.mgraph.formula;

import com.finplan.mgraph.tensor.Tensor;

import java.util.List;

/**
 * Result of compiling formula text once: the original text, the text after
 * identifier safing, the resolved dependency ids in order of first appearance,
 * and the reusable evaluator.
 */
public record CompiledFormula(String source, String safeSource, List<String> dependencies,
        FormulaEvaluator evaluator) {

    public CompiledFormula {
        dependencies = List.copyOf(dependencies);
    }

    public Tensor evaluate(Tensor[] args) {
        return evaluator.apply(args);
    }
}
