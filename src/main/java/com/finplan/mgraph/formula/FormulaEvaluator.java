package com.finplan.mgraph.formula;

import com.finplan.mgraph.tensor.Tensor;

/**
 * Vectorized evaluation of one compiled formula.
 *
 * <p>
 * {@code args[i]} holds the (already aligned) tensor of the i-th dependency in
 * the order of {@link CompiledFormula#dependencies()}. Implementations must not
 * retain or mutate the argument tensors; the result is always a fresh tensor
 * (rank 0 for constant formulas).
 */
@FunctionalInterface
public interface FormulaEvaluator {
    Tensor apply(Tensor[] args);
}
