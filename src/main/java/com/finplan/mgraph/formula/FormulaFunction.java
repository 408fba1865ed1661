package com.finplan.mgraph.formula;

import com.finplan.mgraph.tensor.Tensor;

import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Built-in functions callable from formula text. Names are matched
 * case-insensitively, so {@code MAX(a, b)} and {@code max(a, b)} are the same.
 */
enum FormulaFunction {
    ABS(Math::abs),
    SQRT(Math::sqrt),
    EXP(Math::exp),
    LOG(Math::log),
    LN(Math::log),
    FLOOR(Math::floor),
    CEIL(Math::ceil),
    ROUND(v -> (double) Math.round(v)),
    MIN(Math::min, 2),
    MAX(Math::max, 2),
    POW(Math::pow, 2, 2);

    private final DoubleUnaryOperator unary;
    private final DoubleBinaryOperator binary;
    private final int minArgs, maxArgs;

    FormulaFunction(DoubleUnaryOperator unary) {
        this.unary = unary;
        this.binary = null;
        this.minArgs = 1;
        this.maxArgs = 1;
    }

    // Folds left over two or more arguments.
    FormulaFunction(DoubleBinaryOperator binary, int minArgs) {
        this(binary, minArgs, Integer.MAX_VALUE);
    }

    FormulaFunction(DoubleBinaryOperator binary, int minArgs, int maxArgs) {
        this.unary = null;
        this.binary = binary;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    boolean acceptsArity(int n) {
        return n >= minArgs && n <= maxArgs;
    }

    String arityDescription() {
        if (minArgs == maxArgs)
            return minArgs + " argument" + (minArgs == 1 ? "" : "s");
        return "at least " + minArgs + " arguments";
    }

    Tensor apply(Tensor[] args) {
        if (unary != null)
            return args[0].map(unary);
        Tensor acc = args[0];
        for (int i = 1; i < args.length; i++)
            acc = Tensor.combine(acc, args[i], binary);
        return acc;
    }

    /** Returns the function with that name, or null. */
    static FormulaFunction lookup(String name) {
        for (FormulaFunction f : values()) {
            if (f.name().equalsIgnoreCase(name))
                return f;
        }
        return null;
    }
}
