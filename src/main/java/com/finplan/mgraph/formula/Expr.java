package com.finplan.mgraph.formula;

import com.finplan.mgraph.tensor.Tensor;

import java.util.List;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;

/**
 * Formula syntax tree. Each node lowers itself to a {@link FormulaEvaluator}
 * closure over the ordered dependency tensors; lowering happens once per
 * formula assignment.
 */
interface Expr {

    /**
     * @param slots safe identifier to argument index
     */
    FormulaEvaluator lower(Map<String, Integer> slots);

    record Num(double value) implements Expr {
        @Override
        public FormulaEvaluator lower(Map<String, Integer> slots) {
            return args -> Tensor.scalar(value);
        }
    }

    record Var(String name) implements Expr {
        @Override
        public FormulaEvaluator lower(Map<String, Integer> slots) {
            final int slot = slots.get(name);
            return args -> args[slot];
        }
    }

    record Neg(Expr operand) implements Expr {
        @Override
        public FormulaEvaluator lower(Map<String, Integer> slots) {
            FormulaEvaluator inner = operand.lower(slots);
            return args -> inner.apply(args).map(v -> -v);
        }
    }

    record Binary(char op, Expr left, Expr right) implements Expr {
        @Override
        public FormulaEvaluator lower(Map<String, Integer> slots) {
            FormulaEvaluator l = left.lower(slots);
            FormulaEvaluator r = right.lower(slots);
            DoubleBinaryOperator fn = switch (op) {
                case '+' -> Double::sum;
                case '-' -> (a, b) -> a - b;
                case '*' -> (a, b) -> a * b;
                case '/' -> (a, b) -> a / b;
                case '^' -> Math::pow;
                default -> throw new IllegalStateException("Unknown operator " + op);
            };
            if (left instanceof Num ln && right instanceof Num rn) {
                Tensor folded = Tensor.scalar(fn.applyAsDouble(ln.value(), rn.value()));
                return args -> folded.copy();
            }
            return args -> Tensor.combine(l.apply(args), r.apply(args), fn);
        }
    }

    record Call(FormulaFunction function, List<Expr> arguments) implements Expr {
        @Override
        public FormulaEvaluator lower(Map<String, Integer> slots) {
            FormulaEvaluator[] lowered = new FormulaEvaluator[arguments.size()];
            for (int i = 0; i < lowered.length; i++)
                lowered[i] = arguments.get(i).lower(slots);
            return args -> {
                Tensor[] values = new Tensor[lowered.length];
                for (int i = 0; i < lowered.length; i++)
                    values[i] = lowered[i].apply(args);
                return function.apply(values);
            };
        }
    }
}
