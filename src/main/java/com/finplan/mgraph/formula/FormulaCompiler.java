package com.finplan.mgraph.formula;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns formula text into a {@link CompiledFormula}.
 *
 * <p>
 * Steps: rewrite unsafe ids to their aliases, tokenize and parse, map every
 * referenced alias back to its metric id (ids unknown to the cache are taken
 * verbatim and become placeholders upstream), then lower the tree to one
 * closure taking the dependency tensors in order.
 */
public final class FormulaCompiler {
    private final SafeIdCache safeIds;

    public FormulaCompiler(SafeIdCache safeIds) {
        this.safeIds = safeIds;
    }

    public CompiledFormula compile(String expression) {
        String safeText = safeIds.safeExpression(expression);
        FormulaParser.Parsed parsed = FormulaParser.parse(safeText, expression);

        List<String> dependencies = new ArrayList<>(parsed.variables().size());
        Map<String, Integer> slots = new HashMap<>();
        for (String alias : parsed.variables()) {
            String id = safeIds.toOriginal(alias);
            int slot = dependencies.indexOf(id);
            if (slot < 0) {
                slot = dependencies.size();
                dependencies.add(id);
            }
            slots.put(alias, slot);
        }
        FormulaEvaluator evaluator = parsed.root().lower(slots);
        return new CompiledFormula(expression, safeText, dependencies, evaluator);
    }
}
