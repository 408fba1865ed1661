package com.finplan.mgraph.formula;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bidirectional mapping between metric ids and identifiers legal in formula
 * text.
 *
 * <p>
 * Ids such as {@code 3f2a-9c1e} or {@code gross-margin} cannot appear verbatim
 * in the expression grammar (the hyphen would read as subtraction). Every id is
 * registered once, when its metric is registered; ids that are already legal
 * map to themselves, the others get an alias with illegal characters replaced
 * by {@code _} (prefixed with {@code _} when starting with a digit, suffixed
 * with a counter on collision). Formulas consult the cache; it is never rebuilt
 * per formula.
 *
 * <p>
 * Scoped to one model instance. Not thread-safe: mutated only by structural
 * calls, which are serialized by the owning model.
 */
public final class SafeIdCache {
    private final Map<String, String> originalToSafe = new HashMap<>();
    private final Map<String, String> safeToOriginal = new HashMap<>();
    // Unsafe originals, longest first, so "a-b-c" is rewritten before "a-b".
    private final List<String> unsafeIds = new ArrayList<>();

    /**
     * Registers an id and returns its safe alias. Idempotent.
     */
    public String register(String original) {
        String known = originalToSafe.get(original);
        if (known != null)
            return known;

        if (isLegalIdentifier(original)) {
            String squatter = safeToOriginal.get(original);
            originalToSafe.put(original, original);
            safeToOriginal.put(original, original);
            if (squatter != null && !squatter.equals(original)) {
                // an unsafe id was aliased to this exact name; move it aside
                originalToSafe.remove(squatter);
                assignAlias(squatter);
            }
            return original;
        }

        String alias = assignAlias(original);
        unsafeIds.add(original);
        unsafeIds.sort(Comparator.comparingInt(String::length).reversed());
        return alias;
    }

    public void unregister(String original) {
        String safe = originalToSafe.remove(original);
        if (safe != null)
            safeToOriginal.remove(safe);
        unsafeIds.remove(original);
    }

    /** Safe alias of a registered id; the id itself when unknown. */
    public String toSafe(String original) {
        return originalToSafe.getOrDefault(original, original);
    }

    /** Original id behind an alias; the alias itself when unknown. */
    public String toOriginal(String safe) {
        return safeToOriginal.getOrDefault(safe, safe);
    }

    /**
     * Rewrites every registered unsafe id occurring in {@code expression} (on
     * identifier boundaries) into its alias.
     */
    public String safeExpression(String expression) {
        if (unsafeIds.isEmpty())
            return expression;
        String text = expression;
        for (String id : unsafeIds) {
            if (text.contains(id))
                text = replaceOnBoundaries(text, id, originalToSafe.get(id));
        }
        return text;
    }

    public int size() {
        return originalToSafe.size();
    }

    public static boolean isLegalIdentifier(String id) {
        if (id.isEmpty() || !FormulaLexer.isIdentStart(id.charAt(0)))
            return false;
        for (int i = 1; i < id.length(); i++)
            if (!FormulaLexer.isIdentPart(id.charAt(i)))
                return false;
        return true;
    }

    private String assignAlias(String original) {
        StringBuilder sb = new StringBuilder(original.length() + 1);
        if (!FormulaLexer.isIdentStart(original.charAt(0)))
            sb.append('_');
        for (int i = 0; i < original.length(); i++) {
            char c = original.charAt(i);
            sb.append(FormulaLexer.isIdentPart(c) ? c : '_');
        }
        String base = sb.toString();
        String alias = base;
        int n = 1;
        while (safeToOriginal.containsKey(alias))
            alias = base + "_" + n++;
        originalToSafe.put(original, alias);
        safeToOriginal.put(alias, original);
        return alias;
    }

    private static String replaceOnBoundaries(String text, String id, String alias) {
        StringBuilder out = new StringBuilder(text.length());
        int from = 0;
        int at;
        while ((at = text.indexOf(id, from)) >= 0) {
            int end = at + id.length();
            boolean leftOk = at == 0 || !FormulaLexer.isIdentPart(text.charAt(at - 1));
            boolean rightOk = end == text.length() || !FormulaLexer.isIdentPart(text.charAt(end));
            out.append(text, from, at);
            out.append(leftOk && rightOk ? alias : id);
            from = end;
        }
        out.append(text, from, text.length());
        return out.toString();
    }
}
