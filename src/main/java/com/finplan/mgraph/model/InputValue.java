package com.finplan.mgraph.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One coordinate-scoped input write.
 *
 * @param month  horizon label; values for months outside the horizon are
 *               skipped
 * @param coords dimension name to member; a declared dimension left out here,
 *               or mapped to a null or empty member, receives the value across
 *               its whole axis
 */
public record InputValue(String month, Map<String, String> coords, double value) {

    public InputValue {
        if (coords == null || coords.isEmpty()) {
            coords = Map.of();
        } else {
            Map<String, String> specified = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : coords.entrySet())
                if (e.getKey() != null && e.getValue() != null && !e.getValue().isEmpty())
                    specified.put(e.getKey(), e.getValue());
            coords = Collections.unmodifiableMap(specified);
        }
    }

    /** A value for every member combination of the metric in one month. */
    public static InputValue of(String month, double value) {
        return new InputValue(month, Map.of(), value);
    }

    /** A value at {@code dim1=member1, dim2=member2, ...}. */
    public static InputValue at(String month, double value, String... dimMemberPairs) {
        if (dimMemberPairs.length % 2 != 0)
            throw new IllegalArgumentException("Expected dimension/member pairs, got " + dimMemberPairs.length
                    + " strings");
        Map<String, String> coords = new LinkedHashMap<>();
        for (int i = 0; i < dimMemberPairs.length; i += 2)
            coords.put(dimMemberPairs[i], dimMemberPairs[i + 1]);
        return new InputValue(month, coords, value);
    }
}
