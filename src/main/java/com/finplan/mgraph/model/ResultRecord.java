package com.finplan.mgraph.model;

import java.util.Map;

/**
 * One non-zero cell of a metric's tensor.
 *
 * @param coords member per declared dimension, in the metric's dim order
 */
public record ResultRecord(String month, double value, Map<String, String> coords) {

    public ResultRecord {
        coords = coords == null ? Map.of() : coords;
    }

    /** Member of {@code dim} for this cell, or null if the metric lacks that dimension. */
    public String coord(String dim) {
        return coords.get(dim);
    }
}
