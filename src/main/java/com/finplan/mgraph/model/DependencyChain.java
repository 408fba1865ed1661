package com.finplan.mgraph.model;

import java.util.List;

/**
 * Direct neighbourhood of one metric.
 *
 * @param dependsOn metrics its formula reads
 * @param impacts   metrics whose formulas read it
 * @param formula   formula text, or null for inputs
 */
public record DependencyChain(String node, List<String> dependsOn, List<String> impacts, String formula) {

    public DependencyChain {
        dependsOn = List.copyOf(dependsOn);
        impacts = List.copyOf(impacts);
    }
}
