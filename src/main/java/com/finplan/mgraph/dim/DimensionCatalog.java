package com.finplan.mgraph.dim;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of the model's dimensions, keyed by name.
 *
 * <p>
 * Dimensions contribute tensor axes to every metric that declares them. A
 * metric may declare a dimension that is not (yet) defined here; such an axis
 * has size 1 until the dimension is defined.
 */
public final class DimensionCatalog {
    private static final Logger log = LogManager.getLogger(DimensionCatalog.class);

    private final Map<String, Dimension> dimensions = new LinkedHashMap<>();

    /**
     * Defines or redefines a dimension.
     *
     * @return true if the member list changed, meaning tensors shaped by this
     *         dimension are now stale.
     */
    public boolean define(String name, List<String> members) {
        Dimension next = new Dimension(name, members);
        Dimension prev = dimensions.get(name);
        if (prev != null && prev.members().equals(next.members()))
            return false;
        dimensions.put(name, next);
        if (prev == null)
            log.info("Defined dimension {} with {} members", name, next.size());
        else
            log.warn("Redefined dimension {}: {} -> {} members", name, prev.size(), next.size());
        return prev != null;
    }

    public Dimension get(String name) {
        return dimensions.get(name);
    }

    public boolean contains(String name) {
        return dimensions.containsKey(name);
    }

    /** Axis length contributed by a dimension; 1 for dimensions not yet defined. */
    public int sizeOf(String name) {
        Dimension d = dimensions.get(name);
        return d == null ? 1 : d.size();
    }

    public Collection<Dimension> all() {
        return Collections.unmodifiableCollection(dimensions.values());
    }
}
