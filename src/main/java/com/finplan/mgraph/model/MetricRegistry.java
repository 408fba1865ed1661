package com.finplan.mgraph.model;

import com.finplan.mgraph.error.ConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Insertion-ordered registry of metrics by id.
 */
public final class MetricRegistry {
    public static final String DEFAULT_CATEGORY = "operational";

    private final Map<String, Metric> metrics = new LinkedHashMap<>();

    /**
     * Registers a metric or re-describes an existing one.
     *
     * @return the registered metric
     */
    public Metric register(String id, String displayName, String category, List<String> dims) {
        if (id == null || id.isBlank())
            throw new ConfigurationException("Metric id must not be blank");
        if (new HashSet<>(dims).size() != dims.size())
            throw new ConfigurationException("Metric " + id + " declares a dimension twice: " + dims);
        String name = displayName == null ? id : displayName;
        String cat = category == null ? DEFAULT_CATEGORY : category;
        Metric existing = metrics.get(id);
        if (existing != null) {
            existing.describe(name, cat, dims);
            return existing;
        }
        Metric m = new Metric(id, name, cat, dims, false);
        metrics.put(id, m);
        return m;
    }

    /** Creates an undeclared input metric named after its id. */
    public Metric registerPlaceholder(String id) {
        if (id == null || id.isBlank())
            throw new ConfigurationException("Metric id must not be blank");
        Metric m = new Metric(id, id, DEFAULT_CATEGORY, List.of(), true);
        metrics.put(id, m);
        return m;
    }

    public Metric get(String id) {
        return metrics.get(id);
    }

    public Metric require(String id) {
        Metric m = metrics.get(id);
        if (m == null)
            throw new ConfigurationException("Unknown metric: " + id);
        return m;
    }

    public boolean contains(String id) {
        return metrics.containsKey(id);
    }

    public void remove(String id) {
        metrics.remove(id);
    }

    public Collection<Metric> all() {
        return Collections.unmodifiableCollection(metrics.values());
    }

    public int size() {
        return metrics.size();
    }
}
