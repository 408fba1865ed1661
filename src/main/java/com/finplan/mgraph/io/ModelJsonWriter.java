package com.finplan.mgraph.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.finplan.mgraph.model.DagMetadata;
import com.finplan.mgraph.model.DependencyChain;
import com.finplan.mgraph.model.ResultRecord;
import com.finplan.mgraph.trace.TraceEntry;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders query results as JSON for an embedding transport.
 *
 * <p>
 * Result records are flattened so each dimension becomes a key next to
 * {@code month} and {@code value}; trace entries and dependency chains use
 * snake_case keys.
 */
public final class ModelJsonWriter {
    private final ObjectMapper mapper;

    public ModelJsonWriter() {
        this(false);
    }

    public ModelJsonWriter(boolean pretty) {
        this.mapper = new ObjectMapper().configure(SerializationFeature.INDENT_OUTPUT, pretty);
    }

    public String results(Map<String, List<ResultRecord>> results) {
        Map<String, List<Map<String, Object>>> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<ResultRecord>> e : results.entrySet()) {
            List<Map<String, Object>> rows = new ArrayList<>(e.getValue().size());
            for (ResultRecord r : e.getValue()) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("month", r.month());
                row.put("value", r.value());
                row.putAll(r.coords());
                rows.add(row);
            }
            out.put(e.getKey(), rows);
        }
        return write(out);
    }

    public String trace(List<TraceEntry> entries) {
        List<Map<String, Object>> out = new ArrayList<>(entries.size());
        for (TraceEntry t : entries) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", t.id().toString());
            row.put("created_at", t.createdAt().toString());
            row.put("trigger_node_id", t.triggerNodeId());
            row.put("trigger_user_id", t.triggerUserId());
            row.put("affected_nodes", t.affectedNodes());
            row.put("duration_ms", t.durationMs());
            out.add(row);
        }
        return write(out);
    }

    public String dependencyChain(DependencyChain chain) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("node", chain.node());
        out.put("depends_on", chain.dependsOn());
        out.put("impacts", chain.impacts());
        out.put("formula", chain.formula());
        return write(out);
    }

    public String dag(DagMetadata dag) {
        return write(dag);
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("JSON serialization failed", e);
        }
    }
}
