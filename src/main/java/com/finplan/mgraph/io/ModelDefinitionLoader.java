package com.finplan.mgraph.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finplan.mgraph.EngineConfig;
import com.finplan.mgraph.MetricGraph;
import com.finplan.mgraph.error.ConfigurationException;
import com.finplan.mgraph.model.InputValue;
import com.finplan.mgraph.model.MetricRegistry;

import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link MetricGraph} from a {@link ModelDefinition}.
 *
 * <p>
 * Replays the construction API in dependency-safe order: dimensions, every
 * metric (so ids needing safe aliases are known before any formula is
 * compiled), formulas under a bulk load validated once at the end, the
 * horizon, seed values without per-input recompute, and finally one full
 * recompute.
 */
@Log4j2
public final class ModelDefinitionLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final EngineConfig config;

    public ModelDefinitionLoader() {
        this(EngineConfig.load());
    }

    public ModelDefinitionLoader(EngineConfig config) {
        this.config = config;
    }

    /** @throws ConfigurationException if the JSON is malformed */
    public static ModelDefinition parse(String json) {
        try {
            return MAPPER.readValue(json, ModelDefinition.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid model definition: " + e.getOriginalMessage());
        }
    }

    public static ModelDefinition parse(InputStream in) throws IOException {
        return MAPPER.readValue(in, ModelDefinition.class);
    }

    public MetricGraph load(String json) {
        return load(parse(json));
    }

    /**
     * @throws ConfigurationException if the definition is incomplete
     * @throws com.finplan.mgraph.error.CircularDependencyException if the
     *         formulas form a cycle
     */
    public MetricGraph load(ModelDefinition def) {
        if (def.getMonths() == null || def.getMonths().isEmpty())
            throw new ConfigurationException("Model definition has no months");

        MetricGraph graph = new MetricGraph(def.getId() == null ? "model" : def.getId(), config);
        try {
            populate(graph, def);
        } catch (RuntimeException e) {
            graph.close();
            throw e;
        }
        return graph;
    }

    private void populate(MetricGraph graph, ModelDefinition def) {
        for (ModelDefinition.DimensionDef d : nullSafe(def.getDimensions()))
            graph.defineDimension(d.getName(), nullSafe(d.getMembers()));

        List<ModelDefinition.NodeDef> nodes = nullSafe(def.getNodes());
        graph.beginBulkLoad();
        for (ModelDefinition.NodeDef n : nodes) {
            if (n.getId() == null || n.getId().isBlank())
                throw new ConfigurationException("Node without id in model " + def.getId());
            graph.addMetric(n.getId(), n.getName() == null ? n.getId() : n.getName(),
                    n.getCategory() == null ? MetricRegistry.DEFAULT_CATEGORY : n.getCategory(),
                    nullSafe(n.getDims()));
        }
        for (ModelDefinition.NodeDef n : nodes)
            if (n.getFormula() != null && !n.getFormula().isBlank())
                graph.setFormula(n.getId(), n.getFormula());
        graph.endBulkLoad();

        graph.initializeHorizon(def.getMonths());

        int seeded = 0;
        for (ModelDefinition.InputDef in : nullSafe(def.getInputs())) {
            List<InputValue> values = new ArrayList<>();
            for (ModelDefinition.ValueDef v : nullSafe(in.getValues()))
                values.add(new InputValue(v.getMonth(), v.getCoords(), v.getValue()));
            graph.seedInput(in.getNode(), values);
            log.debug("Seeded {} values into {} (actor {})", values.size(), in.getNode(), in.getActor());
            seeded += values.size();
        }
        if (def.getData() != null) {
            for (Map.Entry<String, Map<String, Double>> e : def.getData().entrySet()) {
                List<InputValue> values = new ArrayList<>();
                for (Map.Entry<String, Double> mv : e.getValue().entrySet())
                    if (mv.getValue() != null)
                        values.add(InputValue.of(mv.getKey(), mv.getValue()));
                graph.seedInput(e.getKey(), values);
                seeded += values.size();
            }
        }

        var result = graph.fullRecompute();
        log.info("Loaded model {}: {} nodes, {} seed values, {} metrics computed in {} ms", graph.name(),
                nodes.size(), seeded, result.affected().size(), String.format("%.2f", result.durationMillis()));
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }
}
