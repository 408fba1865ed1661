package com.finplan.mgraph.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a whole model: dimensions, metrics with their
 * formulas, the horizon and seed values.
 *
 * <pre>
 * {
 *   "id": "plan",
 *   "months": ["2025-01", "2025-02"],
 *   "dimensions": [{"name": "geography", "members": ["US", "EU"]}],
 *   "nodes": [{"id": "revenue", "name": "Revenue", "category": "revenue",
 *              "dims": ["geography"], "formula": "price * volume"}],
 *   "inputs": [{"node": "volume", "values": [{"month": "2025-01", "value": 10,
 *               "coords": {"geography": "US"}}]}],
 *   "data": {"price": {"2025-01": 5.0}}
 * }
 * </pre>
 *
 * {@code data} is the flat form: metric to month to value, broadcast across
 * the metric's dimensions.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ModelDefinition {
    private String id;
    private List<String> months;
    private List<DimensionDef> dimensions;
    private List<NodeDef> nodes;
    private List<InputDef> inputs;
    private Map<String, Map<String, Double>> data;

    /** A named axis and its ordered members. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class DimensionDef {
        private String name;
        private List<String> members;
    }

    /** One metric; a blank formula makes it an input. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String id, name, category, formula;
        private List<String> dims;
    }

    /** Seed values for one input metric. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class InputDef {
        private String node, actor;
        private List<ValueDef> values;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ValueDef {
        private String month;
        private double value;
        private Map<String, String> coords;
    }
}
