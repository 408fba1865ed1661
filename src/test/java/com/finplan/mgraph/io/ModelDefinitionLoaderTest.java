package com.finplan.mgraph.io;

import com.finplan.mgraph.EngineConfig;
import com.finplan.mgraph.MetricGraph;
import com.finplan.mgraph.error.CircularDependencyException;
import com.finplan.mgraph.error.ConfigurationException;
import com.finplan.mgraph.model.ResultRecord;
import org.junit.Test;

import java.io.InputStream;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ModelDefinitionLoaderTest {
    private static final double EPS = 1e-9;

    private final ModelDefinitionLoader loader = new ModelDefinitionLoader(
            EngineConfig.builder().workerThreads(1).build());

    private static ModelDefinition fixture() throws Exception {
        try (InputStream in = ModelDefinitionLoaderTest.class.getResourceAsStream("/models/unit_economics.json")) {
            assertNotNull("fixture missing", in);
            return ModelDefinitionLoader.parse(in);
        }
    }

    @Test
    public void testParseFixture() throws Exception {
        ModelDefinition def = fixture();
        assertEquals("unit-economics", def.getId());
        assertEquals(3, def.getMonths().size());
        assertEquals(5, def.getNodes().size());
        assertEquals("customers * ARPU", def.getNodes().get(0).getFormula());
        assertEquals("cfo", def.getInputs().get(0).getActor());
        assertEquals(200.0, def.getData().get("CAC").get("2025-02"), EPS);
    }

    @Test
    public void testLoadComputesEverything() throws Exception {
        try (MetricGraph graph = loader.load(fixture())) {
            assertEquals("unit-economics", graph.name());
            assertFalse(graph.isBulkLoading());
            assertEquals("New Customers", graph.metric("customers").displayName());

            // formulas declared before their inputs still resolve to the declared metrics
            assertFalse(graph.metric("budget").isPlaceholder());

            Map<String, List<ResultRecord>> us = graph.getResults(Map.of("geography", "US"));
            assertEquals(1, us.get("revenue").size());
            assertEquals(2500.0, us.get("revenue").get(0).value(), EPS);

            Map<String, List<ResultRecord>> eu = graph.getResults(Map.of("geography", "EU"));
            assertEquals(1000.0, eu.get("revenue").get(0).value(), EPS);
            assertTrue("seeding is not traced", graph.getTrace().isEmpty());

            List<String> affected = graph.updateInput("CAC",
                    List.of(com.finplan.mgraph.model.InputValue.of("2025-01", 100)), "growth-team");
            assertEquals(List.of("customers", "revenue"), affected);
            assertEquals(7000.0, graph.getTensor("revenue").sum(), EPS);
        }
    }

    @Test
    public void testLoadFromString() {
        String json = "{\"id\":\"tiny\",\"months\":[\"m1\",\"m2\"],"
                + "\"nodes\":[{\"id\":\"a\"},{\"id\":\"b\",\"formula\":\"a * 2\"}],"
                + "\"data\":{\"a\":{\"m1\":1.5,\"m2\":2.5}}}";
        try (MetricGraph graph = loader.load(json)) {
            assertEquals(8.0, graph.getTensor("b").sum(), EPS);
        }
    }

    @Test
    public void testNullCoordinateBroadcastsAcrossAxis() {
        String json = "{\"id\":\"nulls\",\"months\":[\"m1\",\"m2\"],"
                + "\"dimensions\":[{\"name\":\"geography\",\"members\":[\"US\",\"EU\"]}],"
                + "\"nodes\":[{\"id\":\"a\",\"dims\":[\"geography\"]},"
                + "{\"id\":\"b\",\"formula\":\"a * 2\",\"dims\":[\"geography\"]}],"
                + "\"inputs\":[{\"node\":\"a\",\"values\":["
                + "{\"month\":\"m1\",\"value\":3,\"coords\":{\"geography\":null}}]}]}";
        try (MetricGraph graph = loader.load(json)) {
            assertEquals(6.0, graph.getTensor("a").sum(), EPS);
            assertEquals(12.0, graph.getTensor("b").sum(), EPS);
            Map<String, List<ResultRecord>> eu = graph.getResults(Map.of("geography", "EU"));
            assertEquals(6.0, eu.get("b").get(0).value(), EPS);
        }
    }

    @Test(expected = CircularDependencyException.class)
    public void testCycleInDefinition() {
        loader.load("{\"months\":[\"m1\"],\"nodes\":[{\"id\":\"a\",\"formula\":\"b\"},{\"id\":\"b\",\"formula\":\"a\"}]}");
    }

    @Test(expected = ConfigurationException.class)
    public void testMissingMonths() {
        loader.load("{\"nodes\":[{\"id\":\"a\"}]}");
    }

    @Test(expected = ConfigurationException.class)
    public void testMalformedJson() {
        ModelDefinitionLoader.parse("{\"months\": [");
    }
}
