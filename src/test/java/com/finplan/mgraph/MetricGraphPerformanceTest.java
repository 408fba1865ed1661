package com.finplan.mgraph;

import com.finplan.mgraph.engine.RecomputeResult;
import com.finplan.mgraph.model.InputValue;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class MetricGraphPerformanceTest {
    private static final int CHAIN = 1000;
    private static final int MONTHS = 36;

    private MetricGraph graph;
    private List<String> months;

    @Before
    public void setUp() {
        graph = new MetricGraph("perf", EngineConfig.builder().workerThreads(1).build());
        months = new ArrayList<>(MONTHS);
        for (int i = 0; i < MONTHS; i++)
            months.add(String.format("%d-%02d", 2025 + i / 12, i % 12 + 1));

        graph.beginBulkLoad();
        graph.addMetric("seed");
        graph.addMetric("tail_bump");
        graph.setFormula("n0", "seed * 1.01");
        for (int i = 1; i < CHAIN - 1; i++)
            graph.setFormula("n" + i, "n" + (i - 1) + " + 1");
        graph.setFormula("n" + (CHAIN - 1), "n" + (CHAIN - 2) + " + tail_bump");
        graph.endBulkLoad();
        graph.initializeHorizon(months);
        graph.seedInput("seed", List.of(InputValue.of(months.get(0), 100)));
    }

    @After
    public void tearDown() {
        graph.close();
    }

    @Test
    public void testFullRecomputeOfLongChain() {
        long best = Long.MAX_VALUE;
        for (int run = 0; run < 5; run++) {
            long start = System.nanoTime();
            RecomputeResult r = graph.fullRecompute();
            best = Math.min(best, System.nanoTime() - start);
            assertEquals(CHAIN, r.affected().size());
            assertEquals(CHAIN, r.tierCount());
        }
        System.out.printf("Full recompute of %d x %d months: %.2f ms%n", CHAIN, MONTHS, best / 1e6);
        assertTrue("full recompute took " + best / 1e6 + " ms", best < 1_000_000_000L);
        assertEquals(101.0 + CHAIN - 2, graph.getTensor("n" + (CHAIN - 1)).get(0), 1e-6);
    }

    @Test
    public void testTailUpdateIsIncremental() {
        graph.fullRecompute();
        long best = Long.MAX_VALUE;
        for (int run = 0; run < 50; run++) {
            long start = System.nanoTime();
            List<String> affected = graph.updateInput("tail_bump", List.of(InputValue.of(months.get(5), run)), "perf");
            best = Math.min(best, System.nanoTime() - start);
            assertEquals(List.of("n" + (CHAIN - 1)), affected);
        }
        System.out.printf("Tail update: %.3f ms%n", best / 1e6);
        assertTrue("tail update took " + best / 1e6 + " ms", best < 10_000_000L);
        assertEquals(49.0 + CHAIN - 2, graph.getTensor("n" + (CHAIN - 1)).get(5), 1e-6);
    }
}
