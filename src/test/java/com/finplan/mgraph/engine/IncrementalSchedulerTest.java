package com.finplan.mgraph.engine;

import com.finplan.mgraph.api.RecomputeListener;
import com.finplan.mgraph.error.ShapeException;
import com.finplan.mgraph.model.Metric;
import com.finplan.mgraph.tensor.Tensor;
import com.finplan.mgraph.tensor.TimeHorizon;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.Assert.*;

public class IncrementalSchedulerTest {
    private static final double EPS = 1e-9;

    private ModelContext ctx;
    private IncrementalScheduler scheduler;

    @Before
    public void setUp() {
        ctx = new ModelContext("test");
        ctx.tensors().setHorizon(new TimeHorizon(List.of("2024-01", "2024-02", "2024-03")));
    }

    @After
    public void tearDown() {
        if (scheduler != null)
            scheduler.close();
    }

    private void input(String id, String... dims) {
        ctx.metrics().register(id, id, null, List.of(dims));
        ctx.safeIds().register(id);
        ctx.graph().addNode(id);
        ctx.tensors().allocate(id, List.of(dims));
    }

    private void calc(String id, String formula, String... dims) {
        Metric m = ctx.metrics().register(id, id, null, List.of(dims));
        ctx.safeIds().register(id);
        ctx.graph().addNode(id);
        m.setFormula(ctx.compiler().compile(formula));
        ctx.graph().replaceIncoming(id, m.formula().dependencies());
        ctx.graph().setSource(id, false);
        ctx.tensors().allocate(id, List.of(dims));
    }

    private double cell(String id, int flat) {
        return ctx.tensors().get(id).get(flat);
    }

    @Test
    public void testChainRecompute() {
        input("a");
        calc("b", "a * 2");
        calc("c", "b + 10");
        scheduler = new IncrementalScheduler(ctx, 1, 64, 0);

        ctx.tensors().get("a").fill(10.0);
        RecomputeResult r = scheduler.recomputeFrom("a");

        assertEquals(List.of("b", "c"), r.affected());
        assertTrue(r.failed().isEmpty());
        assertEquals(2, r.tierCount());
        assertEquals(30.0, cell("c", 2), EPS);
        assertEquals(RecomputeState.DONE, scheduler.state());
    }

    @Test
    public void testOnlyDescendantsAreTouched() {
        input("a");
        input("x");
        calc("b", "a + 1");
        calc("y", "x + 1");
        scheduler = new IncrementalScheduler(ctx, 1, 64, 0);

        ctx.tensors().get("y").fill(-5.0);
        RecomputeResult r = scheduler.recomputeFrom("a");
        assertEquals(List.of("b"), r.affected());
        assertEquals(-5.0, cell("y", 0), EPS);
    }

    @Test
    public void testLeafChangeIsEmpty() {
        input("a");
        calc("b", "a + 1");
        scheduler = new IncrementalScheduler(ctx, 1, 64, 0);

        RecomputeResult r = scheduler.recomputeFrom("b");
        assertTrue(r.isEmpty());
        assertSame(RecomputeResult.EMPTY, r);
    }

    @Test
    public void testRecomputeAll() {
        input("a");
        calc("b", "a + 1");
        calc("c", "b * b");
        scheduler = new IncrementalScheduler(ctx, 1, 64, 0);

        ctx.tensors().get("a").fill(2.0);
        RecomputeResult r = scheduler.recomputeAll();
        assertEquals(List.of("b", "c"), r.affected());
        assertEquals(9.0, cell("c", 1), EPS);
    }

    @Test
    public void testFailureIsIsolated() {
        ctx.dimensions().define("geo", List.of("US", "EU"));
        ctx.dimensions().define("product", List.of("A", "B", "C"));
        input("x", "geo");
        input("y", "product");
        input("a");
        calc("bad", "x + y", "geo");
        calc("after_bad", "bad + 1", "geo");
        calc("fine", "a * 3");
        scheduler = new IncrementalScheduler(ctx, 1, 64, 0);

        List<String> errors = Collections.synchronizedList(new ArrayList<>());
        scheduler.setListener(new RecordingListener() {
            @Override
            public void onNodeError(long batch, String metricId, Throwable error) {
                assertTrue(error instanceof ShapeException);
                errors.add(metricId);
            }
        });

        ctx.tensors().get("a").fill(1.0);
        ctx.tensors().get("bad").fill(99.0);
        RecomputeResult r = scheduler.recomputeAll();

        assertEquals(List.of("bad"), r.failed());
        assertEquals(List.of("bad"), errors);
        assertEquals(RecomputeState.PARTIAL_FAILURE, scheduler.state());
        assertEquals(Set.of("bad"), scheduler.staleMetrics());
        // the failed tensor is zeroed and its dependents still ran on the zeros
        assertEquals(0.0, ctx.tensors().get("bad").sum(), EPS);
        assertEquals(1.0, cell("after_bad", 0), EPS);
        assertEquals(3.0, cell("fine", 0), EPS);
    }

    @Test
    public void testStaleClearsAfterCleanEvaluation() {
        ctx.dimensions().define("geo", List.of("US", "EU"));
        ctx.dimensions().define("product", List.of("A", "B", "C"));
        input("x", "geo");
        input("y", "product");
        calc("bad", "x + y", "geo");
        scheduler = new IncrementalScheduler(ctx, 1, 64, 0);
        scheduler.recomputeAll();
        assertEquals(Set.of("bad"), scheduler.staleMetrics());

        Metric bad = ctx.metrics().get("bad");
        bad.setFormula(ctx.compiler().compile("x * 2"));
        ctx.graph().replaceIncoming("bad", bad.formula().dependencies());
        scheduler.recomputeFrom("x");
        assertTrue(scheduler.staleMetrics().isEmpty());
        assertEquals(RecomputeState.DONE, scheduler.state());
    }

    @Test
    public void testNonFiniteCellsStoredAsZero() {
        input("num");
        input("den");
        calc("ratio", "num / den");
        scheduler = new IncrementalScheduler(ctx, 1, 64, 0);

        List<String> warnings = new ArrayList<>();
        scheduler.setListener(new RecordingListener() {
            @Override
            public void onNodeWarning(long batch, String metricId, String message) {
                warnings.add(metricId);
            }
        });

        Tensor num = ctx.tensors().get("num");
        num.fill(10.0);
        ctx.tensors().get("den").set(1, 2.0);
        RecomputeResult r = scheduler.recomputeFrom("num");

        assertTrue(r.failed().isEmpty());
        assertEquals(List.of("ratio"), warnings);
        assertEquals(0.0, cell("ratio", 0), EPS);
        assertEquals(5.0, cell("ratio", 1), EPS);
        assertEquals(0.0, cell("ratio", 2), EPS);
    }

    @Test
    public void testScalarFormulaFillsWholeTensor() {
        ctx.dimensions().define("geo", List.of("US", "EU"));
        calc("constant", "100", "geo");
        scheduler = new IncrementalScheduler(ctx, 1, 64, 0);
        scheduler.recomputeAll();
        assertEquals(600.0, ctx.tensors().get("constant").sum(), EPS);
    }

    @Test
    public void testParallelTierMatchesSequential() {
        input("root");
        for (int i = 0; i < 50; i++)
            calc("n" + i, "root * " + i);
        calc("total", String.join(" + ", names(50)));

        scheduler = new IncrementalScheduler(ctx, 4, 8, 0);
        Map<String, String> threads = new ConcurrentHashMap<>();
        scheduler.setListener(new RecordingListener() {
            @Override
            public void onNodeEvaluated(long batch, String metricId, int tier, long durationNanos) {
                threads.put(metricId, Thread.currentThread().getName());
            }
        });

        ctx.tensors().get("root").fill(1.0);
        RecomputeResult r = scheduler.recomputeFrom("root");

        assertEquals(51, r.affected().size());
        assertEquals(2, r.tierCount());
        assertEquals(1225.0, cell("total", 0), EPS);
        assertTrue(threads.get("n0").startsWith("mgraph-test-worker-"));
    }

    @Test
    public void testListenerSeesWholePass() {
        input("a");
        calc("b", "a + 1");
        calc("c", "b + 1");
        scheduler = new IncrementalScheduler(ctx, 1, 64, 0);
        RecordingListener listener = new RecordingListener();
        scheduler.setListener(listener);

        scheduler.recomputeFrom("a");
        assertEquals(List.of("start:a:2", "b@0", "c@1", "end:2:0"), listener.events);
        assertEquals(1, scheduler.batchCount());
    }

    @Test
    public void testThrowingListenerDoesNotFailNode() {
        input("a");
        calc("b", "a * 2");
        calc("c", "b + 1");
        scheduler = new IncrementalScheduler(ctx, 1, 64, 0);
        scheduler.setListener(new RecordingListener() {
            @Override
            public void onNodeEvaluated(long batch, String metricId, int tier, long durationNanos) {
                throw new IllegalStateException("listener broke on " + metricId);
            }
        });

        ctx.tensors().get("a").fill(10.0);
        RecomputeResult r = scheduler.recomputeFrom("a");

        assertTrue(r.failed().isEmpty());
        assertEquals(20.0, cell("b", 0), EPS);
        assertEquals(21.0, cell("c", 2), EPS);
        assertTrue(scheduler.staleMetrics().isEmpty());
        assertEquals(RecomputeState.DONE, scheduler.state());
    }

    @Test
    public void testThrowingWarningListenerKeepsValues() {
        input("num");
        input("den");
        calc("ratio", "num / den");
        scheduler = new IncrementalScheduler(ctx, 1, 64, 0);
        scheduler.setListener(new RecordingListener() {
            @Override
            public void onNodeWarning(long batch, String metricId, String message) {
                throw new IllegalStateException(message);
            }
        });

        ctx.tensors().get("num").fill(10.0);
        ctx.tensors().get("den").set(1, 2.0);
        RecomputeResult r = scheduler.recomputeFrom("num");

        assertTrue(r.failed().isEmpty());
        assertEquals(5.0, cell("ratio", 1), EPS);
        assertFalse(scheduler.staleMetrics().contains("ratio"));
    }

    private static List<String> names(int n) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < n; i++)
            out.add("n" + i);
        return out;
    }

    private static class RecordingListener implements RecomputeListener {
        final List<String> events = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void onRecomputeStart(long batch, String triggerId, int affectedCount) {
            events.add("start:" + triggerId + ":" + affectedCount);
        }

        @Override
        public void onNodeEvaluated(long batch, String metricId, int tier, long durationNanos) {
            events.add(metricId + "@" + tier);
        }

        @Override
        public void onNodeError(long batch, String metricId, Throwable error) {
            events.add("error:" + metricId);
        }

        @Override
        public void onRecomputeEnd(long batch, int evaluated, int failed) {
            events.add("end:" + evaluated + ":" + failed);
        }
    }
}
