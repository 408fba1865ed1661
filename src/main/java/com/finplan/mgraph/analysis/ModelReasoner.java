package com.finplan.mgraph.analysis;

import com.finplan.mgraph.MetricGraph;
import com.finplan.mgraph.engine.DependencyGraph;
import com.finplan.mgraph.engine.ModelContext;
import com.finplan.mgraph.engine.RecomputeStatus;
import com.finplan.mgraph.error.ConfigurationException;
import com.finplan.mgraph.model.Metric;
import com.finplan.mgraph.tensor.Tensor;
import com.finplan.mgraph.tensor.TensorSnapshot;

import lombok.extern.log4j.Log4j2;

import java.util.*;

/**
 * What-if analysis over a loaded {@link MetricGraph}.
 *
 * <p>
 * Every operation that perturbs values captures a {@link TensorSnapshot} and
 * the scheduler's {@link RecomputeStatus} first and restores both afterwards,
 * so the model's values and stale metrics are unchanged when the call returns. Calls lock the model for their whole duration.
 *
 * <p>
 * Metrics are compared by the sum of their tensor over all cells.
 */
@Log4j2
public final class ModelReasoner {
    /** Relative bump applied to each driver during sensitivity analysis. */
    public static final double PERTURBATION = 0.10;
    public static final int DEFAULT_TOP_DRIVERS = 5;

    private static final double EPSILON = 1e-9;
    private static final double STATIC_TOLERANCE = 1e-6;

    private final MetricGraph graph;

    public ModelReasoner(MetricGraph graph) {
        this.graph = graph;
    }

    public enum Impact {
        HIGH, MEDIUM, LOW;

        /** Above 10% relative change is high, above 2% medium. */
        public static Impact of(double sensitivity) {
            double s = Math.abs(sensitivity);
            return s > 0.1 ? HIGH : s > 0.02 ? MEDIUM : LOW;
        }
    }

    /**
     * @param sensitivity relative change of the target when the driver rises by
     *                    {@link #PERTURBATION}
     */
    public record DriverImpact(String id, String name, double sensitivity, Impact impact) {
    }

    public record ScenarioResult(String target, double baseline, double scenario, double variance,
            double variancePercent, String description) {
    }

    public record MetricExplanation(String id, String name, boolean calculated, String formula, List<String> inputs,
            String derivation) {
    }

    public record AssumptionWarning(String id, String name, String issue, String recommendation) {
    }

    public record Suggestion(String driver, String action, String reasoning, double confidence) {
    }

    public List<DriverImpact> analyzeDrivers(String target) {
        return analyzeDrivers(target, DEFAULT_TOP_DRIVERS);
    }

    /**
     * Ranks the input metrics upstream of {@code target} by how strongly a 10%
     * increase moves it.
     *
     * @return at most {@code topN} drivers, largest absolute sensitivity first
     */
    public List<DriverImpact> analyzeDrivers(String target, int topN) {
        synchronized (graph) {
            ModelContext ctx = graph.context();
            ctx.metrics().require(target);
            double baseline = total(ctx, target);
            DependencyGraph dag = ctx.graph();

            List<DriverImpact> drivers = new ArrayList<>();
            TensorSnapshot snapshot = TensorSnapshot.capture(ctx.tensors());
            RecomputeStatus status = graph.recomputeStatus();
            for (String id : dag.ancestors(target)) {
                Metric m = ctx.metrics().get(id);
                if (m == null || m.isCalculated() || !dag.predecessors(id).isEmpty())
                    continue;
                Tensor input = ctx.tensors().get(id);
                if (input == null)
                    continue;
                try {
                    double[] data = input.data();
                    for (int i = 0; i < data.length; i++)
                        data[i] *= 1 + PERTURBATION;
                    graph.recomputeFrom(id);
                    double delta = (total(ctx, target) - baseline) / (Math.abs(baseline) + EPSILON);
                    drivers.add(new DriverImpact(id, m.displayName(), delta, Impact.of(delta)));
                } finally {
                    snapshot.restore(ctx.tensors());
                    graph.restoreRecomputeStatus(status);
                }
            }
            drivers.sort(Comparator.comparingDouble((DriverImpact d) -> Math.abs(d.sensitivity())).reversed());
            log.debug("Driver analysis of {}: {} candidate inputs", target, drivers.size());
            return drivers.size() > topN ? List.copyOf(drivers.subList(0, topN)) : List.copyOf(drivers);
        }
    }

    /**
     * Applies fractional changes to metrics ({@code 0.2} means +20%), runs a
     * full recompute and reports how {@code target} moves.
     */
    public ScenarioResult simulateScenario(String target, Map<String, Double> overrides) {
        synchronized (graph) {
            ModelContext ctx = graph.context();
            ctx.metrics().require(target);
            double baseline = total(ctx, target);
            double scenario;

            List<String> applied = new ArrayList<>();
            TensorSnapshot snapshot = TensorSnapshot.capture(ctx.tensors());
            RecomputeStatus status = graph.recomputeStatus();
            try {
                for (Map.Entry<String, Double> e : overrides.entrySet()) {
                    Tensor t = ctx.tensors().get(e.getKey());
                    if (t == null || e.getValue() == null)
                        continue;
                    double factor = 1 + e.getValue();
                    double[] data = t.data();
                    for (int i = 0; i < data.length; i++)
                        data[i] *= factor;
                    applied.add(String.format("%s (%+.1f%%)", e.getKey(), e.getValue() * 100));
                }
                graph.fullRecompute();
                scenario = total(ctx, target);
            } finally {
                snapshot.restore(ctx.tensors());
                graph.restoreRecomputeStatus(status);
            }

            double variance = scenario - baseline;
            return new ScenarioResult(target, baseline, scenario, variance,
                    variance / (Math.abs(baseline) + EPSILON), "Scenario: " + String.join(", ", applied));
        }
    }

    /** Describes how a metric is derived. */
    public MetricExplanation explainMetric(String id) {
        synchronized (graph) {
            ModelContext ctx = graph.context();
            Metric m = ctx.metrics().require(id);
            if (!m.isCalculated())
                return new MetricExplanation(id, m.displayName(), false, null, List.of(),
                        "This value is provided as a direct input to the model.");

            List<String> inputs = new ArrayList<>();
            for (String dep : m.formula().dependencies()) {
                Metric d = ctx.metrics().get(dep);
                inputs.add(d == null ? dep : d.displayName());
            }
            String formula = m.formula().source();
            return new MetricExplanation(id, m.displayName(), true, formula, List.copyOf(inputs),
                    "Derived from " + String.join(", ", inputs) + " using the logic: " + formula + ".");
        }
    }

    /**
     * Flags inputs that hold the same non-zero value in every populated cell,
     * a sign of a flat placeholder assumption.
     */
    public List<AssumptionWarning> detectWeakAssumptions() {
        synchronized (graph) {
            ModelContext ctx = graph.context();
            List<AssumptionWarning> warnings = new ArrayList<>();
            for (Metric m : ctx.metrics().all()) {
                if (m.isCalculated() || !ctx.graph().predecessors(m.id()).isEmpty())
                    continue;
                Tensor t = ctx.tensors().get(m.id());
                if (t != null && isStatic(t.data()))
                    warnings.add(new AssumptionWarning(m.id(), m.displayName(), "Static Assumption",
                            "Consider adding a growth driver or seasonality to " + m.displayName() + "."));
            }
            return warnings;
        }
    }

    /** Turns the top drivers of {@code target} into scale-up or reduce actions. */
    public List<Suggestion> suggestImprovements(String target) {
        List<Suggestion> out = new ArrayList<>();
        for (DriverImpact d : analyzeDrivers(target)) {
            if (d.sensitivity() > 0)
                out.add(new Suggestion(d.name(), "Optimize/Scale",
                        d.name() + " is a primary positive driver of " + target + ".", 0.85));
            else if (d.sensitivity() < 0)
                out.add(new Suggestion(d.name(), "Reduce/Control",
                        d.name() + " negatively impacts " + target + ", suggesting efficiency gains are possible.",
                        0.9));
        }
        return out;
    }

    private static double total(ModelContext ctx, String id) {
        Tensor t = ctx.tensors().get(id);
        if (t == null)
            throw new ConfigurationException("No data for metric " + id + "; initialize the horizon first");
        return t.sum();
    }

    private static boolean isStatic(double[] data) {
        int n = 0;
        double mean = 0;
        for (double v : data) {
            if (v != 0) {
                n++;
                mean += v;
            }
        }
        if (n < 2)
            return false;
        mean /= n;
        double sq = 0;
        for (double v : data)
            if (v != 0)
                sq += (v - mean) * (v - mean);
        return Math.sqrt(sq / n) < STATIC_TOLERANCE;
    }
}
