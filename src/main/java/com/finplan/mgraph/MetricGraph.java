package com.finplan.mgraph;

import com.finplan.mgraph.api.RecomputeListener;
import com.finplan.mgraph.dim.Dimension;
import com.finplan.mgraph.engine.DependencyGraph;
import com.finplan.mgraph.engine.IncrementalScheduler;
import com.finplan.mgraph.engine.ModelContext;
import com.finplan.mgraph.engine.RecomputeResult;
import com.finplan.mgraph.engine.RecomputeState;
import com.finplan.mgraph.engine.RecomputeStatus;
import com.finplan.mgraph.error.CircularDependencyException;
import com.finplan.mgraph.error.ConfigurationException;
import com.finplan.mgraph.formula.CompiledFormula;
import com.finplan.mgraph.model.*;
import com.finplan.mgraph.tensor.Tensor;
import com.finplan.mgraph.tensor.TensorStore;
import com.finplan.mgraph.tensor.TimeHorizon;
import com.finplan.mgraph.trace.ExplainabilityLog;
import com.finplan.mgraph.trace.TraceEntry;
import com.finplan.mgraph.util.CompositeRecomputeListener;
import com.finplan.mgraph.util.LatencyTrackingListener;
import com.finplan.mgraph.util.ModelExplain;
import com.finplan.mgraph.util.NodeProfileListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * A multi-dimensional metric model with incremental recomputation.
 *
 * <p>
 * Typical lifecycle:
 *
 * <pre>
 * try (MetricGraph g = new MetricGraph("plan")) {
 *     g.defineDimension("geography", List.of("US", "EU"));
 *     g.addMetric("price", "Price", "revenue", List.of());
 *     g.addMetric("volume", "Volume", "operational", List.of("geography"));
 *     g.setFormula("revenue", "price * volume");
 *     g.initializeHorizon(List.of("2025-01", "2025-02"));
 *     g.updateInput("price", List.of(InputValue.of("2025-01", 10)), "alice");
 *     Map&lt;String, List&lt;ResultRecord&gt;&gt; results = g.getResults();
 * }
 * </pre>
 *
 * <p>
 * Every public method is {@code synchronized}: a model has a single writer,
 * and structural changes never overlap a recompute. Use
 * {@link com.finplan.mgraph.disruptor.ModelPublisher} to feed a model from
 * many producer threads.
 */
public class MetricGraph implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(MetricGraph.class);

    static final String CYCLE_SUGGESTION = "Break the loop with a lagged reference to a prior period, "
            + "or turn one of the metrics into an input.";

    private final EngineConfig config;
    private final ModelContext ctx;
    private final IncrementalScheduler scheduler;
    private final ExplainabilityLog traceLog;
    private final CompositeRecomputeListener compositeListener = new CompositeRecomputeListener();

    private boolean bulkLoading;

    public MetricGraph() {
        this("model");
    }

    public MetricGraph(String modelId) {
        this(modelId, EngineConfig.load());
    }

    public MetricGraph(String modelId, EngineConfig config) {
        this.config = config.validate();
        this.ctx = new ModelContext(modelId);
        this.scheduler = new IncrementalScheduler(ctx, config.getWorkerThreads(), config.getParallelTierThreshold(),
                config.getErrorLogIntervalMillis());
        this.scheduler.setListener(compositeListener);
        this.traceLog = new ExplainabilityLog(config.getTraceCapacity());
        log.debug("Created model {} with {}", modelId, config);
    }

    // ---------------------------------------------------------------- construction

    /**
     * Defines or redefines a dimension. An identical redefinition is a no-op;
     * a different member list zero-resets every tensor shaped by the dimension.
     */
    public synchronized void defineDimension(String name, List<String> members) {
        boolean changed = ctx.dimensions().define(name, members);
        TensorStore store = ctx.tensors();
        if (!store.horizon().isInitialized())
            return;
        int reset = 0;
        for (Metric m : ctx.metrics().all()) {
            if (!m.dims().contains(name))
                continue;
            Tensor t = store.get(m.id());
            if (changed || t == null || !t.hasShape(store.shapeFor(m.dims()))) {
                store.allocate(m.id(), m.dims());
                reset++;
            }
        }
        if (changed && reset > 0)
            log.warn("Dimension {} redefined; zero-reset {} metric tensors", name, reset);
    }

    public synchronized Metric addMetric(String id) {
        return addMetric(id, id, MetricRegistry.DEFAULT_CATEGORY, List.of());
    }

    public synchronized Metric addMetric(String id, List<String> dims) {
        return addMetric(id, id, MetricRegistry.DEFAULT_CATEGORY, dims);
    }

    /**
     * Registers a metric, or re-describes an existing one.
     *
     * @param dims ordered dimension names; the time axis is implicit and last
     * @throws ConfigurationException if the metric already owns a tensor for
     *                                different dims (placeholders excepted)
     */
    public synchronized Metric addMetric(String id, String displayName, String category, List<String> dims) {
        List<String> declared = dims == null ? List.of() : dims;
        Metric existing = ctx.metrics().get(id);
        if (existing != null && !existing.isPlaceholder() && !existing.dims().equals(declared)
                && ctx.tensors().contains(id))
            throw new ConfigurationException("Metric " + id + " already has a tensor for dims " + existing.dims()
                    + "; cannot change them to " + declared);
        boolean reshape = existing == null || !existing.dims().equals(declared);

        Metric m = ctx.metrics().register(id, displayName, category, declared);
        ctx.safeIds().register(id);
        ctx.graph().addNode(id);
        if (ctx.tensors().horizon().isInitialized() && (reshape || !ctx.tensors().contains(id)))
            ctx.tensors().allocate(id, m.dims());
        log.debug("Registered metric {} dims={} category={}", id, m.dims(), m.category());
        return m;
    }

    /**
     * Assigns a formula, replacing the metric's dependencies.
     *
     * <p>
     * Unknown identifiers become placeholder input metrics. The graph is
     * validated for cycles unless a bulk load is in progress; on a cycle every
     * change made by this call is undone.
     *
     * @throws com.finplan.mgraph.error.FormulaSyntaxException if the text does
     *                                                          not parse
     * @throws CircularDependencyException                     if the formula
     *                                                          closes a cycle
     */
    public synchronized CompiledFormula setFormula(String id, String expression) {
        CompiledFormula compiled = ctx.compiler().compile(expression);

        List<String> created = new ArrayList<>();
        Metric target = ctx.metrics().get(id);
        if (target == null) {
            target = createPlaceholder(id);
            created.add(id);
        }
        for (String dep : compiled.dependencies()) {
            if (!ctx.metrics().contains(dep)) {
                createPlaceholder(dep);
                created.add(dep);
            }
        }

        DependencyGraph graph = ctx.graph();
        CompiledFormula previous = target.formula();
        List<String> previousDeps = graph.replaceIncoming(id, compiled.dependencies());
        target.setFormula(compiled);
        graph.setSource(id, false);

        if (!bulkLoading) {
            List<String> cycle = graph.findCycle(id);
            if (!cycle.isEmpty()) {
                graph.replaceIncoming(id, previousDeps);
                target.setFormula(previous);
                graph.setSource(id, previous == null);
                for (int i = created.size() - 1; i >= 0; i--)
                    removeMetric(created.get(i));
                log.warn("Rejected formula {} = {}: cycle {}", id, expression, cycle);
                throw new CircularDependencyException(cycle, CYCLE_SUGGESTION);
            }
        }
        log.debug("Formula {} = {} (depends on {})", id, expression, compiled.dependencies());
        return compiled;
    }

    /**
     * Sets the shared time axis and reallocates every tensor (all values are
     * zeroed).
     */
    public synchronized void initializeHorizon(List<String> months) {
        TimeHorizon horizon = new TimeHorizon(months);
        ctx.tensors().setHorizon(horizon);
        for (Metric m : ctx.metrics().all())
            ctx.tensors().allocate(m.id(), m.dims());
        scheduler.clearStale();
        log.info("Model {}: horizon of {} months, {} tensors allocated", ctx.name(), horizon.length(),
                ctx.metrics().size());
    }

    /** Suspends cycle validation until {@link #endBulkLoad()}. */
    public synchronized void beginBulkLoad() {
        bulkLoading = true;
    }

    /**
     * Validates the whole graph and leaves bulk mode.
     *
     * @throws CircularDependencyException if a cycle exists; bulk mode stays on
     *                                     so the offending formulas can be
     *                                     replaced
     */
    public synchronized void endBulkLoad() {
        List<String> cycle = ctx.graph().findCycle();
        if (!cycle.isEmpty())
            throw new CircularDependencyException(cycle, CYCLE_SUGGESTION);
        bulkLoading = false;
        log.debug("Bulk load complete: {} metrics, {} edges", ctx.graph().nodeCount(), ctx.graph().edgeCount());
    }

    public synchronized boolean isBulkLoading() {
        return bulkLoading;
    }

    // ---------------------------------------------------------------- updates

    /**
     * Writes coordinate-scoped values into a metric and recomputes everything
     * downstream of it.
     *
     * <p>
     * All entries are validated before anything is written. Months outside the
     * horizon are skipped. A declared dimension missing from an entry's coords
     * receives the value across its whole axis; coords for dimensions the
     * metric does not declare are ignored. An unknown metric id is registered
     * as a placeholder input.
     *
     * @param actor user responsible for the change, recorded in the trace
     * @return recomputed metrics in evaluation order
     * @throws ConfigurationException for a member unknown to a declared
     *                                dimension, before the horizon is set, or
     *                                during a bulk load
     */
    public synchronized List<String> updateInput(String id, List<InputValue> values, String actor) {
        requireReady("updateInput");
        long start = System.nanoTime();
        writeValues(metricForWrite(id), values);
        RecomputeResult result = scheduler.recomputeFrom(id);
        if (result.isEmpty())
            return List.of();
        double durationMs = (System.nanoTime() - start) / 1_000_000.0;
        traceLog.append(TraceEntry.of(id, actor, result.affected(), durationMs));
        return result.affected();
    }

    /** Writes values like {@link #updateInput} without recomputing or tracing. */
    public synchronized void seedInput(String id, List<InputValue> values) {
        if (!ctx.tensors().horizon().isInitialized())
            throw new ConfigurationException("Horizon not initialized; call initializeHorizon first");
        writeValues(metricForWrite(id), values);
    }

    /** Re-evaluates every calculated metric. */
    public synchronized RecomputeResult fullRecompute() {
        requireReady("fullRecompute");
        RecomputeResult result = scheduler.recomputeAll();
        log.debug("Full recompute of {}: {} metrics in {} ms", ctx.name(), result.affected().size(),
                result.durationMillis());
        return result;
    }

    /**
     * Recomputes the dependents of a metric whose tensor was changed directly
     * (what-if analysis). No trace entry is written.
     */
    public synchronized RecomputeResult recomputeFrom(String changedId) {
        requireReady("recomputeFrom");
        ctx.metrics().require(changedId);
        return scheduler.recomputeFrom(changedId);
    }

    // ---------------------------------------------------------------- queries

    /** Every metric's non-zero cells. */
    public synchronized Map<String, List<ResultRecord>> getResults() {
        return getResults(Map.of());
    }

    /**
     * Non-zero cells, keeping only cells whose member equals the filter's for
     * every filtered dimension the metric declares. A filter member unknown to
     * its dimension matches nothing.
     *
     * @return metric id to records, in registration order
     */
    public synchronized Map<String, List<ResultRecord>> getResults(Map<String, String> filter) {
        Map<String, String> f = filter == null ? Map.of() : filter;
        TimeHorizon horizon = ctx.tensors().horizon();
        Map<String, List<ResultRecord>> out = new LinkedHashMap<>();
        for (Metric m : ctx.metrics().all()) {
            List<ResultRecord> records = new ArrayList<>();
            out.put(m.id(), records);
            Tensor t = ctx.tensors().get(m.id());
            if (t != null)
                collect(m, t, horizon, f, records);
        }
        return out;
    }

    private void collect(Metric m, Tensor t, TimeHorizon horizon, Map<String, String> filter,
            List<ResultRecord> records) {
        List<String> dims = m.dims();
        Dimension[] axes = new Dimension[dims.size()];
        int[] required = new int[dims.size()];
        for (int d = 0; d < dims.size(); d++) {
            axes[d] = ctx.dimensions().get(dims.get(d));
            required[d] = -1;
            String want = filter.get(dims.get(d));
            if (want == null)
                continue;
            required[d] = axes[d] == null ? -1 : axes[d].indexOf(want);
            if (required[d] < 0)
                return;
        }

        int[] shape = t.shape();
        int rank = shape.length;
        int[] idx = new int[rank];
        double[] data = t.data();
        for (int flat = 0; flat < data.length; flat++) {
            double v = data[flat];
            if (v != 0.0 && matches(required, idx)) {
                Map<String, String> coords = new LinkedHashMap<>();
                for (int d = 0; d < axes.length; d++)
                    if (axes[d] != null)
                        coords.put(dims.get(d), axes[d].member(idx[d]));
                records.add(new ResultRecord(horizon.month(idx[rank - 1]), v, coords));
            }
            for (int ax = rank - 1; ax >= 0; ax--) {
                if (++idx[ax] < shape[ax])
                    break;
                idx[ax] = 0;
            }
        }
    }

    private static boolean matches(int[] required, int[] idx) {
        for (int d = 0; d < required.length; d++)
            if (required[d] >= 0 && required[d] != idx[d])
                return false;
        return true;
    }

    /** Copy of a metric's tensor, or null if none is allocated. */
    public synchronized Tensor getTensor(String id) {
        Tensor t = ctx.tensors().get(id);
        return t == null ? null : t.copy();
    }

    /** The ten most recent trace entries, oldest first. */
    public synchronized List<TraceEntry> getTrace() {
        return getTrace(10);
    }

    public synchronized List<TraceEntry> getTrace(int limit) {
        return traceLog.recent(limit);
    }

    /** @throws ConfigurationException if the metric is unknown */
    public synchronized DependencyChain getDependencyChain(String id) {
        Metric m = ctx.metrics().require(id);
        DependencyGraph graph = ctx.graph();
        return new DependencyChain(id, new ArrayList<>(graph.predecessors(id)),
                new ArrayList<>(graph.successors(id)), m.isCalculated() ? m.formula().source() : null);
    }

    public synchronized DagMetadata getDagMetadata() {
        List<DagMetadata.Node> nodes = new ArrayList<>(ctx.metrics().size());
        List<DagMetadata.Edge> edges = new ArrayList<>();
        for (Metric m : ctx.metrics().all()) {
            nodes.add(new DagMetadata.Node(m.id(), m.displayName(),
                    m.isCalculated() ? DagMetadata.TYPE_FORMULA : DagMetadata.TYPE_INPUT, m.category()));
            for (String dependent : ctx.graph().successors(m.id()))
                edges.add(new DagMetadata.Edge(m.id(), dependent));
        }
        return new DagMetadata(nodes, edges);
    }

    /** Metrics whose most recent evaluation failed; their tensors read as zero. */
    public synchronized Set<String> staleMetrics() {
        return scheduler.staleMetrics();
    }

    public RecomputeState state() {
        return scheduler.state();
    }

    /** Current stale set and state, for callers that undo what-if passes. */
    public synchronized RecomputeStatus recomputeStatus() {
        return scheduler.status();
    }

    public synchronized void restoreRecomputeStatus(RecomputeStatus status) {
        scheduler.restore(status);
    }

    public synchronized List<String> months() {
        return ctx.tensors().horizon().months();
    }

    public synchronized Metric metric(String id) {
        return ctx.metrics().get(id);
    }

    public synchronized String explain(String id) {
        return new ModelExplain(ctx).explainNode(id);
    }

    public synchronized String toMermaid() {
        return new ModelExplain(ctx).toMermaid();
    }

    // ---------------------------------------------------------------- observability

    /**
     * Registers a listener. Adds to the composite, keeping any latency or
     * profiling listeners already attached.
     */
    public void addListener(RecomputeListener listener) {
        compositeListener.add(listener);
    }

    public boolean removeListener(RecomputeListener listener) {
        return compositeListener.remove(listener);
    }

    public LatencyTrackingListener enableLatencyTracking() {
        var latencyListener = new LatencyTrackingListener();
        compositeListener.add(latencyListener);
        return latencyListener;
    }

    public NodeProfileListener enableNodeProfiling() {
        var profileListener = new NodeProfileListener();
        compositeListener.add(profileListener);
        return profileListener;
    }

    public String name() {
        return ctx.name();
    }

    public EngineConfig config() {
        return config;
    }

    /** Live model state, for analysis and serialization layers. */
    public ModelContext context() {
        return ctx;
    }

    @Override
    public void close() {
        scheduler.close();
    }

    // ---------------------------------------------------------------- internals

    private void requireReady(String operation) {
        if (bulkLoading)
            throw new ConfigurationException(operation + " is not allowed during a bulk load");
        if (!ctx.tensors().horizon().isInitialized())
            throw new ConfigurationException("Horizon not initialized; call initializeHorizon first");
    }

    private Metric metricForWrite(String id) {
        Metric m = ctx.metrics().get(id);
        return m != null ? m : createPlaceholder(id);
    }

    private Metric createPlaceholder(String id) {
        Metric m = ctx.metrics().registerPlaceholder(id);
        ctx.safeIds().register(id);
        ctx.graph().addNode(id);
        if (ctx.tensors().horizon().isInitialized())
            ctx.tensors().allocate(id, m.dims());
        log.debug("Created placeholder metric {}", id);
        return m;
    }

    private void removeMetric(String id) {
        ctx.graph().removeNode(id);
        ctx.metrics().remove(id);
        ctx.safeIds().unregister(id);
        ctx.tensors().remove(id);
    }

    private void writeValues(Metric m, List<InputValue> values) {
        TensorStore store = ctx.tensors();
        TimeHorizon horizon = store.horizon();
        List<String> dims = m.dims();
        int[] shape = store.shapeFor(dims);
        int timeAxis = dims.size();

        // Resolve every entry before touching the tensor.
        int[][] slices = new int[values.size()][];
        for (int k = 0; k < values.size(); k++) {
            InputValue v = values.get(k);
            int month = v.month() == null ? -1 : horizon.indexOf(v.month());
            if (month < 0) {
                log.debug("Skipping value for {}: month {} is outside the horizon", m.id(), v.month());
                continue;
            }
            int[] fixed = new int[shape.length];
            Arrays.fill(fixed, -1);
            fixed[timeAxis] = month;
            for (int d = 0; d < dims.size(); d++) {
                String member = v.coords().get(dims.get(d));
                if (member == null)
                    continue;
                Dimension dim = ctx.dimensions().get(dims.get(d));
                int at = dim == null ? -1 : dim.indexOf(member);
                if (at < 0)
                    throw new ConfigurationException("Unknown member '" + member + "' of dimension " + dims.get(d)
                            + " for metric " + m.id());
                fixed[d] = at;
            }
            slices[k] = fixed;
        }

        Tensor t = store.get(m.id());
        if (t == null || !t.hasShape(shape))
            t = store.allocate(m.id(), dims);
        for (int k = 0; k < slices.length; k++)
            if (slices[k] != null)
                t.fillSlice(slices[k], values.get(k).value());
    }
}
