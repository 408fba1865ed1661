package com.finplan.mgraph.engine;

import com.finplan.mgraph.api.RecomputeListener;
import com.finplan.mgraph.formula.CompiledFormula;
import com.finplan.mgraph.model.Metric;
import com.finplan.mgraph.tensor.DimensionAligner;
import com.finplan.mgraph.tensor.Tensor;
import com.finplan.mgraph.tensor.TensorStore;
import com.finplan.mgraph.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives recomputation of calculated metrics after a change.
 *
 * <p>
 * A pass has four phases, visible through {@link #state()}:
 * <ol>
 * <li><b>Affected set:</b> every formula-bearing descendant of the changed
 * metric, in topological order. Nothing outside this set is touched.</li>
 * <li><b>Tiering:</b> the set is split into generations by longest path inside
 * the induced subgraph, so no two nodes of one tier depend on each other.</li>
 * <li><b>Evaluation:</b> tiers run strictly one after another. A tier with at
 * least {@code parallelTierThreshold} nodes is split across the worker pool and
 * joined before the next tier starts; smaller tiers run on the calling
 * thread.</li>
 * <li><b>Done / partial failure.</b></li>
 * </ol>
 *
 * <p>
 * Failure isolation: an exception while evaluating one node (bad shapes, a
 * function domain error) is logged through an {@link ErrorRateLimiter}, the
 * node's tensor is zeroed, the node is reported stale, and the rest of the
 * tier and all later tiers still run. Dependents of a failed node read its
 * zeros.
 *
 * <p>
 * Threading: one pass at a time. The owner must not change the graph while a
 * pass runs. Each worker writes only the tensor of the node it evaluates.
 */
public final class IncrementalScheduler implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(IncrementalScheduler.class);

    private final ModelContext ctx;
    private final ExecutorService workers;
    private final int workerCount;
    private final int parallelTierThreshold;
    private final ErrorRateLimiter errorLog;
    private final Set<String> stale = ConcurrentHashMap.newKeySet();

    private volatile RecomputeState state = RecomputeState.IDLE;
    private volatile RecomputeListener listener;
    private long batch;

    /**
     * @param workerThreads          pool size; 1 or less evaluates everything on
     *                               the calling thread
     * @param parallelTierThreshold  smallest tier handed to the pool
     * @param errorLogIntervalMillis minimum gap between logged node failures
     */
    public IncrementalScheduler(ModelContext ctx, int workerThreads, int parallelTierThreshold,
            long errorLogIntervalMillis) {
        this.ctx = ctx;
        this.workerCount = Math.max(1, workerThreads);
        this.parallelTierThreshold = Math.max(2, parallelTierThreshold);
        this.errorLog = new ErrorRateLimiter(log, errorLogIntervalMillis);
        this.workers = workerCount > 1 ? Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory(ctx.name()))
                : null;
    }

    public void setListener(RecomputeListener listener) {
        this.listener = listener;
    }

    public RecomputeState state() {
        return state;
    }

    /** Metrics whose most recent evaluation failed. */
    public Set<String> staleMetrics() {
        return Collections.unmodifiableSet(new TreeSet<>(stale));
    }

    public void clearStale() {
        stale.clear();
    }

    public RecomputeStatus status() {
        return new RecomputeStatus(stale, state);
    }

    /** Puts back the stale set and state captured by {@link #status()}. */
    public void restore(RecomputeStatus status) {
        stale.clear();
        stale.addAll(status.stale());
        state = status.state();
    }

    public long batchCount() {
        return batch;
    }

    /**
     * Formula-bearing transitive dependents of {@code changedId}, in
     * topological order.
     */
    public List<String> affectedSet(String changedId) {
        TopologicalOrder order = ctx.graph().order();
        Set<String> descendants = ctx.graph().descendants(changedId);
        List<String> affected = new ArrayList<>(descendants.size());
        for (String id : descendants)
            if (!order.isSource(order.topoIndex(id)))
                affected.add(id);
        if (affected.size() > 1)
            affected.sort(Comparator.comparingInt(order::topoIndex));
        return affected;
    }

    /** Re-evaluates the dependents of one changed metric. */
    public RecomputeResult recomputeFrom(String changedId) {
        state = RecomputeState.IDLE;
        List<String> affected = affectedSet(changedId);
        state = RecomputeState.AFFECTED_SET_COMPUTED;
        if (affected.isEmpty()) {
            state = RecomputeState.DONE;
            return RecomputeResult.EMPTY;
        }
        return run(changedId, affected);
    }

    /** Re-evaluates every calculated metric. */
    public RecomputeResult recomputeAll() {
        state = RecomputeState.IDLE;
        TopologicalOrder order = ctx.graph().order();
        List<String> affected = new ArrayList<>();
        for (int ti = 0; ti < order.nodeCount(); ti++)
            if (!order.isSource(ti))
                affected.add(order.node(ti));
        state = RecomputeState.AFFECTED_SET_COMPUTED;
        if (affected.isEmpty()) {
            state = RecomputeState.DONE;
            return RecomputeResult.EMPTY;
        }
        return run(null, affected);
    }

    private RecomputeResult run(String triggerId, List<String> affected) {
        final long start = System.nanoTime();
        final long b = ++batch;
        final RecomputeListener l = this.listener;

        List<List<String>> tiers = ctx.graph().order().tiers(affected);
        state = RecomputeState.TIERED;

        if (l != null)
            l.onRecomputeStart(b, triggerId, affected.size());

        state = RecomputeState.EVALUATING;
        Set<String> failed = ConcurrentHashMap.newKeySet();
        try {
            for (int t = 0; t < tiers.size(); t++) {
                List<String> tier = tiers.get(t);
                if (workers == null || tier.size() < parallelTierThreshold) {
                    for (String id : tier)
                        evaluateNode(b, id, t, failed, l);
                } else {
                    runParallel(b, tier, t, failed, l);
                }
            }
        } finally {
            state = failed.isEmpty() ? RecomputeState.DONE : RecomputeState.PARTIAL_FAILURE;
            if (l != null)
                l.onRecomputeEnd(b, affected.size() - failed.size(), failed.size());
        }

        List<String> failedOrdered = new ArrayList<>(failed.size());
        if (!failed.isEmpty())
            for (String id : affected)
                if (failed.contains(id))
                    failedOrdered.add(id);

        long duration = System.nanoTime() - start;
        if (log.isDebugEnabled())
            log.debug("Recompute #{} from {}: {} nodes in {} tiers, {} failed, {} us", b,
                    triggerId == null ? "<all>" : triggerId, affected.size(), tiers.size(), failedOrdered.size(),
                    duration / 1000);
        return new RecomputeResult(List.copyOf(affected), List.copyOf(failedOrdered), tiers.size(), duration);
    }

    private void runParallel(long b, List<String> tier, int tierIndex, Set<String> failed, RecomputeListener l) {
        int chunks = Math.min(workerCount, tier.size());
        int perChunk = (tier.size() + chunks - 1) / chunks;
        List<Future<?>> futures = new ArrayList<>(chunks);
        for (int from = 0; from < tier.size(); from += perChunk) {
            List<String> slice = tier.subList(from, Math.min(tier.size(), from + perChunk));
            futures.add(workers.submit(() -> {
                for (String id : slice)
                    evaluateNode(b, id, tierIndex, failed, l);
            }));
        }
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for tier " + tierIndex, e);
            } catch (ExecutionException e) {
                // evaluateNode contains its own failures; reaching here is a bug
                throw new IllegalStateException("Tier " + tierIndex + " worker failed", e.getCause());
            }
        }
    }

    private void evaluateNode(long b, String id, int tier, Set<String> failed, RecomputeListener l) {
        long nodeStart = System.nanoTime();
        int replaced;
        try {
            replaced = evaluate(id);
            stale.remove(id);
        } catch (Throwable e) {
            failed.add(id);
            stale.add(id);
            Tensor t = ctx.tensors().get(id);
            if (t != null)
                t.fill(0.0);
            errorLog.log(String.format("Evaluation failed for metric '%s': %s", id, e.getMessage()), e);
            if (l != null)
                notifyListener(id, () -> l.onNodeError(b, id, e));
            return;
        }
        long elapsed = System.nanoTime() - nodeStart;
        if (replaced > 0) {
            log.debug("Metric {} produced {} non-finite cells, stored as 0", id, replaced);
            String warning = replaced + " non-finite cells stored as 0";
            if (l != null)
                notifyListener(id, () -> l.onNodeWarning(b, id, warning));
        }
        if (l != null)
            notifyListener(id, () -> l.onNodeEvaluated(b, id, tier, elapsed));
    }

    // A throwing listener never changes the node's value or stale flag.
    private void notifyListener(String id, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            errorLog.log(String.format("Listener failed for metric '%s': %s", id, e.getMessage()), e);
        }
    }

    /**
     * Evaluates one calculated metric into its tensor.
     *
     * @return number of non-finite cells replaced by 0
     */
    int evaluate(String id) {
        Metric m = ctx.metrics().require(id);
        CompiledFormula formula = m.formula();
        if (formula == null)
            return 0;

        TensorStore store = ctx.tensors();
        List<String> dims = m.dims();
        int[] shape = store.shapeFor(dims);
        Tensor target = store.get(id);
        if (target == null || !target.hasShape(shape))
            target = store.allocate(id, dims);

        List<String> deps = formula.dependencies();
        Tensor[] args = new Tensor[deps.size()];
        for (int i = 0; i < args.length; i++) {
            Metric dep = ctx.metrics().require(deps.get(i));
            args[i] = DimensionAligner.align(store.read(dep.id(), dep.dims()), dep.dims(), dims, shape);
        }

        Tensor result = formula.evaluate(args);
        if (result.isScalar())
            target.fill(result.scalarValue());
        else if (result.hasShape(shape))
            target.copyFrom(result);
        else
            target.copyFrom(result.broadcastTo(shape));
        return target.zeroNonFinite();
    }

    @Override
    public void close() {
        if (workers != null)
            workers.shutdownNow();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger();

        WorkerThreadFactory(String modelName) {
            this.prefix = "mgraph-" + modelName + "-worker-";
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
