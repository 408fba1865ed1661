package com.finplan.mgraph.engine;

import java.util.*;

/**
 * Mutable adjacency of the metric DAG. An edge {@code a -> b} means "b's
 * formula reads a".
 *
 * <p>
 * Edges change only through {@link #replaceIncoming}, which swaps a metric's
 * whole dependency set at once and hands back the previous one so callers can
 * roll back. A {@link TopologicalOrder} snapshot is built lazily and reused
 * until the structure changes again.
 *
 * <p>
 * Not thread-safe. Owned by the model facade, which serializes structural
 * changes.
 */
public final class DependencyGraph {
    private final Map<String, Set<String>> successors = new LinkedHashMap<>();
    private final Map<String, Set<String>> predecessors = new LinkedHashMap<>();
    private final Set<String> sources = new HashSet<>();

    private TopologicalOrder cachedOrder;
    private long version;

    public void addNode(String id) {
        if (successors.containsKey(id))
            return;
        successors.put(id, new LinkedHashSet<>());
        predecessors.put(id, new LinkedHashSet<>());
        sources.add(id);
        invalidate();
    }

    /** Removes a node that has no edges left. */
    public void removeNode(String id) {
        Set<String> out = successors.get(id);
        if (out == null)
            return;
        if (!out.isEmpty() || !predecessors.get(id).isEmpty())
            throw new IllegalStateException("Node still has edges: " + id);
        successors.remove(id);
        predecessors.remove(id);
        sources.remove(id);
        invalidate();
    }

    public boolean hasNode(String id) {
        return successors.containsKey(id);
    }

    /**
     * Marks whether the node is written by callers (input) or by its formula.
     * Only affects the source flags in the topological snapshot.
     */
    public void setSource(String id, boolean source) {
        boolean changed = source ? sources.add(id) : sources.remove(id);
        if (changed)
            invalidate();
    }

    /**
     * Replaces the full dependency set of {@code id}.
     *
     * @return the previous dependencies, in their original order
     */
    public List<String> replaceIncoming(String id, Collection<String> dependencies) {
        Set<String> preds = predecessors.get(id);
        if (preds == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        List<String> previous = new ArrayList<>(preds);
        for (String p : previous)
            successors.get(p).remove(id);
        preds.clear();
        for (String dep : dependencies) {
            if (!successors.containsKey(dep))
                throw new IllegalArgumentException("Unknown node: " + dep);
            preds.add(dep);
            successors.get(dep).add(id);
        }
        invalidate();
        return previous;
    }

    public Set<String> predecessors(String id) {
        Set<String> p = predecessors.get(id);
        return p == null ? Collections.emptySet() : Collections.unmodifiableSet(p);
    }

    public Set<String> successors(String id) {
        Set<String> s = successors.get(id);
        return s == null ? Collections.emptySet() : Collections.unmodifiableSet(s);
    }

    public Set<String> nodes() {
        return Collections.unmodifiableSet(successors.keySet());
    }

    public int nodeCount() {
        return successors.size();
    }

    public int edgeCount() {
        int n = 0;
        for (Set<String> s : successors.values())
            n += s.size();
        return n;
    }

    /** Every transitive dependent of {@code id}, excluding {@code id} itself. */
    public Set<String> descendants(String id) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> work = new ArrayDeque<>(successors(id));
        while (!work.isEmpty()) {
            String next = work.poll();
            if (seen.add(next))
                work.addAll(successors.get(next));
        }
        seen.remove(id);
        return seen;
    }

    /** Every transitive dependency of {@code id}, excluding {@code id} itself. */
    public Set<String> ancestors(String id) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> work = new ArrayDeque<>(predecessors(id));
        while (!work.isEmpty()) {
            String next = work.poll();
            if (seen.add(next))
                work.addAll(predecessors.get(next));
        }
        seen.remove(id);
        return seen;
    }

    /**
     * Finds one directed cycle, searching from {@code preferredStart} first.
     *
     * <p>
     * When the graph was acyclic before an edit to {@code preferredStart}, any
     * new cycle passes through it, so the reported path starts at the edited
     * metric. Iterative DFS; long chains do not grow the call stack.
     *
     * @return cycle members in edge order (the last one points back to the
     *         first), or an empty list when the graph is acyclic
     */
    public List<String> findCycle(String preferredStart) {
        Map<String, Integer> color = new HashMap<>(successors.size() * 2);
        List<String> starts = new ArrayList<>(successors.size() + 1);
        if (preferredStart != null && successors.containsKey(preferredStart))
            starts.add(preferredStart);
        starts.addAll(successors.keySet());

        for (String start : starts) {
            if (color.getOrDefault(start, WHITE) != WHITE)
                continue;
            List<String> path = new ArrayList<>();
            Deque<Iterator<String>> stack = new ArrayDeque<>();
            color.put(start, GREY);
            path.add(start);
            stack.push(successors.get(start).iterator());

            while (!stack.isEmpty()) {
                Iterator<String> it = stack.peek();
                if (it.hasNext()) {
                    String next = it.next();
                    int c = color.getOrDefault(next, WHITE);
                    if (c == GREY)
                        return new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                    if (c == WHITE) {
                        color.put(next, GREY);
                        path.add(next);
                        stack.push(successors.get(next).iterator());
                    }
                } else {
                    stack.pop();
                    color.put(path.remove(path.size() - 1), BLACK);
                }
            }
        }
        return Collections.emptyList();
    }

    public List<String> findCycle() {
        return findCycle(null);
    }

    /**
     * Topological snapshot of the current structure. Rebuilt only after a
     * structural change.
     *
     * @throws IllegalStateException if the graph has a cycle
     */
    public TopologicalOrder order() {
        TopologicalOrder order = cachedOrder;
        if (order != null)
            return order;
        TopologicalOrder.Builder b = TopologicalOrder.builder();
        for (String id : successors.keySet()) {
            b.addNode(id);
            if (sources.contains(id))
                b.markSource(id);
        }
        for (var e : successors.entrySet())
            for (String child : e.getValue())
                b.addEdge(e.getKey(), child);
        order = b.build();
        cachedOrder = order;
        return order;
    }

    /** Incremented on every structural change. */
    public long version() {
        return version;
    }

    private void invalidate() {
        cachedOrder = null;
        version++;
    }

    private static final int WHITE = 0;
    private static final int GREY = 1;
    private static final int BLACK = 2;
}
