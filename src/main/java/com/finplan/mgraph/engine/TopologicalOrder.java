package com.finplan.mgraph.engine;

import java.util.*;

/**
 * CSR-encoded snapshot of the metric DAG in topological order.
 *
 * <p>
 * Built from the mutable {@link DependencyGraph} whenever the structure has
 * changed and a recompute needs an order. The graph is flattened into
 * structure-of-arrays:
 * <ul>
 * <li><b>topoOrder:</b> metric ids sorted so dependencies precede
 * dependents.</li>
 * <li><b>childrenList / childrenOffset:</b> children of node {@code i} are
 * {@code childrenList[childrenOffset[i] .. childrenOffset[i+1])}.</li>
 * <li><b>parentList / parentOffset:</b> the same for parents, used to level
 * nodes into tiers.</li>
 * </ul>
 *
 * <p>
 * Kahn's algorithm seeds its queue in node insertion order, so identical
 * definitions always produce the identical order.
 */
public final class TopologicalOrder {
    private final String[] topoOrder;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentOffset;
    private final int[] parentList;
    private final Map<String, Integer> nameToIndex;
    // Input metrics: no formula, written only by coordinate updates. The
    // scheduler evaluates exactly the non-source nodes.
    private final boolean[] isSource;

    private TopologicalOrder(String[] topoOrder, int[] childrenOffset, int[] childrenList,
            int[] parentOffset, int[] parentList, Map<String, Integer> nameToIndex, boolean[] isSource) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentOffset = parentOffset;
        this.parentList = parentList;
        this.nameToIndex = nameToIndex;
        this.isSource = isSource;
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    /** Returns the metric id at the given topological index. */
    public String node(int ti) {
        return topoOrder[ti];
    }

    /** Resolves a metric id to its topological index. O(1) hash lookup. */
    public int topoIndex(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + name);
        return idx;
    }

    public boolean contains(String name) {
        return nameToIndex.containsKey(name);
    }

    public boolean isSource(int ti) {
        return isSource[ti];
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    /**
     * Groups a subset of nodes into generations.
     *
     * <p>
     * A node's generation is one more than the highest generation among its
     * parents inside the subset (0 when it has none), i.e. longest-path
     * leveling of the induced subgraph. Nodes of one generation share no edges,
     * and every edge inside the subset points to a strictly later generation.
     *
     * @param subset metric ids, in any order
     * @return generations in execution order, each in topological order
     */
    public List<List<String>> tiers(Collection<String> subset) {
        int n = topoOrder.length;
        int[] level = new int[n];
        Arrays.fill(level, -1);
        for (String id : subset)
            level[topoIndex(id)] = 0;

        int maxLevel = -1;
        // Parents always precede children, so one forward pass settles levels.
        for (int ti = 0; ti < n; ti++) {
            if (level[ti] < 0)
                continue;
            int lv = 0;
            for (int p = parentOffset[ti]; p < parentOffset[ti + 1]; p++) {
                int parentLevel = level[parentList[p]];
                if (parentLevel >= lv)
                    lv = parentLevel + 1;
            }
            level[ti] = lv;
            if (lv > maxLevel)
                maxLevel = lv;
        }

        List<List<String>> tiers = new ArrayList<>(maxLevel + 1);
        for (int i = 0; i <= maxLevel; i++)
            tiers.add(new ArrayList<>());
        for (int ti = 0; ti < n; ti++)
            if (level[ti] >= 0)
                tiers.get(level[ti]).add(topoOrder[ti]);
        return tiers;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final List<String> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final Map<Integer, List<Integer>> forwardEdges = new HashMap<>();
        private final Set<Integer> sourceIndices = new HashSet<>();

        public Builder addNode(String name) {
            if (nameToIdx.containsKey(name))
                throw new IllegalArgumentException("Duplicate node name: " + name);
            int idx = nodes.size();
            nodes.add(name);
            nameToIdx.put(name, idx);
            forwardEdges.put(idx, new ArrayList<>());
            return this;
        }

        public Builder addEdge(String from, String to) {
            forwardEdges.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        public Builder markSource(String name) {
            sourceIndices.add(requireIndex(name));
            return this;
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + name);
            return idx;
        }

        /**
         * Compiles the graph.
         * <p>
         * Performs Kahn's algorithm for topological sorting and cycle detection.
         */
        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];

            // 1. Calculate in-degrees
            for (var entry : forwardEdges.entrySet())
                for (int child : entry.getValue())
                    inDegree[child]++;

            // 2. Initialize queue with nodes having in-degree 0
            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            // 3. Process queue (Kahn's algorithm)
            int[] topoMap = new int[n], reverseMap = new int[n];
            int topoIdx = 0;
            while (head < tail) {
                int curr = queue[head++];
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        queue[tail++] = child;
            }
            if (topoIdx != n)
                throw new IllegalStateException("Cycle detected! Processed " + topoIdx + " of " + n);

            // 4. Construct compact arrays
            String[] orderedNodes = new String[n];
            boolean[] isSrc = new boolean[n];
            int[] parentCounts = new int[n];
            Map<String, Integer> newNameToIndex = new HashMap<>(n * 2);

            for (int ti = 0; ti < n; ti++) {
                int origIdx = reverseMap[ti];
                orderedNodes[ti] = nodes.get(origIdx);
                isSrc[ti] = sourceIndices.contains(origIdx);
                newNameToIndex.put(orderedNodes[ti], ti);
            }

            // 5. Build CSR structures, children first
            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(reverseMap[ti]).size();

            int totalEdges = offsets[n];
            int[] flatChildren = new int[totalEdges];
            for (int ti = 0; ti < n; ti++) {
                List<Integer> children = forwardEdges.get(reverseMap[ti]);
                int base = offsets[ti];
                for (int j = 0; j < children.size(); j++) {
                    int childTi = topoMap[children.get(j)];
                    flatChildren[base + j] = childTi;
                    parentCounts[childTi]++;
                }
            }

            int[] parentOffsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                parentOffsets[ti + 1] = parentOffsets[ti] + parentCounts[ti];
            int[] flatParents = new int[totalEdges];
            int[] fill = Arrays.copyOf(parentOffsets, n);
            for (int ti = 0; ti < n; ti++)
                for (int e = offsets[ti]; e < offsets[ti + 1]; e++)
                    flatParents[fill[flatChildren[e]]++] = ti;

            return new TopologicalOrder(orderedNodes, offsets, flatChildren, parentOffsets, flatParents,
                    newNameToIndex, isSrc);
        }
    }
}
