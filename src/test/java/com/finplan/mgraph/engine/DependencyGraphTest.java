package com.finplan.mgraph.engine;

import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class DependencyGraphTest {
    private DependencyGraph graph;

    @Before
    public void setUp() {
        graph = new DependencyGraph();
        for (String id : List.of("a", "b", "c", "d"))
            graph.addNode(id);
        graph.replaceIncoming("b", List.of("a"));
        graph.replaceIncoming("c", List.of("b"));
        graph.replaceIncoming("d", List.of("a", "c"));
    }

    @Test
    public void testEdges() {
        assertEquals(4, graph.nodeCount());
        assertEquals(4, graph.edgeCount());
        assertEquals(Set.of("b", "d"), graph.successors("a"));
        assertEquals(Set.of("a", "c"), graph.predecessors("d"));
        assertTrue(graph.predecessors("unknown").isEmpty());
    }

    @Test
    public void testDescendantsAndAncestors() {
        assertEquals(Set.of("b", "c", "d"), graph.descendants("a"));
        assertEquals(Set.of("d"), graph.descendants("c"));
        assertTrue(graph.descendants("d").isEmpty());
        assertEquals(Set.of("a", "b", "c"), graph.ancestors("d"));
    }

    @Test
    public void testReplaceIncomingReturnsPrevious() {
        List<String> previous = graph.replaceIncoming("d", List.of("b"));
        assertEquals(List.of("a", "c"), previous);
        assertEquals(Set.of("b"), graph.predecessors("d"));
        assertFalse(graph.successors("c").contains("d"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReplaceIncomingUnknownDependency() {
        graph.replaceIncoming("d", List.of("zzz"));
    }

    @Test
    public void testAcyclicHasNoCycle() {
        assertTrue(graph.findCycle().isEmpty());
        TopologicalOrder order = graph.order();
        assertEquals(0, order.topoIndex("a"));
        assertEquals(3, order.topoIndex("d"));
    }

    @Test
    public void testCycleStartsAtEditedNode() {
        graph.replaceIncoming("a", List.of("c"));
        assertEquals(List.of("a", "b", "c"), graph.findCycle("a"));
        assertEquals(List.of("c", "a", "b"), graph.findCycle("c"));
    }

    @Test
    public void testSelfLoop() {
        graph.replaceIncoming("b", List.of("b"));
        assertEquals(List.of("b"), graph.findCycle("b"));
    }

    @Test(expected = IllegalStateException.class)
    public void testOrderFailsOnCycle() {
        graph.replaceIncoming("a", List.of("d"));
        graph.order();
    }

    @Test
    public void testOrderIsCachedUntilChange() {
        TopologicalOrder first = graph.order();
        assertSame(first, graph.order());
        long version = graph.version();

        graph.setSource("b", false);
        assertTrue(graph.version() > version);
        TopologicalOrder second = graph.order();
        assertNotSame(first, second);
        assertFalse(second.isSource(second.topoIndex("b")));
        assertTrue(second.isSource(second.topoIndex("a")));
    }

    @Test
    public void testRemoveNode() {
        graph.addNode("orphan");
        graph.removeNode("orphan");
        assertFalse(graph.hasNode("orphan"));
    }

    @Test(expected = IllegalStateException.class)
    public void testRemoveNodeWithEdgesFails() {
        graph.removeNode("b");
    }
}
