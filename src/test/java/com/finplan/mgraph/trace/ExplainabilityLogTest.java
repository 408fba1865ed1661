package com.finplan.mgraph.trace;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ExplainabilityLogTest {

    private static TraceEntry entry(String trigger) {
        return TraceEntry.of(trigger, "tester", List.of(trigger + "_child"), 0.5);
    }

    @Test
    public void testRecentIsOldestFirst() {
        ExplainabilityLog log = new ExplainabilityLog(10);
        log.append(entry("a"));
        log.append(entry("b"));
        log.append(entry("c"));

        List<TraceEntry> recent = log.recent(2);
        assertEquals(2, recent.size());
        assertEquals("b", recent.get(0).triggerNodeId());
        assertEquals("c", recent.get(1).triggerNodeId());
        assertEquals(3, log.recent(100).size());
    }

    @Test
    public void testRingOverwritesOldest() {
        ExplainabilityLog log = new ExplainabilityLog(3);
        for (String id : List.of("a", "b", "c", "d", "e"))
            log.append(entry(id));

        assertEquals(3, log.size());
        assertEquals(5, log.totalAppended());
        List<TraceEntry> recent = log.recent(10);
        assertEquals("c", recent.get(0).triggerNodeId());
        assertEquals("e", recent.get(2).triggerNodeId());
    }

    @Test
    public void testEntryFields() {
        TraceEntry e = entry("price");
        assertNotNull(e.id());
        assertNotNull(e.createdAt());
        assertEquals("tester", e.triggerUserId());
        assertEquals(List.of("price_child"), e.affectedNodes());
        assertEquals(0.5, e.durationMs(), 0.0);
        assertNotEquals(e.id(), entry("price").id());
    }

    @Test
    public void testClear() {
        ExplainabilityLog log = new ExplainabilityLog();
        assertEquals(ExplainabilityLog.DEFAULT_CAPACITY, log.capacity());
        log.append(entry("a"));
        log.clear();
        assertEquals(0, log.size());
        assertTrue(log.recent(5).isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroCapacity() {
        new ExplainabilityLog(0);
    }
}
