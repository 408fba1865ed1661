package com.finplan.mgraph.formula;

import org.junit.Test;

import static org.junit.Assert.*;

public class SafeIdCacheTest {

    @Test
    public void testLegalIdsMapToThemselves() {
        SafeIdCache cache = new SafeIdCache();
        assertEquals("revenue", cache.register("revenue"));
        assertEquals("revenue", cache.toSafe("revenue"));
        assertEquals("revenue", cache.toOriginal("revenue"));
        assertEquals("revenue * 2", cache.safeExpression("revenue * 2"));
    }

    @Test
    public void testUnsafeIdsGetAliases() {
        SafeIdCache cache = new SafeIdCache();
        assertEquals("a_b", cache.register("a-b"));
        assertEquals("_9x", cache.register("9x"));
        assertEquals("a-b", cache.toOriginal("a_b"));
        assertEquals("9x", cache.toOriginal("_9x"));
        assertEquals(2, cache.size());
    }

    @Test
    public void testRegisterIsIdempotent() {
        SafeIdCache cache = new SafeIdCache();
        String first = cache.register("net-income");
        assertEquals(first, cache.register("net-income"));
        assertEquals(1, cache.size());
    }

    @Test
    public void testAliasCollisionGetsSuffix() {
        SafeIdCache cache = new SafeIdCache();
        assertEquals("a_b", cache.register("a-b"));
        assertEquals("a_b_1", cache.register("a.b"));
    }

    @Test
    public void testLegalIdDisplacesSquattingAlias() {
        SafeIdCache cache = new SafeIdCache();
        cache.register("a-b");
        assertEquals("a_b", cache.register("a_b"));
        assertEquals("a_b", cache.toOriginal("a_b"));
        assertEquals("a_b_1", cache.toSafe("a-b"));
    }

    @Test
    public void testLongestIdRewrittenFirst() {
        SafeIdCache cache = new SafeIdCache();
        cache.register("a-b");
        cache.register("a-b-c");
        assertEquals("a_b_c + a_b", cache.safeExpression("a-b-c + a-b"));
    }

    @Test
    public void testRewriteRespectsIdentifierBoundaries() {
        SafeIdCache cache = new SafeIdCache();
        cache.register("x-1");
        assertEquals("x_1 + yx-1", cache.safeExpression("x-1 + yx-1"));
    }

    @Test
    public void testUnregister() {
        SafeIdCache cache = new SafeIdCache();
        cache.register("a-b");
        cache.unregister("a-b");
        assertEquals(0, cache.size());
        assertEquals("a-b", cache.safeExpression("a-b"));
    }

    @Test
    public void testIsLegalIdentifier() {
        assertTrue(SafeIdCache.isLegalIdentifier("_x1"));
        assertFalse(SafeIdCache.isLegalIdentifier("1x"));
        assertFalse(SafeIdCache.isLegalIdentifier("a-b"));
        assertFalse(SafeIdCache.isLegalIdentifier(""));
    }
}
