package com.finplan.mgraph.model;

import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class InputValueTest {

    @Test
    public void testNullMemberIsUnspecified() {
        Map<String, String> coords = new HashMap<>();
        coords.put("geography", null);
        coords.put("product", "A");

        InputValue v = new InputValue("2025-01", coords, 5.0);
        assertEquals(Map.of("product", "A"), v.coords());
        assertFalse(v.coords().containsKey("geography"));
    }

    @Test
    public void testEmptyMemberIsUnspecified() {
        InputValue v = InputValue.at("2025-01", 1.0, "geography", "");
        assertTrue(v.coords().isEmpty());
    }

    @Test
    public void testNullCoordsBecomeEmpty() {
        assertTrue(new InputValue("2025-01", null, 1.0).coords().isEmpty());
    }

    @Test
    public void testCoordsAreDetachedAndReadOnly() {
        Map<String, String> coords = new HashMap<>(Map.of("geography", "US"));
        InputValue v = new InputValue("2025-01", coords, 1.0);
        coords.put("geography", "EU");
        assertEquals("US", v.coords().get("geography"));
        try {
            v.coords().put("product", "B");
            fail("coords must be read-only");
        } catch (UnsupportedOperationException expected) {
        }
    }

    @Test
    public void testPairsKeepOrder() {
        InputValue v = InputValue.at("2025-01", 1.0, "geography", "US", "product", "A");
        assertEquals(List.of("geography", "product"), List.copyOf(v.coords().keySet()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOddPairs() {
        InputValue.at("2025-01", 1.0, "geography");
    }
}
