package com.finplan.mgraph.util;

import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import static org.junit.Assert.*;

public class ErrorRateLimiterTest {

    @Test
    public void testFirstCallLogsThenThrottles() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 60_000);
        assertTrue(limiter.log("first", new RuntimeException("boom")));
        assertFalse(limiter.log("second", null));
        assertFalse(limiter.log("third", null));
        assertEquals(2, limiter.suppressedCount());
    }

    @Test
    public void testZeroIntervalNeverThrottlesSequentialCalls() throws Exception {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 0);
        assertTrue(limiter.log("one", null));
        Thread.sleep(1);
        assertTrue(limiter.log("two", null));
        assertEquals(0, limiter.suppressedCount());
    }
}
