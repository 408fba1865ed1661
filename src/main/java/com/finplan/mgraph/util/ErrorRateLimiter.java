package com.finplan.mgraph.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Limits how often errors reach the log.
 *
 * <p>
 * A model with a broken formula fails the same node on every recompute; this
 * keeps one line per interval and counts what it suppressed.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
    private final LongAdder suppressed = new LongAdder();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /** @return true if the message was logged, false if throttled */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last == Long.MIN_VALUE || now - last > minIntervalNanos) {
            // One winner per interval when several tier workers fail at once.
            if (lastLogTime.compareAndSet(last, now)) {
                long dropped = suppressed.sumThenReset();
                if (dropped > 0)
                    logger.error("{} (Throttled, {} suppressed)", message, dropped, t);
                else
                    logger.error(message, t);
                return true;
            }
        }
        suppressed.increment();
        return false;
    }

    public long suppressedCount() {
        return suppressed.sum();
    }
}
