package com.finplan.mgraph.util;

import com.finplan.mgraph.api.RecomputeListener;

import java.util.Arrays;

/**
 * Fans callbacks out to several {@link RecomputeListener}s.
 *
 * <p>
 * The listener array is replaced copy-on-write, so worker threads iterate a
 * stable snapshot without locking.
 */
public class CompositeRecomputeListener implements RecomputeListener {
    private volatile RecomputeListener[] listeners = new RecomputeListener[0];

    public synchronized void add(RecomputeListener listener) {
        RecomputeListener[] old = listeners;
        RecomputeListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public synchronized boolean remove(RecomputeListener listener) {
        RecomputeListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                RecomputeListener[] next = new RecomputeListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRecomputeStart(long batch, String triggerId, int affectedCount) {
        for (RecomputeListener l : listeners)
            l.onRecomputeStart(batch, triggerId, affectedCount);
    }

    @Override
    public void onNodeEvaluated(long batch, String metricId, int tier, long durationNanos) {
        for (RecomputeListener l : listeners)
            l.onNodeEvaluated(batch, metricId, tier, durationNanos);
    }

    @Override
    public void onNodeError(long batch, String metricId, Throwable error) {
        for (RecomputeListener l : listeners)
            l.onNodeError(batch, metricId, error);
    }

    @Override
    public void onNodeWarning(long batch, String metricId, String message) {
        for (RecomputeListener l : listeners)
            l.onNodeWarning(batch, metricId, message);
    }

    @Override
    public void onRecomputeEnd(long batch, int evaluated, int failed) {
        for (RecomputeListener l : listeners)
            l.onRecomputeEnd(batch, evaluated, failed);
    }
}
