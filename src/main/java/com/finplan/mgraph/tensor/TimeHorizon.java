package com.finplan.mgraph.tensor;

import com.finplan.mgraph.error.ConfigurationException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered month labels forming the shared time axis of every tensor.
 */
public final class TimeHorizon {
    /** Placeholder before {@code initializeHorizon} is called. */
    public static final TimeHorizon NONE = new TimeHorizon();

    private final List<String> months;
    private final Map<String, Integer> monthToIndex;
    private final boolean initialized;

    private TimeHorizon() {
        this.months = List.of();
        this.monthToIndex = Map.of();
        this.initialized = false;
    }

    public TimeHorizon(List<String> months) {
        this.months = List.copyOf(months);
        this.monthToIndex = new HashMap<>(months.size() * 2);
        for (int i = 0; i < this.months.size(); i++) {
            if (monthToIndex.put(this.months.get(i), i) != null)
                throw new ConfigurationException("Duplicate month '" + this.months.get(i) + "' in horizon");
        }
        this.initialized = true;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public int length() {
        return months.size();
    }

    public List<String> months() {
        return months;
    }

    /** Time index of a month label, or -1 when it lies outside the horizon. */
    public int indexOf(String month) {
        Integer idx = monthToIndex.get(month);
        return idx == null ? -1 : idx;
    }

    public String month(int index) {
        return months.get(index);
    }
}
