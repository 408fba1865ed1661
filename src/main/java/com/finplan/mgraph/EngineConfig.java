package com.finplan.mgraph;

import com.finplan.mgraph.error.ConfigurationException;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Tuning knobs of one {@link MetricGraph}.
 *
 * <p>
 * Build programmatically, or read {@code metricgraph.*} keys from a
 * {@link Properties} source:
 *
 * <pre>
 * metricgraph.workerThreads=4
 * metricgraph.parallelTierThreshold=64
 * metricgraph.traceCapacity=1000
 * metricgraph.errorLogIntervalMillis=1000
 * metricgraph.ringBufferSize=1024
 * </pre>
 */
@Getter
@ToString
@Builder(toBuilder = true)
public final class EngineConfig {
    public static final String RESOURCE = "metric-graph.properties";
    public static final String PREFIX = "metricgraph.";

    /** Tier worker pool size. 1 evaluates every tier on the calling thread. */
    @Builder.Default
    private final int workerThreads = Math.min(4, Runtime.getRuntime().availableProcessors());

    /** Tiers with at least this many nodes are split across the pool. */
    @Builder.Default
    private final int parallelTierThreshold = 64;

    /** Trace entries kept before the oldest is overwritten. */
    @Builder.Default
    private final int traceCapacity = 1000;

    /** Minimum gap between two logged node failures. */
    @Builder.Default
    private final long errorLogIntervalMillis = 1000;

    /** Slots in the update ring buffer; must be a power of two. */
    @Builder.Default
    private final int ringBufferSize = 1024;

    public static EngineConfig defaults() {
        return builder().build();
    }

    /** Reads {@code metricgraph.*} keys; missing keys keep their defaults. */
    public static EngineConfig fromProperties(Properties props) {
        EngineConfig d = defaults();
        EngineConfig config = builder()
                .workerThreads(intValue(props, "workerThreads", d.workerThreads))
                .parallelTierThreshold(intValue(props, "parallelTierThreshold", d.parallelTierThreshold))
                .traceCapacity(intValue(props, "traceCapacity", d.traceCapacity))
                .errorLogIntervalMillis(longValue(props, "errorLogIntervalMillis", d.errorLogIntervalMillis))
                .ringBufferSize(intValue(props, "ringBufferSize", d.ringBufferSize))
                .build();
        config.validate();
        return config;
    }

    /**
     * Reads {@value #RESOURCE} from the classpath, falling back to defaults
     * when it is absent.
     */
    public static EngineConfig load() {
        ClassLoader cl = EngineConfig.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
            if (in == null)
                return defaults();
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    /** @throws ConfigurationException if any value is out of range */
    public EngineConfig validate() {
        if (workerThreads < 1)
            throw new ConfigurationException("workerThreads must be at least 1: " + workerThreads);
        if (parallelTierThreshold < 1)
            throw new ConfigurationException("parallelTierThreshold must be at least 1: " + parallelTierThreshold);
        if (traceCapacity < 1)
            throw new ConfigurationException("traceCapacity must be at least 1: " + traceCapacity);
        if (errorLogIntervalMillis < 0)
            throw new ConfigurationException("errorLogIntervalMillis must not be negative: " + errorLogIntervalMillis);
        if (ringBufferSize < 1 || Integer.bitCount(ringBufferSize) != 1)
            throw new ConfigurationException("ringBufferSize must be a power of two: " + ringBufferSize);
        return this;
    }

    private static int intValue(Properties props, String key, int fallback) {
        String raw = props.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank())
            return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + PREFIX + key + ": '" + raw + "'");
        }
    }

    private static long longValue(Properties props, String key, long fallback) {
        String raw = props.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank())
            return fallback;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + PREFIX + key + ": '" + raw + "'");
        }
    }
}
