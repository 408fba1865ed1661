package com.finplan.mgraph;

import com.finplan.mgraph.error.ConfigurationException;
import org.junit.Test;

import java.util.Properties;

import static org.junit.Assert.*;

public class EngineConfigTest {

    @Test
    public void testDefaults() {
        EngineConfig config = EngineConfig.defaults();
        assertTrue(config.getWorkerThreads() >= 1);
        assertEquals(64, config.getParallelTierThreshold());
        assertEquals(1000, config.getTraceCapacity());
        assertEquals(1024, config.getRingBufferSize());
    }

    @Test
    public void testFromProperties() {
        Properties props = new Properties();
        props.setProperty("metricgraph.workerThreads", " 8 ");
        props.setProperty("metricgraph.ringBufferSize", "256");
        props.setProperty("unrelated.key", "x");

        EngineConfig config = EngineConfig.fromProperties(props);
        assertEquals(8, config.getWorkerThreads());
        assertEquals(256, config.getRingBufferSize());
        assertEquals(64, config.getParallelTierThreshold());
    }

    @Test
    public void testLoadReadsClasspathResource() {
        EngineConfig config = EngineConfig.load();
        assertEquals(2, config.getWorkerThreads());
        assertEquals(4, config.getParallelTierThreshold());
        assertEquals(100, config.getTraceCapacity());
    }

    @Test
    public void testToBuilder() {
        EngineConfig config = EngineConfig.defaults().toBuilder().traceCapacity(5).build();
        assertEquals(5, config.getTraceCapacity());
    }

    @Test(expected = ConfigurationException.class)
    public void testMalformedNumber() {
        Properties props = new Properties();
        props.setProperty("metricgraph.traceCapacity", "lots");
        EngineConfig.fromProperties(props);
    }

    @Test(expected = ConfigurationException.class)
    public void testRingBufferMustBePowerOfTwo() {
        EngineConfig.builder().ringBufferSize(1000).build().validate();
    }

    @Test(expected = ConfigurationException.class)
    public void testWorkerThreadsMustBePositive() {
        EngineConfig.builder().workerThreads(0).build().validate();
    }
}
