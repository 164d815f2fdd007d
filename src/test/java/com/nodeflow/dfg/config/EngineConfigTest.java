package com.nodeflow.dfg.config;

import org.junit.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class EngineConfigTest {

    @Test
    public void testDefaults() {
        EngineConfig config = EngineConfig.defaults();

        assertTrue(config.isSkipNodesBeforeUpdatedNode());
        assertTrue(config.isValidateOutputs());
        assertFalse(config.isApplyResults());
        assertEquals(1024, config.getRingBufferSize());
        assertEquals("blocking", config.getWaitStrategy());
        assertEquals(1000, config.getErrorLogIntervalMillis());
    }

    @Test
    public void testLoadFromClasspath() {
        assertEquals(EngineConfig.defaults(), EngineConfig.load());
    }

    @Test
    public void testPartialJsonKeepsDefaultsAndIgnoresUnknownKeys() {
        EngineConfig config = EngineConfig.fromJson(
                "{\"applyResults\": true, \"waitStrategy\": \"yielding\", \"somethingNew\": 1}");

        assertTrue(config.isApplyResults());
        assertEquals("yielding", config.getWaitStrategy());
        assertTrue(config.isValidateOutputs());
    }

    @Test
    public void testFromFile() throws Exception {
        Path file = Files.createTempFile("engine", ".json");
        try {
            Files.writeString(file, "{\"ringBufferSize\": 64}");

            assertEquals(64, EngineConfig.fromFile(file).getRingBufferSize());
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRingBufferSizeMustBePowerOfTwo() {
        EngineConfig.fromJson("{\"ringBufferSize\": 1000}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownWaitStrategy() {
        EngineConfig config = EngineConfig.defaults();
        config.setWaitStrategy("spinning");
        config.validate();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJson() {
        EngineConfig.fromJson("{not json");
    }
}
