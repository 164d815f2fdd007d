package com.nodeflow.dfg.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Engine settings.
 *
 * Bound from JSON with Jackson. Unknown keys are ignored so that one file can
 * be shared between engine versions. {@link #load()} reads
 * {@value #RESOURCE_NAME} from the classpath and falls back to the defaults
 * declared here.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {
    public static final String RESOURCE_NAME = "dataflow-engine.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Start an incremental run at the updated node's position in the
     * calculation order instead of at the first node. A heuristic: nodes placed
     * before the updated node are assumed unaffected. They are neither
     * calculated nor reported, but their stored outputs still reach the ports
     * they feed, except single-connection inputs of the updated node itself.
     */
    private boolean skipNodesBeforeUpdatedNode = true;

    /** Fail a run when a calculation does not produce every declared output. */
    private boolean validateOutputs = true;

    /** Apply the result of every coordinated run back into the graph. */
    private boolean applyResults = false;

    /** Capacity of the change notification ring buffer. Must be a power of two. */
    private int ringBufferSize = 1024;

    /** Wait strategy of the coordinator thread: "blocking" or "yielding". */
    private String waitStrategy = "blocking";

    /** Minimum interval between two logged failures of coordinated runs. */
    private long errorLogIntervalMillis = 1000;

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * Loads {@value #RESOURCE_NAME} from the classpath, or returns the
     * defaults if there is no such resource.
     */
    public static EngineConfig load() {
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in == null)
                return defaults();
            return MAPPER.readValue(in, EngineConfig.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + RESOURCE_NAME, e);
        }
    }

    public static EngineConfig fromFile(Path path) {
        try {
            return fromJson(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load engine configuration from " + path, e);
        }
    }

    public static EngineConfig fromJson(String json) {
        try {
            return MAPPER.readValue(json, EngineConfig.class).validate();
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid engine configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Checks value ranges.
     *
     * @return this
     * @throws IllegalArgumentException on an invalid setting.
     */
    public EngineConfig validate() {
        if (ringBufferSize < 1 || Integer.bitCount(ringBufferSize) != 1)
            throw new IllegalArgumentException("ringBufferSize must be a power of two: " + ringBufferSize);
        if (!"blocking".equals(waitStrategy) && !"yielding".equals(waitStrategy))
            throw new IllegalArgumentException("Unknown waitStrategy: " + waitStrategy);
        if (errorLogIntervalMillis < 0)
            throw new IllegalArgumentException("errorLogIntervalMillis must not be negative");
        return this;
    }
}
