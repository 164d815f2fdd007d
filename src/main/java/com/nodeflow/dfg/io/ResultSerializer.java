package com.nodeflow.dfg.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.nodeflow.dfg.api.CalculationResult;
import com.nodeflow.dfg.api.NodeResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts calculation results to and from JSON snapshots.
 *
 * <p>
 * Port values are written as Jackson renders them. Reading a snapshot back
 * yields plain JSON types (maps, lists, strings, numbers, booleans), so a
 * restored result only equals the original for values of those types.
 */
public final class ResultSerializer {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ResultSerializer() {
        // Utility class
    }

    public static ResultSnapshot toSnapshot(long runId, CalculationResult result) {
        ResultSnapshot snapshot = new ResultSnapshot();
        snapshot.setRunId(runId);
        result.forEach((nodeId, entry) -> {
            ResultSnapshot.NodeEntry e = new ResultSnapshot.NodeEntry();
            e.setInputs(new LinkedHashMap<>(entry.inputs()));
            e.setOutputs(new LinkedHashMap<>(entry.outputs()));
            snapshot.getNodes().put(nodeId, e);
        });
        return snapshot;
    }

    public static CalculationResult toResult(ResultSnapshot snapshot) {
        Map<String, NodeResult> entries = new LinkedHashMap<>();
        snapshot.getNodes().forEach((nodeId, e) -> entries.put(nodeId, new NodeResult(e.getInputs(), e.getOutputs())));
        return new CalculationResult(entries);
    }

    /**
     * @throws IllegalArgumentException if a port value cannot be serialized.
     */
    public static String toJson(long runId, CalculationResult result) {
        try {
            return MAPPER.writeValueAsString(toSnapshot(runId, result));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Result of run " + runId + " is not serializable: " + e.getMessage(), e);
        }
    }

    /**
     * @throws IllegalArgumentException on malformed JSON.
     */
    public static ResultSnapshot fromJson(String json) {
        try {
            return MAPPER.readValue(json, ResultSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid result snapshot: " + e.getOriginalMessage(), e);
        }
    }
}
