package com.nodeflow.dfg.io;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * POJO representation of a calculation result.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ResultSnapshot {
    private long runId;
    private Map<String, NodeEntry> nodes = new LinkedHashMap<>();

    /** Resolved inputs and produced outputs of one node. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class NodeEntry {
        private Map<String, Object> inputs = new LinkedHashMap<>();
        private Map<String, Object> outputs = new LinkedHashMap<>();
    }
}
