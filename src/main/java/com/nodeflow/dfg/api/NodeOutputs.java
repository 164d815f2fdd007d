package com.nodeflow.dfg.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The output values produced by one invocation of a calculation step.
 *
 * Besides the values keyed by output port name, a node that internally ran a
 * subgraph may embed the nested run's result. The engine merges the nested
 * entries into the top-level result, keyed by the inner nodes' ids.
 */
public final class NodeOutputs {
    private final Map<String, Object> values;
    private final CalculationResult nestedResult;

    private NodeOutputs(Map<String, Object> values, CalculationResult nestedResult) {
        this.values = Collections.unmodifiableMap(values);
        this.nestedResult = nestedResult;
    }

    /** Creates outputs from a map. Null values are allowed. */
    public static NodeOutputs of(Map<String, ?> values) {
        return new NodeOutputs(new LinkedHashMap<>(values), null);
    }

    public static NodeOutputs empty() {
        return new NodeOutputs(new LinkedHashMap<>(), null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Output values keyed by output port name. */
    public Map<String, Object> values() {
        return values;
    }

    public Object get(String name) {
        return values.get(name);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    /** The result of a nested run, or null. */
    public CalculationResult nestedResult() {
        return nestedResult;
    }

    @Override
    public String toString() {
        return "NodeOutputs" + values;
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();
        private CalculationResult nestedResult;

        public Builder put(String name, Object value) {
            values.put(name, value);
            return this;
        }

        public Builder nestedResult(CalculationResult result) {
            this.nestedResult = result;
            return this;
        }

        public NodeOutputs build() {
            return new NodeOutputs(new LinkedHashMap<>(values), nestedResult);
        }
    }
}
