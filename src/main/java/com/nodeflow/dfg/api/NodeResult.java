package com.nodeflow.dfg.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolved inputs and produced outputs of a single node in one run.
 *
 * Both maps are unmodifiable copies keyed by port name.
 */
public record NodeResult(Map<String, Object> inputs, Map<String, Object> outputs) {

    public NodeResult {
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }
}
