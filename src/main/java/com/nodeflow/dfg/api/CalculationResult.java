package com.nodeflow.dfg.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * The per-run record of every evaluated node's resolved inputs and produced
 * outputs, keyed by node id.
 *
 * A result is a snapshot: it only contains the nodes that were evaluated in
 * its run and is never modified after it has been returned.
 */
public final class CalculationResult {
    private static final CalculationResult EMPTY = new CalculationResult(Map.of());

    private final Map<String, NodeResult> entries;

    public CalculationResult(Map<String, NodeResult> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static CalculationResult empty() {
        return EMPTY;
    }

    /** Returns the entry of the given node, or null if it was not evaluated. */
    public NodeResult get(String nodeId) {
        return entries.get(nodeId);
    }

    public boolean contains(String nodeId) {
        return entries.containsKey(nodeId);
    }

    public Set<String> nodeIds() {
        return entries.keySet();
    }

    public Map<String, NodeResult> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public void forEach(BiConsumer<String, NodeResult> action) {
        entries.forEach(action);
    }

    @Override
    public String toString() {
        return "CalculationResult" + entries;
    }
}
