package com.nodeflow.dfg.api;

import java.util.Map;

/**
 * Context handed to every calculation step of a run.
 *
 * @param <D> Type of the caller supplied calculation data.
 */
public interface CalculationContext<D> {

    /** Returns the calculation data passed unchanged to every node of the run. */
    D globalValues();

    /**
     * Runs a nested graph with the engine executing the current run.
     *
     * Used by nodes that wrap a subgraph. The nested run uses the same
     * calculation data and the same transfer hook, and never carries an update
     * hint.
     *
     * @param graph  The nested graph.
     * @param inputs Values of the nested graph's external input ports, keyed by port id.
     * @return The nested run's result.
     */
    CalculationResult runGraph(GraphView graph, Map<String, Object> inputs);
}
