package com.nodeflow.dfg.api;

import java.util.Map;

/**
 * Observes individual node calculations.
 *
 * Callbacks run on the thread executing the run, between node calculations.
 * Keep them cheap; they delay every dependent node.
 */
public interface CalculationListener {

    /**
     * Called after a node's inputs are resolved, before the engine decides
     * whether to invoke its calculation step.
     *
     * @param node        The node.
     * @param inputValues Resolved input values keyed by port name.
     */
    default void beforeNodeCalculation(Node node, Map<String, Object> inputValues) {
    }

    /**
     * Called with the node's outputs for this run, whether they were computed
     * or reused.
     *
     * @param node         The node.
     * @param outputValues Output values keyed by port name.
     */
    default void afterNodeCalculation(Node node, Map<String, Object> outputValues) {
    }

    /**
     * Called when a node's calculation step failed. The run is aborted after
     * this callback.
     */
    default void onNodeError(Node node, Throwable error) {
    }
}
