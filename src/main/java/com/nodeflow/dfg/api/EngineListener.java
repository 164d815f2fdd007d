package com.nodeflow.dfg.api;

/**
 * Observes the run lifecycle of an engine.
 */
public interface EngineListener {

    /**
     * Called immediately before a run begins.
     *
     * @param runId Incrementing run counter of the engine.
     */
    default void onRunStart(long runId) {
    }

    /**
     * Called when a run completed.
     *
     * @param runId  The run counter.
     * @param result The run's result.
     */
    default void onRunEnd(long runId, CalculationResult result) {
    }

    /**
     * Called when a run was aborted, e.g. by a cycle or a failing node.
     */
    default void onRunError(long runId, Throwable error) {
    }

    /**
     * Called when the engine status changed.
     */
    default void onStatusChanged(EngineStatus previous, EngineStatus current) {
    }
}
