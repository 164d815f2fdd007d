package com.nodeflow.dfg.engine;

/**
 * Signals a broken invariant between the engine and the graph model, e.g. a
 * calculation that did not produce a declared output, or a connection whose
 * source port cannot be mapped back to its node. Fatal for the current run.
 */
public class EngineStateException extends IllegalStateException {

    public EngineStateException(String message) {
        super(message);
    }
}
