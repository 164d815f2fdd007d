package com.nodeflow.dfg.engine;

/**
 * Wraps the failure of a node's calculation step. Aborts the run.
 */
public class NodeCalculationException extends RuntimeException {
    private final String nodeId;

    public NodeCalculationException(String nodeId, String title, Throwable cause) {
        super("Calculation of node " + title + " (" + nodeId + ") failed: " + cause.getMessage(), cause);
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
