package com.nodeflow.dfg.engine;

/**
 * Raised when a set of nodes and connections cannot be linearized because it
 * contains a directed cycle. Aborts any run touching the cyclic region.
 */
public class CycleException extends IllegalStateException {
    private final int unsortedNodes;

    public CycleException(int unsortedNodes) {
        super("Cycle detected! " + unsortedNodes + " node(s) could not be sorted");
        this.unsortedNodes = unsortedNodes;
    }

    /** Number of nodes left over when the sort ran out of ready nodes. */
    public int unsortedNodes() {
        return unsortedNodes;
    }
}
