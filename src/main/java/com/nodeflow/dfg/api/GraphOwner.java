package com.nodeflow.dfg.api;

/**
 * The editing surface that owns the graphs an engine calculates.
 *
 * This is the narrow interface through which the engine reads the root graph,
 * resolves node ids when applying results, and receives change notifications.
 */
public interface GraphOwner {

    /** Returns the root graph that a run calculates. */
    GraphView rootGraph();

    /**
     * Looks up a node by id in the root graph or any nested graph.
     *
     * @param nodeId The node id.
     * @return The node, or null if no such node exists (any more).
     */
    Node findNodeById(String nodeId);

    /** Registers a listener for structural and value changes. */
    void addChangeListener(GraphChangeListener listener);

    /** Removes a previously registered listener. No-op if it is not registered. */
    void removeChangeListener(GraphChangeListener listener);
}
