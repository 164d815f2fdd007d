package com.nodeflow.dfg.api;

/**
 * Receives change notifications from a graph owner.
 *
 * Structural changes (node or connection added or removed) invalidate the
 * calculation order; value changes only name the node whose input changed.
 */
public interface GraphChangeListener {

    /**
     * Called after a node or connection was added to or removed from a graph.
     *
     * @param graph The graph whose topology changed.
     */
    void onStructureChanged(GraphView graph);

    /**
     * Called after the stored value of an input port changed.
     *
     * @param node The node owning the port.
     * @param port The port whose value changed.
     */
    void onInputValueChanged(Node node, NodePort port);
}
