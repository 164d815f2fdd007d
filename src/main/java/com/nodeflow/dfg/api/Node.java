package com.nodeflow.dfg.api;

import java.util.Map;

/**
 * A node in the dataflow graph.
 *
 * A node is identified by a stable id that is unique within its graph, and
 * exposes two ordered mappings of named ports: inputs and outputs. The engine
 * never creates, removes or rewires nodes; it only reads them and, through the
 * result application step, writes computed values back into output ports.
 *
 * Computation:
 * A plain Node has no calculation step. The scheduler treats it as a
 * pass-through: it takes part in ordering (it may still carry connections) but
 * is never invoked, never reported in a calculation result and never triggers
 * calculation events. Nodes that compute something implement
 * {@link CalculableNode}.
 */
public interface Node {

    /**
     * Returns the unique id of this node within its graph.
     *
     * @return The node id.
     */
    String id();

    /**
     * Returns the node type, e.g. "Math" or "Subgraph". Used for diagnostics.
     *
     * @return The type name.
     */
    String type();

    /**
     * Returns the human-readable title of this node. Defaults to the type.
     *
     * @return The title.
     */
    default String title() {
        return type();
    }

    /**
     * Returns the input ports keyed by port name, in declaration order.
     *
     * @return An unmodifiable ordered view of the input ports.
     */
    Map<String, NodePort> inputs();

    /**
     * Returns the output ports keyed by port name, in declaration order.
     *
     * @return An unmodifiable ordered view of the output ports.
     */
    Map<String, NodePort> outputs();
}
