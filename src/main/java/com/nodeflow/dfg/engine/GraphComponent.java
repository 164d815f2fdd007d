package com.nodeflow.dfg.engine;

import com.nodeflow.dfg.api.Connection;
import com.nodeflow.dfg.api.Node;

import java.util.List;

/**
 * A maximal weakly-connected region of a graph: its nodes and every
 * connection with at least one endpoint among them.
 */
public record GraphComponent(List<Node> nodes, List<Connection> connections) {

    public GraphComponent {
        nodes = List.copyOf(nodes);
        connections = List.copyOf(connections);
    }
}
