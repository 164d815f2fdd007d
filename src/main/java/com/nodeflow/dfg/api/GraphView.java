package com.nodeflow.dfg.api;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Read-only view of a graph: an identity plus the nodes and connections that
 * are currently present.
 *
 * The view may contain several disjoint regions. It must not contain a
 * directed cycle; the engine reports one as a hard error.
 */
public interface GraphView {

    /** Returns the identity of the graph, used as the key of the order cache. */
    String id();

    /** Returns the nodes of the graph. */
    List<? extends Node> nodes();

    /** Returns the connections of the graph. */
    List<Connection> connections();

    /**
     * Wraps an explicit node and connection set into a view with a fresh id.
     *
     * @param nodes       The nodes.
     * @param connections The connections among them.
     * @return An immutable view.
     */
    static GraphView of(List<? extends Node> nodes, List<Connection> connections) {
        return of(UUID.randomUUID().toString(), nodes, connections);
    }

    /**
     * Wraps an explicit node and connection set into a view with the given id.
     */
    static GraphView of(String id, List<? extends Node> nodes, List<Connection> connections) {
        Objects.requireNonNull(connections, "Invalid argument value: expected list of connections");
        return new StaticGraphView(id, List.copyOf(nodes), List.copyOf(connections));
    }

    /** Immutable snapshot view. */
    record StaticGraphView(String id, List<Node> nodes, List<Connection> connections) implements GraphView {
    }
}
