package com.nodeflow.dfg.api;

import java.util.Objects;

/**
 * A directed edge from an output port to an input port.
 *
 * Connections are identified by id. Equality is identity of the id so that
 * the same logical connection seen through different graph views compares
 * equal.
 */
public record Connection(String id, NodePort from, NodePort to) {

    public Connection {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Connection c && id.equals(c.id));
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Connection[" + id + ": " + from.nodeId() + "." + from.name() + " -> "
                + to.nodeId() + "." + to.name() + "]";
    }
}
