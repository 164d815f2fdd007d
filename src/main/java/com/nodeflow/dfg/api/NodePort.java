package com.nodeflow.dfg.api;

/**
 * A named slot on a node that can be connected to ports of other nodes.
 *
 * Input ports receive values, output ports produce them. A connection always
 * leads from exactly one output port to exactly one input port.
 *
 * Multiple Connections:
 * An input port that {@link #allowsMultipleConnections()} may be the target of
 * several connections. During a run its effective value is then the ordered
 * list of the values contributed by each connection, in the order in which the
 * connections were processed.
 */
public interface NodePort {

    /** Returns the id of this port, unique within the graph. */
    String id();

    /** Returns the id of the node owning this port. */
    String nodeId();

    /** Returns the name under which the owning node exposes this port. */
    String name();

    /**
     * Returns the stored value of this port.
     *
     * For inputs this is the externally supplied value or the value propagated
     * during the most recently applied run; for outputs it is the value written
     * back by the most recently applied run.
     */
    Object value();

    /**
     * Replaces the stored value of this port.
     *
     * @param value The new value, may be null.
     */
    void setValue(Object value);

    /** Returns the number of connections currently attached to this port. */
    int connectionCount();

    /** Returns true if this input port accepts more than one incoming connection. */
    boolean allowsMultipleConnections();
}
