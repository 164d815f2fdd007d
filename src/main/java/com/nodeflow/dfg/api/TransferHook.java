package com.nodeflow.dfg.api;

/**
 * Intercepts a value while it travels along a connection, e.g. to coerce it
 * into the type expected by the destination port.
 */
@FunctionalInterface
public interface TransferHook {

    TransferHook IDENTITY = (value, connection) -> value;

    /**
     * @param value      The value produced by the source output port.
     * @param connection The connection being traversed.
     * @return The value to stage for the destination input port.
     */
    Object transfer(Object value, Connection connection);
}
