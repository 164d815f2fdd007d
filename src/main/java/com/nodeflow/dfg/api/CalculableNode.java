package com.nodeflow.dfg.api;

import com.nodeflow.dfg.util.Values;

import java.util.Map;

/**
 * A node that carries a calculation step.
 *
 * The engine resolves a node's capability once when it builds the
 * calculation order: a node implementing this interface is "computable",
 * any other node is a pass-through.
 *
 * Recalculation Contract:
 * During an incremental run (one with an update hint), a computable node is
 * only invoked if it is the hinted node, if {@link #alwaysRecalculate()} is
 * set, or if at least one resolved input differs from the port's stored value
 * according to {@link #isInputEqualTo(NodePort, Object)}. Otherwise the node's
 * stored output values are reused as the run's outputs.
 */
public interface CalculableNode extends Node {

    /**
     * Computes the output values from the resolved input values.
     *
     * The returned outputs must contain a value for every declared output port.
     * The call may block; the engine waits for it before visiting dependents.
     *
     * @param inputs  Resolved input values keyed by input port name. For a port
     *                accepting multiple connections the value is a list.
     * @param context Run context carrying the caller supplied calculation data.
     * @return The produced output values.
     * @throws Exception If the calculation fails. The failure aborts the run.
     */
    NodeOutputs calculate(Map<String, Object> inputs, CalculationContext<?> context) throws Exception;

    /**
     * Returns true if this node must be recalculated on every run regardless
     * of whether its inputs changed.
     */
    default boolean alwaysRecalculate() {
        return false;
    }

    /**
     * Structural equality between a port's stored value and a resolved value.
     *
     * Override when values are wrapped by the editing surface in a way that
     * changes their identity or equality semantics.
     *
     * @param port  The input port.
     * @param value The value resolved for the current run.
     * @return true if the value is unchanged.
     */
    default boolean isInputEqualTo(NodePort port, Object value) {
        return Values.structurallyEqual(port.value(), value);
    }
}
