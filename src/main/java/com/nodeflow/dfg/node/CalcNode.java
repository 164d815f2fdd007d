package com.nodeflow.dfg.node;

import com.nodeflow.dfg.api.CalculableNode;
import com.nodeflow.dfg.api.CalculationContext;
import com.nodeflow.dfg.api.NodeOutputs;
import com.nodeflow.dfg.graph.AbstractNode;

import java.util.Map;
import java.util.Objects;

/**
 * A general-purpose node that delegates its calculation to a functional
 * interface.
 *
 * <pre>
 * CalcNode add = new CalcNode("Add")
 *         .withInput("a", 0)
 *         .withInput("b", 0)
 *         .withOutput("sum", 0)
 *         .calculation((in, ctx) -&gt; NodeOutputs.builder()
 *                 .put("sum", (int) in.get("a") + (int) in.get("b"))
 *                 .build());
 * </pre>
 */
public class CalcNode extends AbstractNode implements CalculableNode {
    private volatile CalcFn fn = (inputs, context) -> NodeOutputs.empty();
    private volatile boolean alwaysRecalculate;

    public CalcNode(String type) {
        super(type);
    }

    public CalcNode(String id, String type) {
        super(id, type);
    }

    public CalcNode withInput(String name, Object defaultValue) {
        addInput(name, defaultValue);
        return this;
    }

    /** Declares an input port accepting any number of connections. */
    public CalcNode withMultiInput(String name, Object defaultValue) {
        addInput(name, defaultValue).allowMultipleConnections();
        return this;
    }

    public CalcNode withOutput(String name, Object defaultValue) {
        addOutput(name, defaultValue);
        return this;
    }

    public CalcNode calculation(CalcFn fn) {
        this.fn = Objects.requireNonNull(fn, "fn");
        return this;
    }

    public CalcNode alwaysRecalculate(boolean value) {
        this.alwaysRecalculate = value;
        return this;
    }

    @Override
    public boolean alwaysRecalculate() {
        return alwaysRecalculate;
    }

    @Override
    public NodeOutputs calculate(Map<String, Object> inputs, CalculationContext<?> context) throws Exception {
        return fn.calculate(inputs, context);
    }

    /** The computation logic. */
    @FunctionalInterface
    public interface CalcFn {
        NodeOutputs calculate(Map<String, Object> inputs, CalculationContext<?> context) throws Exception;
    }
}
