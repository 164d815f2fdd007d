package com.nodeflow.dfg.node;

import com.nodeflow.dfg.api.CalculableNode;
import com.nodeflow.dfg.api.CalculationContext;
import com.nodeflow.dfg.api.CalculationResult;
import com.nodeflow.dfg.api.NodeOutputs;
import com.nodeflow.dfg.api.NodePort;
import com.nodeflow.dfg.api.NodeResult;
import com.nodeflow.dfg.api.SubgraphHolder;
import com.nodeflow.dfg.engine.DependencyEngine;
import com.nodeflow.dfg.graph.AbstractNode;
import com.nodeflow.dfg.graph.Graph;
import com.nodeflow.dfg.graph.Port;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node wrapping a nested graph.
 *
 * Inputs of the node are exposed inner input ports, outputs are exposed inner
 * output ports. Calculating the node runs the inner graph through the
 * engine's {@link CalculationContext#runGraph} with the outer input values
 * fed into the exposed inner ports. The nested result is embedded in the
 * node's outputs, so the inner nodes' entries appear in the top-level result
 * and can be applied like any other.
 */
public class SubgraphNode extends AbstractNode implements CalculableNode, SubgraphHolder {
    private final Graph subgraph;
    private final Map<String, String> inputToInnerPort = new LinkedHashMap<>();
    private final Map<String, Port> outputToInnerPort = new LinkedHashMap<>();

    public SubgraphNode(Graph subgraph) {
        super("Subgraph");
        this.subgraph = subgraph;
    }

    public SubgraphNode(String id, Graph subgraph) {
        super(id, "Subgraph");
        this.subgraph = subgraph;
    }

    @Override
    public Graph subgraph() {
        return subgraph;
    }

    /**
     * Exposes an input port of an inner node as an input of this node. The
     * outer port starts with the inner port's current value.
     *
     * @return the outer port.
     */
    public Port exposeInput(String name, Port innerInput) {
        if (!innerInput.isInput())
            throw new IllegalArgumentException("Not an input port: " + innerInput.name());
        requireInner(innerInput);
        Port outer = addInput(name, innerInput.value());
        inputToInnerPort.put(name, innerInput.id());
        return outer;
    }

    /**
     * Exposes an output port of an inner node as an output of this node.
     *
     * @return the outer port.
     */
    public Port exposeOutput(String name, Port innerOutput) {
        if (innerOutput.isInput())
            throw new IllegalArgumentException("Not an output port: " + innerOutput.name());
        requireInner(innerOutput);
        Port outer = addOutput(name, innerOutput.value());
        outputToInnerPort.put(name, innerOutput);
        return outer;
    }

    @Override
    public NodeOutputs calculate(Map<String, Object> inputs, CalculationContext<?> context) {
        Map<String, Object> innerInputs = DependencyEngine.unconnectedInputValues(subgraph);
        inputToInnerPort.forEach((name, portId) -> {
            if (inputs.containsKey(name))
                innerInputs.put(portId, inputs.get(name));
        });

        CalculationResult nested = context.runGraph(subgraph, innerInputs);

        NodeOutputs.Builder b = NodeOutputs.builder().nestedResult(nested);
        outputToInnerPort.forEach((name, port) -> {
            NodeResult inner = nested.get(port.nodeId());
            // Pass-through inner nodes are not part of the result
            b.put(name, inner != null && inner.outputs().containsKey(port.name())
                    ? inner.outputs().get(port.name())
                    : port.value());
        });
        return b.build();
    }

    private void requireInner(NodePort port) {
        if (subgraph.findPort(port.id()) == null)
            throw new IllegalArgumentException("Port " + port.name() + " is not part of the subgraph");
    }
}
