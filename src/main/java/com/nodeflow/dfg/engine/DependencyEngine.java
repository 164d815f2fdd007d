package com.nodeflow.dfg.engine;

import com.nodeflow.dfg.api.CalculableNode;
import com.nodeflow.dfg.api.CalculationContext;
import com.nodeflow.dfg.api.CalculationResult;
import com.nodeflow.dfg.api.Connection;
import com.nodeflow.dfg.api.GraphOwner;
import com.nodeflow.dfg.api.GraphView;
import com.nodeflow.dfg.api.Node;
import com.nodeflow.dfg.api.NodeOutputs;
import com.nodeflow.dfg.api.NodePort;
import com.nodeflow.dfg.api.NodeResult;
import com.nodeflow.dfg.config.EngineConfig;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Incremental engine that calculates a graph region by region in dependency
 * order.
 *
 * Algorithm Details:
 *
 * 1. Order: The graph is split into weakly-connected regions, each sorted
 * topologically. The result is cached per graph and rebuilt lazily after any
 * structural change.
 *
 * 2. Hint: A run may carry an update hint, the node whose input changed. It
 * is consumed when the run starts. Regions not containing the hinted node are
 * skipped entirely; within the hinted region nodes before the hinted node's
 * position only pass their stored output values downstream (see
 * {@link EngineConfig#isSkipNodesBeforeUpdatedNode()}).
 *
 * 3. Resolve: Each input is resolved, in priority order, from a value
 * propagated earlier in the same run, from the externally supplied inputs, or
 * from the port's stored value. A port accepting multiple connections
 * resolves to the list of every value propagated into it.
 *
 * 4. Skip Unchanged: In an incremental run a node is invoked only if it is
 * the hinted node, is marked to always recalculate, or has an input whose
 * resolved value differs from its stored value. Otherwise its stored outputs
 * are propagated unchanged.
 *
 * 5. Propagate: Output values travel along every outgoing connection through
 * the transfer hook and are staged for the destination ports.
 *
 * The first failing calculation aborts the whole run; no partial result is
 * returned.
 *
 * @param <D> Type of the caller supplied calculation data.
 */
public class DependencyEngine<D> extends BaseEngine<D> {
    private static final Logger log = LogManager.getLogger(DependencyEngine.class);

    private final SortedComponentCache order = new SortedComponentCache();
    private volatile boolean recalculateOrder;
    private volatile Node updatedNode;

    public DependencyEngine(GraphOwner owner) {
        this(owner, EngineConfig.load());
    }

    public DependencyEngine(GraphOwner owner, EngineConfig config) {
        super(owner, config);
    }

    @Override
    public void start() {
        recalculateOrder = true;
        super.start();
    }

    /**
     * Sets the update hint of the next run. Consumed when that run starts.
     *
     * @param node The node whose input changed, or null for a full recompute.
     */
    public void setUpdatedNode(Node node) {
        this.updatedNode = node;
    }

    public Node updatedNode() {
        return updatedNode;
    }

    /** Forces the calculation order to be rebuilt on the next run. */
    public void invalidateOrder() {
        recalculateOrder = true;
    }

    @Override
    protected void onStructureChanged(GraphView graph) {
        recalculateOrder = true;
    }

    @Override
    protected void onChange(boolean structural, Node hint) {
        if (structural)
            recalculateOrder = true;
        updatedNode = hint;
    }

    @Override
    protected CalculationResult execute(D calculationData) {
        if (recalculateOrder) {
            recalculateOrder = false;
            order.invalidate();
        }
        GraphView graph = owner.rootGraph();
        return runGraph(graph, unconnectedInputValues(graph), calculationData);
    }

    /**
     * Calculates a graph, consuming the current update hint.
     */
    @Override
    public CalculationResult runGraph(GraphView graph, Map<String, Object> inputs, D calculationData) {
        Node hint = updatedNode;
        updatedNode = null;
        return calculate(graph, inputs, calculationData, hint);
    }

    /**
     * Collects the stored values of every input port without connections,
     * keyed by port id. These are the external inputs of a graph.
     */
    public static Map<String, Object> unconnectedInputValues(GraphView graph) {
        Map<String, Object> values = new HashMap<>();
        for (Node node : graph.nodes())
            for (NodePort port : node.inputs().values())
                if (port.connectionCount() == 0)
                    values.put(port.id(), port.value());
        return values;
    }

    private CalculationResult calculate(GraphView graph, Map<String, Object> inputs, D calculationData,
            Node updated) {
        List<SortedComponent> components = order.get(graph);

        Node hint = updated;
        if (hint != null && components.stream().noneMatch(c -> c.contains(updated.id()))) {
            // Hint from a nested graph; the subgraph node owning it has to recalculate.
            log.debug("Updated node {} is not part of graph {}, running all nodes", hint.id(), graph.id());
            hint = null;
        }

        Run run = new Run(inputs, new Context(calculationData));
        for (SortedComponent component : components) {
            int start = 0;
            if (hint != null) {
                int idx = component.indexOf(hint.id());
                if (idx < 0)
                    continue;
                if (config.isSkipNodesBeforeUpdatedNode())
                    start = idx;
            }
            run.calculateComponent(component, start, hint);
        }
        return new CalculationResult(run.results);
    }

    /** State of one graph calculation. */
    private final class Run {
        private final Map<String, Object> externalInputs;
        private final Context context;
        private final Map<String, Object> propagated = new HashMap<>();
        private final Map<String, List<Object>> contributions = new HashMap<>();
        private final Map<String, NodeResult> results = new LinkedHashMap<>();

        Run(Map<String, Object> externalInputs, Context context) {
            this.externalInputs = externalInputs;
            this.context = context;
        }

        void calculateComponent(SortedComponent component, int start, Node hint) {
            for (int i = 0; i < component.size(); i++) {
                CalculableNode node = component.calculable(i);
                if (node == null)
                    continue;

                if (i < start) {
                    // Not recalculated, but downstream ports still need its current values.
                    // Single inputs of the hinted node keep the value set on them.
                    NodeOutputs stored = storedOutputs(node);
                    for (Connection connection : component.connectionsFrom(node.id())) {
                        NodePort to = connection.to();
                        if (to.allowsMultipleConnections() || !to.nodeId().equals(hint.id()))
                            stage(node, stored, connection);
                    }
                    continue;
                }

                Map<String, Object> inputValues = new LinkedHashMap<>();
                boolean inputsChanged = false;
                for (Map.Entry<String, NodePort> e : node.inputs().entrySet()) {
                    NodePort port = e.getValue();
                    Object value = resolve(port);
                    inputValues.put(e.getKey(), value);
                    if (!inputsChanged && !node.isInputEqualTo(port, value))
                        inputsChanged = true;
                }
                Map<String, Object> inputView = Collections.unmodifiableMap(inputValues);

                calculationEvents().beforeNodeCalculation(node, inputView);
                boolean invoke = hint == null || hint.id().equals(node.id()) || node.alwaysRecalculate()
                        || inputsChanged;
                NodeOutputs outputs = invoke ? invoke(node, inputView) : storedOutputs(node);
                if (config.isValidateOutputs())
                    validateNodeCalculationOutput(node, outputs);
                calculationEvents().afterNodeCalculation(node, outputs.values());

                results.put(node.id(), new NodeResult(inputValues, outputs.values()));
                if (outputs.nestedResult() != null)
                    results.putAll(outputs.nestedResult().entries());

                for (Connection connection : component.connectionsFrom(node.id()))
                    stage(node, outputs, connection);
            }
        }

        private Object resolve(NodePort port) {
            List<Object> list = contributions.get(port.id());
            if (list != null)
                return Collections.unmodifiableList(new ArrayList<>(list));
            if (propagated.containsKey(port.id()))
                return propagated.get(port.id());
            if (externalInputs.containsKey(port.id()))
                return externalInputs.get(port.id());
            return port.value();
        }

        private NodeOutputs invoke(CalculableNode node, Map<String, Object> inputs) {
            NodeOutputs outputs;
            try {
                outputs = node.calculate(inputs, context);
            } catch (CycleException | EngineStateException | NodeCalculationException e) {
                // Raised by a nested run, already carries its origin
                calculationEvents().onNodeError(node, e);
                throw e;
            } catch (Exception e) {
                calculationEvents().onNodeError(node, e);
                throw new NodeCalculationException(node.id(), node.title(), e);
            }
            if (outputs == null)
                throw new EngineStateException("Calculation of node " + node.title() + " (" + node.id()
                        + ") returned no outputs");
            return outputs;
        }

        private NodeOutputs storedOutputs(CalculableNode node) {
            NodeOutputs.Builder b = NodeOutputs.builder();
            node.outputs().forEach((name, port) -> b.put(name, port.value()));
            return b.build();
        }

        private void stage(Node node, NodeOutputs outputs, Connection connection) {
            String key = outputKey(node, connection.from());
            if (key == null)
                throw new EngineStateException("Could not find key for port " + connection.from().id()
                        + " on node " + node.title() + " (" + node.id() + ")");
            Object value = transferHook().transfer(outputs.get(key), connection);
            NodePort target = connection.to();
            if (target.allowsMultipleConnections())
                contributions.computeIfAbsent(target.id(), k -> new ArrayList<>()).add(value);
            else
                propagated.put(target.id(), value);
        }

        private String outputKey(Node node, NodePort port) {
            for (Map.Entry<String, NodePort> e : node.outputs().entrySet())
                if (e.getValue().id().equals(port.id()))
                    return e.getKey();
            return null;
        }
    }

    private final class Context implements CalculationContext<D> {
        private final D calculationData;

        Context(D calculationData) {
            this.calculationData = calculationData;
        }

        @Override
        public D globalValues() {
            return calculationData;
        }

        @Override
        public CalculationResult runGraph(GraphView graph, Map<String, Object> inputs) {
            return calculate(graph, inputs, calculationData, null);
        }
    }
}
