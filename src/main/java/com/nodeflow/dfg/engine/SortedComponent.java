package com.nodeflow.dfg.engine;

import com.nodeflow.dfg.api.CalculableNode;
import com.nodeflow.dfg.api.Connection;
import com.nodeflow.dfg.api.Node;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The calculation order of one weakly-connected region.
 *
 * Data layout:
 * - order: the region's nodes in topological order. Iterating 0..N-1 visits
 * every producer before its consumers.
 * - calculables: order[i] viewed as a {@link CalculableNode}, or null for a
 * pass-through node. The capability is resolved once here instead of on every
 * visit.
 * - connectionsFromNode: the outgoing connections of every node, keyed by node id.
 * - portIdToNodeId: owner lookup for every port of the region.
 *
 * Instances are immutable and are discarded as a whole on the next structural
 * change of their graph.
 */
public final class SortedComponent {
    private final Node[] order;
    private final CalculableNode[] calculables;
    private final Map<String, Integer> idToIndex;
    private final Map<String, List<Connection>> connectionsFromNode;
    private final Map<String, String> portIdToNodeId;

    SortedComponent(Node[] order, Map<String, List<Connection>> connectionsFromNode,
            Map<String, String> portIdToNodeId) {
        this.order = order;
        this.calculables = new CalculableNode[order.length];
        this.idToIndex = new HashMap<>(order.length * 2);
        for (int i = 0; i < order.length; i++) {
            if (order[i] instanceof CalculableNode cn)
                calculables[i] = cn;
            idToIndex.put(order[i].id(), i);
        }
        Map<String, List<Connection>> outgoing = new HashMap<>(connectionsFromNode.size() * 2);
        connectionsFromNode.forEach((k, v) -> outgoing.put(k, List.copyOf(v)));
        this.connectionsFromNode = Collections.unmodifiableMap(outgoing);
        this.portIdToNodeId = Collections.unmodifiableMap(portIdToNodeId);
    }

    public int size() {
        return order.length;
    }

    /** Returns the node at position i of the calculation order. */
    public Node node(int i) {
        return order[i];
    }

    /** Returns the computable view of the node at position i, or null for a pass-through node. */
    public CalculableNode calculable(int i) {
        return calculables[i];
    }

    /** The calculation order as an unmodifiable list. */
    public List<Node> calculationOrder() {
        return Collections.unmodifiableList(Arrays.asList(order));
    }

    /** Position of a node in the calculation order, or -1 if it is not part of this region. */
    public int indexOf(String nodeId) {
        Integer idx = idToIndex.get(nodeId);
        return idx == null ? -1 : idx;
    }

    public boolean contains(String nodeId) {
        return idToIndex.containsKey(nodeId);
    }

    /** Outgoing connections of the given node; empty if it has none. */
    public List<Connection> connectionsFrom(String nodeId) {
        return connectionsFromNode.getOrDefault(nodeId, List.of());
    }

    public Map<String, List<Connection>> connectionsFromNode() {
        return connectionsFromNode;
    }

    /** Owning node of a port, or null if the port does not belong to this region. */
    public String nodeIdOfPort(String portId) {
        return portIdToNodeId.get(portId);
    }

    public Map<String, String> portIdToNodeId() {
        return portIdToNodeId;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SortedComponent[");
        for (int i = 0; i < order.length; i++) {
            if (i > 0)
                sb.append(" -> ");
            sb.append(order[i].title()).append('(').append(order[i].id()).append(')');
        }
        return sb.append(']').toString();
    }
}
