package com.nodeflow.dfg.engine;

import com.nodeflow.dfg.api.Connection;
import com.nodeflow.dfg.api.GraphView;
import com.nodeflow.dfg.api.Node;
import com.nodeflow.dfg.api.NodePort;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Linearizes a set of nodes and connections into a calculation order.
 *
 * Algorithm (Kahn):
 * 1. Map every port id to its owning node and collect, per node, the
 * connections leaving it together with the set of downstream node indices.
 * 2. Count incoming edges per node. Only edges between nodes of the given set
 * are counted, so a connection arriving from outside never blocks a node.
 * 3. Seed the ready queue with every node that has no incoming edge.
 * 4. Repeatedly take a ready node, append it to the order and consume its
 * outgoing edges; a child becomes ready once its last incoming edge is gone.
 * 5. Any edge left unconsumed belongs to a cycle.
 *
 * The relative order of nodes that are ready at the same time is unspecified.
 */
public final class TopologicalSorter {

    private TopologicalSorter() {
        // Utility class
    }

    /** Sorts the nodes of a graph. */
    public static SortedComponent sortTopologically(GraphView graph) {
        return sortTopologically(graph.nodes(), graph.connections());
    }

    /**
     * Sorts an explicit node and connection set.
     *
     * @throws CycleException if the set contains a directed cycle.
     * @throws IllegalArgumentException if two nodes share an id.
     */
    public static SortedComponent sortTopologically(List<? extends Node> nodes, List<Connection> connections) {
        Objects.requireNonNull(connections, "Invalid argument value: expected list of connections");
        final int n = nodes.size();

        // 1. Index nodes and ports
        Map<String, Integer> idToIdx = new HashMap<>(n * 2);
        Map<String, String> portIdToNodeId = new HashMap<>();
        for (int i = 0; i < n; i++) {
            Node node = nodes.get(i);
            if (idToIdx.put(node.id(), i) != null)
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            for (NodePort port : node.inputs().values())
                portIdToNodeId.put(port.id(), node.id());
            for (NodePort port : node.outputs().values())
                portIdToNodeId.put(port.id(), node.id());
        }

        // 2. Outgoing connections and adjacency (distinct downstream nodes)
        Map<String, List<Connection>> connectionsFromNode = new LinkedHashMap<>(n * 2);
        List<Set<Integer>> adjacency = new ArrayList<>(n);
        for (Node node : nodes) {
            connectionsFromNode.put(node.id(), new ArrayList<>());
            adjacency.add(new LinkedHashSet<>());
        }
        for (Connection c : connections) {
            String fromNode = portIdToNodeId.get(c.from().id());
            if (fromNode == null)
                continue;
            connectionsFromNode.get(fromNode).add(c);
            String toNode = portIdToNodeId.get(c.to().id());
            if (toNode != null)
                adjacency.get(idToIdx.get(fromNode)).add(idToIdx.get(toNode));
        }

        // 3. In-degrees
        int[] inDegree = new int[n];
        int remainingEdges = 0;
        for (Set<Integer> children : adjacency) {
            for (int child : children) {
                inDegree[child]++;
                remainingEdges++;
            }
        }

        // 4. Kahn's algorithm
        int[] queue = new int[n];
        int head = 0, tail = 0;
        for (int i = 0; i < n; i++)
            if (inDegree[i] == 0)
                queue[tail++] = i;

        Node[] order = new Node[n];
        int sorted = 0;
        while (head < tail) {
            int curr = queue[head++];
            order[sorted++] = nodes.get(curr);
            for (int child : adjacency.get(curr)) {
                remainingEdges--;
                if (--inDegree[child] == 0)
                    queue[tail++] = child; // Child is now ready
            }
        }

        if (remainingEdges > 0)
            throw new CycleException(n - sorted);

        return new SortedComponent(order, connectionsFromNode, portIdToNodeId);
    }

    /** Returns true if the graph contains a directed cycle. */
    public static boolean containsCycle(GraphView graph) {
        return containsCycle(graph.nodes(), graph.connections());
    }

    /** Returns true if the node and connection set contains a directed cycle. */
    public static boolean containsCycle(List<? extends Node> nodes, List<Connection> connections) {
        try {
            sortTopologically(nodes, connections);
            return false;
        } catch (CycleException e) {
            return true;
        }
    }
}
