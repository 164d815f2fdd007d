package com.nodeflow.dfg.engine;

import com.nodeflow.dfg.api.Connection;
import com.nodeflow.dfg.api.GraphView;
import com.nodeflow.dfg.api.Node;
import com.nodeflow.dfg.api.NodePort;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Partitions a node and connection set into weakly-connected regions.
 *
 * Two nodes end up in the same region iff a path connects them when
 * connections are followed in either direction. Regions are discovered by a
 * depth-first traversal over successor and predecessor lists, started from
 * every node not yet visited, in node order.
 *
 * Unrelated regions can be scheduled independently: a value change inside one
 * region can never affect another.
 */
public final class ConnectedComponents {

    private ConnectedComponents() {
        // Utility class
    }

    public static List<GraphComponent> connectedComponents(GraphView graph) {
        return connectedComponents(graph.nodes(), graph.connections());
    }

    public static List<GraphComponent> connectedComponents(List<? extends Node> nodes, List<Connection> connections) {
        Objects.requireNonNull(connections, "Invalid argument value: expected list of connections");
        final int n = nodes.size();

        Map<String, Integer> portToNode = new HashMap<>();
        for (int i = 0; i < n; i++) {
            for (NodePort port : nodes.get(i).inputs().values())
                portToNode.put(port.id(), i);
            for (NodePort port : nodes.get(i).outputs().values())
                portToNode.put(port.id(), i);
        }

        // Successor and predecessor lists, as node indices
        List<List<Integer>> successors = new ArrayList<>(n);
        List<List<Integer>> predecessors = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            successors.add(new ArrayList<>());
            predecessors.add(new ArrayList<>());
        }
        for (Connection c : connections) {
            Integer from = portToNode.get(c.from().id());
            Integer to = portToNode.get(c.to().id());
            if (from == null || to == null)
                continue;
            successors.get(from).add(to);
            predecessors.get(to).add(from);
        }

        // Iterative DFS, both directions
        int[] componentOf = new int[n];
        java.util.Arrays.fill(componentOf, -1);
        List<List<Node>> regions = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        for (int start = 0; start < n; start++) {
            if (componentOf[start] >= 0)
                continue;
            int region = regions.size();
            List<Node> members = new ArrayList<>();
            regions.add(members);
            stack.push(start);
            while (!stack.isEmpty()) {
                int curr = stack.pop();
                if (componentOf[curr] >= 0)
                    continue;
                componentOf[curr] = region;
                members.add(nodes.get(curr));
                for (int next : successors.get(curr))
                    if (componentOf[next] < 0)
                        stack.push(next);
                for (int next : predecessors.get(curr))
                    if (componentOf[next] < 0)
                        stack.push(next);
            }
        }

        // Bucket connections by region, keeping their original order
        List<List<Connection>> regionConnections = new ArrayList<>(regions.size());
        for (int i = 0; i < regions.size(); i++)
            regionConnections.add(new ArrayList<>());
        for (Connection c : connections) {
            Integer from = portToNode.get(c.from().id());
            Integer to = portToNode.get(c.to().id());
            if (from != null)
                regionConnections.get(componentOf[from]).add(c);
            else if (to != null)
                regionConnections.get(componentOf[to]).add(c);
        }

        List<GraphComponent> components = new ArrayList<>(regions.size());
        for (int i = 0; i < regions.size(); i++)
            components.add(new GraphComponent(regions.get(i), regionConnections.get(i)));
        return components;
    }
}
