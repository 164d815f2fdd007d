package com.nodeflow.dfg.engine;

import com.nodeflow.dfg.api.Connection;
import com.nodeflow.dfg.api.GraphView;
import com.nodeflow.dfg.api.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a graph into weakly-connected regions and sorts each one
 * independently.
 */
public final class SortedComponents {

    private SortedComponents() {
        // Utility class
    }

    /**
     * @return One sorted component per weakly-connected region.
     * @throws CycleException if any region contains a directed cycle.
     */
    public static List<SortedComponent> getSortedComponents(GraphView graph) {
        return getSortedComponents(graph.nodes(), graph.connections());
    }

    public static List<SortedComponent> getSortedComponents(List<? extends Node> nodes, List<Connection> connections) {
        List<GraphComponent> components = ConnectedComponents.connectedComponents(nodes, connections);
        List<SortedComponent> sorted = new ArrayList<>(components.size());
        for (GraphComponent component : components)
            sorted.add(TopologicalSorter.sortTopologically(component.nodes(), component.connections()));
        return sorted;
    }
}
