package com.nodeflow.dfg.util;

import com.nodeflow.dfg.api.Connection;
import com.nodeflow.dfg.api.GraphView;
import com.nodeflow.dfg.api.Node;
import com.nodeflow.dfg.engine.SortedComponent;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnostic utility for inspecting calculation orders and graph structure.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and debug logging.
 * Do <b>not</b> use on the hot path (allocates strings, iterates collections).
 */
public final class GraphExplain {

    private GraphExplain() {
        // Utility class
    }

    /**
     * Dumps the calculation order of every component in text form.
     * Pass-through nodes are marked with (PT).
     */
    public static String describe(List<SortedComponent> components) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append(components.size()).append(" component(s):\n");
        for (int c = 0; c < components.size(); c++) {
            SortedComponent component = components.get(c);
            sb.append("  Component ").append(c).append(" (").append(component.size()).append(" nodes):\n");
            for (int i = 0; i < component.size(); i++) {
                Node node = component.node(i);
                sb.append("    [").append(i).append("] ").append(node.title()).append(" <").append(node.id()).append('>');
                if (component.calculable(i) == null)
                    sb.append(" (PT)");
                List<Connection> outgoing = component.connectionsFrom(node.id());
                if (!outgoing.isEmpty()) {
                    sb.append(" -> ");
                    for (int j = 0; j < outgoing.size(); j++) {
                        Connection conn = outgoing.get(j);
                        sb.append(conn.to().nodeId()).append('.').append(conn.to().name());
                        if (j < outgoing.size() - 1)
                            sb.append(", ");
                    }
                }
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid flowchart of a graph, one edge per connection,
     * labelled with the connected port names.
     */
    public static String toMermaid(GraphView graph) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        Map<String, String> safeIds = new HashMap<>();
        for (Node node : graph.nodes()) {
            String safeId = sanitize(node.id());
            safeIds.put(node.id(), safeId);
            sb.append("  ").append(safeId).append("[\"").append(node.title().replace("\"", "'")).append("\"];\n");
        }
        for (Connection conn : graph.connections()) {
            String from = safeIds.get(conn.from().nodeId());
            String to = safeIds.get(conn.to().nodeId());
            if (from == null || to == null)
                continue;
            sb.append("  ").append(from).append(" -- \"").append(conn.from().name()).append(" to ")
                    .append(conn.to().name()).append("\" --> ").append(to).append(";\n");
        }
        return sb.toString();
    }

    private static String sanitize(String name) {
        return "n_" + name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
