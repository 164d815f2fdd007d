package com.nodeflow.dfg.graph;

import com.nodeflow.dfg.api.GraphChangeListener;
import com.nodeflow.dfg.api.GraphOwner;
import com.nodeflow.dfg.api.GraphView;
import com.nodeflow.dfg.api.Node;
import com.nodeflow.dfg.api.NodePort;
import com.nodeflow.dfg.api.SubgraphHolder;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns a root graph and the graphs nested in it through subgraph nodes.
 *
 * The editor relays change notifications of every graph it owns to its own
 * listeners and resolves node ids across all of them, so results of nested
 * runs can be applied to inner nodes.
 */
public class Editor implements GraphOwner {
    private final Graph graph;
    private final List<GraphChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Set<Graph> attached = Collections.newSetFromMap(new IdentityHashMap<>());
    private final GraphChangeListener relay = new GraphChangeListener() {
        @Override
        public void onStructureChanged(GraphView changed) {
            syncNested();
            for (GraphChangeListener l : listeners)
                l.onStructureChanged(changed);
        }

        @Override
        public void onInputValueChanged(Node node, NodePort port) {
            for (GraphChangeListener l : listeners)
                l.onInputValueChanged(node, port);
        }
    };

    public Editor() {
        this(new Graph());
    }

    public Editor(Graph graph) {
        this.graph = graph;
        syncNested();
    }

    /** The root graph. */
    public Graph graph() {
        return graph;
    }

    @Override
    public GraphView rootGraph() {
        return graph;
    }

    @Override
    public Node findNodeById(String nodeId) {
        return findIn(graph, nodeId);
    }

    @Override
    public void addChangeListener(GraphChangeListener listener) {
        if (!listeners.contains(listener))
            listeners.add(listener);
    }

    @Override
    public void removeChangeListener(GraphChangeListener listener) {
        listeners.remove(listener);
    }

    private static Node findIn(GraphView view, String nodeId) {
        for (Node node : view.nodes()) {
            if (node.id().equals(nodeId))
                return node;
            if (node instanceof SubgraphHolder holder) {
                Node inner = findIn(holder.subgraph(), nodeId);
                if (inner != null)
                    return inner;
            }
        }
        return null;
    }

    /** Relays exactly the graphs currently reachable from the root graph. */
    private synchronized void syncNested() {
        Set<Graph> reachable = Collections.newSetFromMap(new IdentityHashMap<>());
        collectNested(graph, reachable);
        for (Graph g : attached)
            if (!reachable.contains(g))
                g.removeChangeListener(relay);
        for (Graph g : reachable)
            g.addChangeListener(relay);
        attached.clear();
        attached.addAll(reachable);
    }

    private static void collectNested(Graph g, Set<Graph> into) {
        if (!into.add(g))
            return;
        for (Node node : g.nodes())
            if (node instanceof SubgraphHolder holder && holder.subgraph() instanceof Graph inner)
                collectNested(inner, into);
    }
}
