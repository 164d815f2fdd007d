package com.nodeflow.dfg.engine;

import com.nodeflow.dfg.api.GraphView;
import com.nodeflow.dfg.util.GraphExplain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-graph cache of sorted components, keyed by graph id.
 *
 * Entries are built lazily on the first run after an invalidation and stay
 * valid only while the graph's node and connection set is unchanged. Any
 * structural change invalidates the whole cache; entries are never patched.
 */
public final class SortedComponentCache {
    private static final Logger log = LogManager.getLogger(SortedComponentCache.class);

    private final Map<String, List<SortedComponent>> order = new ConcurrentHashMap<>();

    /**
     * Returns the sorted components of the graph, building them on a miss.
     *
     * @throws CycleException if the graph contains a cycle. Nothing is cached then.
     */
    public List<SortedComponent> get(GraphView graph) {
        List<SortedComponent> components = order.get(graph.id());
        if (components == null) {
            components = List.copyOf(SortedComponents.getSortedComponents(graph));
            order.put(graph.id(), components);
            if (log.isDebugEnabled())
                log.debug("Rebuilt calculation order of graph {}:\n{}", graph.id(), GraphExplain.describe(components));
        }
        return components;
    }

    public boolean contains(String graphId) {
        return order.containsKey(graphId);
    }

    /** Drops every cached entry. */
    public void invalidate() {
        order.clear();
    }

    public int size() {
        return order.size();
    }
}
