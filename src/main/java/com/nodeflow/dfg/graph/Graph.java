package com.nodeflow.dfg.graph;

import com.nodeflow.dfg.api.Connection;
import com.nodeflow.dfg.api.GraphChangeListener;
import com.nodeflow.dfg.api.GraphView;
import com.nodeflow.dfg.api.Node;
import com.nodeflow.dfg.api.NodePort;
import com.nodeflow.dfg.engine.TopologicalSorter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A mutable graph of nodes and connections.
 *
 * Nodes and ports are resolved through id-indexed tables; connections hold
 * port references only. Every mutation notifies the registered
 * {@link GraphChangeListener}s: adding or removing nodes and connections is a
 * structural change, setting the value of an input port is a value change.
 *
 * Connection Rules:
 * - A connection leads from an output port to an input port of another node
 * of this graph.
 * - The same pair of ports is connected at most once.
 * - A connection that would close a directed cycle is rejected.
 * - Connecting into an input port that does not accept multiple connections
 * replaces the connection it already has.
 */
public class Graph implements GraphView {
    private static final Logger log = LogManager.getLogger(Graph.class);

    private final String id;
    private final Map<String, AbstractNode> nodes = new LinkedHashMap<>();
    private final Map<String, Connection> connections = new LinkedHashMap<>();
    private final Map<String, Port> ports = new LinkedHashMap<>();
    private final List<GraphChangeListener> listeners = new CopyOnWriteArrayList<>();

    public Graph() {
        this(UUID.randomUUID().toString());
    }

    public Graph(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public synchronized List<Node> nodes() {
        return List.copyOf(nodes.values());
    }

    @Override
    public synchronized List<Connection> connections() {
        return List.copyOf(connections.values());
    }

    /**
     * Adds a node and indexes its ports.
     *
     * @return the node, for chaining.
     * @throws IllegalArgumentException if a node with the same id is present.
     */
    public <T extends AbstractNode> T addNode(T node) {
        synchronized (this) {
            if (nodes.containsKey(node.id()))
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            nodes.put(node.id(), node);
            indexPorts(node);
            node.attach(this::onPortValueChanged);
        }
        log.trace("Added node {} to graph {}", node, id);
        fireStructureChanged();
        return node;
    }

    /**
     * Removes a node together with every connection attached to it.
     *
     * @return true if the node was present.
     */
    public boolean removeNode(String nodeId) {
        synchronized (this) {
            AbstractNode node = nodes.remove(nodeId);
            if (node == null)
                return false;
            for (Connection c : new ArrayList<>(connections.values())) {
                if (c.from().nodeId().equals(nodeId) || c.to().nodeId().equals(nodeId))
                    detach(c);
            }
            node.inputs().values().forEach(p -> ports.remove(p.id()));
            node.outputs().values().forEach(p -> ports.remove(p.id()));
            node.attach(null);
        }
        fireStructureChanged();
        return true;
    }

    /**
     * Checks whether a connection from {@code from} to {@code to} may be added.
     */
    public synchronized ConnectionCheck checkConnection(NodePort from, NodePort to) {
        indexLateDeclaredPorts();
        Port source = ports.get(from.id());
        Port target = ports.get(to.id());
        if (source == null || target == null)
            return ConnectionCheck.reject("Port is not part of graph " + id);
        if (source.isInput() || !target.isInput())
            return ConnectionCheck.reject("Connections lead from an output port to an input port");
        if (source.nodeId().equals(target.nodeId()))
            return ConnectionCheck.reject("Cannot connect a node to itself");

        List<Connection> replaced = new ArrayList<>();
        for (Connection c : connections.values()) {
            if (!c.to().id().equals(target.id()))
                continue;
            if (c.from().id().equals(source.id()))
                return ConnectionCheck.reject("Ports are already connected");
            if (!target.allowsMultipleConnections())
                replaced.add(c);
        }

        List<Connection> candidate = new ArrayList<>(connections.values());
        candidate.removeAll(replaced);
        candidate.add(new Connection("__candidate", source, target));
        if (TopologicalSorter.containsCycle(new ArrayList<>(nodes.values()), candidate))
            return ConnectionCheck.reject("Connection would create a cycle");

        return ConnectionCheck.allow(replaced);
    }

    /**
     * Connects an output port to an input port.
     *
     * @return the new connection.
     * @throws IllegalArgumentException if {@link #checkConnection} rejects it.
     */
    public Connection addConnection(NodePort from, NodePort to) {
        Connection connection;
        synchronized (this) {
            ConnectionCheck check = checkConnection(from, to);
            if (!check.allowed())
                throw new IllegalArgumentException(check.reason());
            check.replaced().forEach(this::detach);
            connection = new Connection(UUID.randomUUID().toString(), ports.get(from.id()), ports.get(to.id()));
            connections.put(connection.id(), connection);
            ports.get(from.id()).connectionAdded();
            ports.get(to.id()).connectionAdded();
        }
        log.trace("Added {} to graph {}", connection, id);
        fireStructureChanged();
        return connection;
    }

    /** @return true if the connection was present. */
    public boolean removeConnection(Connection connection) {
        synchronized (this) {
            if (!connections.containsKey(connection.id()))
                return false;
            detach(connection);
        }
        fireStructureChanged();
        return true;
    }

    public synchronized AbstractNode findNodeById(String nodeId) {
        return nodes.get(nodeId);
    }

    public synchronized NodePort findPort(String portId) {
        indexLateDeclaredPorts();
        return ports.get(portId);
    }

    /** Connections ending in the given input port. */
    public synchronized List<Connection> connectionsTo(NodePort port) {
        List<Connection> result = new ArrayList<>();
        for (Connection c : connections.values())
            if (c.to().id().equals(port.id()))
                result.add(c);
        return result;
    }

    public void addChangeListener(GraphChangeListener listener) {
        if (!listeners.contains(listener))
            listeners.add(listener);
    }

    public void removeChangeListener(GraphChangeListener listener) {
        listeners.remove(listener);
    }

    private void detach(Connection c) {
        connections.remove(c.id());
        Port source = ports.get(c.from().id());
        Port target = ports.get(c.to().id());
        if (source != null)
            source.connectionRemoved();
        if (target != null)
            target.connectionRemoved();
    }

    private void indexPorts(AbstractNode node) {
        for (NodePort p : node.inputs().values())
            ports.put(p.id(), (Port) p);
        for (NodePort p : node.outputs().values())
            ports.put(p.id(), (Port) p);
    }

    // Ports may be declared after the node joined the graph.
    private void indexLateDeclaredPorts() {
        for (AbstractNode node : nodes.values())
            indexPorts(node);
    }

    private void onPortValueChanged(Port port) {
        AbstractNode node;
        synchronized (this) {
            node = nodes.get(port.nodeId());
        }
        if (node == null)
            return;
        for (GraphChangeListener l : listeners)
            l.onInputValueChanged(node, port);
    }

    private void fireStructureChanged() {
        for (GraphChangeListener l : listeners)
            l.onStructureChanged(this);
    }
}
