package com.nodeflow.dfg.graph;

import com.nodeflow.dfg.api.NodePort;
import com.nodeflow.dfg.util.Values;

import java.util.UUID;

/**
 * Mutable port of an {@link AbstractNode}.
 *
 * A port refers to its node by id only. The graph holding the node installs
 * an observer that is told about value changes of input ports; the graph
 * resolves the owning node through its id index.
 */
public class Port implements NodePort {
    private final String id;
    private final String nodeId;
    private final String name;
    private final boolean input;
    private boolean allowMultipleConnections;
    private volatile Object value;
    private volatile int connectionCount;
    private volatile PortObserver observer;

    Port(String nodeId, String name, Object value, boolean input) {
        this.id = UUID.randomUUID().toString();
        this.nodeId = nodeId;
        this.name = name;
        this.value = value;
        this.input = input;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String nodeId() {
        return nodeId;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Object value() {
        return value;
    }

    /**
     * Stores a new value. The owning graph is notified when the port is an
     * input and the value actually changed.
     */
    @Override
    public void setValue(Object value) {
        Object previous = this.value;
        this.value = value;
        PortObserver o = observer;
        if (input && o != null && !Values.structurallyEqual(previous, value))
            o.onValueChanged(this);
    }

    @Override
    public int connectionCount() {
        return connectionCount;
    }

    @Override
    public boolean allowsMultipleConnections() {
        return allowMultipleConnections;
    }

    /**
     * Lets this input port accept more than one incoming connection. Its
     * resolved value during a run is then the list of contributed values.
     *
     * @return this
     */
    public Port allowMultipleConnections() {
        if (!input)
            throw new IllegalStateException("Only input ports accept multiple connections: " + name);
        this.allowMultipleConnections = true;
        return this;
    }

    public boolean isInput() {
        return input;
    }

    void connectionAdded() {
        connectionCount++;
    }

    void connectionRemoved() {
        connectionCount--;
    }

    void observe(PortObserver observer) {
        this.observer = observer;
    }

    @Override
    public String toString() {
        return "Port[" + name + "=" + value + "]";
    }

    /** Receives value changes of an input port. */
    @FunctionalInterface
    interface PortObserver {
        void onValueChanged(Port port);
    }
}
