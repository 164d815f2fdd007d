package com.nodeflow.dfg.graph;

import com.nodeflow.dfg.api.Node;
import com.nodeflow.dfg.api.NodePort;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base class of the nodes held by a {@link Graph}: identity, title and the
 * ordered input and output port maps.
 */
public abstract class AbstractNode implements Node {
    private final String id;
    private final String type;
    private volatile String title;
    private final Map<String, Port> inputs = new LinkedHashMap<>();
    private final Map<String, Port> outputs = new LinkedHashMap<>();
    private Port.PortObserver observer;

    protected AbstractNode(String type) {
        this(UUID.randomUUID().toString(), type);
    }

    protected AbstractNode(String id, String type) {
        this.id = id;
        this.type = type;
        this.title = type;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public String title() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    @Override
    public Map<String, NodePort> inputs() {
        return Collections.unmodifiableMap(inputs);
    }

    @Override
    public Map<String, NodePort> outputs() {
        return Collections.unmodifiableMap(outputs);
    }

    /**
     * Declares an input port.
     *
     * @throws IllegalArgumentException if an input with that name exists.
     */
    public synchronized Port addInput(String name, Object defaultValue) {
        if (inputs.containsKey(name))
            throw new IllegalArgumentException("Duplicate input '" + name + "' on node " + id);
        Port port = new Port(id, name, defaultValue, true);
        port.observe(observer);
        inputs.put(name, port);
        return port;
    }

    /**
     * Declares an output port.
     *
     * @throws IllegalArgumentException if an output with that name exists.
     */
    public synchronized Port addOutput(String name, Object defaultValue) {
        if (outputs.containsKey(name))
            throw new IllegalArgumentException("Duplicate output '" + name + "' on node " + id);
        Port port = new Port(id, name, defaultValue, false);
        outputs.put(name, port);
        return port;
    }

    /**
     * Returns the input port with the given name.
     *
     * @throws IllegalArgumentException if there is no such input.
     */
    public Port input(String name) {
        Port port = inputs.get(name);
        if (port == null)
            throw new IllegalArgumentException("Unknown input '" + name + "' on node " + title + " (" + id + ")");
        return port;
    }

    /**
     * Returns the output port with the given name.
     *
     * @throws IllegalArgumentException if there is no such output.
     */
    public Port output(String name) {
        Port port = outputs.get(name);
        if (port == null)
            throw new IllegalArgumentException("Unknown output '" + name + "' on node " + title + " (" + id + ")");
        return port;
    }

    synchronized void attach(Port.PortObserver observer) {
        this.observer = observer;
        for (Port port : inputs.values())
            port.observe(observer);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + title + ", " + id + "]";
    }
}
