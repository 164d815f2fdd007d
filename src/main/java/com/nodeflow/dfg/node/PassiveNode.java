package com.nodeflow.dfg.node;

import com.nodeflow.dfg.graph.AbstractNode;

/**
 * A node without a calculation step, e.g. a display or annotation node.
 * It takes part in ordering but is never invoked or reported in results.
 */
public class PassiveNode extends AbstractNode {

    public PassiveNode(String type) {
        super(type);
    }

    public PassiveNode(String id, String type) {
        super(id, type);
    }

    public PassiveNode withInput(String name, Object defaultValue) {
        addInput(name, defaultValue);
        return this;
    }

    public PassiveNode withOutput(String name, Object defaultValue) {
        addOutput(name, defaultValue);
        return this;
    }
}
