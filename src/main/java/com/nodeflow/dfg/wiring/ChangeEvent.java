package com.nodeflow.dfg.wiring;

import com.nodeflow.dfg.api.Node;

/**
 * A mutable change notification slot in the coordinator's ring buffer.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Instances are pre-allocated when the ring buffer is created and reused for
 * every notification, so publishing a change allocates nothing.
 *
 * Fields:
 * - kind: what happened (see {@link Kind}).
 * - node: for value changes, the node whose input changed; otherwise null.
 */
public final class ChangeEvent {

    /** Notification kinds. */
    public enum Kind {
        /** A node or connection was added or removed. Invalidates the order, forces a full run. */
        STRUCTURE,
        /** An input value of {@link #node()} changed. */
        VALUE,
        /** The engine was started: full run with a rebuilt order. */
        FULL,
        /** No change; runs whatever was recorded while the engine was inactive. */
        FLUSH
    }

    private Kind kind;
    private Node node;

    public void set(Kind kind, Node node) {
        this.kind = kind;
        this.node = node;
    }

    public Kind kind() {
        return kind;
    }

    public Node node() {
        return node;
    }

    public void clear() {
        kind = null;
        node = null;
    }
}
