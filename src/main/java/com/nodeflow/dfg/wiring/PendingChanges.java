package com.nodeflow.dfg.wiring;

import com.nodeflow.dfg.api.Node;

/**
 * Accumulates the notifications of one batch into the parameters of a
 * single run.
 *
 * Merge rules:
 * - A structural or full-run notification makes the run a full recompute
 * with a rebuilt order.
 * - Value notifications keep the update hint only while they all name the
 * same node. Two different nodes, or any structural change, drop the hint,
 * since one hint cannot describe both origins.
 *
 * Only touched by the coordinator thread.
 */
final class PendingChanges {
    private boolean requested;
    private boolean structural;
    private boolean full;
    private Node hint;

    void merge(ChangeEvent.Kind kind, Node node) {
        switch (kind) {
            case FLUSH -> {
            }
            case STRUCTURE, FULL -> {
                requested = true;
                structural = true;
                full = true;
                hint = null;
            }
            case VALUE -> {
                if (!requested) {
                    requested = true;
                    hint = node;
                } else if (!full && (hint == null || node == null || !hint.id().equals(node.id()))) {
                    full = true;
                    hint = null;
                }
            }
        }
    }

    boolean requested() {
        return requested;
    }

    boolean structural() {
        return structural;
    }

    /** The update hint of the coalesced run, or null for a full recompute. */
    Node hint() {
        return full ? null : hint;
    }

    void reset() {
        requested = false;
        structural = false;
        full = false;
        hint = null;
    }
}
