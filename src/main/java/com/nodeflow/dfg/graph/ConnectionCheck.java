package com.nodeflow.dfg.graph;

import com.nodeflow.dfg.api.Connection;

import java.util.List;

/**
 * Outcome of {@link Graph#checkConnection}: whether the connection may be
 * added, why not, and which existing connections it would replace.
 */
public record ConnectionCheck(boolean allowed, String reason, List<Connection> replaced) {

    static ConnectionCheck allow(List<Connection> replaced) {
        return new ConnectionCheck(true, null, List.copyOf(replaced));
    }

    static ConnectionCheck reject(String reason) {
        return new ConnectionCheck(false, reason, List.of());
    }
}
