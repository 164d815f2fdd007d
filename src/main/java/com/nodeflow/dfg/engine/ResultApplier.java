package com.nodeflow.dfg.engine;

import com.nodeflow.dfg.api.CalculationResult;
import com.nodeflow.dfg.api.GraphOwner;
import com.nodeflow.dfg.api.Node;
import com.nodeflow.dfg.api.NodePort;

import lombok.extern.log4j.Log4j2;

/**
 * Writes a run's result back into the graph.
 *
 * For every entry whose node still exists, each produced output value is
 * stored on the output port of the same name, and each resolved value of a
 * connected input port is stored on that port. The stored input values are
 * what the next incremental run compares against to decide whether a node
 * must be recalculated.
 *
 * Entries of nodes removed since the run, and keys naming ports the node no
 * longer has, are skipped silently.
 *
 * Writing connected inputs fires value change notifications. An engine that
 * applies its own results suppresses them; callers applying a result by hand
 * to a started engine should pause it around the call.
 */
@Log4j2
public final class ResultApplier {

    private ResultApplier() {
        // Utility class
    }

    public static void applyResult(CalculationResult result, GraphOwner owner) {
        result.forEach((nodeId, entry) -> {
            Node node = owner.findNodeById(nodeId);
            if (node == null) {
                log.trace("Skipping result of removed node {}", nodeId);
                return;
            }
            entry.outputs().forEach((name, value) -> {
                NodePort port = node.outputs().get(name);
                if (port != null)
                    port.setValue(value);
            });
            entry.inputs().forEach((name, value) -> {
                NodePort port = node.inputs().get(name);
                if (port != null && port.connectionCount() > 0)
                    port.setValue(value);
            });
        });
    }
}
