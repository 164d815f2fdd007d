package com.nodeflow.dfg.api;

/**
 * A node that contains a nested graph. Graph owners use it to resolve node
 * ids of inner nodes when results of nested runs are applied.
 */
public interface SubgraphHolder {

    GraphView subgraph();
}
