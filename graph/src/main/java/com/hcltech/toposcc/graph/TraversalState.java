package com.hcltech.toposcc.graph;

/** Per-vertex scratch state of the SCC search. */
enum TraversalState {
    /** Not reached by the forward search. */
    UNVISITED,
    /** Reached by the forward search, not yet assigned by the reverse search. */
    DISCOVERED,
    /** Assigned to a component, or known to lie on no cycle. */
    FINALIZED
}
