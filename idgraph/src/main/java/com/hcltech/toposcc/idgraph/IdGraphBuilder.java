package com.hcltech.toposcc.idgraph;

import com.hcltech.toposcc.graph.IndexGraphBuilder;

/** Adds edges to or from one item of an {@link IdGraph}, addressing the other end by id. */
public final class IdGraphBuilder<Id> {
    private final IndexGraphBuilder builder;
    private final IdTC<Id> tc;
    private final Id id;

    IdGraphBuilder(IndexGraphBuilder builder, IdTC<Id> tc, Id id) {
        this.builder = builder;
        this.tc = tc;
        this.id = id;
    }

    /** Id of the item this builder is bound to. */
    public Id id() {
        return id;
    }

    public void addOutEdge(Id to) {
        builder.addOutEdge(tc.index(to));
    }

    public void addInEdge(Id from) {
        builder.addInEdge(tc.index(from));
    }
}
