package com.hcltech.toposcc.graph;

/** Adds edges to or from one vertex of a graph under construction. */
public final class IndexGraphBuilder {
    private final IndexGraph graph;
    private final int index;

    IndexGraphBuilder(IndexGraph graph, int index) {
        this.graph = graph;
        this.index = index;
    }

    /** The vertex this builder is bound to. */
    public int index() {
        return index;
    }

    public IndexGraph graph() {
        return graph;
    }

    /** Edge from the bound vertex to {@code to}. No duplicate check. */
    public void addOutEdge(int to) {
        graph.addEdge(index, to);
    }

    /** Edge from {@code from} to the bound vertex. No duplicate check. */
    public void addInEdge(int from) {
        graph.addEdge(from, index);
    }
}
