package com.hcltech.toposcc.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Adjacency-list graph over the dense vertex indices {@code 0..vertexCount-1}.
 * <p>
 * Each vertex stores its incoming and outgoing edges by neighbour index; no other data is kept per vertex.
 * The vertex count is fixed at construction, edges are only ever added. A graph is consumed by
 * {@link #toposortOrScc()} and every operation on it fails afterwards.
 * <p>
 * Not thread safe.
 */
public final class IndexGraph implements Iterable<Vertex> {
    private final List<Vertex> vertices;
    private boolean consumed;

    private IndexGraph(int vertexCount) {
        this.vertices = new ArrayList<>(vertexCount);
        for (int i = 0; i < vertexCount; i++) vertices.add(new Vertex());
    }

    /** A graph with {@code vertexCount} vertices and no edges. */
    public static IndexGraph withVertices(int vertexCount) {
        if (vertexCount < 0) throw new IllegalArgumentException("Vertex count must not be negative: " + vertexCount);
        return new IndexGraph(vertexCount);
    }

    /** Vertex {@code i} gets one out-edge for every entry of {@code adjacency.get(i)}. */
    public static IndexGraph fromAdjacency(List<? extends List<Integer>> adjacency) {
        Objects.requireNonNull(adjacency);
        return fromItems(adjacency, (builder, targets) -> {
            for (int to : targets) builder.addOutEdge(to);
        });
    }

    /**
     * One vertex per item, vertex {@code i} being {@code items.get(i)}. The callback is invoked once per item,
     * in order, with a builder bound to that item's index.
     */
    public static <T> IndexGraph fromItems(List<T> items, BiConsumer<IndexGraphBuilder, ? super T> edges) {
        Objects.requireNonNull(items);
        Objects.requireNonNull(edges);
        IndexGraph graph = new IndexGraph(items.size());
        for (int i = 0; i < items.size(); i++) {
            edges.accept(new IndexGraphBuilder(graph, i), items.get(i));
        }
        return graph;
    }

    public int vertexCount() {
        checkNotConsumed();
        return vertices.size();
    }

    public int edgeCount() {
        checkNotConsumed();
        int count = 0;
        for (Vertex v : vertices) count += v.outEdges.size();
        return count;
    }

    public Vertex vertex(int index) {
        checkNotConsumed();
        return vertices.get(Objects.checkIndex(index, vertices.size()));
    }

    /** Adds the edge {@code from -> to}. Does not check for duplicate edges. */
    public void addEdge(int from, int to) {
        checkNotConsumed();
        Vertex source = vertices.get(Objects.checkIndex(from, vertices.size()));
        Vertex target = vertices.get(Objects.checkIndex(to, vertices.size()));
        source.outDegree++;
        target.inDegree++;
        source.outEdges.add(to);
        target.inEdges.add(from);
    }

    /** Reverses every edge of the graph in place. */
    public void transpose() {
        checkNotConsumed();
        for (Vertex v : vertices) v.reverse();
    }

    /** Consumes this graph. See {@link Topo#toposortOrScc(IndexGraph)}. */
    public SortResult<Integer> toposortOrScc() {
        return Topo.toposortOrScc(this);
    }

    public boolean isConsumed() {
        return consumed;
    }

    /** Hands the vertices over to the sorter; the graph is unusable from here on. */
    List<Vertex> consume() {
        checkNotConsumed();
        consumed = true;
        return vertices;
    }

    @Override
    public Iterator<Vertex> iterator() {
        checkNotConsumed();
        return Collections.unmodifiableList(vertices).iterator();
    }

    private void checkNotConsumed() {
        if (consumed) throw new IllegalStateException("Graph has already been consumed by toposortOrScc");
    }

    @Override
    public String toString() {
        return consumed ? "IndexGraph(consumed)" : "IndexGraph" + vertices;
    }
}
