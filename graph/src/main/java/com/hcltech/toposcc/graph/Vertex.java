package com.hcltech.toposcc.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One vertex of an {@link IndexGraph}: its in/out degree counters and the indices of its neighbours,
 * in insertion order. Duplicate neighbours are kept.
 * <p>
 * Instances handed out by the graph are read-only views. Once the graph has been sorted the degree
 * counters no longer match the edge lists.
 */
public final class Vertex {
    int inDegree;
    int outDegree;
    List<Integer> inEdges = new ArrayList<>();
    List<Integer> outEdges = new ArrayList<>();

    Vertex() {}

    public int inDegree() { return inDegree; }

    public int outDegree() { return outDegree; }

    public List<Integer> inEdges() { return Collections.unmodifiableList(inEdges); }

    public List<Integer> outEdges() { return Collections.unmodifiableList(outEdges); }

    /** Swap edge direction in place. The lists are exchanged, not copied. */
    void reverse() {
        int degree = inDegree;
        inDegree = outDegree;
        outDegree = degree;

        List<Integer> edges = inEdges;
        inEdges = outEdges;
        outEdges = edges;
    }

    @Override
    public String toString() {
        return "Vertex(in=" + inEdges + ", out=" + outEdges + ")";
    }
}
