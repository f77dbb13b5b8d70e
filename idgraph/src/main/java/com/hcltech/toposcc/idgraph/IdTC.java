package com.hcltech.toposcc.idgraph;

/**
 * Converts between caller-owned vertex ids and the dense indices of an {@link com.hcltech.toposcc.graph.IndexGraph}.
 * An id is a (tag, index) pair: the tag names the collection the id belongs to (an arena, a generation...),
 * the index is the position within it.
 */
public interface IdTC<Id> {
    /** Position of the id in its collection. */
    int index(Id id);

    /** Collection the id belongs to. */
    int tag(Id id);

    /** Inverse of {@link #index} and {@link #tag}. */
    Id newId(int tag, int index);
}
