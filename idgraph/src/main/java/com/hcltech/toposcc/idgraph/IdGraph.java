package com.hcltech.toposcc.idgraph;

import com.hcltech.toposcc.graph.IndexGraph;
import com.hcltech.toposcc.graph.SortResult;

import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * An {@link IndexGraph} over items that carry their own ids, e.g. objects allocated in an arena.
 * Item {@code i} of the source list must have an id whose index is {@code i}, and all items must share one tag.
 * Sorting maps the resulting indices back to ids.
 */
public final class IdGraph<Id> {
    private final IndexGraph graph;
    private final IdTC<Id> tc;
    private final int tag;

    private IdGraph(IndexGraph graph, IdTC<Id> tc, int tag) {
        this.graph = graph;
        this.tc = tc;
        this.tag = tag;
    }

    /**
     * One vertex per item. {@code edges} is called once per item, in order, with a builder bound to that item.
     *
     * @throws IllegalArgumentException if an item's id does not match its position or the tags differ
     */
    public static <T, Id> IdGraph<Id> fromItems(List<T> items,
                                                 Function<? super T, Id> idOf,
                                                 IdTC<Id> tc,
                                                 BiConsumer<IdGraphBuilder<Id>, ? super T> edges) {
        Objects.requireNonNull(items);
        Objects.requireNonNull(idOf);
        Objects.requireNonNull(tc);
        Objects.requireNonNull(edges);

        int tag = items.isEmpty() ? 0 : tc.tag(idOf.apply(items.get(0)));
        IndexGraph graph = IndexGraph.fromItems(items, (builder, item) -> {
            Id id = idOf.apply(item);
            if (tc.index(id) != builder.index())
                throw new IllegalArgumentException("Item " + builder.index() + " has id " + id + " with index " + tc.index(id));
            if (tc.tag(id) != tag)
                throw new IllegalArgumentException("Item " + builder.index() + " has id " + id + " with tag " + tc.tag(id) + ", expected " + tag);
            edges.accept(new IdGraphBuilder<>(builder, tc, id), item);
        });
        return new IdGraph<>(graph, tc, tag);
    }

    /** The underlying index graph, e.g. to {@link IndexGraph#transpose()} it before sorting. */
    public IndexGraph graph() {
        return graph;
    }

    public int tag() {
        return tag;
    }

    /** Consumes the underlying graph. See {@link IndexGraph#toposortOrScc()}. */
    public SortResult<Id> toposortOrScc() {
        return graph.toposortOrScc().map(index -> tc.newId(tag, index));
    }
}
