package com.hcltech.toposcc.graph;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a topological sort: either a complete ordering of the vertices, or the strongly connected
 * components that prevented one. Both are normal results; a cycle is not an exceptional condition.
 * <p>
 * The order of the components, and of the vertices inside a component, follows the traversal and is
 * stable for a given edge insertion order. Only the grouping itself is meaningful.
 */
public interface SortResult<V> {

    boolean isSorted();

    boolean isCyclic();

    Optional<List<V>> getSorted();

    /** Components that lie on a cycle. Empty when sorted. */
    List<List<V>> getCycles();

    <T> T fold(Function<List<V>, T> onSorted, Function<List<List<V>>, T> onCycles);

    /** Translates every vertex of either outcome, preserving order. */
    <U> SortResult<U> map(Function<? super V, ? extends U> f);

    static <V> SortResult<V> sorted(List<V> order) {
        return new Sorted<>(order);
    }

    static <V> SortResult<V> cycles(List<? extends List<V>> components) {
        return new Cycles<>(components);
    }

    default List<V> sortedOrThrow() {
        return getSorted().orElseThrow(() ->
                new IllegalStateException("Expected a topological order but got cycles: " + getCycles()));
    }

    default List<List<V>> cyclesOrThrow() {
        if (isCyclic()) return getCycles();
        throw new IllegalStateException("Expected cycles but got a topological order: " + getSorted().orElse(null));
    }

    default void ifSorted(Consumer<? super List<V>> consumer) {
        if (isSorted()) consumer.accept(getSorted().get());
    }

    default void ifCycles(Consumer<? super List<List<V>>> consumer) {
        if (isCyclic()) consumer.accept(getCycles());
    }
}
