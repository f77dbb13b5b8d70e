package com.hcltech.toposcc.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

public final class Sorted<V> implements SortResult<V> {
    private final List<V> order;

    Sorted(List<V> order) {
        this.order = List.copyOf(order);
    }

    @Override
    public boolean isSorted() {
        return true;
    }

    @Override
    public boolean isCyclic() {
        return false;
    }

    @Override
    public Optional<List<V>> getSorted() {
        return Optional.of(order);
    }

    @Override
    public List<List<V>> getCycles() {
        return List.of();
    }

    @Override
    public <T> T fold(Function<List<V>, T> onSorted, Function<List<List<V>>, T> onCycles) {
        return onSorted.apply(order);
    }

    @Override
    public <U> SortResult<U> map(Function<? super V, ? extends U> f) {
        List<U> mapped = new ArrayList<>(order.size());
        for (V v : order) mapped.add(f.apply(v));
        return new Sorted<>(mapped);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Sorted<?> other && order.equals(other.order);
    }

    @Override
    public int hashCode() {
        return order.hashCode();
    }

    @Override
    public String toString() {
        return "Sorted(" + order + ")";
    }
}
