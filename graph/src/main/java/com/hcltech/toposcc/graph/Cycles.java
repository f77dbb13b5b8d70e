package com.hcltech.toposcc.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

public final class Cycles<V> implements SortResult<V> {
    private final List<List<V>> components;

    Cycles(List<? extends List<V>> components) {
        List<List<V>> copy = new ArrayList<>(components.size());
        for (List<V> component : components) {
            if (component.isEmpty()) throw new IllegalArgumentException("Components must not be empty");
            copy.add(List.copyOf(component));
        }
        if (copy.isEmpty()) throw new IllegalArgumentException("Cycles must contain at least one component");
        this.components = List.copyOf(copy);
    }

    @Override
    public boolean isSorted() {
        return false;
    }

    @Override
    public boolean isCyclic() {
        return true;
    }

    @Override
    public Optional<List<V>> getSorted() {
        return Optional.empty();
    }

    @Override
    public List<List<V>> getCycles() {
        return components;
    }

    @Override
    public <T> T fold(Function<List<V>, T> onSorted, Function<List<List<V>>, T> onCycles) {
        return onCycles.apply(components);
    }

    @Override
    public <U> SortResult<U> map(Function<? super V, ? extends U> f) {
        List<List<U>> mapped = new ArrayList<>(components.size());
        for (List<V> component : components) {
            List<U> c = new ArrayList<>(component.size());
            for (V v : component) c.add(f.apply(v));
            mapped.add(c);
        }
        return new Cycles<>(mapped);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Cycles<?> other && components.equals(other.components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    @Override
    public String toString() {
        return "Cycles(" + components + ")";
    }
}
