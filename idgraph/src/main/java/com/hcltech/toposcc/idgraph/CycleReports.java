package com.hcltech.toposcc.idgraph;

import com.hcltech.toposcc.common.errorsor.ErrorsOr;
import com.hcltech.toposcc.graph.SortResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/** Turns sort results into messages for end users. */
public final class CycleReports {
    private CycleReports() {}

    /** The order as a value, or one error per cycle. */
    public static <V> ErrorsOr<List<V>> toErrorsOr(SortResult<V> result, Function<? super V, String> label) {
        Objects.requireNonNull(result);
        Objects.requireNonNull(label);
        return result.<ErrorsOr<List<V>>>fold(ErrorsOr::lift, cycles -> {
            List<String> errors = new ArrayList<>(cycles.size());
            for (List<V> component : cycles) errors.add(describe(component, label));
            return ErrorsOr.errors(errors);
        });
    }

    public static <V> String describe(List<V> component, Function<? super V, String> label) {
        List<String> labels = new ArrayList<>(component.size());
        for (V v : component) labels.add(label.apply(v));
        return "Cycle detected among nodes: " + labels;
    }
}
