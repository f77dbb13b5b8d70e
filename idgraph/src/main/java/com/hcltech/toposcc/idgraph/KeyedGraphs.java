package com.hcltech.toposcc.idgraph;

import com.hcltech.toposcc.common.errorsor.ErrorsOr;
import com.hcltech.toposcc.graph.IndexGraph;
import com.hcltech.toposcc.graph.SortResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Dependency ordering for graphs keyed by arbitrary values. A dependency always comes before its dependents.
 */
public final class KeyedGraphs {
    private static final Logger log = LoggerFactory.getLogger(KeyedGraphs.class);

    private KeyedGraphs() {}

    /** Keys are the map's keys, in iteration order. See {@link #toposortOrScc(Collection, Function)}. */
    public static <K> ErrorsOr<SortResult<K>> toposortOrScc(Map<K, ? extends Collection<K>> dependencies) {
        Objects.requireNonNull(dependencies);
        return toposortOrScc(dependencies.keySet(), k -> dependencies.get(k));
    }

    /**
     * Sorts {@code nodes} so that every node follows the nodes it depends on.
     *
     * @return every reference to a node outside {@code nodes} as an error, otherwise the sort result in keys
     */
    public static <K> ErrorsOr<SortResult<K>> toposortOrScc(Collection<K> nodes,
                                                          Function<? super K, ? extends Collection<K>> dependsOn) {
        Objects.requireNonNull(nodes);
        Objects.requireNonNull(dependsOn);

        Map<K, Integer> indexOf = new LinkedHashMap<>();
        for (K k : nodes) {
            if (indexOf.putIfAbsent(k, indexOf.size()) != null)
                throw new IllegalArgumentException("Duplicate node " + k);
        }
        List<K> keys = new ArrayList<>(indexOf.keySet());

        List<String> errors = new ArrayList<>();
        for (K k : keys) {
            for (K dep : dependsOn.apply(k)) {
                if (!indexOf.containsKey(dep)) errors.add("Unknown dependency " + dep + " of " + k);
            }
        }
        if (!errors.isEmpty()) {
            log.debug("Rejected graph of {} nodes: {}", keys.size(), errors);
            return ErrorsOr.errors(errors);
        }

        IndexGraph graph = IndexGraph.fromItems(keys, (builder, k) -> {
            for (K dep : dependsOn.apply(k)) builder.addInEdge(indexOf.get(dep));
        });
        log.debug("Built graph of {} nodes and {} edges", graph.vertexCount(), graph.edgeCount());
        return ErrorsOr.lift(graph.toposortOrScc().map(keys::get));
    }

    /** Sorted keys, or one error per unknown dependency or per cycle. */
    public static <K> ErrorsOr<List<K>> sortOrReport(Map<K, ? extends Collection<K>> dependencies,
                                                     Function<? super K, String> label) {
        return toposortOrScc(dependencies).flatMap(result -> CycleReports.toErrorsOr(result, label));
    }
}
