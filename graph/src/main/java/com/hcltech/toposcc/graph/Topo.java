package com.hcltech.toposcc.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

import static com.hcltech.toposcc.graph.TraversalState.DISCOVERED;
import static com.hcltech.toposcc.graph.TraversalState.FINALIZED;
import static com.hcltech.toposcc.graph.TraversalState.UNVISITED;

/**
 * Topological sort with a strongly-connected-components fallback.
 * <p>
 * Kahn's algorithm orders the graph. If some vertices are left over the graph has a cycle, and Kosaraju's
 * algorithm groups the vertices that lie on cycles. Runs in {@code O(V + E)} time with {@code O(V)} extra space.
 */
public final class Topo {
    private static final Logger log = LoggerFactory.getLogger(Topo.class);

    private Topo() {}

    /**
     * Consumes {@code graph}: its degree counters are used as scratch space and the graph rejects every
     * call afterwards.
     *
     * @return the topological order if the graph is acyclic, otherwise every non-trivial strongly connected
     * component plus every vertex with a self-loop
     * @throws IllegalStateException if the graph was already consumed
     */
    public static SortResult<Integer> toposortOrScc(IndexGraph graph) {
        List<Vertex> vertices = graph.consume();

        List<Integer> sorted = kahn(vertices);
        if (sorted.size() == vertices.size()) {
            log.debug("Sorted {} vertices", sorted.size());
            return SortResult.sorted(sorted);
        }

        log.debug("Cycle detected: {} of {} vertices could not be ordered",
                vertices.size() - sorted.size(), vertices.size());
        List<List<Integer>> cycles = kosaraju(vertices);
        log.debug("Found {} strongly connected components on cycles", cycles.size());
        return SortResult.cycles(cycles);
    }

    /** Decrements the in-degree counters down to zero for every vertex it places. */
    static List<Integer> kahn(List<Vertex> vertices) {
        Deque<Integer> queue = new ArrayDeque<>();
        for (int i = 0; i < vertices.size(); i++) {
            if (vertices.get(i).inDegree == 0) queue.add(i);
        }

        List<Integer> sorted = new ArrayList<>(vertices.size());
        while (!queue.isEmpty()) {
            int idx = queue.poll();
            sorted.add(idx);
            for (int next : vertices.get(idx).outEdges) {
                if (--vertices.get(next).inDegree == 0) queue.add(next);
            }
        }
        return sorted;
    }

    static List<List<Integer>> kosaraju(List<Vertex> vertices) {
        int n = vertices.size();
        TraversalState[] state = new TraversalState[n];
        Arrays.fill(state, UNVISITED);

        // {vertex, next edge position}
        Deque<int[]> stack = new ArrayDeque<>();

        // forward pass, post-order. Vertex 0 first, then any vertex it could not reach.
        Deque<Integer> finished = new ArrayDeque<>(n);
        for (int start = 0; start < n; start++) {
            if (state[start] != UNVISITED) continue;
            state[start] = DISCOVERED;
            stack.push(new int[]{start, 0});
            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                List<Integer> out = vertices.get(frame[0]).outEdges;
                if (frame[1] < out.size()) {
                    int next = out.get(frame[1]++);
                    if (state[next] == UNVISITED) {
                        state[next] = DISCOVERED;
                        stack.push(new int[]{next, 0});
                    }
                } else {
                    stack.pop();
                    finished.add(frame[0]);
                }
            }
        }

        // reverse pass, latest finisher first
        List<List<Integer>> cycles = new ArrayList<>();
        while (!finished.isEmpty()) {
            int root = finished.removeLast();
            if (state[root] == FINALIZED) continue;

            List<Integer> component = new ArrayList<>();
            stack.push(new int[]{root, 0});
            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                List<Integer> in = vertices.get(frame[0]).inEdges;
                if (frame[1] < in.size()) {
                    int prev = in.get(frame[1]++);
                    if (state[prev] == DISCOVERED) {
                        state[prev] = FINALIZED;
                        component.add(prev);
                        stack.push(new int[]{prev, 0});
                    }
                } else {
                    stack.pop();
                }
            }

            // the root is only finalized if the search came back to it
            if (state[root] == FINALIZED) {
                cycles.add(component);
            } else {
                state[root] = FINALIZED;
            }
        }
        return cycles;
    }
}
