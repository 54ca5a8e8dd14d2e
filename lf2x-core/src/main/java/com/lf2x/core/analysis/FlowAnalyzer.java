package com.lf2x.core.analysis;

import com.lf2x.core.IntermediateRepresentation;
import com.lf2x.core.IrEdge;
import com.lf2x.core.IrNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Classifies a flow as linear, branching or cyclic.
 *
 * <p>Node ids are mapped to dense indices. Edge endpoints that were never declared as nodes get an
 * index too, so dangling edges still take part in the analysis. Cycle detection is an iterative
 * white/gray/black depth-first search started from every unvisited index.
 */
public final class FlowAnalyzer {
    private static final byte WHITE = 0;
    private static final byte GRAY = 1;
    private static final byte BLACK = 2;

    private FlowAnalyzer() {}

    public static FlowAnalysis analyze(IntermediateRepresentation ir) {
        Objects.requireNonNull(ir, "ir");
        Adjacency graph = Adjacency.of(ir);

        boolean hasBranching = graph.hasBranching();
        boolean hasCycles = graph.hasCycle();

        if (hasCycles) {
            return new FlowAnalysis(FlowPattern.CYCLIC, TargetRecommendation.LANGGRAPH, true, hasBranching);
        }
        if (hasBranching) {
            return new FlowAnalysis(FlowPattern.BRANCHING, TargetRecommendation.LANGGRAPH, false, true);
        }
        return new FlowAnalysis(FlowPattern.LINEAR, TargetRecommendation.LANGCHAIN, false, false);
    }

    private static final class Adjacency {
        private final List<Set<Integer>> outgoing = new ArrayList<>();
        private final List<Integer> indegree = new ArrayList<>();
        private final Map<String, Integer> indexById = new HashMap<>();

        static Adjacency of(IntermediateRepresentation ir) {
            Adjacency graph = new Adjacency();
            for (IrNode node : ir.nodes()) graph.indexOf(node.nodeId());
            for (IrEdge edge : ir.edges()) {
                int source = graph.indexOf(edge.source());
                int target = graph.indexOf(edge.target());
                graph.outgoing.get(source).add(target);
                graph.indegree.set(target, graph.indegree.get(target) + 1);
            }
            return graph;
        }

        private int indexOf(String id) {
            Integer existing = indexById.get(id);
            if (existing != null) return existing;
            int index = outgoing.size();
            indexById.put(id, index);
            outgoing.add(new LinkedHashSet<>());
            indegree.add(0);
            return index;
        }

        boolean hasBranching() {
            for (Set<Integer> targets : outgoing) {
                if (targets.size() > 1) return true;
            }
            for (int degree : indegree) {
                if (degree > 1) return true;
            }
            return false;
        }

        boolean hasCycle() {
            int size = outgoing.size();
            byte[] color = new byte[size];
            List<List<Integer>> successors = new ArrayList<>(size);
            for (Set<Integer> targets : outgoing) successors.add(List.copyOf(targets));

            // Each frame is {node, index of the next successor to explore}.
            Deque<int[]> stack = new ArrayDeque<>();
            for (int root = 0; root < size; root++) {
                if (color[root] != WHITE) continue;
                color[root] = GRAY;
                stack.push(new int[] { root, 0 });

                while (!stack.isEmpty()) {
                    int[] frame = stack.peek();
                    List<Integer> next = successors.get(frame[0]);
                    if (frame[1] < next.size()) {
                        int neighbour = next.get(frame[1]++);
                        if (color[neighbour] == GRAY) return true;
                        if (color[neighbour] == WHITE) {
                            color[neighbour] = GRAY;
                            stack.push(new int[] { neighbour, 0 });
                        }
                    } else {
                        color[frame[0]] = BLACK;
                        stack.pop();
                    }
                }
            }
            return false;
        }
    }
}
