package com.dflow.diagram.compile.optimize;

import com.dflow.diagram.model.ExecutableEdge;
import com.dflow.diagram.model.LoopStructure;
import com.dflow.diagram.model.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Derives a {@link LoopStructure} for every loop-back edge. The body is the set of nodes lying on a
 * base-DAG path from the loop entry (edge target) to the latch (edge source), both included.
 */
public final class LoopAnalyzer {

    private LoopAnalyzer() {
    }

    public static List<LoopStructure> analyze(List<ExecutableEdge> edges, Set<String> loopBackEdgeIds,
                                              List<String> topologicalOrder, Map<String, Node> nodes) {
        Map<String, List<String>> forward = new HashMap<>();
        Map<String, List<String>> backward = new HashMap<>();
        for (ExecutableEdge edge : edges) {
            if (loopBackEdgeIds.contains(edge.getId())) continue;
            forward.computeIfAbsent(edge.sourceNodeId(), k -> new ArrayList<>()).add(edge.targetNodeId());
            backward.computeIfAbsent(edge.targetNodeId(), k -> new ArrayList<>()).add(edge.sourceNodeId());
        }
        List<LoopStructure> loops = new ArrayList<>();
        for (ExecutableEdge edge : edges) {
            if (!loopBackEdgeIds.contains(edge.getId())) continue;
            String entry = edge.targetNodeId();
            String latch = edge.sourceNodeId();
            Set<String> fromEntry = reach(entry, id -> forward.getOrDefault(id, List.of()));
            Set<String> toLatch = reach(latch, id -> backward.getOrDefault(id, List.of()));
            Set<String> body = new LinkedHashSet<>();
            List<String> participants = new ArrayList<>();
            for (String id : topologicalOrder) {
                if (fromEntry.contains(id) && toLatch.contains(id)) {
                    body.add(id);
                    Node node = nodes.get(id);
                    if (node != null && node.getMaxExecutions() != null) {
                        participants.add(id);
                    }
                }
            }
            loops.add(new LoopStructure(edge.getId(), entry, latch, body, participants));
        }
        return loops;
    }

    private static Set<String> reach(String from, Function<String, List<String>> next) {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(from);
        seen.add(from);
        while (!queue.isEmpty()) {
            for (String n : next.apply(queue.poll())) {
                if (seen.add(n)) queue.add(n);
            }
        }
        return seen;
    }

    /** Edges whose endpoints both sit in one loop body. */
    public static Set<String> loopScopedEdgeIds(List<ExecutableEdge> edges, List<LoopStructure> loops) {
        Set<String> scoped = new LinkedHashSet<>();
        for (ExecutableEdge edge : edges) {
            for (LoopStructure loop : loops) {
                if (loop.loopBackEdgeId().equals(edge.getId())
                        || (loop.contains(edge.sourceNodeId()) && loop.contains(edge.targetNodeId()))) {
                    scoped.add(edge.getId());
                    break;
                }
            }
        }
        return scoped;
    }
}
