package com.dflow.diagram.compile.optimize;

import com.dflow.diagram.model.ExecutableEdge;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * DFS-based ranking of the node graph. The rank of a node is its position in DFS reverse post-order,
 * visiting START nodes first and everything else in declaration order. Every edge whose target rank is
 * not greater than its source rank is a loop-back edge; the remaining edges all point to a higher rank, so
 * they always form the base DAG.
 */
public final class TopologicalRanker {

    /**
     * @param order           node ids by ascending rank
     * @param rank            node id to rank
     * @param loopBackEdgeIds edges classified as loop-back
     */
    public record Ranking(List<String> order, Map<String, Integer> rank, Set<String> loopBackEdgeIds) {
    }

    private TopologicalRanker() {
    }

    public static Ranking rank(List<String> nodeIds, List<String> startNodeIds, List<ExecutableEdge> edges) {
        Map<String, List<ExecutableEdge>> outgoing = new HashMap<>();
        for (ExecutableEdge edge : edges) {
            outgoing.computeIfAbsent(edge.sourceNodeId(), k -> new ArrayList<>()).add(edge);
        }
        Set<String> visited = new HashSet<>();
        List<String> postOrder = new ArrayList<>();
        Set<String> roots = new LinkedHashSet<>(startNodeIds);
        roots.addAll(nodeIds);
        for (String root : roots) {
            if (!visited.contains(root)) {
                visit(root, outgoing, visited, postOrder);
            }
        }
        List<String> order = new ArrayList<>(postOrder);
        Collections.reverse(order);
        Map<String, Integer> rank = new LinkedHashMap<>();
        for (int i = 0; i < order.size(); i++) {
            rank.put(order.get(i), i);
        }
        Set<String> loopBack = new LinkedHashSet<>();
        for (ExecutableEdge edge : edges) {
            Integer source = rank.get(edge.sourceNodeId());
            Integer target = rank.get(edge.targetNodeId());
            if (source != null && target != null && target <= source) {
                loopBack.add(edge.getId());
            }
        }
        return new Ranking(List.copyOf(order), Collections.unmodifiableMap(rank), Collections.unmodifiableSet(loopBack));
    }

    private static void visit(String nodeId, Map<String, List<ExecutableEdge>> outgoing,
                              Set<String> visited, List<String> postOrder) {
        visited.add(nodeId);
        for (ExecutableEdge edge : outgoing.getOrDefault(nodeId, List.of())) {
            if (!visited.contains(edge.targetNodeId())) {
                visit(edge.targetNodeId(), outgoing, visited, postOrder);
            }
        }
        postOrder.add(nodeId);
    }

    /**
     * Kahn's algorithm over the given edges, ignoring loop-back ones. Empty for any loop-back set produced by
     * {@link #rank}.
     *
     * @return node ids left on a cycle; empty when the base graph is a DAG
     */
    public static Set<String> findCycleNodes(List<String> nodeIds, List<ExecutableEdge> edges, Set<String> loopBackEdgeIds) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> successors = new HashMap<>();
        for (String id : nodeIds) {
            inDegree.put(id, 0);
        }
        for (ExecutableEdge edge : edges) {
            if (loopBackEdgeIds.contains(edge.getId())) continue;
            if (!inDegree.containsKey(edge.sourceNodeId()) || !inDegree.containsKey(edge.targetNodeId())) continue;
            successors.computeIfAbsent(edge.sourceNodeId(), k -> new ArrayList<>()).add(edge.targetNodeId());
            inDegree.merge(edge.targetNodeId(), 1, Integer::sum);
        }
        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) ready.add(id);
        });
        while (!ready.isEmpty()) {
            String id = ready.poll();
            inDegree.remove(id);
            for (String next : successors.getOrDefault(id, List.of())) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        return new LinkedHashSet<>(inDegree.keySet());
    }
}
