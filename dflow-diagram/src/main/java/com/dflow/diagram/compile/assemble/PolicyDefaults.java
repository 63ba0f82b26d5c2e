package com.dflow.diagram.compile.assemble;

import com.dflow.diagram.compile.transform.NodeTransformRegistry;
import com.dflow.diagram.model.ConcurrencyPolicy;
import com.dflow.diagram.model.ExecutableEdge;
import com.dflow.diagram.model.JoinPolicy;
import com.dflow.diagram.model.Node;
import com.dflow.diagram.model.NodeType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Default join and concurrency policies for nodes without an explicit override.
 * <ul>
 *   <li>join: ANY for fan-in (two or more incoming edges) when an incoming edge is loop-back or a source
 *   is a branching node or downstream of one; ALL otherwise</li>
 *   <li>concurrency: PER_TOKEN for PERSON_BATCH_JOB, BOUNDED({@code max_concurrent}) for SUB_DIAGRAM,
 *   SINGLETON for everything else</li>
 * </ul>
 */
public final class PolicyDefaults {

    private final Map<String, List<ExecutableEdge>> incoming = new HashMap<>();
    private final Set<String> branchInfluenced;

    public PolicyDefaults(Map<String, Node> nodes, List<ExecutableEdge> edges) {
        for (ExecutableEdge edge : edges) {
            incoming.computeIfAbsent(edge.targetNodeId(), k -> new ArrayList<>()).add(edge);
        }
        this.branchInfluenced = branchInfluenced(nodes, edges);
    }

    /** Branching nodes and every node reachable from them over non-loop-back edges. */
    private static Set<String> branchInfluenced(Map<String, Node> nodes, List<ExecutableEdge> edges) {
        Map<String, List<String>> forward = new HashMap<>();
        for (ExecutableEdge edge : edges) {
            if (!edge.isLoopBack()) {
                forward.computeIfAbsent(edge.sourceNodeId(), k -> new ArrayList<>()).add(edge.targetNodeId());
            }
        }
        Set<String> influenced = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (Node node : nodes.values()) {
            if (node.getType().isBranching()) {
                influenced.add(node.getId());
                queue.add(node.getId());
            }
        }
        while (!queue.isEmpty()) {
            for (String next : forward.getOrDefault(queue.poll(), List.of())) {
                if (influenced.add(next)) queue.add(next);
            }
        }
        return influenced;
    }

    public int incomingCount(String nodeId) {
        return incoming.getOrDefault(nodeId, List.of()).size();
    }

    public JoinPolicy defaultJoin(Node node) {
        List<ExecutableEdge> in = incoming.getOrDefault(node.getId(), List.of());
        if (in.size() < 2) {
            return JoinPolicy.ALL;
        }
        for (ExecutableEdge edge : in) {
            if (edge.isLoopBack() || branchInfluenced.contains(edge.sourceNodeId())) {
                return JoinPolicy.ANY;
            }
        }
        return JoinPolicy.ALL;
    }

    public ConcurrencyPolicy defaultConcurrency(Node node) {
        if (node.getType() == NodeType.PERSON_BATCH_JOB) {
            return ConcurrencyPolicy.PER_TOKEN;
        }
        if (node.getType() == NodeType.SUB_DIAGRAM) {
            Object max = node.getConfig().get(NodeTransformRegistry.MAX_CONCURRENT);
            return ConcurrencyPolicy.bounded(max instanceof Number n && n.intValue() > 0 ? n.intValue() : 2);
        }
        return ConcurrencyPolicy.SINGLETON;
    }
}
