package com.dflow.diagram.compile.phase;

import com.dflow.diagram.compile.CompilationContext;
import com.dflow.diagram.compile.optimize.LoopAnalyzer;
import com.dflow.diagram.compile.optimize.TopologicalRanker;
import com.dflow.diagram.diagnostic.Diagnostic;
import com.dflow.diagram.diagnostic.DiagnosticPhase;
import com.dflow.diagram.model.ExecutableEdge;
import com.dflow.diagram.model.LoopStructure;
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
 * Ranks nodes, classifies loop-back edges, derives loop bodies and warns about nodes unreachable from
 * START. The ranking already makes every cycle-closing edge loop-back, so the base DAG check afterwards
 * guards the ranker rather than user input.
 * <p>
 * A loop whose body holds neither a branching node nor a node with an execution bound has no way to
 * stop and is rejected as an unrecognized cycle.
 */
public final class OptimizationPhase implements CompilerPhase {

    @Override
    public DiagnosticPhase phase() {
        return DiagnosticPhase.OPTIMIZATION;
    }

    @Override
    public void execute(CompilationContext context) {
        Map<String, Node> nodes = context.getNodes();
        List<String> nodeIds = new ArrayList<>(nodes.keySet());
        for (Node node : nodes.values()) {
            if (node.getType() == NodeType.START) context.getStartNodeIds().add(node.getId());
        }
        List<ExecutableEdge> edges = context.getEdges();
        TopologicalRanker.Ranking ranking = TopologicalRanker.rank(nodeIds, context.getStartNodeIds(), edges);
        context.getTopologicalOrder().addAll(ranking.order());
        context.getLoopBackEdgeIds().addAll(ranking.loopBackEdgeIds());

        // Reverse post-order leaves no cycle once loop-back edges are removed; this only catches ranker bugs.
        Set<String> cycle = TopologicalRanker.findCycleNodes(nodeIds, edges, ranking.loopBackEdgeIds());
        if (!cycle.isEmpty()) {
            context.add(Diagnostic.error(phase(), "Internal compiler error: base graph still cyclic among nodes " + cycle));
            return;
        }

        List<LoopStructure> loops = LoopAnalyzer.analyze(edges, ranking.loopBackEdgeIds(), ranking.order(), nodes);
        for (LoopStructure loop : loops) {
            boolean hasBranch = loop.bodyNodeIds().stream()
                    .map(nodes::get)
                    .anyMatch(n -> n != null && n.getType().isBranching());
            if (!loop.isBounded() && !hasBranch) {
                context.add(Diagnostic.edgeError(phase(), "Unrecognized cycle through " + loop.bodyNodeIds()
                        + ": no condition node and no max_iteration bound", loop.loopBackEdgeId())
                        .withSuggestion("Add a condition node or set max_iteration on a node in the loop"));
            } else if (!loop.isBounded()) {
                context.add(Diagnostic.edgeWarning(phase(), "Loop " + loop.loopBackEdgeId()
                        + " has no node with an execution bound; only the engine iteration cap stops it",
                        loop.loopBackEdgeId()));
            }
        }
        context.getLoops().addAll(loops);

        Set<String> scoped = LoopAnalyzer.loopScopedEdgeIds(edges, loops);
        for (int i = 0; i < edges.size(); i++) {
            ExecutableEdge edge = edges.get(i);
            boolean loopBack = ranking.loopBackEdgeIds().contains(edge.getId());
            edges.set(i, edge.withLoopClassification(loopBack, scoped.contains(edge.getId())));
        }

        warnUnreachable(context, edges);
    }

    private void warnUnreachable(CompilationContext context, List<ExecutableEdge> edges) {
        if (context.getStartNodeIds().isEmpty()) return;
        Map<String, List<String>> next = new HashMap<>();
        for (ExecutableEdge edge : edges) {
            next.computeIfAbsent(edge.sourceNodeId(), k -> new ArrayList<>()).add(edge.targetNodeId());
        }
        Set<String> reached = new HashSet<>(context.getStartNodeIds());
        Deque<String> queue = new ArrayDeque<>(context.getStartNodeIds());
        while (!queue.isEmpty()) {
            for (String target : next.getOrDefault(queue.poll(), List.of())) {
                if (reached.add(target)) queue.add(target);
            }
        }
        for (String id : context.getNodes().keySet()) {
            if (!reached.contains(id)) {
                context.add(Diagnostic.nodeWarning(phase(), "Node " + id + " is unreachable from START", id));
            }
        }
    }
}
