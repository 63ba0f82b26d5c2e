package com.dflow.diagram.compile.phase;

import com.dflow.diagram.compile.CompilationContext;
import com.dflow.diagram.compile.assemble.PolicyDefaults;
import com.dflow.diagram.diagnostic.Diagnostic;
import com.dflow.diagram.diagnostic.DiagnosticPhase;
import com.dflow.diagram.model.ConcurrencyPolicy;
import com.dflow.diagram.model.ExecutableDiagram;
import com.dflow.diagram.model.ExecutableEdge;
import com.dflow.diagram.model.JoinPolicy;
import com.dflow.diagram.model.Node;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fills in default policies, checks explicit K_OF_N bounds against the real fan-in, records compile
 * metadata and, when no error was recorded by any phase, produces the {@link ExecutableDiagram}.
 */
public final class AssemblyPhase implements CompilerPhase {

    @Override
    public DiagnosticPhase phase() {
        return DiagnosticPhase.ASSEMBLY;
    }

    @Override
    public void execute(CompilationContext context) {
        PolicyDefaults defaults = new PolicyDefaults(context.getNodes(), context.getEdges());
        List<Node> assembled = new ArrayList<>();
        for (Node node : context.getNodes().values()) {
            JoinPolicy join = context.getExplicitJoin().get(node.getId());
            if (join == null) {
                join = defaults.defaultJoin(node);
            } else if (join.getKind() == JoinPolicy.Kind.K_OF_N && join.getK() > defaults.incomingCount(node.getId())) {
                context.add(Diagnostic.nodeError(phase(), "Node " + node.getId() + " join K_OF_N(" + join.getK()
                        + ") exceeds its " + defaults.incomingCount(node.getId()) + " incoming edges", node.getId()));
            }
            ConcurrencyPolicy concurrency = context.getExplicitConcurrency().get(node.getId());
            if (concurrency == null) {
                concurrency = defaults.defaultConcurrency(node);
            }
            assembled.add(node.withPolicies(join, concurrency));
        }
        context.getMetadata().put("start_nodes", List.copyOf(context.getStartNodeIds()));
        context.getMetadata().put("node_dependencies", dependencies(context));
        context.getMetadata().put("node_count", assembled.size());
        context.getMetadata().put("edge_count", context.getEdges().size());
        context.getMetadata().put("loop_count", context.getLoops().size());
        if (context.hasErrors()) {
            return;
        }
        context.setResult(new ExecutableDiagram(assembled, context.getEdges(), context.getTopologicalOrder(),
                context.getLoops(), context.getStartNodeIds(), context.getDiagnostics()));
    }

    /** Node id to the ids of its upstream nodes over non-loop-back edges. */
    private static Map<String, List<String>> dependencies(CompilationContext context) {
        Map<String, Set<String>> deps = new LinkedHashMap<>();
        for (String id : context.getNodes().keySet()) {
            deps.put(id, new LinkedHashSet<>());
        }
        for (ExecutableEdge edge : context.getEdges()) {
            if (!edge.isLoopBack() && deps.containsKey(edge.targetNodeId())) {
                deps.get(edge.targetNodeId()).add(edge.sourceNodeId());
            }
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        deps.forEach((id, sources) -> result.put(id, List.copyOf(sources)));
        return result;
    }
}
