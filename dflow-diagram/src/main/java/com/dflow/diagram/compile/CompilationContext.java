package com.dflow.diagram.compile;

import com.dflow.diagram.description.DiagramDescription;
import com.dflow.diagram.diagnostic.Diagnostic;
import com.dflow.diagram.diagnostic.DiagnosticPhase;
import com.dflow.diagram.model.ConcurrencyPolicy;
import com.dflow.diagram.model.ExecutableDiagram;
import com.dflow.diagram.model.ExecutableEdge;
import com.dflow.diagram.model.JoinPolicy;
import com.dflow.diagram.model.LoopStructure;
import com.dflow.diagram.model.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state shared by the compiler phases for one compilation. Each phase reads what earlier phases
 * produced and adds its own output and diagnostics. Not thread-safe; never escapes the compiler.
 */
public final class CompilationContext {

    private final DiagramDescription description;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, JoinPolicy> explicitJoin = new HashMap<>();
    private final Map<String, ConcurrencyPolicy> explicitConcurrency = new HashMap<>();
    private final List<ResolvedConnection> connections = new ArrayList<>();
    private final List<ExecutableEdge> edges = new ArrayList<>();
    private final List<String> topologicalOrder = new ArrayList<>();
    private final Set<String> loopBackEdgeIds = new LinkedHashSet<>();
    private final List<LoopStructure> loops = new ArrayList<>();
    private final List<String> startNodeIds = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private ExecutableDiagram result;

    public CompilationContext(DiagramDescription description) {
        this.description = description;
    }

    public DiagramDescription getDescription() {
        return description;
    }

    public void add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public boolean hasErrors(DiagnosticPhase phase) {
        return diagnostics.stream().anyMatch(d -> d.isError() && d.phase() == phase);
    }

    public Map<String, Node> getNodes() {
        return nodes;
    }

    public Map<String, JoinPolicy> getExplicitJoin() {
        return explicitJoin;
    }

    public Map<String, ConcurrencyPolicy> getExplicitConcurrency() {
        return explicitConcurrency;
    }

    public List<ResolvedConnection> getConnections() {
        return connections;
    }

    public List<ExecutableEdge> getEdges() {
        return edges;
    }

    public List<String> getTopologicalOrder() {
        return topologicalOrder;
    }

    public Set<String> getLoopBackEdgeIds() {
        return loopBackEdgeIds;
    }

    public List<LoopStructure> getLoops() {
        return loops;
    }

    public List<String> getStartNodeIds() {
        return startNodeIds;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public ExecutableDiagram getResult() {
        return result;
    }

    public void setResult(ExecutableDiagram result) {
        this.result = result;
    }
}
