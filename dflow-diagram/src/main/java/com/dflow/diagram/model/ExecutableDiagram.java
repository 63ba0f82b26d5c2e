package com.dflow.diagram.model;

import com.dflow.diagram.diagnostic.Diagnostic;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable compiler output: typed nodes, validated edges with loop classification, adjacency by port,
 * topological order of the base DAG, recognized loops and the diagnostics collected while compiling.
 * Built once per compilation and shared read-only by the runtime.
 */
public final class ExecutableDiagram {

    private final Map<String, Node> nodesById;
    private final List<ExecutableEdge> edges;
    private final Map<String, ExecutableEdge> edgesById;
    private final Map<String, Map<String, List<ExecutableEdge>>> outgoingByPort;
    private final Map<String, Map<String, List<ExecutableEdge>>> incomingByPort;
    private final List<String> topologicalOrder;
    private final List<LoopStructure> loops;
    private final List<String> startNodeIds;
    private final List<Diagnostic> diagnostics;

    @JsonCreator
    public ExecutableDiagram(
            @JsonProperty("nodes") List<Node> nodes,
            @JsonProperty("edges") List<ExecutableEdge> edges,
            @JsonProperty("topologicalOrder") List<String> topologicalOrder,
            @JsonProperty("loops") List<LoopStructure> loops,
            @JsonProperty("startNodeIds") List<String> startNodeIds,
            @JsonProperty("diagnostics") List<Diagnostic> diagnostics) {
        Map<String, Node> byId = new LinkedHashMap<>();
        if (nodes != null) {
            for (Node node : nodes) {
                byId.put(node.getId(), node);
            }
        }
        this.nodesById = Collections.unmodifiableMap(byId);
        this.edges = edges != null ? List.copyOf(edges) : List.of();
        Map<String, ExecutableEdge> edgeIndex = new LinkedHashMap<>();
        Map<String, Map<String, List<ExecutableEdge>>> out = new LinkedHashMap<>();
        Map<String, Map<String, List<ExecutableEdge>>> in = new LinkedHashMap<>();
        for (ExecutableEdge e : this.edges) {
            edgeIndex.put(e.getId(), e);
            out.computeIfAbsent(e.sourceNodeId(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(e.sourcePort(), k -> new ArrayList<>()).add(e);
            in.computeIfAbsent(e.targetNodeId(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(e.targetPort(), k -> new ArrayList<>()).add(e);
        }
        this.edgesById = Collections.unmodifiableMap(edgeIndex);
        this.outgoingByPort = freeze(out);
        this.incomingByPort = freeze(in);
        this.topologicalOrder = topologicalOrder != null ? List.copyOf(topologicalOrder) : List.copyOf(byId.keySet());
        this.loops = loops != null ? List.copyOf(loops) : List.of();
        this.startNodeIds = startNodeIds != null ? List.copyOf(startNodeIds) : List.of();
        this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    private static Map<String, Map<String, List<ExecutableEdge>>> freeze(Map<String, Map<String, List<ExecutableEdge>>> index) {
        Map<String, Map<String, List<ExecutableEdge>>> frozen = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, List<ExecutableEdge>>> e : index.entrySet()) {
            Map<String, List<ExecutableEdge>> ports = new LinkedHashMap<>();
            e.getValue().forEach((port, list) -> ports.put(port, List.copyOf(list)));
            frozen.put(e.getKey(), Collections.unmodifiableMap(ports));
        }
        return Collections.unmodifiableMap(frozen);
    }

    @JsonProperty("nodes")
    public List<Node> getNodes() {
        return List.copyOf(nodesById.values());
    }

    public Node getNode(String nodeId) {
        return nodeId != null ? nodesById.get(nodeId) : null;
    }

    @JsonIgnore
    public Map<String, Node> getNodesById() {
        return nodesById;
    }

    public List<ExecutableEdge> getEdges() {
        return edges;
    }

    public ExecutableEdge getEdge(String edgeId) {
        return edgesById.get(edgeId);
    }

    /** Outgoing edges of a node grouped by source output port. */
    public Map<String, List<ExecutableEdge>> outgoingByPort(String nodeId) {
        return outgoingByPort.getOrDefault(nodeId, Map.of());
    }

    /** Incoming edges of a node grouped by target input port. */
    public Map<String, List<ExecutableEdge>> incomingByPort(String nodeId) {
        return incomingByPort.getOrDefault(nodeId, Map.of());
    }

    public List<ExecutableEdge> outgoingEdges(String nodeId) {
        return flatten(outgoingByPort(nodeId));
    }

    public List<ExecutableEdge> outgoingEdges(String nodeId, String port) {
        return outgoingByPort(nodeId).getOrDefault(port, List.of());
    }

    public List<ExecutableEdge> incomingEdges(String nodeId) {
        return flatten(incomingByPort(nodeId));
    }

    private static List<ExecutableEdge> flatten(Map<String, List<ExecutableEdge>> byPort) {
        if (byPort.isEmpty()) return List.of();
        List<ExecutableEdge> all = new ArrayList<>();
        byPort.values().forEach(all::addAll);
        return all;
    }

    /** Node ids ordered by base-DAG topological rank (loop-back edges ignored). */
    public List<String> getTopologicalOrder() {
        return topologicalOrder;
    }

    public List<LoopStructure> getLoops() {
        return loops;
    }

    public List<LoopStructure> loopsContaining(String nodeId) {
        List<LoopStructure> result = new ArrayList<>();
        for (LoopStructure loop : loops) {
            if (loop.contains(nodeId)) result.add(loop);
        }
        return result;
    }

    public LoopStructure loopForBackEdge(String edgeId) {
        for (LoopStructure loop : loops) {
            if (loop.loopBackEdgeId().equals(edgeId)) return loop;
        }
        return null;
    }

    public List<String> getStartNodeIds() {
        return startNodeIds;
    }

    @JsonIgnore
    public List<String> endpointNodeIds() {
        List<String> ids = new ArrayList<>();
        for (Node node : nodesById.values()) {
            if (node.getType() == NodeType.ENDPOINT) ids.add(node.getId());
        }
        return ids;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    @JsonIgnore
    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutableDiagram that = (ExecutableDiagram) o;
        return nodesById.equals(that.nodesById)
                && edges.equals(that.edges)
                && topologicalOrder.equals(that.topologicalOrder)
                && loops.equals(that.loops)
                && startNodeIds.equals(that.startNodeIds)
                && diagnostics.equals(that.diagnostics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodesById, edges, topologicalOrder, loops, startNodeIds, diagnostics);
    }
}
