package com.dflow.diagram.compile.phase;

import com.dflow.diagram.compile.CompilationContext;
import com.dflow.diagram.compile.resolve.EndpointResolver;
import com.dflow.diagram.compile.resolve.ResolvedEndpoint;
import com.dflow.diagram.description.ConnectionDescription;
import com.dflow.diagram.description.DiagramDescription;
import com.dflow.diagram.description.NodeDescription;
import com.dflow.diagram.diagnostic.Diagnostic;
import com.dflow.diagram.diagnostic.DiagnosticPhase;
import com.dflow.diagram.model.NodeType;
import com.dflow.diagram.model.Ports;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks on the raw description. Produces diagnostics only.
 */
public final class ValidationPhase implements CompilerPhase {

    @Override
    public DiagnosticPhase phase() {
        return DiagnosticPhase.VALIDATION;
    }

    @Override
    public void execute(CompilationContext context) {
        DiagramDescription description = context.getDescription();
        List<NodeDescription> nodes = description.getNodes();
        if (nodes.isEmpty()) {
            context.add(Diagnostic.error(phase(), "Diagram must contain at least one node"));
            return;
        }
        validateNodes(context, nodes);
        validateConnections(context, description.getConnections(), nodes);
    }

    private void validateNodes(CompilationContext context, List<NodeDescription> nodes) {
        Set<String> seen = new HashSet<>();
        int startCount = 0;
        boolean hasEndpoint = false;
        for (NodeDescription node : nodes) {
            String id = node.getId();
            if (id == null || id.isBlank()) {
                context.add(Diagnostic.error(phase(), "Node with blank id (type " + node.getType() + ")"));
                continue;
            }
            if (!seen.add(id)) {
                context.add(Diagnostic.nodeError(phase(), "Duplicate node id: " + id, id));
            }
            NodeType type = NodeType.fromValue(node.getType());
            if (type == NodeType.UNKNOWN) {
                context.add(Diagnostic.nodeError(phase(), "Invalid node type '" + node.getType() + "' for node " + id, id)
                        .withSuggestion("Use one of the known node types"));
            }
            if (type == NodeType.START) startCount++;
            if (type == NodeType.ENDPOINT) hasEndpoint = true;
        }
        if (startCount == 0) {
            context.add(Diagnostic.error(phase(), "Diagram must have exactly one START node, found none")
                    .withSuggestion("Add a start node"));
        } else if (startCount > 1) {
            context.add(Diagnostic.error(phase(), "Diagram must have exactly one START node, found " + startCount));
        }
        if (!hasEndpoint) {
            context.add(Diagnostic.warning(phase(), "Diagram has no ENDPOINT node; results are only available as node outputs"));
        }
    }

    private void validateConnections(CompilationContext context, List<ConnectionDescription> connections,
                                     List<NodeDescription> nodes) {
        EndpointResolver resolver = new EndpointResolver(nodes);
        Set<String> connectionIds = new HashSet<>();
        Map<String, Set<String>> firedConditionPorts = new HashMap<>();
        for (ConnectionDescription connection : connections) {
            String label = connectionLabel(connection);
            if (connection.getId() != null && !connectionIds.add(connection.getId())) {
                context.add(Diagnostic.edgeError(phase(), "Duplicate connection id: " + connection.getId(), connection.getId()));
            }
            ResolvedEndpoint source = resolver.resolveSource(connection.getSource(), connection.getSourcePort());
            if (!source.isResolved()) {
                context.add(Diagnostic.edgeError(phase(), "Connection " + label + " source: " + source.error(), connection.getId()));
            }
            ResolvedEndpoint target = resolver.resolveTarget(connection.getTarget(), connection.getTargetPort());
            if (!target.isResolved()) {
                context.add(Diagnostic.edgeError(phase(), "Connection " + label + " target: " + target.error(), connection.getId()));
            }
            if (source.isResolved() && isCondition(nodes, source.nodeId())) {
                firedConditionPorts.computeIfAbsent(source.nodeId(), k -> new HashSet<>()).add(source.port());
            }
        }
        for (NodeDescription node : nodes) {
            if (node.getId() == null || NodeType.fromValue(node.getType()) != NodeType.CONDITION) continue;
            Set<String> ports = firedConditionPorts.getOrDefault(node.getId(), Set.of());
            if (!ports.contains(Ports.CONDITION_TRUE) || !ports.contains(Ports.CONDITION_FALSE)) {
                context.add(Diagnostic.nodeWarning(phase(),
                        "Condition node " + node.getId() + " does not connect both branches", node.getId()));
            }
        }
    }

    private static boolean isCondition(List<NodeDescription> nodes, String nodeId) {
        for (NodeDescription node : nodes) {
            if (nodeId.equals(node.getId())) {
                return NodeType.fromValue(node.getType()) == NodeType.CONDITION;
            }
        }
        return false;
    }

    private static String connectionLabel(ConnectionDescription connection) {
        if (connection.getId() != null) return connection.getId();
        return connection.getSource() + "->" + connection.getTarget();
    }
}
