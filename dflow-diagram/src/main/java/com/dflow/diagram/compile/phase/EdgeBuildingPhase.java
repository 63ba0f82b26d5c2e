package com.dflow.diagram.compile.phase;

import com.dflow.diagram.compile.CompilationContext;
import com.dflow.diagram.compile.ResolvedConnection;
import com.dflow.diagram.description.ConnectionDescription;
import com.dflow.diagram.diagnostic.Diagnostic;
import com.dflow.diagram.diagnostic.DiagnosticPhase;
import com.dflow.diagram.model.Edge;
import com.dflow.diagram.model.ExecutableEdge;
import com.dflow.diagram.model.Node;
import com.dflow.diagram.rules.ConnectionRuleSet;
import com.dflow.diagram.rules.DataTransformRules;

import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Applies the connection rules to each resolved connection and turns the valid ones into
 * {@link ExecutableEdge}s carrying their merged transform policy. Loop classification is left to
 * Optimization.
 */
public final class EdgeBuildingPhase implements CompilerPhase {

    private final ConnectionRuleSet rules;
    private final DataTransformRules transforms;

    public EdgeBuildingPhase(ConnectionRuleSet rules, DataTransformRules transforms) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.transforms = Objects.requireNonNull(transforms, "transforms");
    }

    @Override
    public DiagnosticPhase phase() {
        return DiagnosticPhase.EDGE_BUILDING;
    }

    @Override
    public void execute(CompilationContext context) {
        Set<Edge> seen = new HashSet<>();
        Set<String> ids = new HashSet<>();
        for (ResolvedConnection connection : context.getConnections()) {
            Edge edge = connection.edge();
            Node source = context.getNodes().get(edge.sourceNodeId());
            Node target = context.getNodes().get(edge.targetNodeId());
            String rejection = rules.rejectionReason(source.getType(), target.getType());
            if (rejection != null) {
                context.add(Diagnostic.edgeError(phase(), "Cannot connect " + source.getId() + " (" + source.getType().toValue()
                        + ") to " + target.getId() + " (" + target.getType().toValue() + "): rule " + rejection,
                        connection.connectionId()));
                continue;
            }
            if (!seen.add(edge)) {
                context.add(Diagnostic.edgeWarning(phase(), "Duplicate connection " + edge + " ignored", connection.connectionId()));
                continue;
            }
            if (!ids.add(connection.connectionId())) {
                context.add(Diagnostic.edgeError(phase(), "Edge id " + connection.connectionId() + " is used twice",
                        connection.connectionId()));
                continue;
            }
            ConnectionDescription raw = connection.description();
            Map<String, Object> transform = transforms.transformFor(source, target, raw.getTransform());
            String contentType = raw.getContentType();
            if (contentType == null && transform.get(DataTransformRules.KEY_CONTENT_TYPE) != null) {
                contentType = transform.get(DataTransformRules.KEY_CONTENT_TYPE).toString();
            }
            context.getEdges().add(new ExecutableEdge(connection.connectionId(), edge, transform,
                    raw.isSkippable(), false, false, contentType));
        }
    }
}
