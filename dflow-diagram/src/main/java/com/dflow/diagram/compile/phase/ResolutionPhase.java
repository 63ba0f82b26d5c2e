package com.dflow.diagram.compile.phase;

import com.dflow.diagram.compile.CompilationContext;
import com.dflow.diagram.compile.ResolvedConnection;
import com.dflow.diagram.compile.resolve.EndpointResolver;
import com.dflow.diagram.compile.resolve.ResolvedEndpoint;
import com.dflow.diagram.description.ConnectionDescription;
import com.dflow.diagram.diagnostic.DiagnosticPhase;
import com.dflow.diagram.model.Edge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Resolves every connection's endpoints to canonical (node id, port) pairs. Connections whose endpoints
 * cannot be resolved were already reported by Validation and are dropped here. Connection ids are kept;
 * missing ones are assigned {@code edge_<index>} from the connection's position.
 */
public final class ResolutionPhase implements CompilerPhase {

    private static final Logger log = LoggerFactory.getLogger(ResolutionPhase.class);

    @Override
    public DiagnosticPhase phase() {
        return DiagnosticPhase.RESOLUTION;
    }

    @Override
    public void execute(CompilationContext context) {
        EndpointResolver resolver = new EndpointResolver(context.getDescription().getNodes());
        List<ConnectionDescription> connections = context.getDescription().getConnections();
        for (int i = 0; i < connections.size(); i++) {
            ConnectionDescription connection = connections.get(i);
            String id = connection.getId() != null && !connection.getId().isBlank() ? connection.getId() : "edge_" + i;
            ResolvedEndpoint source = resolver.resolveSource(connection.getSource(), connection.getSourcePort());
            ResolvedEndpoint target = resolver.resolveTarget(connection.getTarget(), connection.getTargetPort());
            if (!source.isResolved() || !target.isResolved()) {
                if (log.isDebugEnabled()) {
                    log.debug("Resolution skip | connectionId={} | sourceError={} | targetError={}",
                            id, source.error(), target.error());
                }
                continue;
            }
            if (!context.getNodes().containsKey(source.nodeId()) || !context.getNodes().containsKey(target.nodeId())) {
                continue;
            }
            Edge edge = new Edge(source.nodeId(), source.port(), target.nodeId(), target.port());
            context.getConnections().add(new ResolvedConnection(id, edge, connection));
        }
    }
}
