package com.dflow.diagram.compile.phase;

import com.dflow.diagram.compile.CompilationContext;
import com.dflow.diagram.compile.resolve.NodePorts;
import com.dflow.diagram.compile.transform.NodeTransformRegistry;
import com.dflow.diagram.description.NodeDescription;
import com.dflow.diagram.description.PolicyDescription;
import com.dflow.diagram.diagnostic.Diagnostic;
import com.dflow.diagram.diagnostic.DiagnosticPhase;
import com.dflow.diagram.model.ConcurrencyPolicy;
import com.dflow.diagram.model.JoinPolicy;
import com.dflow.diagram.model.Node;
import com.dflow.diagram.model.NodeType;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Converts raw node descriptions into {@link Node} entities: normalizes config through the type's transform
 * descriptor and extracts explicit policies and execution bounds. Policies left unset are filled in by
 * Assembly.
 */
public final class TransformationPhase implements CompilerPhase {

    private final NodeTransformRegistry transforms;

    public TransformationPhase(NodeTransformRegistry transforms) {
        this.transforms = Objects.requireNonNull(transforms, "transforms");
    }

    @Override
    public DiagnosticPhase phase() {
        return DiagnosticPhase.TRANSFORMATION;
    }

    @Override
    public void execute(CompilationContext context) {
        for (NodeDescription description : context.getDescription().getNodes()) {
            String id = description.getId();
            NodeType type = NodeType.fromValue(description.getType());
            if (id == null || id.isBlank() || type == NodeType.UNKNOWN || context.getNodes().containsKey(id)) {
                continue;
            }
            try {
                Map<String, Object> config = transforms.descriptorFor(type).apply(description.getConfig());
                Integer maxExecutions = maxExecutions(type, config);
                applyPolicyOverride(context, id, description.getPolicy());
                context.getNodes().put(id, new Node(id, description.getLabel(), type,
                        NodePorts.inputs(description), NodePorts.outputs(description),
                        config, null, null, maxExecutions));
            } catch (IllegalArgumentException e) {
                context.add(Diagnostic.nodeError(phase(), "Node " + id + ": " + e.getMessage(), id));
            }
        }
    }

    private static Integer maxExecutions(NodeType type, Map<String, Object> config) {
        Object raw = type.hasIterationLimit()
                ? config.get(NodeTransformRegistry.MAX_ITERATION)
                : config.get(NodeTransformRegistry.MAX_EXECUTIONS);
        if (raw == null) return null;
        int value;
        if (raw instanceof Number n) {
            value = n.intValue();
        } else {
            try {
                value = Integer.parseInt(raw.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("execution bound must be an integer, got: " + raw, e);
            }
        }
        if (value < 1) {
            throw new IllegalArgumentException("execution bound must be positive, got: " + value);
        }
        return value;
    }

    private static void applyPolicyOverride(CompilationContext context, String nodeId, PolicyDescription policy) {
        if (policy == null) return;
        if (policy.join() != null && !policy.join().isBlank()) {
            JoinPolicy.Kind kind = parseEnum(JoinPolicy.Kind.class, policy.join(), "join policy");
            JoinPolicy join = switch (kind) {
                case ALL -> JoinPolicy.ALL;
                case ANY -> JoinPolicy.ANY;
                case K_OF_N -> {
                    if (policy.k() == null) {
                        throw new IllegalArgumentException("K_OF_N join policy requires k");
                    }
                    yield JoinPolicy.kOfN(policy.k());
                }
            };
            context.getExplicitJoin().put(nodeId, join);
        }
        if (policy.concurrency() != null && !policy.concurrency().isBlank()) {
            ConcurrencyPolicy.Kind kind = parseEnum(ConcurrencyPolicy.Kind.class, policy.concurrency(), "concurrency policy");
            ConcurrencyPolicy concurrency = switch (kind) {
                case SINGLETON -> ConcurrencyPolicy.SINGLETON;
                case PER_TOKEN -> ConcurrencyPolicy.PER_TOKEN;
                case BOUNDED -> {
                    if (policy.maxConcurrent() == null) {
                        throw new IllegalArgumentException("BOUNDED concurrency policy requires maxConcurrent");
                    }
                    yield ConcurrencyPolicy.bounded(policy.maxConcurrent());
                }
            };
            context.getExplicitConcurrency().put(nodeId, concurrency);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String what) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown " + what + " '" + value + "'", e);
        }
    }
}
