package com.dflow.engine.handlers;

import com.dflow.diagram.compile.transform.NodeTransformRegistry;
import com.dflow.diagram.model.Node;
import com.dflow.diagram.model.NodeType;
import com.dflow.diagram.model.Ports;
import com.dflow.protocol.ContentType;
import com.dflow.protocol.Envelope;
import com.dflow.protocol.handler.HandlerRegistry;
import com.dflow.protocol.handler.HandlerResult;
import com.dflow.protocol.handler.NodeHandler;
import com.dflow.protocol.handler.RunContext;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handlers for the node types the engine can run on its own: START, ENDPOINT and CONDITION. Work nodes
 * (person jobs, code, API calls, ...) need handlers supplied by the embedding application.
 */
public final class BuiltinHandlers {

    public static final String CONDITION_DETECT_MAX_ITERATIONS = "detect_max_iterations";
    public static final String CONDITION_BOOLEAN = "boolean";
    /** Config flag read by {@code boolean} conditions. */
    public static final String EXPRESSION = "expression";

    private BuiltinHandlers() {
    }

    /** Registers every built-in handler whose type has no handler yet. */
    public static HandlerRegistry registerDefaults(HandlerRegistry registry) {
        if (!registry.hasHandler(NodeType.START)) registry.register(NodeType.START, new StartHandler());
        if (!registry.hasHandler(NodeType.ENDPOINT)) registry.register(NodeType.ENDPOINT, new EndpointHandler());
        if (!registry.hasHandler(NodeType.CONDITION)) registry.register(NodeType.CONDITION, new ConditionHandler());
        return registry;
    }

    /** Emits the run's initial inputs on the default port. */
    public static final class StartHandler implements NodeHandler {
        @Override
        public HandlerResult execute(Map<String, Envelope> inputs, Node node, RunContext context) {
            return HandlerResult.success(Envelope.of(context.getInitialInputs(), ContentType.OBJECT, node.getId()));
        }
    }

    /** Records whatever reached the endpoint as its outputs. */
    public static final class EndpointHandler implements NodeHandler {
        @Override
        public HandlerResult execute(Map<String, Envelope> inputs, Node node, RunContext context) {
            return HandlerResult.success(new LinkedHashMap<>(inputs));
        }
    }

    /**
     * Fires {@code condtrue} or {@code condfalse}, passing the default input through. With
     * {@code detect_max_iterations} the condition holds once the enclosing loop is exhausted; with
     * {@code boolean} it reads the {@code expression} flag, or the default input when its body is a Boolean.
     */
    public static final class ConditionHandler implements NodeHandler {
        @Override
        public HandlerResult execute(Map<String, Envelope> inputs, Node node, RunContext context) {
            Object conditionType = node.getConfig().getOrDefault(NodeTransformRegistry.CONDITION_TYPE, CONDITION_BOOLEAN);
            Envelope input = inputs.get(Ports.DEFAULT);
            boolean outcome;
            if (CONDITION_DETECT_MAX_ITERATIONS.equals(conditionType)) {
                outcome = context.isLoopExhausted();
            } else if (CONDITION_BOOLEAN.equals(conditionType)) {
                Object flag = node.getConfig().get(EXPRESSION);
                if (flag instanceof Boolean b) {
                    outcome = b;
                } else if (flag instanceof String s && ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s))) {
                    outcome = Boolean.parseBoolean(s);
                } else if (input != null && input.getBody() instanceof Boolean b) {
                    outcome = b;
                } else {
                    return HandlerResult.failure("Condition " + node.getId() + " has no boolean expression or input");
                }
            } else {
                return HandlerResult.failure("Unsupported condition_type '" + conditionType + "' on " + node.getId());
            }
            String port = outcome ? Ports.CONDITION_TRUE : Ports.CONDITION_FALSE;
            Envelope out = input != null ? input.withProducer(node.getId()) : Envelope.of(outcome, ContentType.OBJECT, node.getId());
            return HandlerResult.success(port, out.withBranch(port).withIteration(context.getEpoch()));
        }
    }
}
