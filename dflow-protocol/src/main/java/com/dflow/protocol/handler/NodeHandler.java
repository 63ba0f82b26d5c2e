package com.dflow.protocol.handler;

import com.dflow.diagram.model.Node;
import com.dflow.protocol.Envelope;

import java.util.Map;

/**
 * Contract for the code that actually performs a node's work. The engine looks handlers up by node type,
 * passes the claimed inputs and the compiled node, and publishes whatever the result emits.
 * <p>
 * <b>Threading:</b> handlers run on the engine's worker pool. A PER_TOKEN or BOUNDED node may have several
 * invocations in flight at once, so implementations holding mutable state must be thread-safe. The engine
 * never retries a handler.
 */
@FunctionalInterface
public interface NodeHandler {

    /**
     * Executes the node once.
     *
     * @param inputs  claimed envelopes keyed by input port ({@code port/sourceNodeId} when several edges feed
     *                one port); empty for nodes without incoming edges
     * @param node    compiled node, including its normalized config
     * @param context run context; never null
     * @return result to publish; a null result counts as a failure
     * @throws Exception on execution failure, treated like {@link HandlerResult#failure(String, Throwable)}
     */
    HandlerResult execute(Map<String, Envelope> inputs, Node node, RunContext context) throws Exception;
}
