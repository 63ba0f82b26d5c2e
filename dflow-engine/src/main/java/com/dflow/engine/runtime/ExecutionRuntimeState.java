package com.dflow.engine.runtime;

import com.dflow.diagram.model.ExecutableDiagram;
import com.dflow.diagram.model.Node;
import com.dflow.protocol.Envelope;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-run mutable state next to the token store: one {@link RuntimeNodeState} per node and the number of
 * loop-backs taken per loop (keyed by loop-back edge id). Not thread-safe; only the scheduler's loop thread
 * touches it.
 */
public final class ExecutionRuntimeState {

    private final Map<String, RuntimeNodeState> nodes = new LinkedHashMap<>();
    private final Map<String, Integer> loopIterations = new LinkedHashMap<>();

    public ExecutionRuntimeState(ExecutableDiagram diagram) {
        Objects.requireNonNull(diagram, "diagram");
        for (Node node : diagram.getNodes()) {
            nodes.put(node.getId(), new RuntimeNodeState(node.getId()));
        }
    }

    public RuntimeNodeState node(String nodeId) {
        RuntimeNodeState state = nodes.get(nodeId);
        if (state == null) {
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        }
        return state;
    }

    public Collection<RuntimeNodeState> nodes() {
        return nodes.values();
    }

    public int executionCount(String nodeId) {
        return node(nodeId).getExecutionCount();
    }

    public NodeStatus status(String nodeId) {
        return node(nodeId).getStatus();
    }

    public void markReady(String nodeId) {
        node(nodeId).setStatus(NodeStatus.READY);
    }

    /** Records a dispatch at the epoch. Returns how many times the node ran before. */
    public int beginExecution(String nodeId, int epoch) {
        return node(nodeId).beginExecution(epoch);
    }

    public void markCompleted(String nodeId, Map<String, Envelope> outputs) {
        node(nodeId).complete(outputs);
    }

    public void markFailed(String nodeId, String message) {
        node(nodeId).fail(message);
    }

    public void markSkipped(String nodeId) {
        node(nodeId).setStatus(NodeStatus.SKIPPED);
    }

    /**
     * Resolves a node left PENDING or READY at run end: SKIPPED when it never ran, otherwise COMPLETED, or
     * FAILED when its latest execution failed. Returns the settled status.
     */
    public NodeStatus settle(String nodeId) {
        RuntimeNodeState state = node(nodeId);
        if (state.getStatus() != NodeStatus.PENDING && state.getStatus() != NodeStatus.READY) {
            return state.getStatus();
        }
        if (state.getExecutionCount() == 0) {
            state.setStatus(NodeStatus.SKIPPED);
        } else {
            state.setStatus(state.getLastError() != null ? NodeStatus.FAILED : NodeStatus.COMPLETED);
        }
        return state.getStatus();
    }

    /** Puts the given nodes back to PENDING for a new epoch; nodes still running keep their status. */
    public void rearm(Collection<String> nodeIds) {
        for (String id : nodeIds) {
            RuntimeNodeState state = node(id);
            if (state.getInFlight() == 0) state.setStatus(NodeStatus.PENDING);
        }
    }

    public int loopIterations(String loopBackEdgeId) {
        return loopIterations.getOrDefault(loopBackEdgeId, 0);
    }

    public int incrementLoopIterations(String loopBackEdgeId) {
        return loopIterations.merge(loopBackEdgeId, 1, Integer::sum);
    }

    public Map<String, Integer> loopIterations() {
        return Map.copyOf(loopIterations);
    }

    /** Deep copy of every node state, in diagram order. */
    public Map<String, RuntimeNodeState> copyNodes() {
        Map<String, RuntimeNodeState> copy = new LinkedHashMap<>();
        nodes.forEach((id, state) -> copy.put(id, state.copy()));
        return copy;
    }

    /**
     * Replaces node states and loop counters. Nodes caught in flight go back to PENDING with their
     * unfinished executions rolled back, so the caller can dispatch them again.
     *
     * @param replayable in-flight invocations per node that the caller will dispatch again
     * @throws IllegalArgumentException if a node is unknown or has more invocations in flight than replayable
     */
    public void restore(Map<String, RuntimeNodeState> nodeStates, Map<String, Integer> iterations,
                        Map<String, Integer> replayable) {
        for (RuntimeNodeState restored : nodeStates.values()) {
            if (!nodes.containsKey(restored.getNodeId())) {
                throw new IllegalArgumentException("Snapshot names unknown node " + restored.getNodeId());
            }
            int replays = replayable.getOrDefault(restored.getNodeId(), 0);
            if (restored.getInFlight() != replays) {
                throw new IllegalArgumentException("Snapshot has " + restored.getInFlight()
                        + " invocations in flight for node " + restored.getNodeId() + " but " + replays + " recorded");
            }
            RuntimeNodeState state = restored.copy();
            state.rollbackInFlight();
            nodes.put(state.getNodeId(), state);
        }
        loopIterations.clear();
        if (iterations != null) loopIterations.putAll(iterations);
    }
}
