package com.dflow.protocol.event;

import com.dflow.diagram.model.Node;
import com.dflow.diagram.model.NodeType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One progress event of a run. Node events carry the node id and type; {@code durationMs} is set on
 * NODE_COMPLETED, NODE_FAILED and RUN_COMPLETED; {@code message} holds the failure text or the run status.
 */
public final class ExecutionEvent {

    /** Attribute naming the loop-back edge that started an epoch. */
    public static final String ATTR_LOOP_BACK_EDGE = "loopBackEdgeId";

    private final ExecutionEventType type;
    private final String runId;
    private final String nodeId;
    private final NodeType nodeType;
    private final int epoch;
    private final long durationMs;
    private final String message;
    private final Instant timestamp;
    private final Map<String, Object> attributes;

    public ExecutionEvent(ExecutionEventType type, String runId, String nodeId, NodeType nodeType, int epoch,
                          long durationMs, String message, Map<String, Object> attributes) {
        this.type = Objects.requireNonNull(type, "type");
        this.runId = Objects.requireNonNull(runId, "runId");
        this.nodeId = nodeId;
        this.nodeType = nodeType;
        this.epoch = epoch;
        this.durationMs = durationMs;
        this.message = message;
        this.timestamp = Instant.now();
        this.attributes = attributes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
    }

    public static ExecutionEvent runStarted(String runId) {
        return new ExecutionEvent(ExecutionEventType.RUN_STARTED, runId, null, null, 0, 0, null, null);
    }

    public static ExecutionEvent nodeStarted(String runId, Node node, int epoch) {
        return new ExecutionEvent(ExecutionEventType.NODE_STARTED, runId, node.getId(), node.getType(), epoch, 0, null, null);
    }

    public static ExecutionEvent nodeCompleted(String runId, Node node, int epoch, long durationMs) {
        return new ExecutionEvent(ExecutionEventType.NODE_COMPLETED, runId, node.getId(), node.getType(), epoch,
                durationMs, null, null);
    }

    public static ExecutionEvent nodeFailed(String runId, Node node, int epoch, long durationMs, String message) {
        return new ExecutionEvent(ExecutionEventType.NODE_FAILED, runId, node.getId(), node.getType(), epoch,
                durationMs, message, null);
    }

    public static ExecutionEvent nodeSkipped(String runId, Node node) {
        return new ExecutionEvent(ExecutionEventType.NODE_SKIPPED, runId, node.getId(), node.getType(), 0, 0, null, null);
    }

    public static ExecutionEvent epochBegan(String runId, int epoch, String loopBackEdgeId) {
        return new ExecutionEvent(ExecutionEventType.EPOCH_BEGAN, runId, null, null, epoch, 0, null,
                loopBackEdgeId != null ? Map.of(ATTR_LOOP_BACK_EDGE, loopBackEdgeId) : null);
    }

    public static ExecutionEvent runCompleted(String runId, String status, int finalEpoch, long durationMs) {
        return new ExecutionEvent(ExecutionEventType.RUN_COMPLETED, runId, null, null, finalEpoch, durationMs,
                status, null);
    }

    public ExecutionEventType getType() {
        return type;
    }

    public String getRunId() {
        return runId;
    }

    /** Null for run and epoch events. */
    public String getNodeId() {
        return nodeId;
    }

    public NodeType getNodeType() {
        return nodeType;
    }

    public int getEpoch() {
        return epoch;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public String getMessage() {
        return message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return type + "{runId=" + runId + (nodeId != null ? ", nodeId=" + nodeId : "") + ", epoch=" + epoch + "}";
    }
}
