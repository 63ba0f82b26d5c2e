package com.dflow.engine.runtime;

import com.dflow.protocol.Envelope;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable runtime view of one node: status, how many times it was dispatched, how many invocations are in
 * flight, the epoch of its latest dispatch, its latest outputs and latest failure message. Owned by the
 * scheduler's loop thread.
 */
public final class RuntimeNodeState {

    private final String nodeId;
    private NodeStatus status;
    private int executionCount;
    private int inFlight;
    private int lastEpoch;
    private Map<String, Envelope> lastOutputs;
    private String lastError;

    public RuntimeNodeState(String nodeId) {
        this(nodeId, NodeStatus.PENDING, 0, 0, 0, null, null);
    }

    @JsonCreator
    public RuntimeNodeState(
            @JsonProperty("nodeId") String nodeId,
            @JsonProperty("status") NodeStatus status,
            @JsonProperty("executionCount") int executionCount,
            @JsonProperty("inFlight") int inFlight,
            @JsonProperty("lastEpoch") int lastEpoch,
            @JsonProperty("lastOutputs") Map<String, Envelope> lastOutputs,
            @JsonProperty("lastError") String lastError) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.status = status != null ? status : NodeStatus.PENDING;
        this.executionCount = executionCount;
        this.inFlight = inFlight;
        this.lastEpoch = lastEpoch;
        this.lastOutputs = copy(lastOutputs);
        this.lastError = lastError;
    }

    private static Map<String, Envelope> copy(Map<String, Envelope> outputs) {
        return outputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(outputs)) : Map.of();
    }

    public String getNodeId() {
        return nodeId;
    }

    public NodeStatus getStatus() {
        return status;
    }

    /** Dispatches so far, including ones still in flight. */
    public int getExecutionCount() {
        return executionCount;
    }

    public int getInFlight() {
        return inFlight;
    }

    public int getLastEpoch() {
        return lastEpoch;
    }

    public Map<String, Envelope> getLastOutputs() {
        return lastOutputs;
    }

    public String getLastError() {
        return lastError;
    }

    /** Records a dispatch. Returns the number of earlier dispatches. */
    int beginExecution(int epoch) {
        int previous = executionCount;
        executionCount++;
        inFlight++;
        lastEpoch = epoch;
        status = NodeStatus.RUNNING;
        return previous;
    }

    void complete(Map<String, Envelope> outputs) {
        finishOne();
        lastOutputs = copy(outputs);
        lastError = null;
        if (inFlight == 0) status = NodeStatus.COMPLETED;
    }

    void fail(String message) {
        finishOne();
        lastError = message;
        if (inFlight == 0) status = NodeStatus.FAILED;
    }

    private void finishOne() {
        if (inFlight > 0) inFlight--;
    }

    void setStatus(NodeStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    /**
     * Undoes the dispatches still in flight, e.g. after restoring a snapshot taken while handlers were
     * running: their executions no longer count and the node goes back to PENDING.
     */
    void rollbackInFlight() {
        executionCount -= inFlight;
        inFlight = 0;
        if (status == NodeStatus.RUNNING || status == NodeStatus.READY) status = NodeStatus.PENDING;
    }

    RuntimeNodeState copy() {
        return new RuntimeNodeState(nodeId, status, executionCount, inFlight, lastEpoch, lastOutputs, lastError);
    }
}
