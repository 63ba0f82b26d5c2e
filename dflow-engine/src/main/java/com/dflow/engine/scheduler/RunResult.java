package com.dflow.engine.scheduler;

import com.dflow.diagram.diagnostic.Diagnostic;
import com.dflow.engine.runtime.NodeStatus;
import com.dflow.protocol.Envelope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Final outcome of a run: status, terminal state and execution count per node, each node's latest outputs,
 * runtime diagnostics and the last epoch reached.
 */
public final class RunResult {

    private final String runId;
    private final RunStatus status;
    private final Map<String, NodeStatus> nodeStatuses;
    private final Map<String, Integer> executionCounts;
    private final Map<String, Map<String, Envelope>> outputs;
    private final List<Diagnostic> diagnostics;
    private final int finalEpoch;
    private final long durationMs;

    public RunResult(String runId, RunStatus status, Map<String, NodeStatus> nodeStatuses,
                     Map<String, Integer> executionCounts, Map<String, Map<String, Envelope>> outputs,
                     List<Diagnostic> diagnostics, int finalEpoch, long durationMs) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.status = Objects.requireNonNull(status, "status");
        this.nodeStatuses = Collections.unmodifiableMap(new LinkedHashMap<>(nodeStatuses));
        this.executionCounts = Collections.unmodifiableMap(new LinkedHashMap<>(executionCounts));
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        this.diagnostics = List.copyOf(diagnostics);
        this.finalEpoch = finalEpoch;
        this.durationMs = durationMs;
    }

    public String getRunId() {
        return runId;
    }

    public RunStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == RunStatus.SUCCEEDED;
    }

    public Map<String, NodeStatus> getNodeStatuses() {
        return nodeStatuses;
    }

    public NodeStatus statusOf(String nodeId) {
        return nodeStatuses.get(nodeId);
    }

    public Map<String, Integer> getExecutionCounts() {
        return executionCounts;
    }

    public int executionCount(String nodeId) {
        return executionCounts.getOrDefault(nodeId, 0);
    }

    /** Latest outputs per node, keyed by port. ENDPOINT nodes hold the run's results here. */
    public Map<String, Map<String, Envelope>> getOutputs() {
        return outputs;
    }

    public Map<String, Envelope> outputsOf(String nodeId) {
        return outputs.getOrDefault(nodeId, Map.of());
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public int getFinalEpoch() {
        return finalEpoch;
    }

    public long getDurationMs() {
        return durationMs;
    }

    @Override
    public String toString() {
        return "RunResult{runId=" + runId + ", status=" + status + ", finalEpoch=" + finalEpoch
                + ", nodes=" + nodeStatuses + "}";
    }
}
