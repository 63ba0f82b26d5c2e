package com.dflow.protocol.handler;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * What a handler may know about the run it executes in: run and node identity, the epoch and how many
 * times the node already ran, the run's initial inputs, whether the enclosing loop is exhausted, the
 * node deadline and a cooperative cancellation flag. Handlers doing long work should poll
 * {@link #isCancelled()}.
 */
public final class RunContext {

    private final String runId;
    private final String nodeId;
    private final int epoch;
    private final int executionCount;
    private final Map<String, Object> initialInputs;
    private final boolean loopExhausted;
    private final Instant deadline;
    private final BooleanSupplier cancelled;

    private RunContext(Builder b) {
        this.runId = Objects.requireNonNull(b.runId, "runId");
        this.nodeId = Objects.requireNonNull(b.nodeId, "nodeId");
        this.epoch = b.epoch;
        this.executionCount = b.executionCount;
        this.initialInputs = Collections.unmodifiableMap(new LinkedHashMap<>(b.initialInputs));
        this.loopExhausted = b.loopExhausted;
        this.deadline = b.deadline;
        this.cancelled = b.cancelled != null ? b.cancelled : () -> false;
    }

    public String getRunId() {
        return runId;
    }

    public String getNodeId() {
        return nodeId;
    }

    public int getEpoch() {
        return epoch;
    }

    /** Completed executions of this node before the current one; 0 on the first run. */
    public int getExecutionCount() {
        return executionCount;
    }

    public boolean isFirstExecution() {
        return executionCount == 0;
    }

    public Map<String, Object> getInitialInputs() {
        return initialInputs;
    }

    /** True when every bounded node of a loop containing this node reached its max execution count. */
    public boolean isLoopExhausted() {
        return loopExhausted;
    }

    /** Node deadline; null when no timeout applies. */
    public Instant getDeadline() {
        return deadline;
    }

    public boolean isCancelled() {
        return cancelled.getAsBoolean() || Thread.currentThread().isInterrupted();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String runId;
        private String nodeId;
        private int epoch;
        private int executionCount;
        private Map<String, Object> initialInputs = Map.of();
        private boolean loopExhausted;
        private Instant deadline;
        private BooleanSupplier cancelled;

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder epoch(int epoch) {
            this.epoch = epoch;
            return this;
        }

        public Builder executionCount(int executionCount) {
            this.executionCount = executionCount;
            return this;
        }

        public Builder initialInputs(Map<String, Object> initialInputs) {
            this.initialInputs = initialInputs != null ? initialInputs : Map.of();
            return this;
        }

        public Builder loopExhausted(boolean loopExhausted) {
            this.loopExhausted = loopExhausted;
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder cancelled(BooleanSupplier cancelled) {
            this.cancelled = cancelled;
            return this;
        }

        public RunContext build() {
            return new RunContext(this);
        }
    }
}
