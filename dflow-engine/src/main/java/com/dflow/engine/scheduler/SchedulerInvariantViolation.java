package com.dflow.engine.scheduler;

/**
 * Thrown when runtime bookkeeping would break one of its guarantees: a consumption cursor moving backwards,
 * a claim that would consume only part of a node's inputs, a sequence gap, or a concurrency gate admitting
 * more runs than its policy allows. The scheduler aborts the run when it sees one.
 */
public final class SchedulerInvariantViolation extends IllegalStateException {

    private final String nodeId;

    public SchedulerInvariantViolation(String message) {
        this(message, null);
    }

    public SchedulerInvariantViolation(String message, String nodeId) {
        super(message);
        this.nodeId = nodeId;
    }

    /** Node the violation was detected for; may be null. */
    public String getNodeId() {
        return nodeId;
    }
}
