package com.dflow.engine.runtime;

/**
 * Runtime status of a node. A node in a loop body goes back to PENDING when a new epoch begins.
 */
public enum NodeStatus {
    /** Waiting for inputs. */
    PENDING,
    /** Inputs satisfied; about to be dispatched. */
    READY,
    /** At least one handler invocation in flight. */
    RUNNING,
    COMPLETED,
    FAILED,
    /** Never ran (e.g. on a branch that was not taken). */
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }
}
