package com.dflow.engine.scheduler;

public enum RunStatus {
    /** Finished without an unrouted node failure. */
    SUCCEEDED,
    /** At least one node failed and had no {@code error} edge to route the failure to. */
    FAILED,
    CANCELLED,
    TIMED_OUT
}
