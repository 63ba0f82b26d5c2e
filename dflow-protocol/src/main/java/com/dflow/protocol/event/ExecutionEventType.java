package com.dflow.protocol.event;

public enum ExecutionEventType {
    RUN_STARTED,
    NODE_STARTED,
    NODE_COMPLETED,
    NODE_FAILED,
    NODE_SKIPPED,
    EPOCH_BEGAN,
    RUN_COMPLETED
}
