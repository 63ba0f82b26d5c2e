package com.dflow.protocol.event;

/**
 * Observer of execution events. Called on the scheduler's loop thread, so implementations should return
 * quickly. Must not throw: the engine logs and drops listener exceptions.
 */
@FunctionalInterface
public interface ExecutionEventListener {

    void onEvent(ExecutionEvent event);
}
