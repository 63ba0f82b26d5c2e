package com.dflow.engine.snapshot;

import com.dflow.protocol.Envelope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A handler invocation that was still running when a snapshot was taken, with the inputs it had claimed.
 * Resuming dispatches it again with the same inputs.
 */
public record InterruptedDispatch(String nodeId, int epoch, Map<String, Envelope> inputs) {

    public InterruptedDispatch {
        Objects.requireNonNull(nodeId, "nodeId");
        inputs = inputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs)) : Map.of();
    }
}
