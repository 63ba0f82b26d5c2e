package com.dflow.protocol.handler;

import com.dflow.diagram.model.Ports;
import com.dflow.protocol.Envelope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one handler invocation: on success the envelopes to emit, keyed by output port (ports
 * left out, or mapped to null, emit nothing); on failure a message and optional cause.
 */
public final class HandlerResult {

    private final boolean success;
    private final Map<String, Envelope> outputs;
    private final String errorMessage;
    private final Throwable cause;

    private HandlerResult(boolean success, Map<String, Envelope> outputs, String errorMessage, Throwable cause) {
        this.success = success;
        // null values mark ports that stay silent, so no Map.copyOf here
        this.outputs = outputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(outputs)) : Map.of();
        this.errorMessage = errorMessage;
        this.cause = cause;
    }

    public static HandlerResult success(Map<String, Envelope> outputs) {
        return new HandlerResult(true, outputs, null, null);
    }

    public static HandlerResult success(String port, Envelope envelope) {
        Map<String, Envelope> outputs = new LinkedHashMap<>();
        outputs.put(port, envelope);
        return success(outputs);
    }

    /** Single envelope on the {@code default} port. */
    public static HandlerResult success(Envelope envelope) {
        return success(Ports.DEFAULT, envelope);
    }

    public static HandlerResult failure(String message) {
        return failure(message, null);
    }

    public static HandlerResult failure(String message, Throwable cause) {
        String text = message != null ? message : (cause != null ? cause.toString() : "handler failed");
        return new HandlerResult(false, null, text, cause);
    }

    public boolean isSuccess() {
        return success;
    }

    public Map<String, Envelope> getOutputs() {
        return outputs;
    }

    /** Failure message; null on success. */
    public String getErrorMessage() {
        return errorMessage;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return success ? "HandlerResult{success, ports=" + outputs.keySet() + "}"
                : "HandlerResult{failure, " + errorMessage + "}";
    }
}
