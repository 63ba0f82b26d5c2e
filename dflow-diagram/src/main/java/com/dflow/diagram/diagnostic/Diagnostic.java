package com.dflow.diagram.diagnostic;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * Phase-tagged compiler or runtime finding, optionally scoped to a node or edge.
 *
 * @param suggestion optional hint for fixing the problem; may be null
 */
public record Diagnostic(DiagnosticPhase phase, Severity severity, String message,
                         String nodeId, String edgeId, String suggestion) {

    public Diagnostic {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(severity, "severity");
        message = message != null ? message : "";
    }

    public static Diagnostic error(DiagnosticPhase phase, String message) {
        return new Diagnostic(phase, Severity.ERROR, message, null, null, null);
    }

    public static Diagnostic nodeError(DiagnosticPhase phase, String message, String nodeId) {
        return new Diagnostic(phase, Severity.ERROR, message, nodeId, null, null);
    }

    public static Diagnostic edgeError(DiagnosticPhase phase, String message, String edgeId) {
        return new Diagnostic(phase, Severity.ERROR, message, null, edgeId, null);
    }

    public static Diagnostic warning(DiagnosticPhase phase, String message) {
        return new Diagnostic(phase, Severity.WARNING, message, null, null, null);
    }

    public static Diagnostic nodeWarning(DiagnosticPhase phase, String message, String nodeId) {
        return new Diagnostic(phase, Severity.WARNING, message, nodeId, null, null);
    }

    public static Diagnostic edgeWarning(DiagnosticPhase phase, String message, String edgeId) {
        return new Diagnostic(phase, Severity.WARNING, message, null, edgeId, null);
    }

    public Diagnostic withSuggestion(String hint) {
        return new Diagnostic(phase, severity, message, nodeId, edgeId, hint);
    }

    @JsonIgnore
    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /** {@code PHASE: message}, the form used in compilation failure messages. */
    public String summary() {
        return phase.name() + ": " + message;
    }
}
