package com.dflow.diagram.compile;

import com.dflow.diagram.diagnostic.Diagnostic;

import java.util.List;

/**
 * Thrown when a diagram cannot be compiled. The message lists one {@code PHASE: message} line per error.
 */
public final class CompilationException extends IllegalStateException {

    private final List<Diagnostic> errors;

    public CompilationException(List<Diagnostic> errors) {
        super(format(errors));
        this.errors = List.copyOf(errors);
    }

    private static String format(List<Diagnostic> errors) {
        StringBuilder sb = new StringBuilder("Compilation failed:");
        for (Diagnostic error : errors) {
            sb.append('\n').append(error.summary());
        }
        return sb.toString();
    }

    public List<Diagnostic> getErrors() {
        return errors;
    }
}
