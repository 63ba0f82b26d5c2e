package com.dflow.diagram.diagnostic;

/**
 * Where a diagnostic was raised. The first six constants are the compiler phases in execution order;
 * {@link #EXECUTION} tags failures recorded by the runtime.
 */
public enum DiagnosticPhase {
    VALIDATION,
    TRANSFORMATION,
    RESOLUTION,
    EDGE_BUILDING,
    OPTIMIZATION,
    ASSEMBLY,
    EXECUTION;

    public boolean isCompilePhase() {
        return this != EXECUTION;
    }
}
