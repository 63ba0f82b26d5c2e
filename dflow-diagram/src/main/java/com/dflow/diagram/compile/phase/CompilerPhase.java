package com.dflow.diagram.compile.phase;

import com.dflow.diagram.compile.CompilationContext;
import com.dflow.diagram.diagnostic.DiagnosticPhase;

/**
 * One step of the compiler pipeline. Phases report problems as diagnostics on the context; an exception
 * escaping {@link #execute} is treated as an internal compiler error.
 */
public interface CompilerPhase {

    DiagnosticPhase phase();

    void execute(CompilationContext context);
}
