package com.dflow.engine.snapshot;

import com.dflow.diagram.diagnostic.Diagnostic;
import com.dflow.engine.runtime.RuntimeNodeState;
import com.dflow.engine.token.TokenManagerSnapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to resume a run: token store, node states, loop counters, the runtime diagnostics
 * so far, whether an unrouted failure already happened and the handler invocations caught in flight.
 */
public record RunSnapshot(String runId,
                          TokenManagerSnapshot tokens,
                          Map<String, RuntimeNodeState> nodes,
                          Map<String, Integer> loopIterations,
                          List<Diagnostic> diagnostics,
                          boolean unroutedFailure,
                          List<InterruptedDispatch> interrupted) {

    public RunSnapshot {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(tokens, "tokens");
        nodes = nodes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(nodes)) : Map.of();
        loopIterations = loopIterations != null ? Map.copyOf(loopIterations) : Map.of();
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
        interrupted = interrupted != null ? List.copyOf(interrupted) : List.of();
    }
}
