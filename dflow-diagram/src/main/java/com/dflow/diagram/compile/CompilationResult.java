package com.dflow.diagram.compile;

import com.dflow.diagram.diagnostic.Diagnostic;
import com.dflow.diagram.model.ExecutableDiagram;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a compilation: the diagram (null when any error was recorded), every diagnostic, and
 * metadata such as start nodes and node dependencies.
 */
public final class CompilationResult {

    private final ExecutableDiagram diagram;
    private final List<Diagnostic> diagnostics;
    private final Map<String, Object> metadata;

    public CompilationResult(ExecutableDiagram diagram, List<Diagnostic> diagnostics, Map<String, Object> metadata) {
        this.diagram = diagram;
        this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public ExecutableDiagram getDiagram() {
        return diagram;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public boolean isValid() {
        return diagram != null && errors().isEmpty();
    }

    /**
     * @throws CompilationException when the result carries errors
     */
    public ExecutableDiagram getDiagramOrThrow() {
        if (!isValid()) {
            throw new CompilationException(errors());
        }
        return diagram;
    }
}
