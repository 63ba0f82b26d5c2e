/**
 * Diagram compiler: turns a {@link com.dflow.diagram.description.DiagramDescription} into an immutable
 * {@link com.dflow.diagram.model.ExecutableDiagram}.
 * <ul>
 *   <li>{@link com.dflow.diagram.compile.DiagramCompiler} – entry point; fail-fast or collect-all modes</li>
 *   <li>{@link com.dflow.diagram.compile.phase} – the six phases, run in order over a
 *   {@link com.dflow.diagram.compile.CompilationContext}</li>
 *   <li>{@link com.dflow.diagram.compile.transform} – per-type config normalization table</li>
 *   <li>{@link com.dflow.diagram.compile.resolve} – id, label and handle resolution of connection endpoints</li>
 *   <li>{@link com.dflow.diagram.compile.optimize} – DFS ranking, loop-back classification, loop bodies</li>
 *   <li>{@link com.dflow.diagram.compile.assemble} – default join and concurrency policies</li>
 * </ul>
 * Errors never produce a diagram; {@link com.dflow.diagram.compile.CompilationException} carries them.
 */
package com.dflow.diagram.compile;
