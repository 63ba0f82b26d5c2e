package com.dflow.engine;

import com.dflow.diagram.compile.CompilationException;
import com.dflow.diagram.compile.CompilationResult;
import com.dflow.diagram.compile.DiagramCompiler;
import com.dflow.diagram.description.DiagramDescription;
import com.dflow.diagram.model.ExecutableDiagram;
import com.dflow.engine.config.EngineConfig;
import com.dflow.engine.event.EventDispatcher;
import com.dflow.engine.handlers.BuiltinHandlers;
import com.dflow.engine.scheduler.RunResult;
import com.dflow.engine.scheduler.Scheduler;
import com.dflow.engine.snapshot.RunSnapshot;
import com.dflow.protocol.event.ExecutionEventListener;
import com.dflow.protocol.handler.HandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point: compiles diagram descriptions and runs them on a shared fixed-size worker pool.
 * Compilation errors never reach the scheduler; {@link #execute(DiagramDescription, Map)} throws
 * {@link CompilationException} instead. Built-in START, ENDPOINT and CONDITION handlers are registered
 * unless the registry already has handlers for those types.
 * <p>
 * Use {@link #newScheduler(ExecutableDiagram)} when the caller needs the scheduler itself, e.g. to cancel
 * from another thread or snapshot from a listener.
 */
public final class ExecutionEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final EngineConfig config;
    private final HandlerRegistry handlers;
    private final DiagramCompiler compiler;
    private final EventDispatcher events = new EventDispatcher();
    private final ExecutorService workers;

    public ExecutionEngine(EngineConfig config, HandlerRegistry handlers) {
        this(config, handlers, new DiagramCompiler());
    }

    public ExecutionEngine(EngineConfig config, HandlerRegistry handlers, DiagramCompiler compiler) {
        this.config = config != null ? config : EngineConfig.DEFAULT;
        this.handlers = BuiltinHandlers.registerDefaults(handlers != null ? handlers : new HandlerRegistry());
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.workers = Executors.newFixedThreadPool(this.config.getMaxWorkers(), workerThreadFactory());
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "dflow-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public EngineConfig getConfig() {
        return config;
    }

    public HandlerRegistry getHandlers() {
        return handlers;
    }

    public ExecutionEngine addListener(ExecutionEventListener listener) {
        events.addListener(listener);
        return this;
    }

    /**
     * Compiles with the configured diagnostics mode.
     *
     * @throws CompilationException listing the errors when the diagram is invalid
     */
    public ExecutableDiagram compile(DiagramDescription description) {
        CompilationResult result = compiler.compileWithDiagnostics(description, config.getDiagnosticsMode(), null);
        if (!result.isValid()) {
            log.warn("Diagram rejected | diagramId={} | errors={}", description.getId(), result.errors().size());
        }
        return result.getDiagramOrThrow();
    }

    /** Compiles and runs a description. */
    public RunResult execute(DiagramDescription description, Map<String, Object> initialInputs) {
        return run(compile(description), initialInputs);
    }

    public RunResult run(ExecutableDiagram diagram, Map<String, Object> initialInputs) {
        return newScheduler(diagram).run(initialInputs);
    }

    /** Continues a run from a snapshot under the snapshot's run id. */
    public RunResult resume(ExecutableDiagram diagram, RunSnapshot snapshot, Map<String, Object> initialInputs) {
        Objects.requireNonNull(snapshot, "snapshot");
        Scheduler scheduler = newScheduler(diagram, snapshot.runId());
        scheduler.restore(snapshot);
        return scheduler.run(initialInputs);
    }

    public Scheduler newScheduler(ExecutableDiagram diagram) {
        return newScheduler(diagram, UUID.randomUUID().toString());
    }

    public Scheduler newScheduler(ExecutableDiagram diagram, String runId) {
        return new Scheduler(diagram, handlers, config, workers, events, runId);
    }

    /** Stops the worker pool, waiting up to five minutes for running handlers. */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.MINUTES)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
