package com.dflow.engine.scheduler;

import com.dflow.diagram.compile.transform.NodeTransformRegistry;
import com.dflow.diagram.diagnostic.Diagnostic;
import com.dflow.diagram.diagnostic.DiagnosticPhase;
import com.dflow.diagram.model.ExecutableDiagram;
import com.dflow.diagram.model.ExecutableEdge;
import com.dflow.diagram.model.LoopStructure;
import com.dflow.diagram.model.Node;
import com.dflow.diagram.model.Ports;
import com.dflow.engine.config.EngineConfig;
import com.dflow.engine.event.EventDispatcher;
import com.dflow.engine.runtime.ExecutionRuntimeState;
import com.dflow.engine.runtime.NodeStatus;
import com.dflow.engine.runtime.RuntimeNodeState;
import com.dflow.engine.snapshot.InterruptedDispatch;
import com.dflow.engine.snapshot.RunSnapshot;
import com.dflow.engine.token.TokenManager;
import com.dflow.protocol.Envelope;
import com.dflow.protocol.event.ExecutionEvent;
import com.dflow.protocol.handler.HandlerRegistry;
import com.dflow.protocol.handler.HandlerResult;
import com.dflow.protocol.handler.NodeHandler;
import com.dflow.protocol.handler.RunContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single responsibility: drive one run of a compiled diagram to quiescence.
 * <p>
 * The event loop runs on the thread calling {@link #run(Map)}. Each pass walks nodes in topological order,
 * dispatches every node that is ready at one of its pending epochs and admitted by its concurrency policy,
 * then waits for handler completions, which workers hand back through a blocking queue. Completions, loop
 * advancement, token publication, event delivery and snapshots all happen on the loop thread; handlers
 * run on the supplied executor.
 * <p>
 * A node that fires a loop-back edge starts a new epoch when every fired loop may advance (not exhausted
 * and below the iteration cap): the loop bodies are re-armed and the loop-back tokens land in the new
 * epoch. Otherwise the loop-back tokens are dropped and the loop ends.
 * <p>
 * A scheduler runs once. {@link #cancel()} may be called from any thread.
 */
public final class Scheduler {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    /** One dispatched handler invocation. {@code future} is null when no handler was submitted. */
    private record InFlight(long dispatchId, Node node, int epoch, Map<String, Envelope> inputs, Future<?> future,
                            Instant deadline, Duration timeout, long startNanos) {
    }

    private record Completion(long dispatchId, HandlerResult result) {
    }

    private final ExecutableDiagram diagram;
    private final HandlerRegistry handlers;
    private final EngineConfig config;
    private final ExecutorService executor;
    private final EventDispatcher events;
    private final String runId;

    private final TokenManager tokens;
    private final ExecutionRuntimeState state;
    private final LoopController loops;
    private final ConcurrencyGate gate = new ConcurrencyGate();
    private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
    private final Map<Long, InFlight> inFlight = new LinkedHashMap<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Deque<InterruptedDispatch> replays = new ArrayDeque<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean started = new AtomicBoolean();

    private long nextDispatchId;
    private boolean unroutedFailure;
    private Map<String, Object> initialInputs = Map.of();

    public Scheduler(ExecutableDiagram diagram, HandlerRegistry handlers, EngineConfig config,
                     ExecutorService executor, EventDispatcher events, String runId) {
        this.diagram = Objects.requireNonNull(diagram, "diagram");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.config = config != null ? config : EngineConfig.DEFAULT;
        this.executor = Objects.requireNonNull(executor, "executor");
        this.events = events != null ? events : new EventDispatcher();
        this.runId = Objects.requireNonNull(runId, "runId");
        this.tokens = new TokenManager(diagram);
        this.state = new ExecutionRuntimeState(diagram);
        this.loops = new LoopController(diagram, state, this.config.getMaxLoopIterations());
    }

    public String getRunId() {
        return runId;
    }

    public TokenManager tokens() {
        return tokens;
    }

    public ExecutionRuntimeState state() {
        return state;
    }

    /** Requests cooperative cancellation: no further dispatch, running handlers are interrupted. */
    public void cancel() {
        if (cancelled.compareAndSet(false, true) && log.isInfoEnabled()) {
            log.info("Scheduler cancel requested | runId={}", runId);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Captures tokens, node states, loop counters and runtime diagnostics. Call it from an event listener
     * (which runs on the loop thread) or while the scheduler is not running.
     */
    public RunSnapshot snapshot() {
        List<InterruptedDispatch> interrupted = new ArrayList<>(replays);
        for (InFlight running : inFlight.values()) {
            interrupted.add(new InterruptedDispatch(running.node().getId(), running.epoch(), running.inputs()));
        }
        return new RunSnapshot(runId, tokens.snapshot(), state.copyNodes(), state.loopIterations(),
                diagnostics, unroutedFailure, interrupted);
    }

    /**
     * Loads a snapshot before {@link #run(Map)}. Handler invocations that were running when it was taken are
     * dispatched again, first thing in the run, with the inputs they had claimed.
     *
     * @throws IllegalStateException if the run already started
     * @throws IllegalArgumentException if the snapshot does not fit this diagram
     */
    public void restore(RunSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (started.get()) {
            throw new IllegalStateException("Cannot restore a scheduler that already ran");
        }
        Map<String, Integer> replayable = new HashMap<>();
        for (InterruptedDispatch interrupted : snapshot.interrupted()) {
            if (diagram.getNode(interrupted.nodeId()) == null) {
                throw new IllegalArgumentException("Snapshot names unknown node " + interrupted.nodeId());
            }
            replayable.merge(interrupted.nodeId(), 1, Integer::sum);
        }
        tokens.restore(snapshot.tokens());
        state.restore(snapshot.nodes(), snapshot.loopIterations(), replayable);
        replays.clear();
        replays.addAll(snapshot.interrupted());
        diagnostics.clear();
        diagnostics.addAll(snapshot.diagnostics());
        unroutedFailure = snapshot.unroutedFailure();
        if (log.isInfoEnabled()) {
            log.info("Scheduler restored | runId={} | epoch={} | tokens={} | replays={}", runId,
                    snapshot.tokens().currentEpoch(), snapshot.tokens().tokens().size(), replays.size());
        }
    }

    /**
     * Runs the diagram until quiescence, endpoint completion (when configured), cancellation or run timeout.
     *
     * @throws IllegalStateException if called twice
     * @throws SchedulerInvariantViolation if token or concurrency bookkeeping breaks; in-flight work is
     *                                     cancelled first
     */
    public RunResult run(Map<String, Object> initialInputs) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Scheduler " + runId + " already ran");
        }
        this.initialInputs = initialInputs != null ? Map.copyOf(initialInputs) : Map.of();
        long startNanos = System.nanoTime();
        Instant runDeadline = config.getRunTimeout().isZero() ? null : Instant.now().plus(config.getRunTimeout());
        if (log.isInfoEnabled()) {
            log.info("Scheduler run started | runId={} | nodes={} | edges={} | loops={}", runId,
                    diagram.getNodes().size(), diagram.getEdges().size(), diagram.getLoops().size());
        }
        events.dispatch(ExecutionEvent.runStarted(runId));

        RunStatus stoppedAs = null;
        try {
            while (true) {
                if (cancelled.get()) {
                    stoppedAs = RunStatus.CANCELLED;
                    break;
                }
                if (runDeadline != null && Instant.now().isAfter(runDeadline)) {
                    stoppedAs = RunStatus.TIMED_OUT;
                    break;
                }
                if (!(config.isTerminateOnEndpoints() && endpointsCompleted())) {
                    dispatchReady();
                }
                if (inFlight.isEmpty()) {
                    break;
                }
                Completion completion = completions.poll(config.getPollIntervalMillis(), TimeUnit.MILLISECONDS);
                while (completion != null) {
                    handleCompletion(completion);
                    completion = completions.poll();
                }
                expireTimedOutNodes();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled.set(true);
            stoppedAs = RunStatus.CANCELLED;
        } catch (SchedulerInvariantViolation e) {
            log.error("Scheduler invariant violated | runId={} | nodeId={} | error={}", runId, e.getNodeId(), e.getMessage());
            abortInFlight("Aborted: " + e.getMessage());
            throw e;
        }

        if (stoppedAs != null) {
            abortInFlight(stoppedAs == RunStatus.CANCELLED ? "Cancelled" : "Run timed out");
        }
        RunStatus status = stoppedAs != null ? stoppedAs
                : unroutedFailure ? RunStatus.FAILED : RunStatus.SUCCEEDED;
        return finish(status, startNanos);
    }

    private boolean endpointsCompleted() {
        List<String> endpoints = diagram.endpointNodeIds();
        if (endpoints.isEmpty()) return false;
        for (String id : endpoints) {
            if (state.status(id) != NodeStatus.COMPLETED) return false;
        }
        return true;
    }

    private void dispatchReady() {
        dispatchReplays();
        for (String nodeId : diagram.getTopologicalOrder()) {
            if (cancelled.get()) return;
            Node node = diagram.getNode(nodeId);
            if (diagram.incomingEdges(nodeId).isEmpty()) {
                if (state.executionCount(nodeId) == 0 && gate.tryAdmit(node)) {
                    state.markReady(nodeId);
                    dispatch(node, tokens.currentEpoch(), Map.of());
                }
                continue;
            }
            while (!executionsExhausted(node)) {
                Integer epoch = firstReadyEpoch(node);
                if (epoch == null || !gate.tryAdmit(node)) break;
                if (state.node(nodeId).getInFlight() == 0) state.markReady(nodeId);
                Map<String, Envelope> inputs = tokens.consumeInbound(nodeId, epoch);
                dispatch(node, epoch, inputs);
            }
        }
    }

    /** Re-runs invocations interrupted by a snapshot, as far as their concurrency policy admits them. */
    private void dispatchReplays() {
        for (int i = replays.size(); i > 0 && !cancelled.get(); i--) {
            InterruptedDispatch replay = replays.poll();
            Node node = diagram.getNode(replay.nodeId());
            if (!gate.tryAdmit(node)) {
                replays.add(replay);
                continue;
            }
            if (log.isInfoEnabled()) {
                log.info("Scheduler replaying interrupted dispatch | runId={} | nodeId={} | epoch={}",
                        runId, replay.nodeId(), replay.epoch());
            }
            if (state.node(replay.nodeId()).getInFlight() == 0) state.markReady(replay.nodeId());
            dispatch(node, replay.epoch(), replay.inputs());
        }
    }

    private boolean executionsExhausted(Node node) {
        OptionalInt limit = node.maxExecutionsLimit();
        return limit.isPresent() && state.executionCount(node.getId()) >= limit.getAsInt();
    }

    private Integer firstReadyEpoch(Node node) {
        int executionCount = state.executionCount(node.getId());
        for (Integer epoch : tokens.pendingEpochs(node.getId())) {
            if (tokens.hasNewInputs(node.getId(), epoch, node.getJoinPolicy(), executionCount)) return epoch;
        }
        return null;
    }

    private void dispatch(Node node, int epoch, Map<String, Envelope> inputs) {
        long dispatchId = nextDispatchId++;
        int previousExecutions = state.beginExecution(node.getId(), epoch);
        Duration timeout = nodeTimeout(node);
        Instant deadline = timeout.isZero() ? null : Instant.now().plus(timeout);
        RunContext context = RunContext.builder()
                .runId(runId)
                .nodeId(node.getId())
                .epoch(epoch)
                .executionCount(previousExecutions)
                .initialInputs(initialInputs)
                .loopExhausted(loops.isLoopExhausted(node.getId()))
                .deadline(deadline)
                .cancelled(cancelled::get)
                .build();
        if (log.isInfoEnabled()) {
            log.info("Scheduler dispatch | runId={} | nodeId={} | type={} | epoch={} | execution={} | inputs={}",
                    runId, node.getId(), node.getType().toValue(), epoch, previousExecutions + 1, inputs.keySet());
        }
        long startNanos = System.nanoTime();
        NodeHandler handler = handlers.handlerFor(node.getType());
        Future<?> future = null;
        if (handler == null) {
            completions.add(new Completion(dispatchId,
                    HandlerResult.failure("No handler registered for node type " + node.getType().toValue())));
        } else {
            try {
                future = executor.submit(() -> invoke(dispatchId, handler, inputs, node, context));
            } catch (RejectedExecutionException e) {
                completions.add(new Completion(dispatchId, HandlerResult.failure("Worker pool rejected node", e)));
            }
        }
        inFlight.put(dispatchId, new InFlight(dispatchId, node, epoch, inputs, future, deadline, timeout, startNanos));
        events.dispatch(ExecutionEvent.nodeStarted(runId, node, epoch));
    }

    private Duration nodeTimeout(Node node) {
        Object configured = node.getConfig().get(NodeTransformRegistry.TIMEOUT_SECONDS);
        if (configured instanceof Number n && n.longValue() > 0) {
            return Duration.ofSeconds(n.longValue());
        }
        return config.getNodeTimeout();
    }

    /** Worker side: runs the handler and hands the outcome back to the loop thread. */
    private void invoke(long dispatchId, NodeHandler handler, Map<String, Envelope> inputs, Node node, RunContext context) {
        HandlerResult result;
        try {
            result = handler.execute(inputs, node, context);
            if (result == null) {
                result = HandlerResult.failure("Handler returned no result");
            }
        } catch (Exception e) {
            result = HandlerResult.failure(e.getMessage(), e);
        } catch (Error e) {
            completions.add(new Completion(dispatchId, HandlerResult.failure(e.toString(), e)));
            throw e;
        }
        completions.add(new Completion(dispatchId, result));
    }

    private void handleCompletion(Completion completion) {
        InFlight running = inFlight.remove(completion.dispatchId());
        if (running == null) {
            if (log.isDebugEnabled()) {
                log.debug("Ignoring completion of abandoned dispatch | runId={} | dispatchId={}", runId, completion.dispatchId());
            }
            return;
        }
        gate.release(running.node().getId());
        HandlerResult result = completion.result();
        if (result.isSuccess()) {
            onSuccess(running, result.getOutputs());
        } else {
            onFailure(running, result.getErrorMessage());
        }
    }

    private void onSuccess(InFlight running, Map<String, Envelope> outputs) {
        Node node = running.node();
        String nodeId = node.getId();
        try {
            tokens.checkBranchOutputs(nodeId, outputs);
        } catch (IllegalArgumentException e) {
            onFailure(running, e.getMessage());
            return;
        }
        state.markCompleted(nodeId, outputs);
        Integer loopBackEpoch = advanceLoops(node, outputs);
        tokens.emitOutputs(nodeId, outputs, running.epoch(), loopBackEpoch);
        long durationMs = elapsedMs(running.startNanos());
        if (log.isInfoEnabled()) {
            log.info("Scheduler node completed | runId={} | nodeId={} | epoch={} | ports={} | durationMs={}",
                    runId, nodeId, running.epoch(), outputs.keySet(), durationMs);
        }
        events.dispatch(ExecutionEvent.nodeCompleted(runId, node, running.epoch(), durationMs));
    }

    /**
     * Starts a new epoch when the node fired loop-back edges and every one of their loops may advance.
     *
     * @return the epoch loop-back tokens go to, or null to drop them
     */
    private Integer advanceLoops(Node node, Map<String, Envelope> outputs) {
        Set<LoopStructure> fired = new LinkedHashSet<>();
        for (ExecutableEdge edge : diagram.outgoingEdges(node.getId())) {
            if (edge.isLoopBack() && outputs.get(edge.sourcePort()) != null) {
                LoopStructure loop = diagram.loopForBackEdge(edge.getId());
                if (loop != null) fired.add(loop);
            }
        }
        if (fired.isEmpty()) return null;
        for (LoopStructure loop : fired) {
            if (!loops.canAdvance(loop)) {
                if (log.isInfoEnabled()) {
                    log.info("Scheduler loop ended | runId={} | loopBackEdge={} | iterations={}",
                            runId, loop.loopBackEdgeId(), state.loopIterations(loop.loopBackEdgeId()));
                }
                return null;
            }
        }
        Set<String> body = new LinkedHashSet<>();
        for (LoopStructure loop : fired) {
            loops.recordAdvance(loop);
            body.addAll(loop.bodyNodeIds());
        }
        int epoch = tokens.beginEpoch();
        state.rearm(body);
        String edgeId = fired.iterator().next().loopBackEdgeId();
        if (log.isInfoEnabled()) {
            log.info("Scheduler loop step | runId={} | loopBackEdge={} | epoch={} | rearmed={}", runId, edgeId, epoch, body);
        }
        events.dispatch(ExecutionEvent.epochBegan(runId, epoch, edgeId));
        return epoch;
    }

    private void onFailure(InFlight running, String message) {
        Node node = running.node();
        String nodeId = node.getId();
        String error = message != null ? message : "Node failed";
        state.markFailed(nodeId, error);
        diagnostics.add(Diagnostic.nodeError(DiagnosticPhase.EXECUTION, "Node " + nodeId + " failed: " + error, nodeId));
        boolean routed = !diagram.outgoingEdges(nodeId, Ports.ERROR).isEmpty();
        if (routed) {
            tokens.emitOutputs(nodeId, Map.of(Ports.ERROR, Envelope.error(nodeId, error)), running.epoch(), null);
        } else {
            unroutedFailure = true;
        }
        long durationMs = elapsedMs(running.startNanos());
        log.warn("Scheduler node failed | runId={} | nodeId={} | epoch={} | routedToErrorPort={} | error={}",
                runId, nodeId, running.epoch(), routed, error);
        events.dispatch(ExecutionEvent.nodeFailed(runId, node, running.epoch(), durationMs, error));
    }

    private void expireTimedOutNodes() {
        if (inFlight.isEmpty()) return;
        Instant now = Instant.now();
        for (InFlight running : new ArrayList<>(inFlight.values())) {
            if (running.deadline() == null || running.future() == null || !now.isAfter(running.deadline())) continue;
            running.future().cancel(true);
            inFlight.remove(running.dispatchId());
            gate.release(running.node().getId());
            onFailure(running, "Timed out after " + running.timeout().toSeconds() + "s");
        }
    }

    /** Interrupts every running handler and marks its node FAILED; late completions are ignored. */
    private void abortInFlight(String reason) {
        for (InFlight running : new ArrayList<>(inFlight.values())) {
            if (running.future() != null) running.future().cancel(true);
            gate.release(running.node().getId());
            state.markFailed(running.node().getId(), reason);
            events.dispatch(ExecutionEvent.nodeFailed(runId, running.node(), running.epoch(),
                    elapsedMs(running.startNanos()), reason));
        }
        inFlight.clear();
    }

    private RunResult finish(RunStatus status, long startNanos) {
        Map<String, NodeStatus> statuses = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, Map<String, Envelope>> outputs = new LinkedHashMap<>();
        for (RuntimeNodeState nodeState : state.nodes()) {
            String nodeId = nodeState.getNodeId();
            NodeStatus before = nodeState.getStatus();
            NodeStatus settled = state.settle(nodeId);
            if (settled == NodeStatus.SKIPPED && before != NodeStatus.SKIPPED) {
                events.dispatch(ExecutionEvent.nodeSkipped(runId, diagram.getNode(nodeId)));
            }
            statuses.put(nodeId, settled);
            counts.put(nodeId, nodeState.getExecutionCount());
            if (!nodeState.getLastOutputs().isEmpty()) outputs.put(nodeId, nodeState.getLastOutputs());
        }
        long durationMs = elapsedMs(startNanos);
        int finalEpoch = tokens.currentEpoch();
        if (log.isInfoEnabled()) {
            log.info("Scheduler run finished | runId={} | status={} | finalEpoch={} | failures={} | durationMs={}",
                    runId, status, finalEpoch, diagnostics.size(), durationMs);
        }
        events.dispatch(ExecutionEvent.runCompleted(runId, status.name(), finalEpoch, durationMs));
        return new RunResult(runId, status, statuses, counts, outputs, diagnostics, finalEpoch, durationMs);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
