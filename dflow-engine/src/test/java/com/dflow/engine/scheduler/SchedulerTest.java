package com.dflow.engine.scheduler;

import com.dflow.diagram.compile.DiagramCompiler;
import com.dflow.diagram.description.ConnectionDescription;
import com.dflow.diagram.description.DiagramDescription;
import com.dflow.diagram.description.NodeDescription;
import com.dflow.diagram.description.PolicyDescription;
import com.dflow.diagram.diagnostic.DiagnosticPhase;
import com.dflow.diagram.model.ExecutableDiagram;
import com.dflow.diagram.model.NodeType;
import com.dflow.diagram.model.Ports;
import com.dflow.engine.config.EngineConfig;
import com.dflow.engine.event.EventDispatcher;
import com.dflow.engine.handlers.BuiltinHandlers;
import com.dflow.engine.runtime.NodeStatus;
import com.dflow.engine.snapshot.RunSnapshot;
import com.dflow.engine.snapshot.SnapshotCodec;
import com.dflow.protocol.Envelope;
import com.dflow.protocol.event.ExecutionEvent;
import com.dflow.protocol.event.ExecutionEventType;
import com.dflow.protocol.handler.HandlerRegistry;
import com.dflow.protocol.handler.HandlerResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchedulerTest {

    private ExecutorService executor;
    private HandlerRegistry handlers;
    private List<ExecutionEvent> events;
    private EventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        handlers = BuiltinHandlers.registerDefaults(new HandlerRegistry());
        events = new CopyOnWriteArrayList<>();
        dispatcher = new EventDispatcher();
        dispatcher.addListener(events::add);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ExecutableDiagram compile(List<NodeDescription> nodes, List<ConnectionDescription> connections) {
        return new DiagramCompiler().compile(new DiagramDescription(nodes, connections));
    }

    private static ConnectionDescription c(String source, String target) {
        return ConnectionDescription.of(source, target);
    }

    private static ConnectionDescription c(String source, String sourcePort, String target) {
        return ConnectionDescription.of(source, sourcePort, target, null);
    }

    private Scheduler scheduler(ExecutableDiagram diagram) {
        return scheduler(diagram, EngineConfig.DEFAULT, "run-1");
    }

    private Scheduler scheduler(ExecutableDiagram diagram, EngineConfig config, String runId) {
        return new Scheduler(diagram, handlers, config, executor, dispatcher, runId);
    }

    private List<ExecutionEventType> eventTypes() {
        List<ExecutionEventType> types = new ArrayList<>();
        events.forEach(e -> types.add(e.getType()));
        return types;
    }

    private static ExecutableDiagram conditionLoop(Map<String, Object> conditionConfig, int maxIteration) {
        return compile(
                List.of(NodeDescription.of("start", "start"),
                        NodeDescription.of("pj", "person_job", Map.of("max_iteration", maxIteration)),
                        NodeDescription.of("cond", "condition", conditionConfig),
                        NodeDescription.of("end", "endpoint")),
                List.of(c("start", "pj"),
                        c("pj", "cond"),
                        c("cond", Ports.CONDITION_FALSE, "pj"),
                        c("cond", Ports.CONDITION_TRUE, "end")));
    }

    private void registerCountingPersonJob() {
        handlers.register(NodeType.PERSON_JOB, (inputs, node, ctx) ->
                HandlerResult.success(Envelope.of("draft-" + (ctx.getExecutionCount() + 1), null, node.getId())));
    }

    @Test
    void run_startToEndpointExecutesEndpointOnce() {
        ExecutableDiagram diagram = compile(
                List.of(NodeDescription.of("start", "start"), NodeDescription.of("end", "endpoint")),
                List.of(c("start", "end")));

        RunResult result = scheduler(diagram).run(Map.of("topic", "rivers"));

        assertEquals(RunStatus.SUCCEEDED, result.getStatus());
        assertEquals(1, result.executionCount("end"));
        assertEquals(NodeStatus.COMPLETED, result.statusOf("end"));
        assertEquals(0, result.getFinalEpoch());
        assertEquals(Map.of("topic", "rivers"), result.outputsOf("end").get(Ports.DEFAULT).getBody());
        assertEquals(List.of(
                ExecutionEventType.RUN_STARTED,
                ExecutionEventType.NODE_STARTED, ExecutionEventType.NODE_COMPLETED,
                ExecutionEventType.NODE_STARTED, ExecutionEventType.NODE_COMPLETED,
                ExecutionEventType.RUN_COMPLETED), eventTypes());
    }

    @Test
    void run_fanInWaitsForBothBranches() {
        handlers.register(NodeType.DB, (inputs, node, ctx) -> HandlerResult.success(Envelope.of(node.getId())));
        ExecutableDiagram diagram = compile(
                List.of(NodeDescription.of("start", "start"),
                        NodeDescription.of("a", "db"),
                        NodeDescription.of("b", "db"),
                        NodeDescription.of("end", "endpoint")),
                List.of(c("start", "a"), c("start", "b"), c("a", "end"), c("b", "end")));

        RunResult result = scheduler(diagram).run(Map.of());

        assertEquals(RunStatus.SUCCEEDED, result.getStatus());
        assertEquals(1, result.executionCount("end"));
        Map<String, Envelope> received = result.outputsOf("end");
        assertEquals("a", received.get("default/a").getBody());
        assertEquals("b", received.get("default/b").getBody());
    }

    @Test
    void run_conditionLoopRunsParticipantMaxIterationTimesThenExits() {
        registerCountingPersonJob();
        ExecutableDiagram diagram = conditionLoop(Map.of("condition_type", "detect_max_iterations"), 3);

        RunResult result = scheduler(diagram).run(Map.of());

        assertEquals(RunStatus.SUCCEEDED, result.getStatus());
        assertEquals(3, result.executionCount("pj"));
        assertEquals(3, result.executionCount("cond"));
        assertEquals(1, result.executionCount("end"));
        assertEquals(2, result.getFinalEpoch());
        assertEquals("draft-3", result.outputsOf("end").get(Ports.DEFAULT).getBody());
        assertEquals(2, eventTypes().stream().filter(t -> t == ExecutionEventType.EPOCH_BEGAN).count());
    }

    @Test
    void run_loopStopsAtConfiguredIterationCap() {
        registerCountingPersonJob();
        ExecutableDiagram diagram = conditionLoop(Map.of("condition_type", "boolean", "expression", false), 10);
        EngineConfig config = EngineConfig.builder().maxLoopIterations(1).build();

        RunResult result = scheduler(diagram, config, "capped").run(Map.of());

        assertEquals(RunStatus.SUCCEEDED, result.getStatus());
        assertEquals(2, result.executionCount("pj"));
        assertEquals(1, result.getFinalEpoch());
        assertEquals(NodeStatus.SKIPPED, result.statusOf("end"));
        assertTrue(eventTypes().contains(ExecutionEventType.NODE_SKIPPED));
    }

    @Test
    void run_loopThatNeverExitsStopsWhenParticipantsAreExhausted() {
        registerCountingPersonJob();
        ExecutableDiagram diagram = conditionLoop(Map.of("condition_type", "boolean", "expression", false), 3);

        RunResult result = scheduler(diagram).run(Map.of());

        assertEquals(RunStatus.SUCCEEDED, result.getStatus());
        assertEquals(3, result.executionCount("pj"));
        assertEquals(3, result.executionCount("cond"));
        assertEquals(2, result.getFinalEpoch());
        assertEquals(NodeStatus.SKIPPED, result.statusOf("end"));
    }

    @Test
    void run_failureRoutesErrorEnvelopeToErrorPort() {
        handlers.register(NodeType.DB, (inputs, node, ctx) -> HandlerResult.failure("connection refused"));
        ExecutableDiagram diagram = compile(
                List.of(NodeDescription.of("start", "start"),
                        NodeDescription.of("a", "db"),
                        NodeDescription.of("handler", "endpoint"),
                        NodeDescription.of("end", "endpoint")),
                List.of(c("start", "a"), c("a", Ports.ERROR, "handler"), c("a", "end")));

        RunResult result = scheduler(diagram).run(Map.of());

        assertEquals(RunStatus.SUCCEEDED, result.getStatus());
        assertEquals(NodeStatus.FAILED, result.statusOf("a"));
        assertEquals(NodeStatus.SKIPPED, result.statusOf("end"));
        Envelope error = result.outputsOf("handler").get(Ports.DEFAULT);
        assertTrue(error.hasError());
        assertEquals("connection refused", error.getBody());
        assertEquals(1, result.getDiagnostics().size());
        assertEquals(DiagnosticPhase.EXECUTION, result.getDiagnostics().get(0).phase());
        assertEquals("a", result.getDiagnostics().get(0).nodeId());
    }

    @Test
    void run_unroutedHandlerExceptionFailsRun() {
        handlers.register(NodeType.DB, (inputs, node, ctx) -> {
            throw new IllegalStateException("boom");
        });
        ExecutableDiagram diagram = compile(
                List.of(NodeDescription.of("start", "start"),
                        NodeDescription.of("a", "db"),
                        NodeDescription.of("end", "endpoint")),
                List.of(c("start", "a"), c("a", "end")));

        RunResult result = scheduler(diagram).run(Map.of());

        assertEquals(RunStatus.FAILED, result.getStatus());
        assertEquals(NodeStatus.FAILED, result.statusOf("a"));
        assertEquals(NodeStatus.SKIPPED, result.statusOf("end"));
        assertTrue(result.getDiagnostics().get(0).message().contains("boom"));
    }

    @Test
    void run_missingHandlerFailsNode() {
        ExecutableDiagram diagram = compile(
                List.of(NodeDescription.of("start", "start"),
                        NodeDescription.of("a", "api_job"),
                        NodeDescription.of("end", "endpoint")),
                List.of(c("start", "a"), c("a", "end")));

        RunResult result = scheduler(diagram).run(Map.of());

        assertEquals(RunStatus.FAILED, result.getStatus());
        assertTrue(result.getDiagnostics().get(0).message().contains("No handler registered for node type api_job"));
    }

    @Test
    void run_branchFiringBothPortsFailsNode() {
        handlers.replace(NodeType.CONDITION, (inputs, node, ctx) -> HandlerResult.success(Map.of(
                Ports.CONDITION_TRUE, Envelope.of(true), Ports.CONDITION_FALSE, Envelope.of(false))));
        ExecutableDiagram diagram = compile(
                List.of(NodeDescription.of("start", "start"),
                        NodeDescription.of("d", "condition"),
                        NodeDescription.of("yes", "endpoint"),
                        NodeDescription.of("no", "endpoint")),
                List.of(c("start", "d"), c("d", Ports.CONDITION_TRUE, "yes"), c("d", Ports.CONDITION_FALSE, "no")));

        RunResult result = scheduler(diagram).run(Map.of());

        assertEquals(RunStatus.FAILED, result.getStatus());
        assertEquals(NodeStatus.FAILED, result.statusOf("d"));
        assertEquals(NodeStatus.SKIPPED, result.statusOf("yes"));
        assertEquals(NodeStatus.SKIPPED, result.statusOf("no"));
    }

    @Test
    void run_booleanConditionSelectsOneBranch() {
        ExecutableDiagram diagram = compile(
                List.of(NodeDescription.of("start", "start"),
                        NodeDescription.of("d", "condition", Map.of("expression", true)),
                        NodeDescription.of("yes", "endpoint"),
                        NodeDescription.of("no", "endpoint")),
                List.of(c("start", "d"), c("d", Ports.CONDITION_TRUE, "yes"), c("d", Ports.CONDITION_FALSE, "no")));
        EngineConfig config = EngineConfig.builder().terminateOnEndpoints(false).build();

        RunResult result = scheduler(diagram, config, "branch").run(Map.of());

        assertEquals(RunStatus.SUCCEEDED, result.getStatus());
        assertEquals(NodeStatus.COMPLETED, result.statusOf("yes"));
        assertEquals(NodeStatus.SKIPPED, result.statusOf("no"));
        assertEquals(Ports.CONDITION_TRUE,
                result.outputsOf("yes").get(Ports.DEFAULT).getMeta().get(Envelope.META_BRANCH));
    }

    @Test
    void run_concurrencyPolicyNeverOverAdmits() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        handlers.register(NodeType.DB, (inputs, node, ctx) -> HandlerResult.success(Envelope.of(node.getId())));
        handlers.register(NodeType.CODE_JOB, (inputs, node, ctx) -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(100);
            } finally {
                running.decrementAndGet();
            }
            return HandlerResult.success(Envelope.of("ok"));
        });
        List<NodeDescription> nodes = new ArrayList<>(List.of(NodeDescription.of("start", "start"),
                NodeDescription.of("work", "code_job")
                        .withPolicy(new PolicyDescription("any", null, "bounded", 2))));
        List<ConnectionDescription> connections = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            nodes.add(NodeDescription.of("src" + i, "db"));
            connections.add(c("start", "src" + i));
            connections.add(c("src" + i, "work"));
        }
        ExecutableDiagram diagram = compile(nodes, connections);

        RunResult result = scheduler(diagram).run(Map.of());

        assertEquals(RunStatus.SUCCEEDED, result.getStatus());
        assertTrue(result.executionCount("work") >= 1);
        assertTrue(peak.get() <= 2, "peak concurrency " + peak.get());
    }

    @Test
    void cancel_stopsDispatchAndFailsInFlightNodes() {
        handlers.register(NodeType.DB, (inputs, node, ctx) -> {
            Thread.sleep(10_000);
            return HandlerResult.success(Envelope.of("late"));
        });
        ExecutableDiagram diagram = compile(
                List.of(NodeDescription.of("start", "start"),
                        NodeDescription.of("slow", "db"),
                        NodeDescription.of("end", "endpoint")),
                List.of(c("start", "slow"), c("slow", "end")));
        Scheduler scheduler = scheduler(diagram);
        dispatcher.addListener(event -> {
            if (event.getType() == ExecutionEventType.NODE_STARTED && "slow".equals(event.getNodeId())) {
                scheduler.cancel();
            }
        });

        RunResult result = scheduler.run(Map.of());

        assertEquals(RunStatus.CANCELLED, result.getStatus());
        assertEquals(NodeStatus.FAILED, result.statusOf("slow"));
        assertEquals(NodeStatus.SKIPPED, result.statusOf("end"));
        assertTrue(scheduler.isCancelled());
    }

    @Test
    void nodeTimeout_fromNodeConfigFailsNode() {
        handlers.register(NodeType.DB, (inputs, node, ctx) -> {
            Thread.sleep(10_000);
            return HandlerResult.success(Envelope.of("late"));
        });
        ExecutableDiagram diagram = compile(
                List.of(NodeDescription.of("start", "start"),
                        NodeDescription.of("slow", "db", Map.of("timeout_seconds", 1)),
                        NodeDescription.of("end", "endpoint")),
                List.of(c("start", "slow"), c("slow", "end")));

        RunResult result = scheduler(diagram).run(Map.of());

        assertEquals(RunStatus.FAILED, result.getStatus());
        assertEquals(NodeStatus.FAILED, result.statusOf("slow"));
        assertTrue(result.getDiagnostics().get(0).message().contains("Timed out"));
    }

    @Test
    void nodeTimeout_fromEngineConfigAppliesToCodeJob() {
        handlers.register(NodeType.CODE_JOB, (inputs, node, ctx) -> {
            Thread.sleep(3_000);
            return HandlerResult.success(Envelope.of("late"));
        });
        ExecutableDiagram diagram = compile(
                List.of(NodeDescription.of("start", "start"),
                        NodeDescription.of("code", "code_job"),
                        NodeDescription.of("end", "endpoint")),
                List.of(c("start", "code"), c("code", "end")));
        EngineConfig config = EngineConfig.builder().nodeTimeout(Duration.ofSeconds(1)).build();

        RunResult result = scheduler(diagram, config, "engine-timeout").run(Map.of());

        assertEquals(RunStatus.FAILED, result.getStatus());
        assertEquals(NodeStatus.FAILED, result.statusOf("code"));
        assertEquals("Node code failed: Timed out after 1s", result.getDiagnostics().get(0).message());
    }

    @Test
    void runTimeout_endsRunAsTimedOut() {
        handlers.register(NodeType.DB, (inputs, node, ctx) -> {
            Thread.sleep(10_000);
            return HandlerResult.success(Envelope.of("late"));
        });
        ExecutableDiagram diagram = compile(
                List.of(NodeDescription.of("start", "start"),
                        NodeDescription.of("slow", "db"),
                        NodeDescription.of("end", "endpoint")),
                List.of(c("start", "slow"), c("slow", "end")));
        EngineConfig config = EngineConfig.builder().runTimeout(Duration.ofMillis(300)).build();

        RunResult result = scheduler(diagram, config, "timeout").run(Map.of());

        assertEquals(RunStatus.TIMED_OUT, result.getStatus());
        assertEquals(NodeStatus.FAILED, result.statusOf("slow"));
        assertEquals(ExecutionEventType.RUN_COMPLETED, events.get(events.size() - 1).getType());
        assertEquals("TIMED_OUT", events.get(events.size() - 1).getMessage());
    }

    @Test
    void run_secondCallIsRejected() {
        ExecutableDiagram diagram = compile(
                List.of(NodeDescription.of("start", "start"), NodeDescription.of("end", "endpoint")),
                List.of(c("start", "end")));
        Scheduler scheduler = scheduler(diagram);
        scheduler.run(Map.of());

        assertThrows(IllegalStateException.class, () -> scheduler.run(Map.of()));
        assertThrows(IllegalStateException.class, () -> scheduler.restore(scheduler.snapshot()));
    }

    @Test
    void snapshot_takenMidLoopResumesToSameOutcome() {
        registerCountingPersonJob();
        ExecutableDiagram diagram = conditionLoop(Map.of("condition_type", "detect_max_iterations"), 3);
        Scheduler first = scheduler(diagram);
        AtomicReference<RunSnapshot> captured = new AtomicReference<>();
        dispatcher.addListener(event -> {
            if (event.getType() == ExecutionEventType.NODE_COMPLETED && "cond".equals(event.getNodeId())
                    && event.getEpoch() == 0 && captured.get() == null) {
                captured.set(first.snapshot());
            }
        });
        first.run(Map.of("topic", "rivers"));
        assertNotNull(captured.get());

        RunSnapshot decoded = SnapshotCodec.decode(SnapshotCodec.encode(captured.get()));
        Scheduler resumed = scheduler(diagram, EngineConfig.DEFAULT, decoded.runId());
        resumed.restore(decoded);
        RunResult result = resumed.run(Map.of("topic", "rivers"));

        assertEquals("run-1", result.getRunId());
        assertEquals(RunStatus.SUCCEEDED, result.getStatus());
        assertEquals(1, result.executionCount("start"));
        assertEquals(3, result.executionCount("pj"));
        assertEquals(1, result.executionCount("end"));
        assertEquals(2, result.getFinalEpoch());
    }

    @Test
    void restore_redispatchesNodeThatWasRunningWhenSnapshotWasTaken() {
        AtomicInteger calls = new AtomicInteger();
        List<Integer> seenCounts = new CopyOnWriteArrayList<>();
        handlers.register(NodeType.DB, (inputs, node, ctx) -> {
            if (calls.incrementAndGet() == 1) {
                Thread.sleep(10_000);
            }
            seenCounts.add(ctx.getExecutionCount());
            return HandlerResult.success(Envelope.of("stored:" + inputs.get(Ports.DEFAULT).getBody()));
        });
        ExecutableDiagram diagram = compile(
                List.of(NodeDescription.of("start", "start"),
                        NodeDescription.of("work", "db"),
                        NodeDescription.of("end", "endpoint")),
                List.of(c("start", "work"), c("work", "end")));
        Scheduler first = scheduler(diagram);
        AtomicReference<RunSnapshot> captured = new AtomicReference<>();
        dispatcher.addListener(event -> {
            if (event.getType() == ExecutionEventType.NODE_STARTED && "work".equals(event.getNodeId())
                    && captured.get() == null) {
                captured.set(first.snapshot());
                first.cancel();
            }
        });
        assertEquals(RunStatus.CANCELLED, first.run(Map.of("topic", "rivers")).getStatus());
        assertEquals(1, captured.get().interrupted().size());

        RunSnapshot decoded = SnapshotCodec.decode(SnapshotCodec.encode(captured.get()));
        Scheduler resumed = scheduler(diagram, EngineConfig.DEFAULT, decoded.runId());
        resumed.restore(decoded);
        RunResult result = resumed.run(Map.of("topic", "rivers"));

        assertEquals(RunStatus.SUCCEEDED, result.getStatus());
        assertEquals(NodeStatus.COMPLETED, result.statusOf("work"));
        assertEquals(1, result.executionCount("work"));
        assertEquals(List.of(0), seenCounts);
        assertEquals(NodeStatus.COMPLETED, result.statusOf("end"));
        assertEquals("stored:{topic=rivers}", result.outputsOf("end").get(Ports.DEFAULT).getBody());
    }

    @Test
    void restore_rejectsInFlightNodeWithoutRecordedInputs() {
        handlers.register(NodeType.DB, (inputs, node, ctx) -> {
            Thread.sleep(10_000);
            return HandlerResult.success(Envelope.of("late"));
        });
        ExecutableDiagram diagram = compile(
                List.of(NodeDescription.of("start", "start"),
                        NodeDescription.of("work", "db"),
                        NodeDescription.of("end", "endpoint")),
                List.of(c("start", "work"), c("work", "end")));
        Scheduler first = scheduler(diagram);
        AtomicReference<RunSnapshot> captured = new AtomicReference<>();
        dispatcher.addListener(event -> {
            if (event.getType() == ExecutionEventType.NODE_STARTED && "work".equals(event.getNodeId())) {
                captured.set(first.snapshot());
                first.cancel();
            }
        });
        first.run(Map.of());
        RunSnapshot taken = captured.get();
        RunSnapshot withoutInputs = new RunSnapshot(taken.runId(), taken.tokens(), taken.nodes(),
                taken.loopIterations(), taken.diagnostics(), taken.unroutedFailure(), List.of());

        assertThrows(IllegalArgumentException.class, () -> scheduler(diagram).restore(withoutInputs));
    }
}
