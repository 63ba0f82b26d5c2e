package com.dflow.diagram.compile;

import com.dflow.diagram.DiagramConfig;
import com.dflow.diagram.compile.transform.NodeTransformDescriptor;
import com.dflow.diagram.compile.transform.NodeTransformRegistry;
import com.dflow.diagram.description.ConnectionDescription;
import com.dflow.diagram.description.DiagramDescription;
import com.dflow.diagram.description.NodeDescription;
import com.dflow.diagram.description.PolicyDescription;
import com.dflow.diagram.diagnostic.Diagnostic;
import com.dflow.diagram.diagnostic.DiagnosticPhase;
import com.dflow.diagram.model.ConcurrencyPolicy;
import com.dflow.diagram.model.ExecutableDiagram;
import com.dflow.diagram.model.ExecutableEdge;
import com.dflow.diagram.model.JoinPolicy;
import com.dflow.diagram.model.LoopStructure;
import com.dflow.diagram.model.Node;
import com.dflow.diagram.model.NodeType;
import com.dflow.diagram.model.Ports;
import com.dflow.diagram.rules.ConnectionRuleSet;
import com.dflow.diagram.rules.DataTransformRules;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiagramCompilerTest {

    private final DiagramCompiler compiler = new DiagramCompiler();

    private static NodeDescription n(String id, String type) {
        return NodeDescription.of(id, type);
    }

    private static ConnectionDescription c(String source, String target) {
        return ConnectionDescription.of(source, target);
    }

    private static ConnectionDescription c(String source, String sourcePort, String target, String targetPort) {
        return ConnectionDescription.of(source, sourcePort, target, targetPort);
    }

    private static DiagramDescription diagram(List<NodeDescription> nodes, List<ConnectionDescription> connections) {
        return new DiagramDescription(nodes, connections);
    }

    /** start -> pj -> cond; cond.condfalse -> pj (loop); cond.condtrue -> end */
    private static DiagramDescription conditionLoop() {
        return diagram(
                List.of(n("start", "start"),
                        NodeDescription.of("pj", "person_job", Map.of("max_iteration", 3)),
                        NodeDescription.of("cond", "condition", Map.of("condition_type", "detect_max_iterations")),
                        n("end", "endpoint")),
                List.of(c("start", "pj"),
                        c("pj", "cond"),
                        c("cond", Ports.CONDITION_FALSE, "pj", null),
                        c("cond", Ports.CONDITION_TRUE, "end", null)));
    }

    @Test
    void compile_startToEnd() {
        ExecutableDiagram compiled = compiler.compile(diagram(
                List.of(n("start", "start"), n("end", "endpoint")),
                List.of(c("start", "end"))));

        assertEquals(2, compiled.getNodes().size());
        assertEquals(List.of("start", "end"), compiled.getTopologicalOrder());
        assertEquals(List.of("start"), compiled.getStartNodeIds());
        assertEquals(List.of("end"), compiled.endpointNodeIds());
        assertEquals(1, compiled.getEdges().size());
        ExecutableEdge edge = compiled.getEdges().get(0);
        assertEquals("edge_0", edge.getId());
        assertEquals(Ports.DEFAULT, edge.sourcePort());
        assertEquals(Ports.DEFAULT, edge.targetPort());
        assertFalse(edge.isLoopBack());
        assertEquals(JoinPolicy.ALL, compiled.getNode("end").getJoinPolicy());
        assertEquals(ConcurrencyPolicy.SINGLETON, compiled.getNode("end").getConcurrencyPolicy());
        assertTrue(compiled.warnings().isEmpty());
    }

    @Test
    void compile_twoStartNodesFailsInValidation() {
        DiagramDescription twoStarts = diagram(
                List.of(n("s1", "start"), n("s2", "start"), n("end", "endpoint")),
                List.of(c("s1", "end"), c("s2", "end")));

        CompilationException e = assertThrows(CompilationException.class, () -> compiler.compile(twoStarts));
        assertTrue(e.getMessage().startsWith("Compilation failed:"));
        assertTrue(e.getMessage().contains("VALIDATION: Diagram must have exactly one START node, found 2"));

        CompilationResult result = compiler.compileWithDiagnostics(twoStarts);
        assertNull(result.getDiagram());
        assertFalse(result.isValid());
        assertEquals(1, result.errors().size());
        assertEquals(DiagnosticPhase.VALIDATION, result.errors().get(0).phase());
    }

    @Test
    void compile_emptyDiagramIsRejected() {
        CompilationResult result = compiler.compileWithDiagnostics(diagram(List.of(), List.of()));
        assertFalse(result.isValid());
        assertEquals("Diagram must contain at least one node", result.errors().get(0).message());
    }

    @Test
    void compile_reportsDuplicateIdsAndUnknownTypes() {
        CompilationResult result = compiler.compileWithDiagnostics(diagram(
                List.of(n("start", "start"), n("x", "code_job"), n("x", "code_job"), n("y", "teleporter")),
                List.of()));

        List<String> messages = result.errors().stream().map(Diagnostic::message).toList();
        assertTrue(messages.contains("Duplicate node id: x"));
        assertTrue(messages.contains("Invalid node type 'teleporter' for node y"));
        assertEquals("y", result.errors().stream().filter(d -> d.message().contains("teleporter"))
                .findFirst().orElseThrow().nodeId());
    }

    @Test
    void compile_reportsUnknownNodeAndPortReferences() {
        CompilationResult result = compiler.compileWithDiagnostics(diagram(
                List.of(n("start", "start"), n("end", "endpoint")),
                List.of(c("start", "nowhere"), c("start", "bogus", "end", null).withId("c2"))));

        assertEquals(2, result.errors().size());
        assertTrue(result.errors().get(0).message().contains("unknown node 'nowhere'"));
        assertTrue(result.errors().get(1).message().contains("no output port 'bogus'"));
        assertEquals("c2", result.errors().get(1).edgeId());
    }

    @Test
    void compile_missingEndpointIsOnlyAWarning() {
        CompilationResult result = compiler.compileWithDiagnostics(diagram(
                List.of(n("start", "start"), n("job", "code_job")),
                List.of(c("start", "job"))));

        assertTrue(result.isValid());
        assertTrue(result.warnings().stream().anyMatch(d -> d.message().contains("no ENDPOINT")));
    }

    @Test
    void compile_resolvesLabelsAndHandles() {
        ExecutableDiagram compiled = compiler.compile(diagram(
                List.of(n("n0", "start").withLabel("Begin"),
                        n("n1", "condition").withLabel("Check"),
                        n("n2", "endpoint").withLabel("Yes"),
                        n("n3", "endpoint").withLabel("No")),
                List.of(c("Begin", "Check"),
                        c("Check_condtrue", "Yes"),
                        c("Check_condfalse", "No"))));

        ExecutableEdge yes = compiled.getEdges().get(1);
        assertEquals("n1", yes.sourceNodeId());
        assertEquals(Ports.CONDITION_TRUE, yes.sourcePort());
        assertEquals("n2", yes.targetNodeId());
        assertEquals(List.of("n2"), compiled.outgoingEdges("n1", Ports.CONDITION_TRUE).stream()
                .map(ExecutableEdge::targetNodeId).toList());
    }

    @Test
    void compile_ambiguousLabelIsAnError() {
        CompilationResult result = compiler.compileWithDiagnostics(diagram(
                List.of(n("start", "start"), n("a", "endpoint").withLabel("Out"), n("b", "endpoint").withLabel("Out")),
                List.of(c("start", "Out"))));
        assertTrue(result.errors().get(0).message().contains("matches more than one node"));
    }

    @Test
    void compile_connectionRuleRejectionIsEdgeBuildingError() {
        DiagramCompiler strict = new DiagramCompiler(
                ConnectionRuleSet.defaults().withRule("no_code_to_endpoint",
                        (s, t) -> !(s == NodeType.CODE_JOB && t == NodeType.ENDPOINT)),
                DataTransformRules.defaults(), NodeTransformRegistry.defaults());

        CompilationResult result = strict.compileWithDiagnostics(diagram(
                List.of(n("start", "start"), n("job", "code_job"), n("end", "endpoint")),
                List.of(c("start", "job"), c("job", "end").withId("bad"))));

        assertFalse(result.isValid());
        Diagnostic error = result.errors().get(0);
        assertEquals(DiagnosticPhase.EDGE_BUILDING, error.phase());
        assertEquals("bad", error.edgeId());
        assertTrue(error.message().contains("no_code_to_endpoint"));
    }

    @Test
    void compile_duplicateConnectionIsCollapsedWithWarning() {
        CompilationResult result = compiler.compileWithDiagnostics(diagram(
                List.of(n("start", "start"), n("end", "endpoint")),
                List.of(c("start", "end"), c("start", "end"))));

        assertTrue(result.isValid());
        assertEquals(1, result.getDiagram().getEdges().size());
        assertEquals(DiagnosticPhase.EDGE_BUILDING, result.warnings().get(0).phase());
    }

    @Test
    void compile_classifiesConditionLoop() {
        ExecutableDiagram compiled = compiler.compile(conditionLoop());

        assertEquals(List.of("start", "pj", "cond", "end"), compiled.getTopologicalOrder());
        ExecutableEdge back = compiled.getEdges().get(2);
        assertTrue(back.isLoopBack());
        assertTrue(back.isLoopScoped());
        assertTrue(compiled.getEdges().get(1).isLoopScoped());
        assertFalse(compiled.getEdges().get(0).isLoopScoped());
        assertFalse(compiled.getEdges().get(3).isLoopBack());

        assertEquals(1, compiled.getLoops().size());
        LoopStructure loop = compiled.getLoops().get(0);
        assertEquals("pj", loop.entryNodeId());
        assertEquals("cond", loop.latchNodeId());
        assertEquals(java.util.Set.of("pj", "cond"), loop.bodyNodeIds());
        assertEquals(List.of("pj"), loop.participantNodeIds());

        assertEquals(JoinPolicy.ANY, compiled.getNode("pj").getJoinPolicy());
        assertEquals(JoinPolicy.ALL, compiled.getNode("end").getJoinPolicy());
        assertEquals(3, compiled.getNode("pj").getMaxExecutions());
    }

    @Test
    void compile_cycleWithoutConditionOrBoundIsRejected() {
        CompilationResult result = compiler.compileWithDiagnostics(diagram(
                List.of(n("start", "start"), n("a", "code_job"), n("b", "code_job"), n("end", "endpoint")),
                List.of(c("start", "a"), c("a", "b"), c("b", "a").withId("back"), c("b", "end"))));

        assertFalse(result.isValid());
        Diagnostic error = result.errors().get(0);
        assertEquals(DiagnosticPhase.OPTIMIZATION, error.phase());
        assertTrue(error.message().startsWith("Unrecognized cycle"));
        assertEquals("back", error.edgeId());
        assertNotNull(error.suggestion());
    }

    @Test
    void compile_boundedCycleWithoutConditionIsAccepted() {
        ExecutableDiagram compiled = compiler.compile(diagram(
                List.of(n("start", "start"),
                        NodeDescription.of("a", "code_job", Map.of("max_executions", 2)),
                        n("b", "code_job"),
                        n("end", "endpoint")),
                List.of(c("start", "a"), c("a", "b"), c("b", "a"), c("b", "end"))));
        assertEquals(List.of("a"), compiled.getLoops().get(0).participantNodeIds());
    }

    @Test
    void compile_conditionLoopWithoutBoundWarns() {
        CompilationResult result = compiler.compileWithDiagnostics(diagram(
                List.of(n("start", "start"), n("a", "code_job"), n("cond", "condition"), n("end", "endpoint")),
                List.of(c("start", "a"), c("a", "cond"),
                        c("cond", Ports.CONDITION_FALSE, "a", null),
                        c("cond", Ports.CONDITION_TRUE, "end", null))));

        assertTrue(result.isValid());
        assertTrue(result.warnings().stream().anyMatch(d -> d.message().contains("no node with an execution bound")));
    }

    @Test
    void compile_warnsAboutUnreachableNodes() {
        CompilationResult result = compiler.compileWithDiagnostics(diagram(
                List.of(n("start", "start"), n("end", "endpoint"), n("orphan", "code_job")),
                List.of(c("start", "end"))));

        assertTrue(result.isValid());
        Diagnostic warning = result.warnings().stream()
                .filter(d -> d.phase() == DiagnosticPhase.OPTIMIZATION).findFirst().orElseThrow();
        assertEquals("orphan", warning.nodeId());
    }

    @Test
    void compile_warnsAboutConditionMissingABranch() {
        CompilationResult result = compiler.compileWithDiagnostics(diagram(
                List.of(n("start", "start"), n("cond", "condition"), n("end", "endpoint")),
                List.of(c("start", "cond"), c("cond", Ports.CONDITION_TRUE, "end", null))));
        assertTrue(result.warnings().stream().anyMatch(d -> "cond".equals(d.nodeId())
                && d.phase() == DiagnosticPhase.VALIDATION));
    }

    @Test
    void compile_transformsConfigPerType() {
        ExecutableDiagram compiled = compiler.compile(diagram(
                List.of(n("start", "start"),
                        NodeDescription.of("pj", "person_job", Map.of("person", "alice", "maxIteration", "4",
                                "position", Map.of("x", 1, "y", 2))),
                        NodeDescription.of("code", "code_job", Map.of("codeType", "bash")),
                        n("end", "endpoint")),
                List.of(c("start", "pj"), c("pj", "code"), c("code", "end"))));

        Node pj = compiled.getNode("pj");
        assertEquals("alice", pj.getConfig().get("person_id"));
        assertEquals(4, pj.getConfig().get("max_iteration"));
        assertFalse(pj.getConfig().containsKey("position"));
        assertEquals(4, pj.getMaxExecutions());
        assertTrue(pj.hasInputPort(Ports.FIRST));

        Node code = compiled.getNode("code");
        assertEquals("bash", code.getConfig().get("language"));
        assertFalse(code.getConfig().containsKey("timeout_seconds"));
        assertNull(code.getMaxExecutions());
        assertEquals("object", compiled.getEdges().get(2).getContentType());
    }

    @Test
    void compile_invalidIterationBoundIsTransformationError() {
        CompilationResult result = compiler.compileWithDiagnostics(diagram(
                List.of(n("start", "start"), NodeDescription.of("pj", "person_job", Map.of("max_iteration", "lots"))),
                List.of(c("start", "pj"))));
        assertEquals(DiagnosticPhase.TRANSFORMATION, result.errors().get(0).phase());
        assertEquals("pj", result.errors().get(0).nodeId());
    }

    @Test
    void compile_appliesExplicitPolicies() {
        ExecutableDiagram compiled = compiler.compile(diagram(
                List.of(n("start", "start"), n("a", "code_job"), n("b", "code_job"),
                        n("join", "code_job").withPolicy(new PolicyDescription("K_OF_N", 1, "BOUNDED", 3)),
                        n("end", "endpoint")),
                List.of(c("start", "a"), c("start", "b"), c("a", "join"), c("b", "join"), c("join", "end"))));

        Node join = compiled.getNode("join");
        assertEquals(JoinPolicy.kOfN(1), join.getJoinPolicy());
        assertEquals(ConcurrencyPolicy.bounded(3), join.getConcurrencyPolicy());
    }

    @Test
    void compile_kOfNAboveFanInIsAssemblyError() {
        CompilationResult result = compiler.compileWithDiagnostics(diagram(
                List.of(n("start", "start"), n("end", "endpoint").withPolicy(PolicyDescription.kOfN(2))),
                List.of(c("start", "end"))));
        assertEquals(DiagnosticPhase.ASSEMBLY, result.errors().get(0).phase());
    }

    @Test
    void compile_unknownPolicyNameIsTransformationError() {
        CompilationResult result = compiler.compileWithDiagnostics(diagram(
                List.of(n("start", "start"), n("end", "endpoint").withPolicy(PolicyDescription.join("MOST"))),
                List.of(c("start", "end"))));
        assertEquals(DiagnosticPhase.TRANSFORMATION, result.errors().get(0).phase());
        assertTrue(result.errors().get(0).message().contains("unknown join policy 'MOST'"));
    }

    @Test
    void compile_defaultJoinDependsOnBranching() {
        ExecutableDiagram plainFanIn = compiler.compile(diagram(
                List.of(n("start", "start"), n("a", "code_job"), n("b", "code_job"), n("end", "endpoint")),
                List.of(c("start", "a"), c("start", "b"), c("a", "end"), c("b", "end"))));
        assertEquals(JoinPolicy.ALL, plainFanIn.getNode("end").getJoinPolicy());

        ExecutableDiagram branchFanIn = compiler.compile(diagram(
                List.of(n("start", "start"), n("cond", "condition"), n("a", "code_job"), n("b", "code_job"),
                        n("end", "endpoint")),
                List.of(c("start", "cond"),
                        c("cond", Ports.CONDITION_TRUE, "a", null),
                        c("cond", Ports.CONDITION_FALSE, "b", null),
                        c("a", "end"), c("b", "end"))));
        assertEquals(JoinPolicy.ANY, branchFanIn.getNode("end").getJoinPolicy());
        assertEquals(JoinPolicy.ALL, branchFanIn.getNode("a").getJoinPolicy());
    }

    @Test
    void compile_defaultConcurrencyDependsOnType() {
        ExecutableDiagram compiled = compiler.compile(diagram(
                List.of(n("start", "start"), n("batch", "person_batch_job"), n("sub", "sub_diagram"), n("end", "endpoint")),
                List.of(c("start", "batch"), c("batch", "sub"), c("sub", "end"))));
        assertEquals(ConcurrencyPolicy.PER_TOKEN, compiled.getNode("batch").getConcurrencyPolicy());
        assertEquals(ConcurrencyPolicy.bounded(2), compiled.getNode("sub").getConcurrencyPolicy());
    }

    @Test
    void compile_recordsMetadata() {
        CompilationResult result = compiler.compileWithDiagnostics(conditionLoop());
        assertEquals(List.of("start"), result.getMetadata().get("start_nodes"));
        @SuppressWarnings("unchecked")
        Map<String, List<String>> deps = (Map<String, List<String>>) result.getMetadata().get("node_dependencies");
        assertEquals(List.of("start"), deps.get("pj"));
        assertEquals(List.of("cond"), deps.get("end"));
        assertEquals(1, result.getMetadata().get("loop_count"));
    }

    @Test
    void compile_isDeterministic() {
        ExecutableDiagram first = compiler.compile(conditionLoop());
        ExecutableDiagram second = compiler.compile(conditionLoop());
        assertEquals(first, second);

        DiagramDescription reparsed = DiagramConfig.fromJson(DiagramConfig.toJson(conditionLoop()));
        assertEquals(first, compiler.compile(reparsed));
    }

    @Test
    void compileWithDiagnostics_collectAllRunsEveryPhase() {
        DiagramDescription broken = diagram(
                List.of(n("s1", "start"), n("s2", "start"),
                        NodeDescription.of("pj", "person_job", Map.of("max_iteration", 0)),
                        n("end", "endpoint")),
                List.of(c("s1", "pj"), c("pj", "end")));

        CompilationResult failFast = compiler.compileWithDiagnostics(broken);
        assertTrue(failFast.errors().stream().allMatch(d -> d.phase() == DiagnosticPhase.VALIDATION));

        CompilationResult all = compiler.compileWithDiagnostics(broken, CompileMode.COLLECT_ALL, null);
        assertNull(all.getDiagram());
        assertTrue(all.errors().stream().anyMatch(d -> d.phase() == DiagnosticPhase.VALIDATION));
        assertTrue(all.errors().stream().anyMatch(d -> d.phase() == DiagnosticPhase.TRANSFORMATION));
    }

    @Test
    void compileWithDiagnostics_stopAfterLimitsPhases() {
        CompilationResult result = compiler.compileWithDiagnostics(conditionLoop(), CompileMode.FAIL_FAST,
                DiagnosticPhase.RESOLUTION);
        assertNull(result.getDiagram());
        assertTrue(result.errors().isEmpty());
        assertFalse(result.getMetadata().containsKey("start_nodes"));

        assertThrows(IllegalArgumentException.class,
                () -> compiler.compileWithDiagnostics(conditionLoop(), CompileMode.FAIL_FAST, DiagnosticPhase.EXECUTION));
    }

    @Test
    void decompile_recompilesToEqualDiagram() {
        ExecutableDiagram compiled = compiler.compile(diagram(
                List.of(n("start", "start").withLabel("Begin"),
                        NodeDescription.of("pj", "person_job", Map.of("person", "alice", "max_iteration", 2)),
                        NodeDescription.of("cond", "condition", Map.of("condition_type", "detect_max_iterations")),
                        n("side", "code_job").withPorts(List.of("extra"), List.of())
                                .withPolicy(new PolicyDescription("ANY", null, "BOUNDED", 3)),
                        n("end", "endpoint")),
                List.of(c("start", "pj").withId("go"),
                        c("pj", "cond"),
                        c("cond", Ports.CONDITION_FALSE, "pj", null),
                        c("cond", Ports.CONDITION_TRUE, "end", null),
                        c("start", Ports.DEFAULT, "side", "extra").asSkippable().withTransform(Map.of("rule", "strip")),
                        c("side", "end"))));

        DiagramDescription description = compiler.decompile(compiled);
        ExecutableDiagram recompiled = compiler.compile(description);

        assertEquals(compiled, recompiled);
        NodeDescription side = description.getNodes().stream().filter(d -> d.getId().equals("side")).findFirst().orElseThrow();
        assertEquals(List.of("extra"), side.getInputs());
        assertEquals("BOUNDED", side.getPolicy().concurrency());
        assertEquals(3, side.getPolicy().maxConcurrent());
        ConnectionDescription skippable = description.getConnections().stream()
                .filter(ConnectionDescription::isSkippable).findFirst().orElseThrow();
        assertEquals("extra", skippable.getTargetPort());
        assertEquals("strip", skippable.getTransform().get("rule"));
        assertEquals("Begin", description.getNodes().get(0).getLabel());
    }

    @Test
    void compile_unexpectedPhaseFailureBecomesInternalError() {
        NodeTransformRegistry exploding = new NodeTransformRegistry(Map.of(NodeType.CODE_JOB,
                NodeTransformDescriptor.builder().hook(config -> {
                    throw new IllegalStateException("boom");
                }).build()));
        DiagramCompiler fragile = new DiagramCompiler(ConnectionRuleSet.defaults(), DataTransformRules.defaults(), exploding);

        CompilationResult result = fragile.compileWithDiagnostics(diagram(
                List.of(n("start", "start"), n("job", "code_job")),
                List.of(c("start", "job"))));

        assertFalse(result.isValid());
        assertEquals("Internal compiler error: boom", result.errors().get(0).message());
        assertEquals(DiagnosticPhase.TRANSFORMATION, result.errors().get(0).phase());
    }
}
