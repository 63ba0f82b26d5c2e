package com.dflow.diagram.compile;

import com.dflow.diagram.compile.phase.AssemblyPhase;
import com.dflow.diagram.compile.phase.CompilerPhase;
import com.dflow.diagram.compile.phase.EdgeBuildingPhase;
import com.dflow.diagram.compile.phase.OptimizationPhase;
import com.dflow.diagram.compile.phase.ResolutionPhase;
import com.dflow.diagram.compile.phase.TransformationPhase;
import com.dflow.diagram.compile.phase.ValidationPhase;
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
import com.dflow.diagram.model.Node;
import com.dflow.diagram.rules.ConnectionRuleSet;
import com.dflow.diagram.rules.DataTransformRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a {@link DiagramDescription} into an {@link ExecutableDiagram} through six ordered phases:
 * validation, transformation, resolution, edge building, optimization, assembly.
 * <p>
 * {@link CompileMode#FAIL_FAST} stops after the first phase that records an error;
 * {@link CompileMode#COLLECT_ALL} runs every phase so tooling sees all diagnostics at once. In both modes
 * a diagram is only produced when no error was recorded. Instances are stateless and thread-safe.
 */
public final class DiagramCompiler {

    private static final Logger log = LoggerFactory.getLogger(DiagramCompiler.class);

    private final List<CompilerPhase> phases;

    public DiagramCompiler() {
        this(ConnectionRuleSet.defaults(), DataTransformRules.defaults(), NodeTransformRegistry.defaults());
    }

    public DiagramCompiler(ConnectionRuleSet connectionRules,
                           DataTransformRules transformRules,
                           NodeTransformRegistry nodeTransforms) {
        Objects.requireNonNull(connectionRules, "connectionRules");
        Objects.requireNonNull(transformRules, "transformRules");
        Objects.requireNonNull(nodeTransforms, "nodeTransforms");
        this.phases = List.of(
                new ValidationPhase(),
                new TransformationPhase(nodeTransforms),
                new ResolutionPhase(),
                new EdgeBuildingPhase(connectionRules, transformRules),
                new OptimizationPhase(),
                new AssemblyPhase());
    }

    /**
     * Compiles in fail-fast mode.
     *
     * @throws CompilationException listing every error when the diagram is invalid
     */
    public ExecutableDiagram compile(DiagramDescription description) {
        return compileWithDiagnostics(description).getDiagramOrThrow();
    }

    public CompilationResult compileWithDiagnostics(DiagramDescription description) {
        return compileWithDiagnostics(description, CompileMode.FAIL_FAST, null);
    }

    /**
     * @param mode      fail-fast or collect-all
     * @param stopAfter last phase to run; null runs through assembly
     */
    public CompilationResult compileWithDiagnostics(DiagramDescription description, CompileMode mode, DiagnosticPhase stopAfter) {
        Objects.requireNonNull(description, "description");
        if (stopAfter != null && !stopAfter.isCompilePhase()) {
            throw new IllegalArgumentException("stopAfter must be a compile phase, got: " + stopAfter);
        }
        CompileMode effectiveMode = mode != null ? mode : CompileMode.FAIL_FAST;
        if (log.isInfoEnabled()) {
            log.info("Compile start | diagramId={} | nodes={} | connections={} | mode={}",
                    description.getId(), description.getNodes().size(), description.getConnections().size(), effectiveMode);
        }
        CompilationContext context = new CompilationContext(description);
        for (CompilerPhase phase : phases) {
            runPhase(phase, context);
            if (effectiveMode == CompileMode.FAIL_FAST && context.hasErrors(phase.phase())) {
                if (log.isInfoEnabled()) {
                    log.info("Compile stopped | phase={} | errors={}", phase.phase(),
                            context.getDiagnostics().stream().filter(Diagnostic::isError).count());
                }
                break;
            }
            if (phase.phase() == stopAfter) {
                break;
            }
        }
        CompilationResult result = new CompilationResult(context.getResult(), context.getDiagnostics(), context.getMetadata());
        if (log.isInfoEnabled()) {
            log.info("Compile done | diagramId={} | valid={} | errors={} | warnings={}",
                    description.getId(), result.isValid(), result.errors().size(), result.warnings().size());
        }
        return result;
    }

    /**
     * Turns a compiled diagram back into a description, e.g. for editors. Nodes keep their normalized
     * config and carry their effective policies as explicit overrides; connections keep their ids, ports,
     * merged transforms, content types and skippable flags. Compiling the result yields an equal diagram.
     */
    public DiagramDescription decompile(ExecutableDiagram diagram) {
        Objects.requireNonNull(diagram, "diagram");
        List<NodeDescription> nodes = new ArrayList<>();
        for (Node node : diagram.getNodes()) {
            nodes.add(new NodeDescription(node.getId(), node.getType().toValue(), node.getLabel(), node.getConfig(),
                    extraPorts(node.getInputPorts(), node.getType().defaultInputPorts()),
                    extraPorts(node.getOutputPorts(), node.getType().defaultOutputPorts()),
                    policyOf(node)));
        }
        List<ConnectionDescription> connections = new ArrayList<>();
        for (ExecutableEdge edge : diagram.getEdges()) {
            connections.add(new ConnectionDescription(edge.getId(), edge.sourceNodeId(), edge.sourcePort(),
                    edge.targetNodeId(), edge.targetPort(), edge.isSkippable(), edge.getTransform(),
                    edge.getContentType()));
        }
        if (log.isDebugEnabled()) {
            log.debug("Decompiled | nodes={} | connections={}", nodes.size(), connections.size());
        }
        return new DiagramDescription(nodes, connections);
    }

    private static List<String> extraPorts(List<String> declared, List<String> defaults) {
        List<String> extra = new ArrayList<>(declared);
        extra.removeAll(defaults);
        return extra;
    }

    private static PolicyDescription policyOf(Node node) {
        JoinPolicy join = node.getJoinPolicy();
        ConcurrencyPolicy concurrency = node.getConcurrencyPolicy();
        return new PolicyDescription(join.getKind().name(),
                join.getKind() == JoinPolicy.Kind.K_OF_N ? join.getK() : null,
                concurrency.getKind().name(),
                concurrency.getKind() == ConcurrencyPolicy.Kind.BOUNDED ? concurrency.getMaxConcurrent() : null);
    }

    private static void runPhase(CompilerPhase phase, CompilationContext context) {
        if (log.isDebugEnabled()) {
            log.debug("Compile phase | phase={}", phase.phase());
        }
        try {
            phase.execute(context);
        } catch (RuntimeException e) {
            log.error("Compile phase failed unexpectedly | phase={}", phase.phase(), e);
            context.add(Diagnostic.error(phase.phase(), "Internal compiler error: " + e.getMessage()));
        }
    }
}
