package com.dflow.engine.scheduler;

import com.dflow.diagram.model.ExecutableDiagram;
import com.dflow.diagram.model.LoopStructure;
import com.dflow.diagram.model.Node;
import com.dflow.engine.runtime.ExecutionRuntimeState;

import java.util.Objects;

/**
 * Decides whether a loop may take another loop-back. A loop is exhausted once every participant (body node
 * with a max execution count) reached its maximum; independently, each loop may take at most the
 * configured number of loop-backs per run.
 */
public final class LoopController {

    private final ExecutableDiagram diagram;
    private final ExecutionRuntimeState state;
    private final int maxLoopIterations;

    public LoopController(ExecutableDiagram diagram, ExecutionRuntimeState state, int maxLoopIterations) {
        this.diagram = Objects.requireNonNull(diagram, "diagram");
        this.state = Objects.requireNonNull(state, "state");
        if (maxLoopIterations <= 0) {
            throw new IllegalArgumentException("maxLoopIterations must be positive, got: " + maxLoopIterations);
        }
        this.maxLoopIterations = maxLoopIterations;
    }

    /** True when the loop has participants and each one ran its max execution count. */
    public boolean allParticipantsExhausted(LoopStructure loop) {
        if (loop.participantNodeIds().isEmpty()) return false;
        for (String id : loop.participantNodeIds()) {
            Node node = diagram.getNode(id);
            Integer max = node != null ? node.getMaxExecutions() : null;
            if (max != null && state.executionCount(id) < max) return false;
        }
        return true;
    }

    /** True when any loop containing the node is exhausted. */
    public boolean isLoopExhausted(String nodeId) {
        for (LoopStructure loop : diagram.loopsContaining(nodeId)) {
            if (allParticipantsExhausted(loop)) return true;
        }
        return false;
    }

    public boolean canAdvance(LoopStructure loop) {
        return !allParticipantsExhausted(loop) && state.loopIterations(loop.loopBackEdgeId()) < maxLoopIterations;
    }

    /** Counts one loop-back for the loop. Returns the loop's iteration count. */
    public int recordAdvance(LoopStructure loop) {
        return state.incrementLoopIterations(loop.loopBackEdgeId());
    }
}
