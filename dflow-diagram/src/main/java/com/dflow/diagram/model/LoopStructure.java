package com.dflow.diagram.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Set;

/**
 * One loop recognized by Optimization: the loop-back edge, its entry (edge target) and latch (edge source),
 * the body nodes on base-DAG paths from entry to latch, and the body nodes that declare a max execution count.
 */
public record LoopStructure(String loopBackEdgeId, String entryNodeId, String latchNodeId,
                            Set<String> bodyNodeIds, List<String> participantNodeIds) {

    public LoopStructure {
        bodyNodeIds = bodyNodeIds != null ? Set.copyOf(bodyNodeIds) : Set.of();
        participantNodeIds = participantNodeIds != null ? List.copyOf(participantNodeIds) : List.of();
    }

    public boolean contains(String nodeId) {
        return bodyNodeIds.contains(nodeId);
    }

    @JsonIgnore
    public boolean isBounded() {
        return !participantNodeIds.isEmpty();
    }
}
