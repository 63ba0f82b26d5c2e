package com.dflow.engine.token;

import java.util.List;
import java.util.Map;

/**
 * Serializable copy of a {@link TokenManager}: the epoch counter, every published token, every consumption
 * cursor and every branch decision.
 */
public record TokenManagerSnapshot(int currentEpoch,
                                   List<Token> tokens,
                                   List<CursorEntry> cursors,
                                   List<BranchEntry> branchDecisions,
                                   Map<String, String> latestBranchDecisions) {

    public TokenManagerSnapshot {
        tokens = tokens != null ? List.copyOf(tokens) : List.of();
        cursors = cursors != null ? List.copyOf(cursors) : List.of();
        branchDecisions = branchDecisions != null ? List.copyOf(branchDecisions) : List.of();
        latestBranchDecisions = latestBranchDecisions != null ? Map.copyOf(latestBranchDecisions) : Map.of();
    }

    /** Highest sequence consumed by a node on an edge in an epoch. */
    public record CursorEntry(String nodeId, String edgeId, int epoch, int sequence) {
    }

    public record BranchEntry(String nodeId, int epoch, String port) {
    }
}
