package com.dflow.diagram.model;

import java.util.Objects;

/**
 * Directed link from a node's output port to another node's input port. Value-equal on all four fields.
 */
public record Edge(String sourceNodeId, String sourcePort, String targetNodeId, String targetPort) {

    public Edge {
        Objects.requireNonNull(sourceNodeId, "sourceNodeId");
        Objects.requireNonNull(targetNodeId, "targetNodeId");
        sourcePort = Ports.orDefault(sourcePort);
        targetPort = Ports.orDefault(targetPort);
    }

    @Override
    public String toString() {
        return sourceNodeId + "." + sourcePort + "->" + targetNodeId + "." + targetPort;
    }
}
