package com.dflow.diagram.compile.resolve;

/**
 * Canonical (node id, port) pair, or the reason it could not be resolved.
 */
public record ResolvedEndpoint(String nodeId, String port, String error) {

    public static ResolvedEndpoint of(String nodeId, String port) {
        return new ResolvedEndpoint(nodeId, port, null);
    }

    public static ResolvedEndpoint failed(String error) {
        return new ResolvedEndpoint(null, null, error);
    }

    public boolean isResolved() {
        return error == null;
    }
}
