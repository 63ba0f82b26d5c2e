package com.dflow.diagram.compile.resolve;

import com.dflow.diagram.description.NodeDescription;
import com.dflow.diagram.model.Ports;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves a connection endpoint reference to a canonical (node id, port). A reference is tried as a node
 * id, then as a unique label, then, when no explicit port is given, as a {@code <node>_<port>} handle
 * split at each underscore from the right.
 */
public final class EndpointResolver {

    /** Sentinel returned by lookup when a label names several nodes. */
    private static final NodeDescription LOOKUP_AMBIGUOUS = NodeDescription.of("", "");

    private final Map<String, NodeDescription> byId = new LinkedHashMap<>();
    private final Map<String, List<NodeDescription>> byLabel = new HashMap<>();

    public EndpointResolver(List<NodeDescription> nodes) {
        for (NodeDescription node : nodes) {
            if (node == null || node.getId() == null || node.getId().isBlank()) continue;
            byId.putIfAbsent(node.getId(), node);
            if (node.getLabel() != null && !node.getLabel().isBlank()) {
                byLabel.computeIfAbsent(node.getLabel(), k -> new ArrayList<>()).add(node);
            }
        }
    }

    public ResolvedEndpoint resolveSource(String reference, String port) {
        return resolve(reference, port, true);
    }

    public ResolvedEndpoint resolveTarget(String reference, String port) {
        return resolve(reference, port, false);
    }

    private ResolvedEndpoint resolve(String reference, String port, boolean output) {
        if (reference == null || reference.isBlank()) {
            return ResolvedEndpoint.failed("connection endpoint is blank");
        }
        String ref = reference.trim();
        boolean explicitPort = port != null && !port.isBlank();
        NodeDescription node = lookup(ref);
        if (node == LOOKUP_AMBIGUOUS) {
            return ResolvedEndpoint.failed("label '" + ref + "' matches more than one node");
        }
        if (node != null) {
            return checkPort(node, Ports.orDefault(port), output);
        }
        if (!explicitPort) {
            for (int i = ref.lastIndexOf('_'); i > 0; i = ref.lastIndexOf('_', i - 1)) {
                NodeDescription candidate = lookup(ref.substring(0, i));
                String handlePort = ref.substring(i + 1);
                if (candidate != null && candidate != LOOKUP_AMBIGUOUS && !handlePort.isEmpty()) {
                    return checkPort(candidate, handlePort, output);
                }
            }
        }
        return ResolvedEndpoint.failed("unknown node '" + ref + "'");
    }

    private NodeDescription lookup(String ref) {
        NodeDescription node = byId.get(ref);
        if (node != null) return node;
        List<NodeDescription> labelled = byLabel.get(ref);
        if (labelled == null || labelled.isEmpty()) return null;
        return labelled.size() == 1 ? labelled.get(0) : LOOKUP_AMBIGUOUS;
    }

    private static ResolvedEndpoint checkPort(NodeDescription node, String port, boolean output) {
        List<String> declared = output ? NodePorts.outputs(node) : NodePorts.inputs(node);
        if (!declared.contains(port)) {
            return ResolvedEndpoint.failed("node '" + node.getId() + "' has no " + (output ? "output" : "input")
                    + " port '" + port + "' (declared: " + declared + ")");
        }
        return ResolvedEndpoint.of(node.getId(), port);
    }
}
