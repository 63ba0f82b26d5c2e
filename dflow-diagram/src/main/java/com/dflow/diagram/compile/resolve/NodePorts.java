package com.dflow.diagram.compile.resolve;

import com.dflow.diagram.description.NodeDescription;
import com.dflow.diagram.model.NodeType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Declared ports of a raw node: type defaults followed by the ports the description adds.
 */
public final class NodePorts {

    private NodePorts() {
    }

    public static List<String> inputs(NodeDescription node) {
        return merge(NodeType.fromValue(node.getType()).defaultInputPorts(), node.getInputs());
    }

    public static List<String> outputs(NodeDescription node) {
        return merge(NodeType.fromValue(node.getType()).defaultOutputPorts(), node.getOutputs());
    }

    private static List<String> merge(List<String> defaults, List<String> extra) {
        Set<String> ports = new LinkedHashSet<>(defaults);
        for (String port : extra) {
            if (port != null && !port.isBlank()) ports.add(port.trim());
        }
        return new ArrayList<>(ports);
    }
}
