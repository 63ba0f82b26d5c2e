package com.dflow.diagram.rules;

import com.dflow.diagram.model.NodeType;

import java.util.Set;

/**
 * Which node types a given type may receive from and send to, for editors and validators.
 */
public record ConnectionConstraints(NodeType nodeType, Set<NodeType> canReceiveFrom, Set<NodeType> canSendTo) {

    public ConnectionConstraints {
        canReceiveFrom = Set.copyOf(canReceiveFrom);
        canSendTo = Set.copyOf(canSendTo);
    }
}
