package com.dflow.diagram.rules;

import com.dflow.diagram.model.NodeType;

/**
 * One named predicate of the connection table. A rule returns false to forbid a pair; any rule
 * answering false rejects the connection.
 */
@FunctionalInterface
public interface ConnectionRule {

    boolean allows(NodeType sourceType, NodeType targetType);
}
