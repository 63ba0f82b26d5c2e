package com.dflow.diagram.rules;

import com.dflow.diagram.model.Node;

import java.util.Map;

/**
 * Type-pair default data transform. Applicable rules are merged in ascending priority, so a higher
 * priority rule wins on conflicting keys.
 */
public interface TransformRule {

    int PRIORITY_LOW = 0;
    int PRIORITY_NORMAL = 50;
    int PRIORITY_HIGH = 100;

    boolean appliesTo(Node source, Node target);

    Map<String, Object> transform(Node source, Node target);

    default int priority() {
        return PRIORITY_NORMAL;
    }
}
