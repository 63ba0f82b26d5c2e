package com.dflow.diagram.rules;

import com.dflow.diagram.model.NodeType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Single responsibility: decide which node-type pairs may be linked.
 * <p>
 * Stateless and immutable. Rules are evaluated in registration order; the first rule answering false
 * names the rejection. {@link #withRule} returns a derived set, the built-in table is never mutated.
 */
public final class ConnectionRuleSet {

    public static final String RULE_NO_INPUT_TO_START = "no_input_to_start";
    public static final String RULE_NO_OUTPUT_FROM_ENDPOINT = "no_output_from_endpoint";
    public static final String RULE_OUTPUT_CAPABLE_TO_START = "output_capable_not_to_start";
    public static final String RULE_NO_UNKNOWN = "no_unknown_types";

    private static final ConnectionRuleSet DEFAULT = new ConnectionRuleSet(defaultRules());

    private final Map<String, ConnectionRule> rules;

    private ConnectionRuleSet(Map<String, ConnectionRule> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public static ConnectionRuleSet defaults() {
        return DEFAULT;
    }

    private static Map<String, ConnectionRule> defaultRules() {
        Map<String, ConnectionRule> rules = new LinkedHashMap<>();
        rules.put(RULE_NO_INPUT_TO_START, (source, target) -> target != NodeType.START);
        rules.put(RULE_NO_OUTPUT_FROM_ENDPOINT, (source, target) -> source != NodeType.ENDPOINT);
        rules.put(RULE_OUTPUT_CAPABLE_TO_START, (source, target) -> !(source.isOutputCapable() && target == NodeType.START));
        rules.put(RULE_NO_UNKNOWN, (source, target) -> source.role() != NodeType.Role.INVALID
                && target.role() != NodeType.Role.INVALID);
        return rules;
    }

    /**
     * Returns a new rule set with an extra rule appended.
     *
     * @throws IllegalArgumentException if a rule with that name already exists
     */
    public ConnectionRuleSet withRule(String name, ConnectionRule rule) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("rule name must be non-blank");
        }
        if (rules.containsKey(name)) {
            throw new IllegalArgumentException("Connection rule already registered: " + name);
        }
        Map<String, ConnectionRule> extended = new LinkedHashMap<>(rules);
        extended.put(name, rule);
        return new ConnectionRuleSet(extended);
    }

    public boolean canConnect(NodeType sourceType, NodeType targetType) {
        return rejectionReason(sourceType, targetType) == null;
    }

    /** Name of the first rule rejecting the pair, or null if the pair is allowed. */
    public String rejectionReason(NodeType sourceType, NodeType targetType) {
        NodeType source = sourceType != null ? sourceType : NodeType.UNKNOWN;
        NodeType target = targetType != null ? targetType : NodeType.UNKNOWN;
        for (Map.Entry<String, ConnectionRule> e : rules.entrySet()) {
            if (!e.getValue().allows(source, target)) {
                return e.getKey();
            }
        }
        return null;
    }

    /** Derived by testing {@link #canConnect} against every known node type. */
    public ConnectionConstraints connectionConstraints(NodeType nodeType) {
        Set<NodeType> receiveFrom = EnumSet.noneOf(NodeType.class);
        Set<NodeType> sendTo = EnumSet.noneOf(NodeType.class);
        for (NodeType other : NodeType.values()) {
            if (other == NodeType.UNKNOWN) continue;
            if (canConnect(other, nodeType)) receiveFrom.add(other);
            if (canConnect(nodeType, other)) sendTo.add(other);
        }
        return new ConnectionConstraints(nodeType, receiveFrom, sendTo);
    }

    public Set<String> ruleNames() {
        return rules.keySet();
    }
}
