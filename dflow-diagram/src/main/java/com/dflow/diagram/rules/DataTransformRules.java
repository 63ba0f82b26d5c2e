package com.dflow.diagram.rules;

import com.dflow.diagram.model.Node;
import com.dflow.diagram.model.NodeType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single responsibility: compute the data-transform policy of an edge from type-pair defaults and the
 * connection's own override.
 */
public final class DataTransformRules {

    public static final String KEY_CONTENT_TYPE = "content_type";
    public static final String KEY_EXTRACT_TOOL_RESULTS = "extract_tool_results";

    private static final DataTransformRules DEFAULT = new DataTransformRules(defaultRules());

    private final List<TransformRule> rules;

    public DataTransformRules(Collection<TransformRule> rules) {
        List<TransformRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(TransformRule::priority));
        this.rules = List.copyOf(sorted);
    }

    public static DataTransformRules defaults() {
        return DEFAULT;
    }

    private static List<TransformRule> defaultRules() {
        List<TransformRule> rules = new ArrayList<>();
        rules.add(pairRule(NodeType.PERSON_JOB, NodeType.PERSON_JOB, TransformRule.PRIORITY_NORMAL,
                Map.of(KEY_CONTENT_TYPE, "conversation_state")));
        rules.add(pairRule(NodeType.CODE_JOB, null, TransformRule.PRIORITY_LOW,
                Map.of(KEY_CONTENT_TYPE, "object")));
        rules.add(pairRule(NodeType.API_JOB, null, TransformRule.PRIORITY_LOW,
                Map.of(KEY_CONTENT_TYPE, "object")));
        rules.add(new TransformRule() {
            @Override
            public boolean appliesTo(Node source, Node target) {
                Object tools = source.getConfig().get("tools");
                return source.getType() == NodeType.PERSON_JOB
                        && tools instanceof Collection<?> c && !c.isEmpty();
            }

            @Override
            public Map<String, Object> transform(Node source, Node target) {
                return Map.of(KEY_EXTRACT_TOOL_RESULTS, true);
            }

            @Override
            public int priority() {
                return PRIORITY_HIGH;
            }
        });
        return rules;
    }

    /** Rule for a source type and an optional target type (null matches any target). */
    public static TransformRule pairRule(NodeType sourceType, NodeType targetType, int priority, Map<String, Object> transform) {
        Map<String, Object> copy = Map.copyOf(transform);
        return new TransformRule() {
            @Override
            public boolean appliesTo(Node source, Node target) {
                return source.getType() == sourceType && (targetType == null || target.getType() == targetType);
            }

            @Override
            public Map<String, Object> transform(Node source, Node target) {
                return copy;
            }

            @Override
            public int priority() {
                return priority;
            }
        };
    }

    /** Merges every applicable rule, lowest priority first. */
    public Map<String, Object> typeBasedTransform(Node source, Node target) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (TransformRule rule : rules) {
            if (rule.appliesTo(source, target)) {
                result.putAll(rule.transform(source, target));
            }
        }
        return result;
    }

    /** Edge-specific entries override type-based ones key by key. */
    public static Map<String, Object> mergeTransforms(Map<String, Object> edgeSpecific, Map<String, Object> typeBased) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (typeBased != null) merged.putAll(typeBased);
        if (edgeSpecific != null) merged.putAll(edgeSpecific);
        return merged;
    }

    public Map<String, Object> transformFor(Node source, Node target, Map<String, Object> edgeSpecific) {
        return mergeTransforms(edgeSpecific, typeBasedTransform(source, target));
    }
}
