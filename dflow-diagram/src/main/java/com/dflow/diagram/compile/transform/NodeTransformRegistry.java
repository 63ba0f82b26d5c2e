package com.dflow.diagram.compile.transform;

import com.dflow.diagram.model.NodeType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Single responsibility: map a node type to its {@link NodeTransformDescriptor}.
 * The built-in table is assembled once, at class initialization; types without an entry use the
 * identity descriptor.
 */
public final class NodeTransformRegistry {

    public static final String MAX_ITERATION = "max_iteration";
    public static final String MAX_EXECUTIONS = "max_executions";
    public static final String MAX_CONCURRENT = "max_concurrent";
    public static final String TIMEOUT_SECONDS = "timeout_seconds";
    public static final String CONDITION_TYPE = "condition_type";

    /** Editor layout fields that carry no execution meaning. */
    private static final String[] LAYOUT_FIELDS = {"position", "flipped", "width", "height"};

    private static final NodeTransformRegistry DEFAULT = new NodeTransformRegistry(defaultDescriptors());

    private final Map<NodeType, NodeTransformDescriptor> descriptors;

    public NodeTransformRegistry(Map<NodeType, NodeTransformDescriptor> descriptors) {
        Map<NodeType, NodeTransformDescriptor> copy = new EnumMap<>(NodeType.class);
        copy.putAll(descriptors);
        this.descriptors = Collections.unmodifiableMap(copy);
    }

    public static NodeTransformRegistry defaults() {
        return DEFAULT;
    }

    public NodeTransformDescriptor descriptorFor(NodeType type) {
        if (type == null) return NodeTransformDescriptor.IDENTITY;
        return descriptors.getOrDefault(type, NodeTransformDescriptor.IDENTITY);
    }

    private static Map<NodeType, NodeTransformDescriptor> defaultDescriptors() {
        Map<NodeType, NodeTransformDescriptor> map = new EnumMap<>(NodeType.class);
        map.put(NodeType.START, base()
                .rename("triggerMode", "trigger_mode")
                .defaultValue("trigger_mode", "manual")
                .build());
        map.put(NodeType.PERSON_JOB, personJob().build());
        map.put(NodeType.PERSON_BATCH_JOB, personJob()
                .rename("batchInputKey", "batch_input_key")
                .defaultValue("batch_input_key", "items")
                .build());
        map.put(NodeType.CONDITION, base()
                .rename("conditionType", CONDITION_TYPE)
                .defaultValue(CONDITION_TYPE, "boolean")
                .build());
        map.put(NodeType.CODE_JOB, base()
                .rename("codeType", "language")
                .defaultValue("language", "python")
                .hook(coerceInt(TIMEOUT_SECONDS))
                .build());
        map.put(NodeType.API_JOB, base()
                .defaultValue("method", "GET")
                .hook(coerceInt(TIMEOUT_SECONDS))
                .build());
        map.put(NodeType.ENDPOINT, base()
                .rename("saveToFile", "save_to_file")
                .defaultValue("save_to_file", false)
                .build());
        map.put(NodeType.DB, base()
                .defaultValue("operation", "read")
                .build());
        map.put(NodeType.SUB_DIAGRAM, base()
                .rename("diagramName", "diagram_name")
                .rename("maxConcurrent", MAX_CONCURRENT)
                .defaultValue(MAX_CONCURRENT, 2)
                .hook(coerceInt(MAX_CONCURRENT))
                .build());
        map.put(NodeType.TEMPLATE_JOB, base()
                .defaultValue("engine", "internal")
                .build());
        map.put(NodeType.HOOK, base()
                .rename("hookType", "hook_type")
                .defaultValue("hook_type", "shell")
                .hook(coerceInt(TIMEOUT_SECONDS))
                .build());
        map.put(NodeType.USER_RESPONSE, base()
                .hook(coerceInt(TIMEOUT_SECONDS))
                .build());
        map.put(NodeType.JSON_SCHEMA_VALIDATOR, base()
                .rename("strictMode", "strict_mode")
                .defaultValue("strict_mode", false)
                .build());
        map.put(NodeType.INTEGRATED_API, base()
                .hook(coerceInt(TIMEOUT_SECONDS))
                .build());
        return map;
    }

    private static NodeTransformDescriptor.Builder base() {
        return NodeTransformDescriptor.builder().remove(LAYOUT_FIELDS);
    }

    private static NodeTransformDescriptor.Builder personJob() {
        return base()
                .rename("person", "person_id")
                .rename("maxIteration", MAX_ITERATION)
                .rename("defaultPrompt", "default_prompt")
                .rename("firstOnlyPrompt", "first_only_prompt")
                .defaultValue(MAX_ITERATION, 1)
                .hook(coerceInt(MAX_ITERATION));
    }

    /** Hook turning a numeric string into an Integer; rejects anything non-numeric. */
    static NodeTransformHook coerceInt(String field) {
        return config -> {
            Object value = config.get(field);
            if (value == null || value instanceof Integer) return;
            if (value instanceof Number n) {
                config.put(field, n.intValue());
                return;
            }
            try {
                config.put(field, Integer.parseInt(value.toString().trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(field + " must be an integer, got: " + value, e);
            }
        };
    }
}
