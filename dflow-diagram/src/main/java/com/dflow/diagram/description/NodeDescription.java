package com.dflow.diagram.description;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Raw node as authored. {@code type} stays a string so Validation can report the unknown value;
 * {@code config} holds type-specific fields before the Transformation phase normalizes them.
 */
public final class NodeDescription {

    private final String id;
    private final String type;
    private final String label;
    private final Map<String, Object> config;
    private final List<String> inputs;
    private final List<String> outputs;
    private final PolicyDescription policy;

    @JsonCreator
    public NodeDescription(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("label") String label,
            @JsonProperty("config") Map<String, Object> config,
            @JsonProperty("inputs") List<String> inputs,
            @JsonProperty("outputs") List<String> outputs,
            @JsonProperty("policy") PolicyDescription policy) {
        this.id = id;
        this.type = type;
        this.label = label;
        this.config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
        this.inputs = inputs != null ? List.copyOf(inputs) : List.of();
        this.outputs = outputs != null ? List.copyOf(outputs) : List.of();
        this.policy = policy;
    }

    public static NodeDescription of(String id, String type) {
        return new NodeDescription(id, type, null, null, null, null, null);
    }

    public static NodeDescription of(String id, String type, Map<String, Object> config) {
        return new NodeDescription(id, type, null, config, null, null, null);
    }

    public NodeDescription withLabel(String newLabel) {
        return new NodeDescription(id, type, newLabel, config, inputs, outputs, policy);
    }

    public NodeDescription withPolicy(PolicyDescription newPolicy) {
        return new NodeDescription(id, type, label, config, inputs, outputs, newPolicy);
    }

    public NodeDescription withPorts(List<String> newInputs, List<String> newOutputs) {
        return new NodeDescription(id, type, label, config, newInputs, newOutputs, policy);
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getLabel() {
        return label;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    /** Extra input ports beyond the type defaults. */
    public List<String> getInputs() {
        return inputs;
    }

    /** Extra output ports beyond the type defaults. */
    public List<String> getOutputs() {
        return outputs;
    }

    /** Explicit policy override; null means compiler defaults apply. */
    public PolicyDescription getPolicy() {
        return policy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeDescription that = (NodeDescription) o;
        return Objects.equals(id, that.id)
                && Objects.equals(type, that.type)
                && Objects.equals(label, that.label)
                && config.equals(that.config)
                && inputs.equals(that.inputs)
                && outputs.equals(that.outputs)
                && Objects.equals(policy, that.policy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, label, config, inputs, outputs, policy);
    }
}
