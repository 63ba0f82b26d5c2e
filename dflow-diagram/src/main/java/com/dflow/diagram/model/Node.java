package com.dflow.diagram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Compiled node. Immutable after compilation; {@code config} is opaque to the core and handed to the
 * node's handler as-is.
 */
public final class Node {

    private final String id;
    private final String label;
    private final NodeType type;
    private final List<String> inputPorts;
    private final List<String> outputPorts;
    private final Map<String, Object> config;
    private final JoinPolicy joinPolicy;
    private final ConcurrencyPolicy concurrencyPolicy;
    private final Integer maxExecutions;

    @JsonCreator
    public Node(
            @JsonProperty("id") String id,
            @JsonProperty("label") String label,
            @JsonProperty("type") NodeType type,
            @JsonProperty("inputPorts") List<String> inputPorts,
            @JsonProperty("outputPorts") List<String> outputPorts,
            @JsonProperty("config") Map<String, Object> config,
            @JsonProperty("joinPolicy") JoinPolicy joinPolicy,
            @JsonProperty("concurrencyPolicy") ConcurrencyPolicy concurrencyPolicy,
            @JsonProperty("maxExecutions") Integer maxExecutions) {
        this.id = Objects.requireNonNull(id, "id");
        this.label = label;
        this.type = type != null ? type : NodeType.UNKNOWN;
        this.inputPorts = inputPorts != null ? List.copyOf(inputPorts) : List.of();
        this.outputPorts = outputPorts != null ? List.copyOf(outputPorts) : List.of();
        // config values may be null, which Map.copyOf rejects
        this.config = config != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(config))
                : Map.of();
        this.joinPolicy = joinPolicy != null ? joinPolicy : JoinPolicy.ALL;
        this.concurrencyPolicy = concurrencyPolicy != null ? concurrencyPolicy : ConcurrencyPolicy.SINGLETON;
        if (maxExecutions != null && maxExecutions < 1) {
            throw new IllegalArgumentException("maxExecutions must be positive, got: " + maxExecutions);
        }
        this.maxExecutions = maxExecutions;
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public NodeType getType() {
        return type;
    }

    public List<String> getInputPorts() {
        return inputPorts;
    }

    public List<String> getOutputPorts() {
        return outputPorts;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public JoinPolicy getJoinPolicy() {
        return joinPolicy;
    }

    public ConcurrencyPolicy getConcurrencyPolicy() {
        return concurrencyPolicy;
    }

    /** Declared bound on executions for the whole run (loop participants); null when unbounded. */
    public Integer getMaxExecutions() {
        return maxExecutions;
    }

    @JsonIgnore
    public OptionalInt maxExecutionsLimit() {
        return maxExecutions != null ? OptionalInt.of(maxExecutions) : OptionalInt.empty();
    }

    public boolean hasOutputPort(String port) {
        return outputPorts.contains(port);
    }

    public boolean hasInputPort(String port) {
        return inputPorts.contains(port);
    }

    /** Returns a copy with the given policies; used by Assembly when filling defaults. */
    public Node withPolicies(JoinPolicy join, ConcurrencyPolicy concurrency) {
        return new Node(id, label, type, inputPorts, outputPorts, config, join, concurrency, maxExecutions);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node node = (Node) o;
        return id.equals(node.id)
                && Objects.equals(label, node.label)
                && type == node.type
                && inputPorts.equals(node.inputPorts)
                && outputPorts.equals(node.outputPorts)
                && config.equals(node.config)
                && joinPolicy.equals(node.joinPolicy)
                && concurrencyPolicy.equals(node.concurrencyPolicy)
                && Objects.equals(maxExecutions, node.maxExecutions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, type, inputPorts, outputPorts, config, joinPolicy, concurrencyPolicy, maxExecutions);
    }

    @Override
    public String toString() {
        return "Node{" + id + ", " + type + ", join=" + joinPolicy + ", concurrency=" + concurrencyPolicy + "}";
    }
}
