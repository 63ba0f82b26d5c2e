package com.dflow.diagram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Set;

/**
 * Node type tag. JSON uses the lower-case name ({@code person_job}); unknown values deserialize as
 * {@link #UNKNOWN}, which the Validation phase rejects.
 * <p>
 * Every constant is classified by {@link #role()} through an exhaustive switch, so a new type does not
 * compile until it is given a connection role.
 */
public enum NodeType {
    START,
    PERSON_JOB,
    PERSON_BATCH_JOB,
    CONDITION,
    CODE_JOB,
    API_JOB,
    ENDPOINT,
    DB,
    USER_RESPONSE,
    SUB_DIAGRAM,
    TEMPLATE_JOB,
    HOOK,
    JSON_SCHEMA_VALIDATOR,
    INTEGRATED_API,
    /** Used when a description contains an unknown type string. */
    UNKNOWN;

    /** How a node type participates in connections. */
    public enum Role {
        /** Entry point: sends, never receives. */
        SOURCE,
        /** Ordinary work node: receives and sends. */
        WORKER,
        /** Branching node with mutually exclusive outputs. */
        BRANCH,
        /** Exit point: receives, never sends. */
        SINK,
        /** Unclassifiable; never connectable. */
        INVALID
    }

    public Role role() {
        return switch (this) {
            case START -> Role.SOURCE;
            case CONDITION -> Role.BRANCH;
            case ENDPOINT -> Role.SINK;
            case PERSON_JOB, PERSON_BATCH_JOB, CODE_JOB, API_JOB, DB, USER_RESPONSE, SUB_DIAGRAM,
                    TEMPLATE_JOB, HOOK, JSON_SCHEMA_VALIDATOR, INTEGRATED_API -> Role.WORKER;
            case UNKNOWN -> Role.INVALID;
        };
    }

    /** True when the type may originate data on an outgoing edge. */
    public boolean isOutputCapable() {
        Role role = role();
        return role == Role.SOURCE || role == Role.WORKER || role == Role.BRANCH;
    }

    public boolean isBranching() {
        return role() == Role.BRANCH;
    }

    /** Mutually exclusive output ports of a branching type; empty for other types. */
    public Set<String> exclusivePorts() {
        return isBranching() ? Set.of(Ports.CONDITION_TRUE, Ports.CONDITION_FALSE) : Set.of();
    }

    public List<String> defaultInputPorts() {
        return switch (role()) {
            case SOURCE, INVALID -> List.of();
            case WORKER -> this == PERSON_JOB || this == PERSON_BATCH_JOB
                    ? List.of(Ports.DEFAULT, Ports.FIRST)
                    : List.of(Ports.DEFAULT);
            case BRANCH, SINK -> List.of(Ports.DEFAULT);
        };
    }

    public List<String> defaultOutputPorts() {
        return switch (role()) {
            case SOURCE -> List.of(Ports.DEFAULT);
            case WORKER -> List.of(Ports.DEFAULT, Ports.ERROR);
            case BRANCH -> List.of(Ports.CONDITION_TRUE, Ports.CONDITION_FALSE, Ports.ERROR);
            case SINK, INVALID -> List.of();
        };
    }

    /** Types whose config {@code max_iteration} bounds executions (default 1). */
    public boolean hasIterationLimit() {
        return this == PERSON_JOB || this == PERSON_BATCH_JOB;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static NodeType fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim().toUpperCase().replace('-', '_');
        for (NodeType t : values()) {
            if (t != UNKNOWN && t.name().equals(normalized)) return t;
        }
        return UNKNOWN;
    }
}
