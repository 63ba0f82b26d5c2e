package com.dflow.diagram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Validated edge with the runtime attributes the token layer needs: merged data-transform policy,
 * skippable flag and loop classification.
 */
public final class ExecutableEdge {

    private final String id;
    private final Edge edge;
    private final Map<String, Object> transform;
    private final boolean skippable;
    private final boolean loopBack;
    private final boolean loopScoped;
    private final String contentType;

    @JsonCreator
    public ExecutableEdge(
            @JsonProperty("id") String id,
            @JsonProperty("edge") Edge edge,
            @JsonProperty("transform") Map<String, Object> transform,
            @JsonProperty("skippable") boolean skippable,
            @JsonProperty("loopBack") boolean loopBack,
            @JsonProperty("loopScoped") boolean loopScoped,
            @JsonProperty("contentType") String contentType) {
        this.id = Objects.requireNonNull(id, "id");
        this.edge = Objects.requireNonNull(edge, "edge");
        this.transform = transform != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(transform))
                : Map.of();
        this.skippable = skippable;
        this.loopBack = loopBack;
        this.loopScoped = loopScoped;
        this.contentType = contentType;
    }

    public String getId() {
        return id;
    }

    public Edge getEdge() {
        return edge;
    }

    @JsonIgnore
    public String sourceNodeId() {
        return edge.sourceNodeId();
    }

    @JsonIgnore
    public String sourcePort() {
        return edge.sourcePort();
    }

    @JsonIgnore
    public String targetNodeId() {
        return edge.targetNodeId();
    }

    @JsonIgnore
    public String targetPort() {
        return edge.targetPort();
    }

    public Map<String, Object> getTransform() {
        return transform;
    }

    public boolean isSkippable() {
        return skippable;
    }

    /** Target ranks at or before source; tokens on this edge start a new epoch. */
    public boolean isLoopBack() {
        return loopBack;
    }

    /** Both endpoints lie in one loop body (or the edge is loop-back); tokens are looked up per exact epoch. */
    public boolean isLoopScoped() {
        return loopScoped;
    }

    public String getContentType() {
        return contentType;
    }

    public ExecutableEdge withLoopClassification(boolean loopBack, boolean loopScoped) {
        return new ExecutableEdge(id, edge, transform, skippable, loopBack, loopScoped, contentType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutableEdge that = (ExecutableEdge) o;
        return skippable == that.skippable
                && loopBack == that.loopBack
                && loopScoped == that.loopScoped
                && id.equals(that.id)
                && edge.equals(that.edge)
                && transform.equals(that.transform)
                && Objects.equals(contentType, that.contentType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, edge, transform, skippable, loopBack, loopScoped, contentType);
    }

    @Override
    public String toString() {
        return id + "[" + edge + (loopBack ? ", loop-back" : "") + (skippable ? ", skippable" : "") + "]";
    }
}
