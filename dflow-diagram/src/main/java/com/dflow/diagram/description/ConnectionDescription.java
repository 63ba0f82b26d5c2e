package com.dflow.diagram.description;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Raw connection. {@code source}/{@code target} may name a node id, a node label, or a
 * {@code <node>_<port>} handle; ports are optional and default to {@code default}.
 */
public final class ConnectionDescription {

    private final String id;
    private final String source;
    private final String sourcePort;
    private final String target;
    private final String targetPort;
    private final boolean skippable;
    private final Map<String, Object> transform;
    private final String contentType;

    @JsonCreator
    public ConnectionDescription(
            @JsonProperty("id") String id,
            @JsonProperty("source") String source,
            @JsonProperty("sourcePort") String sourcePort,
            @JsonProperty("target") String target,
            @JsonProperty("targetPort") String targetPort,
            @JsonProperty("skippable") boolean skippable,
            @JsonProperty("transform") Map<String, Object> transform,
            @JsonProperty("contentType") String contentType) {
        this.id = id;
        this.source = source;
        this.sourcePort = sourcePort;
        this.target = target;
        this.targetPort = targetPort;
        this.skippable = skippable;
        this.transform = transform != null ? Collections.unmodifiableMap(new LinkedHashMap<>(transform)) : Map.of();
        this.contentType = contentType;
    }

    public static ConnectionDescription of(String source, String target) {
        return new ConnectionDescription(null, source, null, target, null, false, null, null);
    }

    public static ConnectionDescription of(String source, String sourcePort, String target, String targetPort) {
        return new ConnectionDescription(null, source, sourcePort, target, targetPort, false, null, null);
    }

    public ConnectionDescription withId(String newId) {
        return new ConnectionDescription(newId, source, sourcePort, target, targetPort, skippable, transform, contentType);
    }

    public ConnectionDescription asSkippable() {
        return new ConnectionDescription(id, source, sourcePort, target, targetPort, true, transform, contentType);
    }

    public ConnectionDescription withTransform(Map<String, Object> newTransform) {
        return new ConnectionDescription(id, source, sourcePort, target, targetPort, skippable, newTransform, contentType);
    }

    public String getId() {
        return id;
    }

    public String getSource() {
        return source;
    }

    public String getSourcePort() {
        return sourcePort;
    }

    public String getTarget() {
        return target;
    }

    public String getTargetPort() {
        return targetPort;
    }

    public boolean isSkippable() {
        return skippable;
    }

    /** Connection-specific transform entries; win over type-pair defaults key by key. */
    public Map<String, Object> getTransform() {
        return transform;
    }

    public String getContentType() {
        return contentType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConnectionDescription that = (ConnectionDescription) o;
        return skippable == that.skippable
                && Objects.equals(id, that.id)
                && Objects.equals(source, that.source)
                && Objects.equals(sourcePort, that.sourcePort)
                && Objects.equals(target, that.target)
                && Objects.equals(targetPort, that.targetPort)
                && transform.equals(that.transform)
                && Objects.equals(contentType, that.contentType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, source, sourcePort, target, targetPort, skippable, transform, contentType);
    }
}
