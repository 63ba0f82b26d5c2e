package com.dflow.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable payload carried by a token: an opaque body, its content type, the id of the producing node
 * and a meta map. The engine only reads and writes the meta keys declared here; the body is passed
 * through untouched. {@code with*} methods return copies.
 */
public final class Envelope {

    /** Epoch the producing node ran in. */
    public static final String META_ITERATION = "iteration";
    /** Output port a branching node fired. */
    public static final String META_BRANCH = "branch";
    /** Failure message on error envelopes. */
    public static final String META_ERROR = "error";
    /** Data-transform map of the edge that delivered the envelope. */
    public static final String META_EDGE_TRANSFORM = "edge_transform";

    private final Object body;
    private final ContentType contentType;
    private final String producedBy;
    private final Map<String, Object> meta;

    @JsonCreator
    public Envelope(
            @JsonProperty("body") Object body,
            @JsonProperty("contentType") ContentType contentType,
            @JsonProperty("producedBy") String producedBy,
            @JsonProperty("meta") Map<String, Object> meta) {
        this.body = body;
        this.contentType = contentType != null ? contentType : ContentType.OBJECT;
        this.producedBy = producedBy;
        this.meta = meta != null ? Collections.unmodifiableMap(new LinkedHashMap<>(meta)) : Map.of();
    }

    public static Envelope of(Object body) {
        return new Envelope(body, body instanceof String ? ContentType.RAW_TEXT : ContentType.OBJECT, null, null);
    }

    public static Envelope of(Object body, ContentType contentType, String producedBy) {
        return new Envelope(body, contentType, producedBy, null);
    }

    /** Error envelope emitted on a failing node's {@code error} port. */
    public static Envelope error(String producedBy, String message) {
        String text = message != null ? message : "";
        return new Envelope(text, ContentType.RAW_TEXT, producedBy, Map.of(META_ERROR, text));
    }

    public Object getBody() {
        return body;
    }

    public ContentType getContentType() {
        return contentType;
    }

    public String getProducedBy() {
        return producedBy;
    }

    public Map<String, Object> getMeta() {
        return meta;
    }

    /** Body as text; null body gives null, non-string bodies use {@code toString()}. */
    @JsonIgnore
    public String bodyAsText() {
        return body != null ? body.toString() : null;
    }

    @JsonIgnore
    public boolean hasError() {
        return meta.containsKey(META_ERROR);
    }

    public Envelope withMeta(String key, Object value) {
        Objects.requireNonNull(key, "key");
        Map<String, Object> copy = new LinkedHashMap<>(meta);
        copy.put(key, value);
        return new Envelope(body, contentType, producedBy, copy);
    }

    public Envelope withIteration(int epoch) {
        return withMeta(META_ITERATION, epoch);
    }

    public Envelope withBranch(String port) {
        return withMeta(META_BRANCH, port);
    }

    public Envelope withProducer(String nodeId) {
        return new Envelope(body, contentType, nodeId, meta);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Envelope that = (Envelope) o;
        return Objects.equals(body, that.body)
                && contentType == that.contentType
                && Objects.equals(producedBy, that.producedBy)
                && meta.equals(that.meta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(body, contentType, producedBy, meta);
    }

    @Override
    public String toString() {
        return "Envelope{" + contentType.toValue() + ", producedBy=" + producedBy + ", body=" + body + "}";
    }
}
