package com.dflow.engine.token;

import com.dflow.protocol.Envelope;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable unit of data on one edge in one epoch. Sequence numbers start at 1 and grow by one per
 * (edge, epoch); the id is derived from the three so it is stable across snapshot and restore.
 */
public final class Token {

    public static final String META_SOURCE_NODE = "source_node";
    public static final String META_TARGET_NODE = "target_node";

    private final String id;
    private final String edgeId;
    private final int epoch;
    private final int sequence;
    private final Envelope payload;
    private final long timestamp;
    private final Map<String, Object> meta;

    @JsonCreator
    public Token(
            @JsonProperty("id") String id,
            @JsonProperty("edgeId") String edgeId,
            @JsonProperty("epoch") int epoch,
            @JsonProperty("sequence") int sequence,
            @JsonProperty("payload") Envelope payload,
            @JsonProperty("timestamp") long timestamp,
            @JsonProperty("meta") Map<String, Object> meta) {
        this.edgeId = Objects.requireNonNull(edgeId, "edgeId");
        if (epoch < 0) {
            throw new IllegalArgumentException("epoch must not be negative, got: " + epoch);
        }
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be positive, got: " + sequence);
        }
        this.epoch = epoch;
        this.sequence = sequence;
        this.id = id != null ? id : idFor(edgeId, epoch, sequence);
        this.payload = payload;
        this.timestamp = timestamp;
        this.meta = meta != null ? Collections.unmodifiableMap(new LinkedHashMap<>(meta)) : Map.of();
    }

    static String idFor(String edgeId, int epoch, int sequence) {
        return edgeId + "@" + epoch + "#" + sequence;
    }

    public String getId() {
        return id;
    }

    public String getEdgeId() {
        return edgeId;
    }

    public int getEpoch() {
        return epoch;
    }

    public int getSequence() {
        return sequence;
    }

    public Envelope getPayload() {
        return payload;
    }

    /** Publish time, milliseconds since the Unix epoch. */
    public long getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getMeta() {
        return meta;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Token that = (Token) o;
        return epoch == that.epoch
                && sequence == that.sequence
                && timestamp == that.timestamp
                && id.equals(that.id)
                && edgeId.equals(that.edgeId)
                && Objects.equals(payload, that.payload)
                && meta.equals(that.meta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, edgeId, epoch, sequence, payload, timestamp, meta);
    }

    @Override
    public String toString() {
        return "Token{" + id + "}";
    }
}
