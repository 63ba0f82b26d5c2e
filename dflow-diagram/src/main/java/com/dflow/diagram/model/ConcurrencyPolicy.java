package com.dflow.diagram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Bound on overlapping in-flight runs of one node.
 */
public final class ConcurrencyPolicy {

    public enum Kind { SINGLETON, PER_TOKEN, BOUNDED }

    public static final ConcurrencyPolicy SINGLETON = new ConcurrencyPolicy(Kind.SINGLETON, 1);
    public static final ConcurrencyPolicy PER_TOKEN = new ConcurrencyPolicy(Kind.PER_TOKEN, 0);

    private final Kind kind;
    private final int maxConcurrent;

    @JsonCreator
    public ConcurrencyPolicy(@JsonProperty("kind") Kind kind, @JsonProperty("maxConcurrent") int maxConcurrent) {
        this.kind = Objects.requireNonNull(kind, "kind");
        if (kind == Kind.BOUNDED && maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be positive for BOUNDED, got: " + maxConcurrent);
        }
        this.maxConcurrent = switch (kind) {
            case SINGLETON -> 1;
            case PER_TOKEN -> 0;
            case BOUNDED -> maxConcurrent;
        };
    }

    public static ConcurrencyPolicy bounded(int maxConcurrent) {
        return new ConcurrencyPolicy(Kind.BOUNDED, maxConcurrent);
    }

    public Kind getKind() {
        return kind;
    }

    /** Max overlapping runs; 0 means unbounded (PER_TOKEN). */
    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    /** True if one more run may start while {@code inFlight} runs are active. */
    public boolean admits(int inFlight) {
        return kind == Kind.PER_TOKEN || inFlight < maxConcurrent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConcurrencyPolicy that = (ConcurrencyPolicy) o;
        return maxConcurrent == that.maxConcurrent && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, maxConcurrent);
    }

    @Override
    public String toString() {
        return kind == Kind.BOUNDED ? "BOUNDED(" + maxConcurrent + ")" : kind.name();
    }
}
