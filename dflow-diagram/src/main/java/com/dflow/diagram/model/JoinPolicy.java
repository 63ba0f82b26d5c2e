package com.dflow.diagram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Rule deciding when a node has enough incoming tokens to run. {@code k} is only meaningful for
 * {@link Kind#K_OF_N}.
 */
public final class JoinPolicy {

    public enum Kind { ALL, ANY, K_OF_N }

    public static final JoinPolicy ALL = new JoinPolicy(Kind.ALL, 0);
    public static final JoinPolicy ANY = new JoinPolicy(Kind.ANY, 0);

    private final Kind kind;
    private final int k;

    @JsonCreator
    public JoinPolicy(@JsonProperty("kind") Kind kind, @JsonProperty("k") int k) {
        this.kind = Objects.requireNonNull(kind, "kind");
        if (kind == Kind.K_OF_N && k < 1) {
            throw new IllegalArgumentException("k must be positive for K_OF_N, got: " + k);
        }
        this.k = kind == Kind.K_OF_N ? k : 0;
    }

    public static JoinPolicy kOfN(int k) {
        return new JoinPolicy(Kind.K_OF_N, k);
    }

    public Kind getKind() {
        return kind;
    }

    public int getK() {
        return k;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JoinPolicy that = (JoinPolicy) o;
        return k == that.k && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, k);
    }

    @Override
    public String toString() {
        return kind == Kind.K_OF_N ? "K_OF_N(" + k + ")" : kind.name();
    }
}
