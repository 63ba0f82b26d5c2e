package com.dflow.engine.config;

import com.dflow.diagram.compile.CompileMode;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Engine settings loaded from environment variables.
 * <p>
 * Worker pool: DFLOW_MAX_WORKERS. Timeouts: DFLOW_NODE_TIMEOUT_SECONDS, DFLOW_RUN_TIMEOUT_SECONDS
 * (0 disables). Loops: DFLOW_MAX_LOOP_ITERATIONS caps loop-backs per loop. Termination:
 * DFLOW_TERMINATE_ON_ENDPOINTS stops dispatching once every ENDPOINT completed. Compilation:
 * DFLOW_DIAGNOSTICS_MODE is {@code fail_fast} or {@code collect_all}.
 */
public final class EngineConfig {

    static final String ENV_MAX_WORKERS = "DFLOW_MAX_WORKERS";
    static final String ENV_NODE_TIMEOUT_SECONDS = "DFLOW_NODE_TIMEOUT_SECONDS";
    static final String ENV_RUN_TIMEOUT_SECONDS = "DFLOW_RUN_TIMEOUT_SECONDS";
    static final String ENV_MAX_LOOP_ITERATIONS = "DFLOW_MAX_LOOP_ITERATIONS";
    static final String ENV_TERMINATE_ON_ENDPOINTS = "DFLOW_TERMINATE_ON_ENDPOINTS";
    static final String ENV_DIAGNOSTICS_MODE = "DFLOW_DIAGNOSTICS_MODE";

    private static final int DEFAULT_MAX_WORKERS = 4;
    private static final int DEFAULT_NODE_TIMEOUT_SECONDS = 300;
    private static final int DEFAULT_RUN_TIMEOUT_SECONDS = 3600;
    private static final int DEFAULT_MAX_LOOP_ITERATIONS = 100;
    private static final boolean DEFAULT_TERMINATE_ON_ENDPOINTS = true;
    /** How long the scheduler loop waits for a completion before re-checking timeouts and cancellation. */
    private static final int DEFAULT_POLL_INTERVAL_MILLIS = 50;

    public static final EngineConfig DEFAULT = builder().build();

    private final int maxWorkers;
    private final Duration nodeTimeout;
    private final Duration runTimeout;
    private final int maxLoopIterations;
    private final boolean terminateOnEndpoints;
    private final CompileMode diagnosticsMode;
    private final int pollIntervalMillis;

    private EngineConfig(Builder b) {
        this.maxWorkers = requirePositive(b.maxWorkers, "maxWorkers");
        this.nodeTimeout = requireNonNegative(b.nodeTimeout, "nodeTimeout");
        this.runTimeout = requireNonNegative(b.runTimeout, "runTimeout");
        this.maxLoopIterations = requirePositive(b.maxLoopIterations, "maxLoopIterations");
        this.terminateOnEndpoints = b.terminateOnEndpoints;
        this.diagnosticsMode = Objects.requireNonNull(b.diagnosticsMode, "diagnosticsMode");
        this.pollIntervalMillis = requirePositive(b.pollIntervalMillis, "pollIntervalMillis");
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }

    private static Duration requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative, got: " + value);
        }
        return value;
    }

    /** Size of the fixed worker pool that runs handlers. Default 4. */
    public int getMaxWorkers() {
        return maxWorkers;
    }

    /** Per-node handler timeout; {@link Duration#ZERO} means none. Node config {@code timeout_seconds} overrides. */
    public Duration getNodeTimeout() {
        return nodeTimeout;
    }

    /** Whole-run timeout; {@link Duration#ZERO} means none. */
    public Duration getRunTimeout() {
        return runTimeout;
    }

    /** Max loop-backs taken per loop in one run. Default 100. */
    public int getMaxLoopIterations() {
        return maxLoopIterations;
    }

    public boolean isTerminateOnEndpoints() {
        return terminateOnEndpoints;
    }

    public CompileMode getDiagnosticsMode() {
        return diagnosticsMode;
    }

    public int getPollIntervalMillis() {
        return pollIntervalMillis;
    }

    public static EngineConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Reads settings from the given variables; unset or malformed values fall back to defaults. */
    public static EngineConfig fromEnvironment(Map<String, String> env) {
        return builder()
                .maxWorkers(parseInt(env.get(ENV_MAX_WORKERS), DEFAULT_MAX_WORKERS))
                .nodeTimeout(Duration.ofSeconds(parseInt(env.get(ENV_NODE_TIMEOUT_SECONDS), DEFAULT_NODE_TIMEOUT_SECONDS)))
                .runTimeout(Duration.ofSeconds(parseInt(env.get(ENV_RUN_TIMEOUT_SECONDS), DEFAULT_RUN_TIMEOUT_SECONDS)))
                .maxLoopIterations(parseInt(env.get(ENV_MAX_LOOP_ITERATIONS), DEFAULT_MAX_LOOP_ITERATIONS))
                .terminateOnEndpoints(parseBoolean(env.get(ENV_TERMINATE_ON_ENDPOINTS), DEFAULT_TERMINATE_ON_ENDPOINTS))
                .diagnosticsMode(parseMode(env.get(ENV_DIAGNOSTICS_MODE)))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static CompileMode parseMode(String value) {
        if (value == null || value.isBlank()) {
            return CompileMode.FAIL_FAST;
        }
        try {
            return CompileMode.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return CompileMode.FAIL_FAST;
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{maxWorkers=" + maxWorkers + ", nodeTimeout=" + nodeTimeout + ", runTimeout=" + runTimeout
                + ", maxLoopIterations=" + maxLoopIterations + ", terminateOnEndpoints=" + terminateOnEndpoints
                + ", diagnosticsMode=" + diagnosticsMode + "}";
    }

    public static final class Builder {
        private int maxWorkers = DEFAULT_MAX_WORKERS;
        private Duration nodeTimeout = Duration.ofSeconds(DEFAULT_NODE_TIMEOUT_SECONDS);
        private Duration runTimeout = Duration.ofSeconds(DEFAULT_RUN_TIMEOUT_SECONDS);
        private int maxLoopIterations = DEFAULT_MAX_LOOP_ITERATIONS;
        private boolean terminateOnEndpoints = DEFAULT_TERMINATE_ON_ENDPOINTS;
        private CompileMode diagnosticsMode = CompileMode.FAIL_FAST;
        private int pollIntervalMillis = DEFAULT_POLL_INTERVAL_MILLIS;

        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder nodeTimeout(Duration nodeTimeout) {
            this.nodeTimeout = nodeTimeout;
            return this;
        }

        public Builder runTimeout(Duration runTimeout) {
            this.runTimeout = runTimeout;
            return this;
        }

        public Builder maxLoopIterations(int maxLoopIterations) {
            this.maxLoopIterations = maxLoopIterations;
            return this;
        }

        public Builder terminateOnEndpoints(boolean terminateOnEndpoints) {
            this.terminateOnEndpoints = terminateOnEndpoints;
            return this;
        }

        public Builder diagnosticsMode(CompileMode diagnosticsMode) {
            this.diagnosticsMode = diagnosticsMode;
            return this;
        }

        public Builder pollIntervalMillis(int pollIntervalMillis) {
            this.pollIntervalMillis = pollIntervalMillis;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
