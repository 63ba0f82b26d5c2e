package com.dflow.features.metrics;

import com.dflow.protocol.event.ExecutionEvent;
import com.dflow.protocol.event.ExecutionEventListener;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Execution event listener that records run and node metrics in Micrometer:
 * <ul>
 *   <li>{@code dflow.node.executions} counter and {@code dflow.node.duration} timer, tagged nodeType and
 *   outcome (success/failure)</li>
 *   <li>{@code dflow.node.skipped} counter, tagged nodeType</li>
 *   <li>{@code dflow.epochs} counter of loop iterations started</li>
 *   <li>{@code dflow.runs} counter and {@code dflow.run.duration} timer, tagged status</li>
 * </ul>
 * Without an explicit registry a shared {@link SimpleMeterRegistry} is created lazily via CAS and reused.
 */
public final class MetricsEventListener implements ExecutionEventListener {

    private static final AtomicReference<MeterRegistry> DEFAULT_REGISTRY = new AtomicReference<>();

    static final String NODE_EXECUTIONS = "dflow.node.executions";
    static final String NODE_DURATION = "dflow.node.duration";
    static final String NODE_SKIPPED = "dflow.node.skipped";
    static final String EPOCHS = "dflow.epochs";
    static final String RUNS = "dflow.runs";
    static final String RUN_DURATION = "dflow.run.duration";

    private final MeterRegistry registry;

    public MetricsEventListener() {
        this(defaultRegistry());
    }

    public MetricsEventListener(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Shared registry, created on first use. At most one is ever created. */
    static MeterRegistry defaultRegistry() {
        MeterRegistry existing = DEFAULT_REGISTRY.get();
        if (existing != null) {
            return existing;
        }
        MeterRegistry created = new SimpleMeterRegistry();
        if (DEFAULT_REGISTRY.compareAndSet(null, created)) {
            return created;
        }
        return DEFAULT_REGISTRY.get();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void onEvent(ExecutionEvent event) {
        switch (event.getType()) {
            case NODE_COMPLETED -> recordNode(event, "success");
            case NODE_FAILED -> recordNode(event, "failure");
            case NODE_SKIPPED -> registry.counter(NODE_SKIPPED, "nodeType", nodeType(event)).increment();
            case EPOCH_BEGAN -> registry.counter(EPOCHS).increment();
            case RUN_COMPLETED -> {
                String status = event.getMessage() != null ? event.getMessage() : "unknown";
                registry.counter(RUNS, "status", status).increment();
                Timer.builder(RUN_DURATION)
                        .tag("status", status)
                        .register(registry)
                        .record(event.getDurationMs(), TimeUnit.MILLISECONDS);
            }
            default -> {
            }
        }
    }

    private void recordNode(ExecutionEvent event, String outcome) {
        String nodeType = nodeType(event);
        registry.counter(NODE_EXECUTIONS, "nodeType", nodeType, "outcome", outcome).increment();
        Timer.builder(NODE_DURATION)
                .tag("nodeType", nodeType)
                .tag("outcome", outcome)
                .register(registry)
                .record(event.getDurationMs(), TimeUnit.MILLISECONDS);
    }

    private static String nodeType(ExecutionEvent event) {
        return event.getNodeType() != null ? event.getNodeType().toValue() : "unknown";
    }
}
