package com.dflow.engine.scheduler;

import com.dflow.diagram.model.ConcurrencyPolicy;
import com.dflow.diagram.model.Node;

import java.util.HashMap;
import java.util.Map;

/**
 * Single responsibility: count in-flight runs per node and admit a new run only when the node's
 * {@link ConcurrencyPolicy} allows it. Admission and the increment happen under one monitor.
 */
final class ConcurrencyGate {

    private final Map<String, Integer> inFlight = new HashMap<>();

    synchronized boolean tryAdmit(Node node) {
        int current = inFlight.getOrDefault(node.getId(), 0);
        if (!node.getConcurrencyPolicy().admits(current)) {
            return false;
        }
        inFlight.put(node.getId(), current + 1);
        return true;
    }

    synchronized void release(String nodeId) {
        int current = inFlight.getOrDefault(nodeId, 0);
        if (current <= 0) {
            throw new SchedulerInvariantViolation("Concurrency gate released more runs than it admitted", nodeId);
        }
        if (current == 1) {
            inFlight.remove(nodeId);
        } else {
            inFlight.put(nodeId, current - 1);
        }
    }

    synchronized int inFlight(String nodeId) {
        return inFlight.getOrDefault(nodeId, 0);
    }

    synchronized int totalInFlight() {
        int total = 0;
        for (int n : inFlight.values()) total += n;
        return total;
    }
}
