package com.dflow.engine.scheduler;

import com.dflow.diagram.model.ConcurrencyPolicy;
import com.dflow.diagram.model.JoinPolicy;
import com.dflow.diagram.model.Node;
import com.dflow.diagram.model.NodeType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConcurrencyGateTest {

    private static Node node(String id, ConcurrencyPolicy policy) {
        return new Node(id, null, NodeType.DB, List.of("default"), List.of("default"), Map.of(),
                JoinPolicy.ALL, policy, null);
    }

    @Test
    void singleton_admitsOneRunUntilReleased() {
        ConcurrencyGate gate = new ConcurrencyGate();
        Node node = node("a", ConcurrencyPolicy.SINGLETON);

        assertTrue(gate.tryAdmit(node));
        assertFalse(gate.tryAdmit(node));
        gate.release("a");
        assertTrue(gate.tryAdmit(node));
        assertEquals(1, gate.inFlight("a"));
    }

    @Test
    void bounded_admitsUpToLimitAndPerTokenIsUnbounded() {
        ConcurrencyGate gate = new ConcurrencyGate();
        Node bounded = node("b", ConcurrencyPolicy.bounded(2));
        Node perToken = node("p", ConcurrencyPolicy.PER_TOKEN);

        assertTrue(gate.tryAdmit(bounded));
        assertTrue(gate.tryAdmit(bounded));
        assertFalse(gate.tryAdmit(bounded));
        for (int i = 0; i < 50; i++) {
            assertTrue(gate.tryAdmit(perToken));
        }
        assertEquals(52, gate.totalInFlight());
    }

    @Test
    void release_withoutAdmissionIsAnInvariantViolation() {
        ConcurrencyGate gate = new ConcurrencyGate();

        SchedulerInvariantViolation e = assertThrows(SchedulerInvariantViolation.class, () -> gate.release("x"));
        assertEquals("x", e.getNodeId());
    }

    @Test
    void tryAdmit_concurrentCallersNeverExceedBound() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate();
        Node node = node("b", ConcurrencyPolicy.bounded(3));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        try {
            for (int i = 0; i < 32; i++) {
                pool.submit(() -> {
                    go.await();
                    if (gate.tryAdmit(node)) admitted.incrementAndGet();
                    return null;
                });
            }
            go.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(3, admitted.get());
        assertEquals(3, gate.inFlight("b"));
    }
}
