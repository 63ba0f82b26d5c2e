package com.dflow.engine.token;

import com.dflow.diagram.model.ExecutableDiagram;
import com.dflow.diagram.model.ExecutableEdge;
import com.dflow.diagram.model.JoinPolicy;
import com.dflow.diagram.model.Node;
import com.dflow.diagram.model.Ports;
import com.dflow.engine.scheduler.SchedulerInvariantViolation;
import com.dflow.protocol.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Single responsibility: epoch-scoped token bookkeeping for one run.
 * <p>
 * Tokens are stored per (edge, epoch) with gapless sequences starting at 1. Each node keeps a cursor per
 * (edge, epoch) holding the highest sequence it consumed; a token is unconsumed for a node while its
 * sequence is above that cursor. Branching nodes record which exclusive port they fired per epoch.
 * <p>
 * Epoch lookup depends on the edge: loop-scoped edges (both ends in one loop body, or the loop-back edge)
 * only see tokens of exactly the requested epoch. Every other edge sees the newest epoch at or below the
 * requested one that still holds an unconsumed token, so a join between a loop exit and a straight-line
 * branch can pair tokens from different epochs.
 * <p>
 * All state sits behind one {@link ReentrantReadWriteLock}: publish, consume and epoch changes take the
 * write lock, readiness checks the read lock.
 */
public final class TokenManager {

    private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

    private record EdgeEpoch(String edgeId, int epoch) {
    }

    private record CursorKey(String nodeId, String edgeId, int epoch) {
    }

    private record NodeEpoch(String nodeId, int epoch) {
    }

    private final ExecutableDiagram diagram;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private int currentEpoch;
    private final Map<EdgeEpoch, List<Token>> store = new HashMap<>();
    private final Map<String, NavigableSet<Integer>> epochsByEdge = new HashMap<>();
    private final Map<CursorKey, Integer> cursors = new HashMap<>();
    private final Map<NodeEpoch, String> branchDecisions = new HashMap<>();
    private final Map<String, String> latestBranch = new HashMap<>();

    public TokenManager(ExecutableDiagram diagram) {
        this.diagram = Objects.requireNonNull(diagram, "diagram");
    }

    public int currentEpoch() {
        lock.readLock().lock();
        try {
            return currentEpoch;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Starts a new loop iteration. Returns the new epoch. */
    public int beginEpoch() {
        lock.writeLock().lock();
        try {
            currentEpoch++;
            if (log.isDebugEnabled()) {
                log.debug("Epoch began | epoch={}", currentEpoch);
            }
            return currentEpoch;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Publishes one token on an edge.
     *
     * @throws IllegalArgumentException if the edge is not part of the diagram or the epoch is negative or
     *                                  has not begun yet
     */
    public Token publishToken(ExecutableEdge edge, Envelope payload, int epoch) {
        Objects.requireNonNull(edge, "edge");
        lock.writeLock().lock();
        try {
            return publishLocked(edge, payload, epoch);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Token publishLocked(ExecutableEdge edge, Envelope payload, int epoch) {
        if (diagram.getEdge(edge.getId()) == null) {
            throw new IllegalArgumentException("Edge " + edge.getId() + " is not part of the diagram");
        }
        if (epoch < 0 || epoch > currentEpoch) {
            throw new IllegalArgumentException("Cannot publish into epoch " + epoch + " (current " + currentEpoch + ")");
        }
        List<Token> tokens = store.computeIfAbsent(new EdgeEpoch(edge.getId(), epoch), k -> new ArrayList<>());
        int sequence = tokens.size() + 1;
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(Token.META_SOURCE_NODE, edge.sourceNodeId());
        meta.put(Token.META_TARGET_NODE, edge.targetNodeId());
        Token token = new Token(Token.idFor(edge.getId(), epoch, sequence), edge.getId(), epoch, sequence,
                payload, System.currentTimeMillis(), meta);
        tokens.add(token);
        epochsByEdge.computeIfAbsent(edge.getId(), k -> new TreeSet<>()).add(epoch);
        if (log.isDebugEnabled()) {
            log.debug("Token published | edge={} | epoch={} | seq={}", edge, epoch, sequence);
        }
        return token;
    }

    /**
     * Checks that a branching node fires at most one of its exclusive ports.
     *
     * @return the fired exclusive port, or null when none fired or the node does not branch
     * @throws IllegalArgumentException when more than one exclusive port carries an envelope
     */
    public String checkBranchOutputs(String nodeId, Map<String, Envelope> outputs) {
        Node node = requireNode(nodeId);
        if (!node.getType().isBranching() || outputs == null) return null;
        List<String> fired = new ArrayList<>();
        for (String port : node.getType().exclusivePorts()) {
            if (outputs.get(port) != null) fired.add(port);
        }
        if (fired.size() > 1) {
            fired.sort(Comparator.naturalOrder());
            throw new IllegalArgumentException("Branching node " + nodeId + " fired more than one exclusive port: " + fired);
        }
        return fired.isEmpty() ? null : fired.get(0);
    }

    /**
     * Publishes a node's outputs: one token per outgoing edge whose source port maps to a non-null envelope,
     * all in {@code epoch}. A branching node's fired port becomes its decision for that epoch.
     */
    public List<Token> emitOutputs(String nodeId, Map<String, Envelope> outputs, int epoch) {
        return emit(nodeId, outputs, epoch, epoch);
    }

    /**
     * Like {@link #emitOutputs(String, Map, int)}, except that loop-back edges publish into
     * {@code loopBackEpoch}, or publish nothing when it is null.
     */
    public List<Token> emitOutputs(String nodeId, Map<String, Envelope> outputs, int epoch, Integer loopBackEpoch) {
        return emit(nodeId, outputs, epoch, loopBackEpoch);
    }

    private List<Token> emit(String nodeId, Map<String, Envelope> outputs, int epoch, Integer loopBackEpoch) {
        lock.writeLock().lock();
        try {
            String fired = checkBranchOutputs(nodeId, outputs);
            List<Token> published = new ArrayList<>();
            if (outputs != null) {
                for (Map.Entry<String, List<ExecutableEdge>> byPort : diagram.outgoingByPort(nodeId).entrySet()) {
                    Envelope envelope = outputs.get(byPort.getKey());
                    if (envelope == null) continue;
                    for (ExecutableEdge edge : byPort.getValue()) {
                        if (edge.isLoopBack()) {
                            if (loopBackEpoch == null) continue;
                            published.add(publishLocked(edge, envelope, loopBackEpoch));
                        } else {
                            published.add(publishLocked(edge, envelope, epoch));
                        }
                    }
                }
            }
            if (fired != null) {
                branchDecisions.put(new NodeEpoch(nodeId, epoch), fired);
                latestBranch.put(nodeId, fired);
            }
            return published;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Atomically claims the latest unconsumed token of every incoming edge visible at {@code epoch}.
     *
     * @return payloads keyed by target port, or by {@code port/sourceNodeId} when several claimed edges
     * share a port; edges with a data transform attach it under {@link Envelope#META_EDGE_TRANSFORM}.
     * Empty for nodes without incoming edges.
     * @throws SchedulerInvariantViolation if a claim would move a cursor backwards
     */
    public Map<String, Envelope> consumeInbound(String nodeId, int epoch) {
        requireNode(nodeId);
        List<ExecutableEdge> incoming = diagram.incomingEdges(nodeId);
        if (incoming.isEmpty()) return Map.of();
        lock.writeLock().lock();
        try {
            List<ExecutableEdge> edges = new ArrayList<>();
            List<Token> claimed = new ArrayList<>();
            for (ExecutableEdge edge : incoming) {
                Token token = unconsumed(nodeId, edge, epoch);
                if (token == null) continue;
                Integer cursor = cursors.get(new CursorKey(nodeId, edge.getId(), token.getEpoch()));
                if (cursor != null && token.getSequence() <= cursor) {
                    throw new SchedulerInvariantViolation("Cursor regression for node " + nodeId + " on edge "
                            + edge.getId() + " epoch " + token.getEpoch() + ": " + token.getSequence() + " <= " + cursor, nodeId);
                }
                edges.add(edge);
                claimed.add(token);
            }
            Map<String, Integer> perPort = new HashMap<>();
            for (ExecutableEdge edge : edges) {
                perPort.merge(edge.targetPort(), 1, Integer::sum);
            }
            Map<String, Envelope> inputs = new LinkedHashMap<>();
            for (int i = 0; i < edges.size(); i++) {
                ExecutableEdge edge = edges.get(i);
                Token token = claimed.get(i);
                cursors.put(new CursorKey(nodeId, edge.getId(), token.getEpoch()), token.getSequence());
                String key = perPort.get(edge.targetPort()) > 1
                        ? edge.targetPort() + "/" + edge.sourceNodeId()
                        : edge.targetPort();
                if (inputs.containsKey(key)) {
                    key = edge.targetPort() + "/" + edge.getId();
                }
                Envelope payload = token.getPayload();
                if (payload != null && !edge.getTransform().isEmpty()) {
                    payload = payload.withMeta(Envelope.META_EDGE_TRANSFORM, edge.getTransform());
                }
                inputs.put(key, payload);
            }
            if (log.isDebugEnabled()) {
                log.debug("Inputs consumed | nodeId={} | epoch={} | ports={}", nodeId, epoch, inputs.keySet());
            }
            return inputs;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Readiness under the join policy, without the {@code first} input rule.
     * <p>
     * ALL needs a token on every qualifying edge except skippable and {@code error}-port ones, and at least
     * one token overall: a node whose qualifying edges are all optional waits until one of them delivers.
     */
    public boolean hasNewInputs(String nodeId, int epoch, JoinPolicy joinPolicy) {
        return ready(nodeId, epoch, joinPolicy, -1);
    }

    /**
     * Readiness under the join policy, applying the {@code first} input rule for a node that already ran
     * {@code executionCount} times: on its first execution only edges into the {@code first} port qualify
     * (when it has any), afterwards those edges never qualify.
     */
    public boolean hasNewInputs(String nodeId, int epoch, JoinPolicy joinPolicy, int executionCount) {
        if (executionCount < 0) {
            throw new IllegalArgumentException("executionCount must not be negative, got: " + executionCount);
        }
        return ready(nodeId, epoch, joinPolicy, executionCount);
    }

    private boolean ready(String nodeId, int epoch, JoinPolicy joinPolicy, int executionCount) {
        Objects.requireNonNull(joinPolicy, "joinPolicy");
        requireNode(nodeId);
        List<ExecutableEdge> incoming = diagram.incomingEdges(nodeId);
        if (incoming.isEmpty()) return true;
        lock.readLock().lock();
        try {
            List<ExecutableEdge> qualifying = qualifyingEdges(incoming, epoch, executionCount);
            if (qualifying.isEmpty()) return false;
            int withToken = 0;
            boolean requiredMissing = false;
            for (ExecutableEdge edge : qualifying) {
                if (unconsumed(nodeId, edge, epoch) != null) {
                    withToken++;
                } else if (!edge.isSkippable() && !Ports.ERROR.equals(edge.sourcePort())) {
                    requiredMissing = true;
                }
            }
            return switch (joinPolicy.getKind()) {
                case ALL -> !requiredMissing && withToken > 0;
                case ANY -> withToken >= 1;
                case K_OF_N -> withToken >= joinPolicy.getK();
            };
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<ExecutableEdge> qualifyingEdges(List<ExecutableEdge> incoming, int epoch, int executionCount) {
        List<ExecutableEdge> candidates = incoming;
        if (executionCount >= 0) {
            List<ExecutableEdge> first = new ArrayList<>();
            List<ExecutableEdge> rest = new ArrayList<>();
            for (ExecutableEdge edge : incoming) {
                (Ports.FIRST.equals(edge.targetPort()) ? first : rest).add(edge);
            }
            if (executionCount == 0 && !first.isEmpty()) {
                candidates = first;
            } else if (executionCount > 0) {
                candidates = rest;
            }
        }
        List<ExecutableEdge> qualifying = new ArrayList<>();
        for (ExecutableEdge edge : candidates) {
            if (!excludedByBranch(edge, epoch)) qualifying.add(edge);
        }
        return qualifying;
    }

    private boolean excludedByBranch(ExecutableEdge edge, int epoch) {
        Node source = diagram.getNode(edge.sourceNodeId());
        if (source == null || !source.getType().exclusivePorts().contains(edge.sourcePort())) return false;
        String decision = decisionAt(edge.sourceNodeId(), epoch, edge.isLoopScoped());
        return decision != null && !decision.equals(edge.sourcePort());
    }

    private String decisionAt(String nodeId, int epoch, boolean exact) {
        String decision = branchDecisions.get(new NodeEpoch(nodeId, epoch));
        if (decision != null || exact) return decision;
        for (int q = epoch - 1; q >= 0; q--) {
            decision = branchDecisions.get(new NodeEpoch(nodeId, q));
            if (decision != null) return decision;
        }
        return null;
    }

    /** Latest unconsumed token visible to the node on the edge at the epoch; null when none. Caller holds the lock. */
    private Token unconsumed(String nodeId, ExecutableEdge edge, int epoch) {
        if (edge.isLoopScoped()) {
            return unconsumedAt(nodeId, edge.getId(), epoch);
        }
        NavigableSet<Integer> epochs = epochsByEdge.get(edge.getId());
        if (epochs == null) return null;
        for (Integer q : epochs.headSet(epoch, true).descendingSet()) {
            Token token = unconsumedAt(nodeId, edge.getId(), q);
            if (token != null) return token;
        }
        return null;
    }

    private Token unconsumedAt(String nodeId, String edgeId, int epoch) {
        List<Token> tokens = store.get(new EdgeEpoch(edgeId, epoch));
        if (tokens == null || tokens.isEmpty()) return null;
        int cursor = cursors.getOrDefault(new CursorKey(nodeId, edgeId, epoch), 0);
        return tokens.size() > cursor ? tokens.get(tokens.size() - 1) : null;
    }

    /**
     * Epochs, ascending, at which at least one incoming edge of the node holds a token it has not consumed.
     */
    public SortedSet<Integer> pendingEpochs(String nodeId) {
        requireNode(nodeId);
        SortedSet<Integer> pending = new TreeSet<>();
        lock.readLock().lock();
        try {
            for (ExecutableEdge edge : diagram.incomingEdges(nodeId)) {
                NavigableSet<Integer> epochs = epochsByEdge.get(edge.getId());
                if (epochs == null) continue;
                for (Integer epoch : epochs) {
                    if (unconsumedAt(nodeId, edge.getId(), epoch) != null) pending.add(epoch);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return pending;
    }

    /** Most recent decision of a branching node, across epochs; null before it fired. */
    public String getBranchDecision(String nodeId) {
        lock.readLock().lock();
        try {
            return latestBranch.get(nodeId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public String getBranchDecision(String nodeId, int epoch) {
        lock.readLock().lock();
        try {
            return branchDecisions.get(new NodeEpoch(nodeId, epoch));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Tokens published on the edge in the epoch, in sequence order. */
    public List<Token> tokens(String edgeId, int epoch) {
        lock.readLock().lock();
        try {
            return List.copyOf(store.getOrDefault(new EdgeEpoch(edgeId, epoch), List.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Highest sequence the node consumed on the edge in the epoch; 0 when none. */
    public int cursor(String nodeId, String edgeId, int epoch) {
        lock.readLock().lock();
        try {
            return cursors.getOrDefault(new CursorKey(nodeId, edgeId, epoch), 0);
        } finally {
            lock.readLock().unlock();
        }
    }

    public TokenManagerSnapshot snapshot() {
        lock.readLock().lock();
        try {
            List<Token> tokens = new ArrayList<>();
            store.values().forEach(tokens::addAll);
            tokens.sort(Comparator.comparing(Token::getEdgeId)
                    .thenComparingInt(Token::getEpoch)
                    .thenComparingInt(Token::getSequence));
            List<TokenManagerSnapshot.CursorEntry> cursorEntries = new ArrayList<>();
            cursors.forEach((k, seq) -> cursorEntries.add(
                    new TokenManagerSnapshot.CursorEntry(k.nodeId(), k.edgeId(), k.epoch(), seq)));
            cursorEntries.sort(Comparator.comparing(TokenManagerSnapshot.CursorEntry::nodeId)
                    .thenComparing(TokenManagerSnapshot.CursorEntry::edgeId)
                    .thenComparingInt(TokenManagerSnapshot.CursorEntry::epoch));
            List<TokenManagerSnapshot.BranchEntry> branchEntries = new ArrayList<>();
            branchDecisions.forEach((k, port) -> branchEntries.add(
                    new TokenManagerSnapshot.BranchEntry(k.nodeId(), k.epoch(), port)));
            branchEntries.sort(Comparator.comparing(TokenManagerSnapshot.BranchEntry::nodeId)
                    .thenComparingInt(TokenManagerSnapshot.BranchEntry::epoch));
            return new TokenManagerSnapshot(currentEpoch, tokens, cursorEntries, branchEntries, latestBranch);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces all state with the snapshot's.
     *
     * @throws IllegalArgumentException if the snapshot names unknown edges or has sequence gaps
     */
    public void restore(TokenManagerSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        lock.writeLock().lock();
        try {
            store.clear();
            epochsByEdge.clear();
            cursors.clear();
            branchDecisions.clear();
            latestBranch.clear();
            currentEpoch = snapshot.currentEpoch();
            List<Token> tokens = new ArrayList<>(snapshot.tokens());
            tokens.sort(Comparator.comparing(Token::getEdgeId)
                    .thenComparingInt(Token::getEpoch)
                    .thenComparingInt(Token::getSequence));
            for (Token token : tokens) {
                if (diagram.getEdge(token.getEdgeId()) == null) {
                    throw new IllegalArgumentException("Snapshot token on unknown edge " + token.getEdgeId());
                }
                List<Token> list = store.computeIfAbsent(new EdgeEpoch(token.getEdgeId(), token.getEpoch()), k -> new ArrayList<>());
                if (token.getSequence() != list.size() + 1) {
                    throw new IllegalArgumentException("Snapshot sequence gap on " + token.getEdgeId()
                            + " epoch " + token.getEpoch() + " at " + token.getSequence());
                }
                list.add(token);
                epochsByEdge.computeIfAbsent(token.getEdgeId(), k -> new TreeSet<>()).add(token.getEpoch());
            }
            for (TokenManagerSnapshot.CursorEntry c : snapshot.cursors()) {
                cursors.put(new CursorKey(c.nodeId(), c.edgeId(), c.epoch()), c.sequence());
            }
            for (TokenManagerSnapshot.BranchEntry b : snapshot.branchDecisions()) {
                branchDecisions.put(new NodeEpoch(b.nodeId(), b.epoch()), b.port());
            }
            latestBranch.putAll(snapshot.latestBranchDecisions());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Node requireNode(String nodeId) {
        Node node = diagram.getNode(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        }
        return node;
    }
}
