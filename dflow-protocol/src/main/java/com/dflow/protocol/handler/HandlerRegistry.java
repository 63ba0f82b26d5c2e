package com.dflow.protocol.handler;

import com.dflow.diagram.model.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Node type to {@link NodeHandler}. Registration happens before a run starts; lookups during the run are
 * read-only. One handler per type.
 */
public final class HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<NodeType, NodeHandler> handlers = Collections.synchronizedMap(new EnumMap<>(NodeType.class));

    /**
     * Registers the handler for a node type.
     *
     * @throws IllegalArgumentException if the type is UNKNOWN or already has a handler
     */
    public HandlerRegistry register(NodeType type, NodeHandler handler) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        if (type == NodeType.UNKNOWN) {
            throw new IllegalArgumentException("Cannot register a handler for UNKNOWN node type");
        }
        if (handlers.putIfAbsent(type, handler) != null) {
            throw new IllegalArgumentException("Handler already registered for node type " + type.toValue());
        }
        if (log.isDebugEnabled()) {
            log.debug("Handler registered | nodeType={} | handler={}", type.toValue(), handler.getClass().getName());
        }
        return this;
    }

    /** Registers or replaces the handler for a node type. */
    public HandlerRegistry replace(NodeType type, NodeHandler handler) {
        Objects.requireNonNull(type, "type");
        handlers.put(type, Objects.requireNonNull(handler, "handler"));
        return this;
    }

    /**
     * @return the handler for the type, or null when none is registered
     */
    public NodeHandler handlerFor(NodeType type) {
        return type != null ? handlers.get(type) : null;
    }

    public boolean hasHandler(NodeType type) {
        return handlerFor(type) != null;
    }

    public Set<NodeType> registeredTypes() {
        synchronized (handlers) {
            return Set.copyOf(handlers.keySet());
        }
    }
}
