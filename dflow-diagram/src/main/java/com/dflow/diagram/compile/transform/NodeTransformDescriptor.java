package com.dflow.diagram.compile.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Data-driven config normalization for one node type: field renames on ingest, removals, defaults for
 * missing optional fields and a custom hook, applied in that order.
 */
public final class NodeTransformDescriptor {

    public static final NodeTransformDescriptor IDENTITY = builder().build();

    private final Map<String, String> renames;
    private final Set<String> removals;
    private final Map<String, Object> defaults;
    private final NodeTransformHook hook;

    private NodeTransformDescriptor(Builder b) {
        this.renames = Collections.unmodifiableMap(new LinkedHashMap<>(b.renames));
        this.removals = Collections.unmodifiableSet(new LinkedHashSet<>(b.removals));
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(b.defaults));
        this.hook = b.hook;
    }

    public Map<String, Object> apply(Map<String, Object> rawConfig) {
        Map<String, Object> config = new LinkedHashMap<>(rawConfig != null ? rawConfig : Map.of());
        for (Map.Entry<String, String> rename : renames.entrySet()) {
            if (config.containsKey(rename.getKey())) {
                Object value = config.remove(rename.getKey());
                config.putIfAbsent(rename.getValue(), value);
            }
        }
        for (String removed : removals) {
            config.remove(removed);
        }
        for (Map.Entry<String, Object> d : defaults.entrySet()) {
            if (config.get(d.getKey()) == null) {
                config.put(d.getKey(), d.getValue());
            }
        }
        hook.apply(config);
        return config;
    }

    public Map<String, String> getRenames() {
        return renames;
    }

    public Set<String> getRemovals() {
        return removals;
    }

    public Map<String, Object> getDefaults() {
        return defaults;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, String> renames = new LinkedHashMap<>();
        private final Set<String> removals = new LinkedHashSet<>();
        private final Map<String, Object> defaults = new LinkedHashMap<>();
        private NodeTransformHook hook = NodeTransformHook.NONE;

        public Builder rename(String from, String to) {
            renames.put(from, to);
            return this;
        }

        public Builder remove(String... fields) {
            removals.addAll(Set.of(fields));
            return this;
        }

        public Builder defaultValue(String field, Object value) {
            defaults.put(field, value);
            return this;
        }

        public Builder hook(NodeTransformHook hook) {
            this.hook = hook != null ? hook : NodeTransformHook.NONE;
            return this;
        }

        public NodeTransformDescriptor build() {
            return new NodeTransformDescriptor(this);
        }
    }
}
