package com.dflow.diagram.description;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pre-parsed, loosely validated graph description: the compiler's only input. Produced by external
 * format parsers or bound directly from JSON with {@link com.dflow.diagram.DiagramConfig}.
 */
public final class DiagramDescription {

    private final String id;
    private final String name;
    private final List<NodeDescription> nodes;
    private final List<ConnectionDescription> connections;
    private final Map<String, Object> metadata;

    @JsonCreator
    public DiagramDescription(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("nodes") List<NodeDescription> nodes,
            @JsonProperty("connections") List<ConnectionDescription> connections,
            @JsonProperty("metadata") Map<String, Object> metadata) {
        this.id = id;
        this.name = name;
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.connections = connections != null ? List.copyOf(connections) : List.of();
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public DiagramDescription(List<NodeDescription> nodes, List<ConnectionDescription> connections) {
        this(null, null, nodes, connections, null);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<NodeDescription> getNodes() {
        return nodes;
    }

    public List<ConnectionDescription> getConnections() {
        return connections;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DiagramDescription that = (DiagramDescription) o;
        return Objects.equals(id, that.id)
                && Objects.equals(name, that.name)
                && nodes.equals(that.nodes)
                && connections.equals(that.connections)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, nodes, connections, metadata);
    }
}
