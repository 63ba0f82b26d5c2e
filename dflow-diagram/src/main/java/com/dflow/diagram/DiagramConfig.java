package com.dflow.diagram;

import com.dflow.diagram.description.DiagramDescription;
import com.dflow.diagram.model.ExecutableDiagram;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON binding for diagram descriptions and compiled diagrams. Serialization excludes null values.
 */
public final class DiagramConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private DiagramConfig() {
    }

    /**
     * Deserializes a diagram description.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static DiagramDescription fromJson(String json) {
        try {
            return MAPPER.readValue(json, DiagramDescription.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String toJson(DiagramDescription description) {
        try {
            return MAPPER.writeValueAsString(description);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Serializes a compiled diagram, e.g. for inspection tooling. */
    public static String toJson(ExecutableDiagram diagram) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(diagram);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static ExecutableDiagram executableFromJson(String json) {
        try {
            return MAPPER.readValue(json, ExecutableDiagram.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
