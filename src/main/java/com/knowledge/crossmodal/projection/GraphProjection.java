package com.knowledge.crossmodal.projection;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Node-and-edge encoding of one record: {@code {id, type, properties, edges}}.
 * Properties are kept in key order and edges in claim-id order, so equal canonical
 * data always yields an equal projection.
 */
public record GraphProjection(String id, String type, Map<String, Object> properties, List<GraphEdge> edges) {
    public GraphProjection {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(type, "type is required");
        properties = Collections.unmodifiableMap(new TreeMap<>(properties != null ? properties : Map.of()));
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    public Object property(String name) {
        return properties.get(name);
    }
}
