package com.knowledge.crossmodal.projection;

import com.knowledge.crossmodal.store.CrossModalRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only adjacency list over a set of committed snapshots.
 */
public final class GraphView {

    private final Map<String, GraphProjection> nodes;

    private GraphView(Map<String, GraphProjection> nodes) {
        this.nodes = nodes;
    }

    public static GraphView of(Collection<CrossModalRecord> records) {
        Map<String, GraphProjection> nodes = new LinkedHashMap<>();
        records.forEach(r -> nodes.put(r.id(), r.graph()));
        return new GraphView(Collections.unmodifiableMap(nodes));
    }

    public Optional<GraphProjection> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public Collection<GraphProjection> nodes() {
        return nodes.values();
    }

    public List<GraphProjection> nodesOfType(String type) {
        return nodes.values().stream()
                .filter(n -> n.type().equalsIgnoreCase(type))
                .collect(Collectors.toList());
    }

    public List<GraphEdge> edgesFrom(String id) {
        GraphProjection node = nodes.get(id);
        return node != null ? node.edges() : List.of();
    }

    /**
     * Ids of the nodes reachable over one outgoing non-literal edge.
     */
    public List<String> neighbours(String id) {
        List<String> result = new ArrayList<>();
        for (GraphEdge edge : edgesFrom(id)) {
            if (!edge.isLiteral() && !result.contains(edge.targetId())) {
                result.add(edge.targetId());
            }
        }
        return result;
    }

    /**
     * Adjacency list: node id to the target ids of its non-literal edges.
     */
    public Map<String, List<String>> adjacency() {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        nodes.keySet().forEach(id -> adjacency.put(id, neighbours(id)));
        return adjacency;
    }

    public int size() {
        return nodes.size();
    }
}
