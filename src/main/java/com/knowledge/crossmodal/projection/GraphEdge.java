package com.knowledge.crossmodal.projection;

import java.util.Objects;

/**
 * Outgoing edge of a graph node. Points either at another node or at a literal value.
 *
 * @param confidence posterior of the claim behind the edge; null while the claim is unaggregated
 */
public record GraphEdge(String predicate, String targetId, String literal, Double confidence, String claimId) {
    public GraphEdge {
        Objects.requireNonNull(predicate, "predicate is required");
        if ((targetId == null) == (literal == null)) {
            throw new IllegalArgumentException("exactly one of targetId or literal is required");
        }
    }

    public boolean isLiteral() {
        return literal != null;
    }
}
