package com.knowledge.crossmodal.identity;

/**
 * A candidate entity and its similarity to the mention being resolved.
 */
public record ScoredCandidate(String entityId, double score) {
}
