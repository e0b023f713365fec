package com.knowledge.crossmodal.similarity;

/**
 * Scores how likely a normalized mention refers to a candidate entity.
 * Must be deterministic and return a value in [0.0, 1.0]; 0.0 means the candidate
 * is incompatible and can never be chosen.
 */
@FunctionalInterface
public interface MentionSimilarity {

    double score(String normalizedText, String typeLabel, String context, CandidateProfile candidate);
}
