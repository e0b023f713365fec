package com.knowledge.crossmodal.similarity;

/**
 * String similarity on normalized surface forms, scored in [0.0, 1.0].
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    String getName();
}
