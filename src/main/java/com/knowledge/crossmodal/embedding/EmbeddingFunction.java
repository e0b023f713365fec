package com.knowledge.crossmodal.embedding;

/**
 * Maps text to a fixed-length vector. Implementations must be deterministic:
 * the same input always yields a bit-identical vector, so vector projections
 * can be compared and rebuilt.
 */
public interface EmbeddingFunction {

    double[] embed(String text);

    int dimension();

    /**
     * Identifies the function and its parameters; stored with every vector projection.
     */
    String modelId();

    static double cosine(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
