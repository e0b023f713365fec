package com.knowledge.crossmodal.embedding;

import java.util.Locale;

/**
 * Feature-hashing embedding over padded character trigrams, L2-normalized.
 * Uses {@link String#hashCode()}, whose value is fixed by the language, so vectors
 * are stable across JVMs and restarts.
 */
public class HashingEmbeddingFunction implements EmbeddingFunction {

    public static final int DEFAULT_DIMENSION = 64;

    private final int dimension;

    public HashingEmbeddingFunction() {
        this(DEFAULT_DIMENSION);
    }

    public HashingEmbeddingFunction(int dimension) {
        if (dimension < 8) {
            throw new IllegalArgumentException("dimension must be >= 8");
        }
        this.dimension = dimension;
    }

    @Override
    public double[] embed(String text) {
        double[] vector = new double[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }
        String padded = "  " + text.toLowerCase(Locale.ROOT).strip() + " ";
        for (int i = 0; i + 3 <= padded.length(); i++) {
            int hash = padded.substring(i, i + 3).hashCode();
            int bucket = Math.floorMod(hash, dimension);
            // high bit picks the sign so collisions partly cancel
            vector[bucket] += (hash & 0x40000000) == 0 ? 1.0 : -1.0;
        }
        double norm = 0.0;
        for (double v : vector) {
            norm += v * v;
        }
        if (norm > 0.0) {
            norm = Math.sqrt(norm);
            for (int i = 0; i < dimension; i++) {
                vector[i] /= norm;
            }
        }
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String modelId() {
        return "hashing-trigram-" + dimension;
    }
}
