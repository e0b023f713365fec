package com.knowledge.crossmodal.similarity;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Token-set overlap: |A ∩ B| / |A ∪ B| on whitespace tokens.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        return of(tokens(s1), tokens(s2));
    }

    @Override
    public String getName() {
        return "Jaccard";
    }

    /**
     * Jaccard index of two sets; two empty sets score 0.
     */
    public static <T> double of(Set<T> a, Set<T> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int shared = 0;
        for (T t : a) {
            if (b.contains(t)) {
                shared++;
            }
        }
        return (double) shared / (a.size() + b.size() - shared);
    }

    static Set<String> tokens(String s) {
        Set<String> tokens = new HashSet<>();
        for (String token : s.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
