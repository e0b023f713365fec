package com.knowledge.crossmodal.similarity;

/**
 * 1 - editDistance / maxLength.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        return 1.0 - (double) distance(s1, s2) / Math.max(s1.length(), s2.length());
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Two-row Wagner-Fischer over the shorter string.
     */
    static int distance(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        int[] prev = new int[shorter.length() + 1];
        int[] curr = new int[shorter.length() + 1];
        for (int i = 0; i < prev.length; i++) {
            prev[i] = i;
        }
        for (int j = 1; j <= longer.length(); j++) {
            curr[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i <= shorter.length(); i++) {
                int substitution = prev[i - 1] + (shorter.charAt(i - 1) == c ? 0 : 1);
                curr[i] = Math.min(substitution, Math.min(prev[i], curr[i - 1]) + 1);
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[shorter.length()];
    }
}
