package com.knowledge.crossmodal.similarity;

/**
 * Order-preserving token alignment that accepts initials.
 * Each token of the shorter name is matched to the next unused token of the longer one:
 * an identical token scores 1.0, a single-letter initial matching the other token's first
 * letter scores {@value #INITIAL_SCORE}. The sum is divided by the longer token count,
 * so "t cook" vs "tim cook" scores 0.95 and "cook" vs "tim cook" scores 0.5.
 */
public class InitialsTokenSimilarity implements SimilarityAlgorithm {

    static final double INITIAL_SCORE = 0.9;

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isBlank() || s2.isBlank()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        String[] a = s1.strip().split("\\s+");
        String[] b = s2.strip().split("\\s+");
        String[] shorter = a.length <= b.length ? a : b;
        String[] longer = shorter == a ? b : a;

        double total = 0.0;
        int cursor = 0;
        for (String token : shorter) {
            for (int j = cursor; j < longer.length; j++) {
                double score = tokenScore(token, longer[j]);
                if (score > 0.0) {
                    total += score;
                    cursor = j + 1;
                    break;
                }
            }
        }
        return total / longer.length;
    }

    @Override
    public String getName() {
        return "InitialsToken";
    }

    private static double tokenScore(String x, String y) {
        if (x.equals(y)) {
            return 1.0;
        }
        if ((x.length() == 1 && y.length() > 1 && y.charAt(0) == x.charAt(0))
                || (y.length() == 1 && x.length() > 1 && x.charAt(0) == y.charAt(0))) {
            return INITIAL_SCORE;
        }
        return 0.0;
    }
}
