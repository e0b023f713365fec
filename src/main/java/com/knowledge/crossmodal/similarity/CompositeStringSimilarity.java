package com.knowledge.crossmodal.similarity;

/**
 * Weighted sum of Levenshtein, Jaro-Winkler and Jaccard scores.
 */
public class CompositeStringSimilarity implements SimilarityAlgorithm {

    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();
    private final JaroWinklerSimilarity jaroWinkler = new JaroWinklerSimilarity();
    private final JaccardSimilarity jaccard = new JaccardSimilarity();
    private final SimilarityWeights weights;

    public CompositeStringSimilarity() {
        this(SimilarityWeights.defaultWeights());
    }

    public CompositeStringSimilarity(SimilarityWeights weights) {
        this.weights = weights;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        return weights.levenshteinWeight() * levenshtein.compute(s1, s2)
                + weights.jaroWinklerWeight() * jaroWinkler.compute(s1, s2)
                + weights.jaccardWeight() * jaccard.compute(s1, s2);
    }

    @Override
    public String getName() {
        return "Composite";
    }

    public SimilarityWeights getWeights() {
        return weights;
    }
}
