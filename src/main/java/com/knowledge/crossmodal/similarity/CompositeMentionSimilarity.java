package com.knowledge.crossmodal.similarity;

import com.knowledge.crossmodal.embedding.EmbeddingFunction;

import java.util.Locale;

/**
 * Default mention-to-entity similarity.
 * <ol>
 *   <li>Type gate: labels must agree (case-insensitively) unless one side is unknown.</li>
 *   <li>Name score: best over the candidate's surface forms of
 *       max(composite string similarity, initials-aware token alignment).</li>
 *   <li>Optional context blend: when a context weight and an embedding function are set
 *       and both sides carry context, the name score is blended with the best context cosine.</li>
 * </ol>
 */
public class CompositeMentionSimilarity implements MentionSimilarity {

    private final SimilarityAlgorithm stringSimilarity;
    private final SimilarityAlgorithm tokenSimilarity;
    private final EmbeddingFunction contextEmbedding;
    private final double contextWeight;

    public CompositeMentionSimilarity() {
        this(new CompositeStringSimilarity(), null, 0.0);
    }

    public CompositeMentionSimilarity(SimilarityAlgorithm stringSimilarity,
                                      EmbeddingFunction contextEmbedding, double contextWeight) {
        if (contextWeight < 0.0 || contextWeight > 0.5) {
            throw new IllegalArgumentException("contextWeight must be between 0.0 and 0.5");
        }
        if (contextWeight > 0.0 && contextEmbedding == null) {
            throw new IllegalArgumentException("contextEmbedding is required when contextWeight > 0");
        }
        this.stringSimilarity = stringSimilarity;
        this.tokenSimilarity = new InitialsTokenSimilarity();
        this.contextEmbedding = contextEmbedding;
        this.contextWeight = contextWeight;
    }

    @Override
    public double score(String normalizedText, String typeLabel, String context, CandidateProfile candidate) {
        if (!typesCompatible(typeLabel, candidate.typeLabel())) {
            return 0.0;
        }
        double name = 0.0;
        for (String form : candidate.surfaceForms()) {
            double s = Math.max(stringSimilarity.compute(normalizedText, form),
                    tokenSimilarity.compute(normalizedText, form));
            name = Math.max(name, s);
        }
        if (contextWeight == 0.0 || context == null || context.isBlank() || candidate.contexts().isEmpty()) {
            return clamp(name);
        }
        double[] query = contextEmbedding.embed(context);
        double best = 0.0;
        for (String other : candidate.contexts()) {
            best = Math.max(best, EmbeddingFunction.cosine(query, contextEmbedding.embed(other)));
        }
        return clamp((1.0 - contextWeight) * name + contextWeight * best);
    }

    static boolean typesCompatible(String a, String b) {
        if (isUnknown(a) || isUnknown(b)) {
            return true;
        }
        return a.trim().toUpperCase(Locale.ROOT).equals(b.trim().toUpperCase(Locale.ROOT));
    }

    private static boolean isUnknown(String label) {
        return label == null || label.isBlank() || label.equalsIgnoreCase("UNKNOWN");
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
