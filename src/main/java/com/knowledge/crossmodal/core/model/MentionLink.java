package com.knowledge.crossmodal.core.model;

/**
 * How a mention is attached to its entity.
 *
 * @param confidence extractor-reported confidence of the mention
 * @param weight     similarity weight the mention contributes to the identity confidence
 * @param ambiguous  whether the attachment was made while another candidate tied
 */
public record MentionLink(double confidence, double weight, boolean ambiguous) {
    public MentionLink {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
        if (weight <= 0.0 || weight > 1.0) {
            throw new IllegalArgumentException("weight must be in (0.0, 1.0]");
        }
    }

    public static MentionLink founding(double confidence) {
        return new MentionLink(confidence, 1.0, false);
    }
}
