package com.knowledge.crossmodal.projection;

import com.knowledge.crossmodal.embedding.EmbeddingFunction;
import com.knowledge.crossmodal.store.CanonicalRecord;

/**
 * Embeds an entity's canonical name or a claim's triple label.
 */
public class VectorProjector implements Projector<VectorProjection> {

    private final EmbeddingFunction embeddingFunction;

    public VectorProjector(EmbeddingFunction embeddingFunction) {
        this.embeddingFunction = embeddingFunction;
    }

    @Override
    public VectorProjection project(CanonicalRecord record) {
        String label = labelOf(record);
        return new VectorProjection(record.id(), label, embeddingFunction.modelId(), embeddingFunction.embed(label));
    }

    public static String labelOf(CanonicalRecord record) {
        if (record instanceof CanonicalEntity entity) {
            return entity.entity().getCanonicalName();
        }
        if (record instanceof CanonicalClaim claim) {
            return claim.label();
        }
        throw new IllegalArgumentException("Unsupported record type: " + record.getClass().getName());
    }

    public EmbeddingFunction getEmbeddingFunction() {
        return embeddingFunction;
    }
}
