package com.knowledge.crossmodal.projection;

import com.knowledge.crossmodal.store.CanonicalRecord;

/**
 * Derives one modality's encoding from canonical data. Implementations are stateless and
 * deterministic: equal canonical data yields equal projections.
 */
@FunctionalInterface
public interface Projector<P> {

    P project(CanonicalRecord record);
}
