package com.knowledge.crossmodal.aggregation;

import com.knowledge.crossmodal.core.model.DependencyDeclaration;
import com.knowledge.crossmodal.core.model.EvidenceItem;
import com.knowledge.crossmodal.error.DependencyDetectionException;

import java.util.List;

/**
 * Finds pairwise dependencies between the evidence items of one claim.
 * Implementations must be deterministic for a given input.
 */
@FunctionalInterface
public interface DependencyDetector {

    /**
     * @param evidence     evidence in ascending id order
     * @param declarations operator-declared dependency groups
     * @throws DependencyDetectionException if the dependency structure cannot be determined
     */
    List<DependencyLink> detect(List<EvidenceItem> evidence, List<DependencyDeclaration> declarations);
}
