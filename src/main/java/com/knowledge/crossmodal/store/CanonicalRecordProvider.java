package com.knowledge.crossmodal.store;

import java.util.Optional;

/**
 * Source of truth the store rebuilds projections from.
 */
@FunctionalInterface
public interface CanonicalRecordProvider {

    Optional<CanonicalRecord> fetch(String recordId);
}
