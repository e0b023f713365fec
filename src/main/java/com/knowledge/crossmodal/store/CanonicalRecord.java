package com.knowledge.crossmodal.store;

/**
 * Canonical data of an entity or claim, from which all three projections are derived.
 */
public interface CanonicalRecord {

    String id();

    RecordKind kind();
}
