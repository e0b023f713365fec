package com.knowledge.crossmodal.store;

/**
 * The three encodings every record is kept in.
 */
public enum Modality {
    GRAPH,
    TABLE,
    VECTOR
}
