package com.knowledge.crossmodal.aggregation;

/**
 * Why two evidence items were judged dependent.
 */
public enum DependencyKind {
    /** An operator declared the items to share an upstream. */
    DECLARED,
    /** Both items carry the same dependency tag. */
    SHARED_TAG,
    /** Both items come from the same source. */
    SHARED_SOURCE,
    /** The items' citation sets overlap. */
    CITATION_OVERLAP,
    /** One item cites the other's source shortly after it appeared, with the same stance. */
    TEMPORAL_CASCADE
}
