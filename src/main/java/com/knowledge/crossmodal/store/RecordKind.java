package com.knowledge.crossmodal.store;

public enum RecordKind {
    ENTITY,
    CLAIM
}
