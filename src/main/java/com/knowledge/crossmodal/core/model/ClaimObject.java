package com.knowledge.crossmodal.core.model;

import java.util.Objects;

/**
 * Object position of a claim: either another entity or a literal value.
 */
public record ClaimObject(String entityId, String literal) {
    public ClaimObject {
        if ((entityId == null) == (literal == null)) {
            throw new IllegalArgumentException("exactly one of entityId or literal is required");
        }
    }

    public static ClaimObject entity(String entityId) {
        return new ClaimObject(Objects.requireNonNull(entityId, "entityId is required"), null);
    }

    public static ClaimObject literal(String value) {
        return new ClaimObject(null, Objects.requireNonNull(value, "literal is required"));
    }

    public boolean isEntity() {
        return entityId != null;
    }

    /**
     * Entity id or literal value, whichever this object holds.
     */
    public String value() {
        return isEntity() ? entityId : literal;
    }

    @Override
    public String toString() {
        return isEntity() ? "entity:" + entityId : "literal:" + literal;
    }
}
