package com.knowledge.crossmodal.projection;

import com.knowledge.crossmodal.core.model.Claim;
import com.knowledge.crossmodal.store.CanonicalRecord;
import com.knowledge.crossmodal.store.RecordKind;

import java.util.Objects;

/**
 * Canonical data of a claim.
 *
 * @param subjectLabel canonical name of the subject entity, used for the vector label
 * @param objectLabel  canonical name of the object entity, or the literal value
 */
public record CanonicalClaim(Claim claim, String subjectLabel, String objectLabel) implements CanonicalRecord {

    public CanonicalClaim {
        Objects.requireNonNull(claim, "claim is required");
        subjectLabel = subjectLabel != null ? subjectLabel : claim.getKey().subjectId();
        objectLabel = objectLabel != null ? objectLabel : claim.getKey().object().value();
    }

    @Override
    public String id() {
        return claim.getId();
    }

    @Override
    public RecordKind kind() {
        return RecordKind.CLAIM;
    }

    /**
     * Human-readable triple, e.g. "Tim Cook works_for Apple".
     */
    public String label() {
        return subjectLabel + " " + claim.getKey().predicate() + " " + objectLabel;
    }
}
