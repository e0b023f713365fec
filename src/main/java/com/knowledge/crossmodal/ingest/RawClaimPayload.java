package com.knowledge.crossmodal.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.knowledge.crossmodal.core.model.EvidenceItem;
import com.knowledge.crossmodal.core.model.Stance;
import com.knowledge.crossmodal.error.MalformedPayloadException;
import com.knowledge.crossmodal.error.Provenance;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * A (subject, predicate, object) assertion from one source. References are surface forms
 * that are resolved against known entities before the claim is opened.
 *
 * <p>{@code object_kind} may be {@code "entity"} or {@code "literal"}; when absent the object
 * is treated as an entity if one matches and as a literal otherwise.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawClaimPayload(
        @JsonProperty("subject_ref") String subjectRef,
        @JsonProperty("subject_type") String subjectType,
        @JsonProperty("predicate") String predicate,
        @JsonProperty("object_ref") String objectRef,
        @JsonProperty("object_type") String objectType,
        @JsonProperty("object_kind") String objectKind,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("source_id") String sourceId,
        @JsonProperty("evidence_id") String evidenceId,
        @JsonProperty("stance") String stance,
        @JsonProperty("dependency_tag") String dependencyTag,
        @JsonProperty("citations") Set<String> citations,
        @JsonProperty("observed_at") Instant observedAt
) implements EvidencePayload {

    public static final String OBJECT_ENTITY = "entity";
    public static final String OBJECT_LITERAL = "literal";

    @Override
    public String kind() {
        return KIND_CLAIM;
    }

    @Override
    public void validate() {
        Provenance provenance = Provenance.builder().source(sourceId).build();
        requireText(sourceId, "source_id", provenance);
        requireText(subjectRef, "subject_ref", provenance);
        requireText(predicate, "predicate", provenance);
        requireText(objectRef, "object_ref", provenance);
        if (confidence == null || confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
            throw new MalformedPayloadException("claim: confidence must be between 0 and 1, got " + confidence,
                    provenance);
        }
        if (objectKind != null && !OBJECT_ENTITY.equalsIgnoreCase(objectKind)
                && !OBJECT_LITERAL.equalsIgnoreCase(objectKind)) {
            throw new MalformedPayloadException("claim: object_kind must be 'entity' or 'literal'", provenance);
        }
        try {
            Stance.fromLabel(stance);
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException("claim: " + e.getMessage(), provenance, e);
        }
    }

    public boolean objectIsLiteral() {
        return objectKind != null && OBJECT_LITERAL.equalsIgnoreCase(objectKind);
    }

    public boolean objectIsEntity() {
        return objectKind != null && OBJECT_ENTITY.equalsIgnoreCase(objectKind);
    }

    /**
     * The evidence this payload contributes. Without an explicit evidence id, one is derived
     * from the source, the triple as written, the stance and the confidence.
     */
    public EvidenceItem toEvidence() {
        validate();
        Stance parsedStance = Stance.fromLabel(stance);
        String id = evidenceId;
        if (id == null || id.isBlank()) {
            String key = String.join("\u0000", sourceId, subjectRef.strip(), predicate.strip().toLowerCase(Locale.ROOT),
                    objectRef.strip(), parsedStance.name(), Double.toString(confidence));
            id = "ev-" + UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
        }
        return EvidenceItem.builder()
                .evidenceId(id)
                .sourceId(sourceId)
                .confidence(confidence)
                .stance(parsedStance)
                .dependencyTag(dependencyTag)
                .citations(citations)
                .observedAt(observedAt)
                .build();
    }

    private static void requireText(String value, String field, Provenance provenance) {
        if (value == null || value.isBlank()) {
            throw new MalformedPayloadException("claim: " + field + " is required", provenance);
        }
    }
}
