package com.knowledge.crossmodal.projection;

import com.knowledge.crossmodal.core.model.Claim;
import com.knowledge.crossmodal.core.model.ClaimObject;
import com.knowledge.crossmodal.core.model.Entity;
import com.knowledge.crossmodal.core.model.Mention;
import com.knowledge.crossmodal.store.CanonicalRecord;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row per record in the {@value #ENTITY_TABLE} or {@value #CLAIM_TABLE} table.
 */
public class TableProjector implements Projector<TableRow> {

    public static final String ENTITY_TABLE = "entities";
    public static final String CLAIM_TABLE = "claims";

    @Override
    public TableRow project(CanonicalRecord record) {
        if (record instanceof CanonicalEntity entity) {
            return projectEntity(entity);
        }
        if (record instanceof CanonicalClaim claim) {
            return projectClaim(claim);
        }
        throw new IllegalArgumentException("Unsupported record type: " + record.getClass().getName());
    }

    private TableRow projectEntity(CanonicalEntity record) {
        Entity entity = record.entity();
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("id", entity.getId());
        columns.put("canonical_name", entity.getCanonicalName());
        columns.put("type", entity.getTypeLabel());
        columns.put("status", entity.getStatus().name());
        columns.put("mention_count", entity.getMentionLinks().size());
        columns.put("source_count", record.mentions().stream().map(Mention::sourceId).distinct().count());
        columns.put("merged_into", entity.getMergedInto());
        return new TableRow(entity.getId(), ENTITY_TABLE, columns,
                Map.of("identity_confidence", entity.getIdentityConfidence()));
    }

    private TableRow projectClaim(CanonicalClaim record) {
        Claim claim = record.claim();
        ClaimObject object = claim.getKey().object();
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("id", claim.getId());
        columns.put("label", record.label());
        columns.put("subject_id", claim.getKey().subjectId());
        columns.put("predicate", claim.getKey().predicate());
        columns.put("object_id", object.isEntity() ? object.entityId() : null);
        columns.put("object_value", object.isEntity() ? null : object.literal());
        columns.put("evidence_count", claim.getEvidence().size());
        columns.put("status", claim.getStatus().name());
        columns.put("merged_into", claim.getMergedInto());

        Map<String, Double> confidences = new LinkedHashMap<>();
        confidences.put("posterior_confidence",
                claim.getPosterior().isPresent() ? claim.getPosterior().getAsDouble() : null);
        return new TableRow(claim.getId(), CLAIM_TABLE, columns, confidences);
    }
}
