package com.knowledge.crossmodal.projection;

import com.knowledge.crossmodal.core.model.Claim;
import com.knowledge.crossmodal.core.model.ClaimObject;
import com.knowledge.crossmodal.core.model.Entity;
import com.knowledge.crossmodal.store.CanonicalRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Entities become typed nodes carrying the edges of the claims they are the subject of.
 * Claims become reified {@code CLAIM} nodes with {@code subject} and {@code object} edges.
 */
public class GraphProjector implements Projector<GraphProjection> {

    public static final String CLAIM_NODE_TYPE = "CLAIM";

    @Override
    public GraphProjection project(CanonicalRecord record) {
        if (record instanceof CanonicalEntity entity) {
            return projectEntity(entity);
        }
        if (record instanceof CanonicalClaim claim) {
            return projectClaim(claim);
        }
        throw new IllegalArgumentException("Unsupported record type: " + record.getClass().getName());
    }

    private GraphProjection projectEntity(CanonicalEntity record) {
        Entity entity = record.entity();
        Map<String, Object> properties = new HashMap<>();
        properties.put("canonical_name", entity.getCanonicalName());
        properties.put("status", entity.getStatus().name());
        properties.put("identity_confidence", entity.getIdentityConfidence());
        properties.put("mention_count", entity.getMentionLinks().size());
        if (entity.getMergedInto() != null) {
            properties.put("merged_into", entity.getMergedInto());
        }
        return new GraphProjection(entity.getId(), entity.getTypeLabel(), properties, record.outgoingEdges());
    }

    private GraphProjection projectClaim(CanonicalClaim record) {
        Claim claim = record.claim();
        ClaimObject object = claim.getKey().object();
        Double posterior = claim.getPosterior().isPresent() ? claim.getPosterior().getAsDouble() : null;

        Map<String, Object> properties = new HashMap<>();
        properties.put("label", record.label());
        properties.put("subject_id", claim.getKey().subjectId());
        properties.put("predicate", claim.getKey().predicate());
        properties.put(object.isEntity() ? "object_id" : "object_value", object.value());
        properties.put("status", claim.getStatus().name());
        properties.put("evidence_count", claim.getEvidence().size());
        if (posterior != null) {
            properties.put("posterior_confidence", posterior);
            properties.put("method_version", claim.getMethodVersion());
        }
        if (claim.getMergedInto() != null) {
            properties.put("merged_into", claim.getMergedInto());
        }

        List<GraphEdge> edges = new ArrayList<>();
        edges.add(new GraphEdge("subject", claim.getKey().subjectId(), null, posterior, claim.getId()));
        edges.add(object.isEntity()
                ? new GraphEdge("object", object.entityId(), null, posterior, claim.getId())
                : new GraphEdge("object", null, object.literal(), posterior, claim.getId()));
        return new GraphProjection(claim.getId(), CLAIM_NODE_TYPE, properties, edges);
    }

    /**
     * Edge an entity node carries for a claim it is the subject of.
     */
    public static GraphEdge edgeFor(Claim claim) {
        ClaimObject object = claim.getKey().object();
        Double posterior = claim.getPosterior().isPresent() ? claim.getPosterior().getAsDouble() : null;
        return object.isEntity()
                ? new GraphEdge(claim.getKey().predicate(), object.entityId(), null, posterior, claim.getId())
                : new GraphEdge(claim.getKey().predicate(), null, object.literal(), posterior, claim.getId());
    }
}
