package com.knowledge.crossmodal.api;

import com.knowledge.crossmodal.aggregation.ClaimAggregationService;
import com.knowledge.crossmodal.core.model.Claim;
import com.knowledge.crossmodal.core.model.ClaimObject;
import com.knowledge.crossmodal.core.model.Entity;
import com.knowledge.crossmodal.identity.IdentityResolutionService;
import com.knowledge.crossmodal.projection.CanonicalClaim;
import com.knowledge.crossmodal.projection.CanonicalEntity;
import com.knowledge.crossmodal.projection.GraphEdge;
import com.knowledge.crossmodal.projection.GraphProjector;
import com.knowledge.crossmodal.store.CanonicalRecord;
import com.knowledge.crossmodal.store.CanonicalRecordProvider;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds canonical records from the identity and claim services, the source of truth
 * every projection is derived from.
 */
public class KnowledgeRecordProvider implements CanonicalRecordProvider {

    private final IdentityResolutionService identityService;
    private final ClaimAggregationService claimService;

    public KnowledgeRecordProvider(IdentityResolutionService identityService, ClaimAggregationService claimService) {
        this.identityService = identityService;
        this.claimService = claimService;
    }

    @Override
    public Optional<CanonicalRecord> fetch(String recordId) {
        Optional<Entity> entity = identityService.getEntity(recordId);
        if (entity.isPresent()) {
            return Optional.of(entityRecord(entity.get()));
        }
        return claimService.getClaim(recordId).map(this::claimRecord);
    }

    private CanonicalRecord entityRecord(Entity entity) {
        List<GraphEdge> edges = entity.isRetired()
                ? List.of()
                : claimService.claimsAbout(entity.getId()).stream()
                        .map(GraphProjector::edgeFor)
                        .collect(Collectors.toList());
        return new CanonicalEntity(entity, identityService.mentionsOf(entity.getId()), edges);
    }

    private CanonicalRecord claimRecord(Claim claim) {
        String subjectLabel = labelOf(claim.getKey().subjectId());
        ClaimObject object = claim.getKey().object();
        String objectLabel = object.isEntity() ? labelOf(object.entityId()) : object.literal();
        return new CanonicalClaim(claim, subjectLabel, objectLabel);
    }

    private String labelOf(String entityId) {
        return identityService.getEntity(entityId).map(Entity::getCanonicalName).orElse(entityId);
    }
}
