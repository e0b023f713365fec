package com.knowledge.crossmodal.api;

import com.knowledge.crossmodal.aggregation.ClaimAggregationService;
import com.knowledge.crossmodal.aggregation.ClaimChangeListener;
import com.knowledge.crossmodal.core.model.Claim;
import com.knowledge.crossmodal.identity.IdentityChangeListener;
import com.knowledge.crossmodal.identity.IdentityResolutionService;
import com.knowledge.crossmodal.store.CrossModalEntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Reindexes every record an identity or claim change touches, so the store never trails
 * the canonical data. A failed reindex propagates to the operation that caused it; the
 * canonical change stays applied and a later reindex or reconcile catches the store up.
 */
public class CrossModalSynchronizer implements IdentityChangeListener, ClaimChangeListener {
    private static final Logger log = LoggerFactory.getLogger(CrossModalSynchronizer.class);

    private final CrossModalEntityStore store;
    private final IdentityResolutionService identityService;
    private final ClaimAggregationService claimService;

    public CrossModalSynchronizer(CrossModalEntityStore store, IdentityResolutionService identityService,
                                  ClaimAggregationService claimService) {
        this.store = store;
        this.identityService = identityService;
        this.claimService = claimService;
    }

    @Override
    public void onEntityChanged(String entityId) {
        store.reindex(entityId);
        // claim labels embed the subject's canonical name
        for (Claim claim : claimService.claimsAbout(entityId)) {
            store.reindex(claim.getId());
        }
    }

    @Override
    public void onMerge(String retiredEntityId, String survivorId) {
        log.debug("sync.merge retiredEntityId={} survivorId={}", retiredEntityId, survivorId);
        store.reindex(retiredEntityId);
        store.reindex(survivorId);
    }

    @Override
    public void onSplit(String sourceEntityId, String newEntityId) {
        log.debug("sync.split sourceEntityId={} newEntityId={}", sourceEntityId, newEntityId);
        store.reindex(sourceEntityId);
        store.reindex(newEntityId);
    }

    @Override
    public void onClaimChanged(String claimId, Set<String> affectedEntityIds) {
        store.reindex(claimId);
        for (String entityId : affectedEntityIds) {
            if (identityService.getEntity(entityId).isPresent()) {
                store.reindex(entityId);
            }
        }
    }
}
