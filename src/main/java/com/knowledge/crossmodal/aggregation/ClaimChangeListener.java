package com.knowledge.crossmodal.aggregation;

import java.util.Set;

/**
 * Notified after a claim was opened, re-aggregated, re-keyed or retired. Runs on the
 * calling thread after the claim locks are released.
 */
@FunctionalInterface
public interface ClaimChangeListener {

    /**
     * @param affectedEntityIds entities whose outgoing claim edges may have changed,
     *                          including the previous subject of a re-keyed claim
     */
    void onClaimChanged(String claimId, Set<String> affectedEntityIds);
}
