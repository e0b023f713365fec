package com.knowledge.crossmodal.aggregation;

import java.util.List;

/**
 * A group of mutually dependent evidence items pulling the same way, and its contribution to the posterior.
 *
 * @param evidenceIds     member ids, ascending
 * @param strength        strongest dependency between two members, 0 for a singleton
 * @param logOdds         sum of the members' signed log-odds, before discounting
 * @param weightedLogOdds contribution after discounting: the strongest member plus {@code 1 - strength}
 *                        times the others
 * @param posterior       posterior from the prior and this cluster alone
 */
public record EvidenceCluster(List<String> evidenceIds, double strength, double logOdds, double weightedLogOdds,
                              double posterior) {

    public EvidenceCluster {
        evidenceIds = List.copyOf(evidenceIds);
    }

    /**
     * Share of the raw log-odds that survives discounting, 1 for a singleton.
     */
    public double weight() {
        return logOdds == 0.0 ? 1.0 : weightedLogOdds / logOdds;
    }

    public int size() {
        return evidenceIds.size();
    }
}
