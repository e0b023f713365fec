package com.knowledge.crossmodal.aggregation;

import com.knowledge.crossmodal.core.model.EvidenceItem;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Full derivation of a claim's posterior, sufficient to replay it.
 *
 * @param evidence          evidence in processing order (ascending id)
 * @param links             dependency links found, empty for the closed form
 * @param clusters          clusters in processing order
 * @param runningPosteriors posterior after each cluster was folded in
 * @param method            {@link #METHOD_CLOSED_FORM} or {@link #METHOD_CLUSTERED}
 * @param lowerTrust        true when dependency detection failed and independence was assumed
 */
public record AuditTrail(
        String claimId,
        List<EvidenceItem> evidence,
        List<DependencyLink> links,
        List<EvidenceCluster> clusters,
        List<Double> runningPosteriors,
        double prior,
        double posterior,
        String method,
        String methodVersion,
        boolean lowerTrust,
        List<String> warnings,
        Instant computedAt
) {
    public static final String METHOD_VERSION = "bayes-dependency-clusters/1";
    public static final String METHOD_CLOSED_FORM = "closed-form-independent";
    public static final String METHOD_CLUSTERED = "dependency-clustered";

    public AuditTrail {
        Objects.requireNonNull(claimId, "claimId is required");
        Objects.requireNonNull(method, "method is required");
        Objects.requireNonNull(methodVersion, "methodVersion is required");
        Objects.requireNonNull(computedAt, "computedAt is required");
        evidence = List.copyOf(evidence);
        links = List.copyOf(links);
        clusters = List.copyOf(clusters);
        runningPosteriors = List.copyOf(runningPosteriors);
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean isClustered() {
        return METHOD_CLUSTERED.equals(method);
    }

    /**
     * Same derivation regardless of when it was computed or for which claim record.
     */
    public boolean sameResult(AuditTrail other) {
        return other != null
                && evidence.equals(other.evidence)
                && links.equals(other.links)
                && clusters.equals(other.clusters)
                && runningPosteriors.equals(other.runningPosteriors)
                && Double.compare(prior, other.prior) == 0
                && Double.compare(posterior, other.posterior) == 0
                && method.equals(other.method)
                && methodVersion.equals(other.methodVersion)
                && lowerTrust == other.lowerTrust;
    }
}
