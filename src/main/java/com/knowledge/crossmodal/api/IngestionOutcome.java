package com.knowledge.crossmodal.api;

import com.knowledge.crossmodal.error.KnowledgeException;
import com.knowledge.crossmodal.identity.ResolutionResult;

import java.util.ArrayList;
import java.util.List;

/**
 * What one source document contributed.
 *
 * @param accepted        false when the extraction was rejected as a whole
 * @param rejectionReason why the extraction was rejected, null when accepted
 * @param failures        typed errors of individual mentions and claims
 */
public record IngestionOutcome(
        String sourceId,
        boolean accepted,
        String rejectionReason,
        List<ResolutionResult> resolutions,
        List<ClaimResult> claims,
        List<KnowledgeException> failures
) {
    public IngestionOutcome {
        resolutions = resolutions != null ? List.copyOf(resolutions) : List.of();
        claims = claims != null ? List.copyOf(claims) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public static IngestionOutcome rejected(String sourceId, String reason) {
        return new IngestionOutcome(sourceId, false, reason, List.of(), List.of(), List.of());
    }

    public static IngestionOutcome of(String sourceId, StageResult<ResolutionResult> mentions,
                                      StageResult<ClaimResult> claims) {
        List<KnowledgeException> failures = new ArrayList<>(mentions.failures());
        failures.addAll(claims.failures());
        return new IngestionOutcome(sourceId, true, null, mentions.results(), claims.results(), failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
