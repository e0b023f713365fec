package com.knowledge.crossmodal.error;

import com.knowledge.crossmodal.identity.ResolutionResult;

import java.util.List;

/**
 * Raised when two or more candidate entities tie within the ambiguity band.
 * The mention has already been attached to the preferred candidate with a penalized
 * identity confidence; the attached result is available through {@link #getResult()}.
 */
public class AmbiguousResolutionException extends KnowledgeException {

    private final ResolutionResult result;
    private final List<String> tiedCandidateIds;

    public AmbiguousResolutionException(ResolutionResult result, List<String> tiedCandidateIds,
                                        Provenance provenance) {
        super("Ambiguous resolution for mention " + result.mentionId()
                + ": candidates " + tiedCandidateIds + " tie; attached to " + result.entityId()
                + " with penalized confidence " + result.identityConfidence(), provenance);
        this.result = result;
        this.tiedCandidateIds = List.copyOf(tiedCandidateIds);
    }

    public ResolutionResult getResult() {
        return result;
    }

    public List<String> getTiedCandidateIds() {
        return tiedCandidateIds;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
