package com.knowledge.crossmodal.api;

/**
 * Outcome of ingesting one raw claim.
 *
 * @param claimId    the claim that now holds the evidence
 * @param evidenceId the evidence item the raw claim became
 * @param posterior  the claim's posterior after aggregation
 */
public record ClaimResult(String claimId, String evidenceId, double posterior) {
}
