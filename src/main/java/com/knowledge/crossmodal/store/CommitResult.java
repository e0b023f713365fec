package com.knowledge.crossmodal.store;

/**
 * @param version the version visible after the commit
 */
public record CommitResult(String recordId, long version, CommitOutcome outcome) {

    public boolean applied() {
        return outcome == CommitOutcome.APPLIED;
    }
}
