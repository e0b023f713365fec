package com.knowledge.crossmodal.store;

import java.time.Instant;

/**
 * @param sequence position in the log, starting at 1
 * @param version  version visible after the attempt (0 when none was ever committed)
 * @param detail   failure description for rejected attempts, otherwise null
 */
public record CommitLogEntry(long sequence, String recordId, long version, CommitOutcome outcome,
                             Instant timestamp, String detail) {
}
