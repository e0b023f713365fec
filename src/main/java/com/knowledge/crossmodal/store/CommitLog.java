package com.knowledge.crossmodal.store;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Append-only log of every commit attempt, for replay and audit.
 */
public class CommitLog {

    private final List<CommitLogEntry> entries = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public CommitLog() {
        this(Clock.systemUTC());
    }

    public CommitLog(Clock clock) {
        this.clock = clock;
    }

    public CommitLogEntry append(String recordId, long version, CommitOutcome outcome, String detail) {
        CommitLogEntry entry = new CommitLogEntry(sequence.incrementAndGet(), recordId, version, outcome,
                clock.instant(), detail);
        entries.add(entry);
        return entry;
    }

    public List<CommitLogEntry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<CommitLogEntry> entriesFor(String recordId) {
        return entries.stream()
                .filter(e -> e.recordId().equals(recordId))
                .collect(Collectors.toList());
    }

    public long count(CommitOutcome outcome) {
        return entries.stream().filter(e -> e.outcome() == outcome).count();
    }

    public int size() {
        return entries.size();
    }
}
