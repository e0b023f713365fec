package com.knowledge.crossmodal.audit;

import com.knowledge.crossmodal.core.model.IdentityOperation;
import com.knowledge.crossmodal.core.model.MergeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only ledger of every merge and split, with the mentions each one moved.
 */
public class MergeLedger {
    private static final Logger log = LoggerFactory.getLogger(MergeLedger.class);

    private final List<MergeRecord> records = new CopyOnWriteArrayList<>();

    public MergeRecord record(MergeRecord entry) {
        records.add(entry);
        log.info("ledger.recorded operation={} source={} target={} mentions={} by={}",
                entry.operation(), entry.sourceEntityId(), entry.targetEntityId(),
                entry.mentionIds().size(), entry.triggeredBy());
        return entry;
    }

    public List<MergeRecord> getAllRecords() {
        return List.copyOf(records);
    }

    public List<MergeRecord> getRecords(IdentityOperation operation) {
        return records.stream()
                .filter(r -> r.operation() == operation)
                .collect(Collectors.toList());
    }

    public List<MergeRecord> getRecordsFor(String entityId) {
        return records.stream()
                .filter(r -> r.involves(entityId))
                .collect(Collectors.toList());
    }

    /**
     * The merge that retired the entity, if any. An entity is retired at most once.
     */
    public Optional<MergeRecord> findMergeOf(String retiredEntityId) {
        return records.stream()
                .filter(MergeRecord::isMerge)
                .filter(r -> r.sourceEntityId().equals(retiredEntityId))
                .findFirst();
    }

    /**
     * Follows merges forward to the entity that now holds this one's mentions.
     * Returns the identifier itself when it was never merged away.
     */
    public String survivorOf(String entityId) {
        String current = entityId;
        Set<String> seen = new LinkedHashSet<>();
        while (seen.add(current)) {
            Optional<MergeRecord> merge = findMergeOf(current);
            if (merge.isEmpty()) {
                return current;
            }
            current = merge.get().targetEntityId();
        }
        throw new IllegalStateException("Merge cycle in ledger: " + seen);
    }

    /**
     * All entities merged into this one, transitively, in ledger order.
     */
    public List<String> getMergeChain(String entityId) {
        List<String> chain = new ArrayList<>();
        for (MergeRecord record : records) {
            if (record.isMerge() && survivorOf(record.sourceEntityId()).equals(entityId)
                    && !record.sourceEntityId().equals(entityId)) {
                chain.add(record.sourceEntityId());
            }
        }
        return chain;
    }

    public int size() {
        return records.size();
    }
}
