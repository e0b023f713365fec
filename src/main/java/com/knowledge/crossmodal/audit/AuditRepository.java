package com.knowledge.crossmodal.audit;

import java.util.List;

/**
 * Append-only storage for the audit trail. Every query returns entries in the order they were saved.
 */
public interface AuditRepository {

    void save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findByRecordId(String recordId);

    List<AuditEntry> findByAction(AuditAction action);

    /**
     * Entries written while the given logging correlation id was open, across all records.
     */
    List<AuditEntry> findByCorrelationId(String correlationId);

    /**
     * The newest {@code limit} entries, oldest first.
     */
    List<AuditEntry> findRecent(int limit);

    int count();
}
