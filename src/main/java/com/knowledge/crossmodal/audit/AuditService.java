package com.knowledge.crossmodal.audit;

import com.knowledge.crossmodal.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Records and queries audit entries through an {@link AuditRepository}.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final String SYSTEM_ACTOR = "system";

    private final AuditRepository repository;
    private final Clock clock;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public AuditService(AuditRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Appends an entry stamped with the service clock and the correlation id of the
     * surrounding {@link LogContext}, so audit rows can be joined to log lines.
     */
    public AuditEntry record(AuditAction action, String recordId, String actorId, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.of(action, recordId, actorId != null ? actorId : SYSTEM_ACTOR,
                MDC.get(LogContext.CORRELATION_ID), details, clock.instant());
        repository.save(entry);
        log.debug("audit.recorded action={} recordId={} actor={} correlationId={}",
                entry.action(), entry.recordId(), entry.actorId(), entry.correlationId());
        return entry;
    }

    public AuditEntry record(AuditAction action, String recordId, Map<String, Object> details) {
        return record(action, recordId, SYSTEM_ACTOR, details);
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesFor(String recordId) {
        return repository.findByRecordId(recordId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    /**
     * Everything one logged operation changed, e.g. a merge and the claim re-keys it caused.
     */
    public List<AuditEntry> getEntriesCorrelatedWith(String correlationId) {
        return repository.findByCorrelationId(correlationId);
    }

    public List<AuditEntry> getRecentEntries(int limit) {
        return repository.findRecent(limit);
    }

    public int size() {
        return repository.count();
    }
}
