package com.knowledge.crossmodal.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * One identity or claim change as written to the audit trail.
 *
 * @param recordId      entity or claim the change applied to
 * @param actorId       caller that triggered it, {@code system} for changes the engine made on its own
 * @param correlationId logging correlation id active when the change was made, if any
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String recordId,
        String actorId,
        String correlationId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(recordId, "recordId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    static AuditEntry of(AuditAction action, String recordId, String actorId, String correlationId,
                         Map<String, Object> details, Instant timestamp) {
        return new AuditEntry(UUID.randomUUID().toString(), action, recordId, actorId, correlationId,
                details, timestamp);
    }

    public Optional<Object> detail(String key) {
        return Optional.ofNullable(details.get(key));
    }

    public boolean isSystemChange() {
        return AuditService.SYSTEM_ACTOR.equals(actorId);
    }
}
