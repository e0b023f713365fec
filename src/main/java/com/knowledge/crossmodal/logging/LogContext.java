package com.knowledge.crossmodal.logging;

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * Scoped MDC entries for engine operations.
 *
 * <p>Contexts nest: a commit opened while a resolution is running overwrites
 * {@code operation} only until it closes, after which the outer value is back.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forResolution(correlationId, mention.sourceId(), "PERSON")) {
 *     log.info("mention.resolved entityId={} decision={}", entityId, decision);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String OPERATION = "operation";

    private final Deque<String[]> previous = new ArrayDeque<>();

    private LogContext(String operation) {
        put(OPERATION, operation);
    }

    public static LogContext forResolution(String correlationId, String sourceId, String typeLabel) {
        return new LogContext("resolve")
                .with(CORRELATION_ID, correlationId)
                .with("sourceId", sourceId)
                .with("typeLabel", typeLabel != null ? typeLabel : "UNKNOWN");
    }

    public static LogContext forMerge(String correlationId, String sourceId, String targetId) {
        return new LogContext("merge")
                .with(CORRELATION_ID, correlationId)
                .with("sourceEntityId", sourceId)
                .with("targetEntityId", targetId);
    }

    public static LogContext forSplit(String correlationId, String entityId) {
        return new LogContext("split")
                .with(CORRELATION_ID, correlationId)
                .with("entityId", entityId);
    }

    public static LogContext forCommit(String recordId) {
        return new LogContext("commit").with("recordId", recordId);
    }

    public static LogContext forAggregation(String claimId) {
        return new LogContext("aggregate").with("claimId", claimId);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Correlation id of the innermost open context, or a fresh one when none is open.
     */
    public static String currentOrNewCorrelationId() {
        String current = MDC.get(CORRELATION_ID);
        return current != null ? current : generateCorrelationId();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        previous.push(new String[]{key, MDC.get(key)});
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    @Override
    public void close() {
        while (!previous.isEmpty()) {
            String[] entry = previous.pop();
            if (entry[1] == null) {
                MDC.remove(entry[0]);
            } else {
                MDC.put(entry[0], entry[1]);
            }
        }
    }
}
