package com.knowledge.crossmodal.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Compensating transaction for one commit. Each staged write registers the action that
 * discards it; if the transaction closes without {@link #markSuccess()}, compensations
 * run in reverse order.
 *
 * <pre>
 * try (ProjectionTransaction tx = new ProjectionTransaction(recordId, version)) {
 *     tx.execute("stage graph", () -> graphSink.stage(...), () -> graphSink.discard(...));
 *     tx.execute("stage table", () -> tableSink.stage(...), () -> tableSink.discard(...));
 *     tx.executeNoCompensation("publish", () -> pointer.put(...));
 *     tx.markSuccess();
 * }
 * </pre>
 *
 * Compensation failures do not stop the remaining compensations; they are collected and
 * available through {@link #getCompensationFailures()} so the caller can attach them to
 * the error it reports.
 */
public class ProjectionTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProjectionTransaction.class);

    private final String recordId;
    private final long version;
    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private final List<RuntimeException> compensationFailures = new ArrayList<>();
    private boolean success = false;
    private boolean closed = false;

    public ProjectionTransaction(String recordId, long version) {
        this.recordId = recordId;
        this.version = version;
    }

    /**
     * Runs the operation and registers its compensation. If the operation fails, all
     * previously registered compensations run and the failure is rethrown.
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        ensureOpen();
        try {
            log.debug("commit.step recordId={} version={} step='{}'", recordId, version, description);
            operation.run();
            compensationStack.push(new CompensatingAction(description, compensation));
        } catch (RuntimeException e) {
            log.warn("commit.step.failed recordId={} version={} step='{}' error={}",
                    recordId, version, description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    /**
     * Runs a step that has nothing to undo, such as publishing the version pointer.
     */
    public void executeNoCompensation(String description, Runnable operation) {
        ensureOpen();
        try {
            log.debug("commit.step recordId={} version={} step='{}'", recordId, version, description);
            operation.run();
        } catch (RuntimeException e) {
            log.warn("commit.step.failed recordId={} version={} step='{}' error={}",
                    recordId, version, description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    public List<RuntimeException> getCompensationFailures() {
        return Collections.unmodifiableList(compensationFailures);
    }

    @Override
    public void close() {
        if (!closed && !success) {
            log.warn("commit.rollback recordId={} version={} pendingCompensations={}",
                    recordId, version, compensationStack.size());
            runCompensations();
        }
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
    }

    private void runCompensations() {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("commit.compensate recordId={} version={} step='{}'", recordId, version, action.description);
                action.compensation.run();
            } catch (RuntimeException e) {
                log.error("commit.compensate.failed recordId={} version={} step='{}' error={}",
                        recordId, version, action.description, e.getMessage(), e);
                compensationFailures.add(e);
            }
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {
    }
}
