package com.knowledge.crossmodal.tracing;

/**
 * A unit of work in a trace. Ends on {@link #close()}, so it can be used in try-with-resources.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Records the failure and marks the span as errored.
     */
    default void fail(Throwable t) {
        recordException(t);
        setStatus(SpanStatus.ERROR);
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
