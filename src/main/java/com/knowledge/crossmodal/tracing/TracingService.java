package com.knowledge.crossmodal.tracing;

import java.util.Map;

/**
 * Tracing integration point. The default {@link NoOpTracingService} records nothing.
 */
public interface TracingService {

    /**
     * @param attributes identifiers of the records the operation touches, recorded under the
     *                   {@code knowledge.} attribute namespace
     */
    Span startSpan(TraceOperation operation, Map<String, String> attributes);

    default Span startSpan(TraceOperation operation) {
        return startSpan(operation, Map.of());
    }
}
