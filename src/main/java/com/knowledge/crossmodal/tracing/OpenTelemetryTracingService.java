package com.knowledge.crossmodal.tracing;

import com.knowledge.crossmodal.error.KnowledgeException;
import com.knowledge.crossmodal.error.Provenance;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Collection;
import java.util.Map;
import java.util.TreeSet;

/**
 * Adapts OpenTelemetry spans to the engine's {@link Span} interface. Attribute keys are
 * prefixed with {@value #ATTRIBUTE_PREFIX}; failures of the engine's own exceptions also
 * record their provenance so a trace leads back to the records and sources involved.
 */
public class OpenTelemetryTracingService implements TracingService {

    public static final String INSTRUMENTATION_NAME = "com.knowledge.crossmodal";
    public static final String ATTRIBUTE_PREFIX = "knowledge.";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    public OpenTelemetryTracingService(OpenTelemetry openTelemetry) {
        this(openTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    @Override
    public Span startSpan(TraceOperation operation, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operation.spanName())
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(ATTRIBUTE_PREFIX + "operation", operation.name());
        if (attributes != null) {
            attributes.forEach((key, value) -> builder.setAttribute(ATTRIBUTE_PREFIX + key, value));
        }
        return new KnowledgeSpan(builder.startSpan());
    }

    private static class KnowledgeSpan implements Span {

        private final io.opentelemetry.api.trace.Span otelSpan;

        KnowledgeSpan(io.opentelemetry.api.trace.Span otelSpan) {
            this.otelSpan = otelSpan;
        }

        @Override
        public void setAttribute(String key, String value) {
            otelSpan.setAttribute(ATTRIBUTE_PREFIX + key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            otelSpan.setAttribute(ATTRIBUTE_PREFIX + key, value);
        }

        @Override
        public void setAttribute(String key, double value) {
            otelSpan.setAttribute(ATTRIBUTE_PREFIX + key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            otelSpan.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            otelSpan.recordException(t);
            if (t instanceof KnowledgeException ke) {
                Provenance provenance = ke.getProvenance();
                otelSpan.setAttribute(ATTRIBUTE_PREFIX + "error.retryable", ke.isRetryable());
                setJoined("error.records", provenance.recordIds());
                setJoined("error.sources", provenance.sourceIds());
                setJoined("error.evidence", provenance.evidenceIds());
            }
        }

        private void setJoined(String key, Collection<String> ids) {
            if (!ids.isEmpty()) {
                otelSpan.setAttribute(ATTRIBUTE_PREFIX + key, String.join(",", new TreeSet<>(ids)));
            }
        }

        @Override
        public void close() {
            otelSpan.end();
        }
    }
}
