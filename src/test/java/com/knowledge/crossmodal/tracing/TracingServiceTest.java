package com.knowledge.crossmodal.tracing;

import com.knowledge.crossmodal.api.CrossModalKnowledgeBase;
import com.knowledge.crossmodal.api.KnowledgeContext;
import com.knowledge.crossmodal.core.model.Mention;
import com.knowledge.crossmodal.core.model.TextSpan;
import com.knowledge.crossmodal.error.UnknownIdentifierException;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Every operation gets the same inert span")
        void sharedSpan() {
            NoOpTracingService noOp = new NoOpTracingService();

            Span resolve = noOp.startSpan(TraceOperation.RESOLVE);
            Span commit = noOp.startSpan(TraceOperation.COMMIT, Map.of("recordId", "ent-1"));

            assertSame(resolve, commit);
            assertDoesNotThrow(() -> {
                try (Span span = resolve) {
                    span.setAttribute("entityId", "ent-1");
                    span.setAttribute("version", 2L);
                    span.setAttribute("posterior", 0.9);
                    span.fail(new IllegalStateException("ignored"));
                }
            });
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer tracer;
        private SpanBuilder builder;
        private io.opentelemetry.api.trace.Span otelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            builder = mock(SpanBuilder.class, RETURNS_SELF);
            otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
            service = new OpenTelemetryTracingService(tracer);
        }

        @Test
        @DisplayName("Spans are named after the operation with namespaced attributes")
        void spanNameAndAttributes() {
            try (Span span = service.startSpan(TraceOperation.MERGE, Map.of("entityA", "ent-1"))) {
                span.setAttribute("survivorId", "ent-1");
                span.setAttribute("version", 3L);
                span.setStatus(Span.SpanStatus.OK);
            }

            verify(tracer).spanBuilder("knowledge.merge");
            verify(builder).setSpanKind(SpanKind.INTERNAL);
            verify(builder).setAttribute("knowledge.operation", "MERGE");
            verify(builder).setAttribute("knowledge.entityA", "ent-1");
            verify(otelSpan).setAttribute("knowledge.survivorId", "ent-1");
            verify(otelSpan).setAttribute("knowledge.version", 3L);
            verify(otelSpan).setStatus(StatusCode.OK);
            verify(otelSpan).end();
        }

        @Test
        @DisplayName("Engine failures carry their provenance onto the span")
        void failureProvenance() {
            UnknownIdentifierException error = new UnknownIdentifierException("Record", "ent-9");

            try (Span span = service.startSpan(TraceOperation.COMMIT)) {
                span.fail(error);
            }

            verify(otelSpan).recordException(error);
            verify(otelSpan).setAttribute("knowledge.error.retryable", false);
            verify(otelSpan).setAttribute("knowledge.error.records", "ent-9");
            verify(otelSpan, never()).setAttribute(eq("knowledge.error.sources"), anyString());
            verify(otelSpan).setStatus(StatusCode.ERROR);
        }

        @Test
        @DisplayName("Other failures are recorded without provenance")
        void plainFailure() {
            IllegalStateException error = new IllegalStateException("boom");

            try (Span span = service.startSpan(TraceOperation.AGGREGATE)) {
                span.fail(error);
            }

            verify(otelSpan).recordException(error);
            verify(otelSpan, never()).setAttribute(eq("knowledge.error.retryable"), anyBoolean());
        }
    }

    @Nested
    @DisplayName("Engine instrumentation")
    class InstrumentationTests {

        @Test
        @DisplayName("Resolution and the commits it triggers open spans")
        void engineOpensSpans() {
            TracingService tracing = mock(TracingService.class);
            Span span = mock(Span.class);
            when(tracing.startSpan(any(TraceOperation.class), anyMap())).thenReturn(span);
            CrossModalKnowledgeBase kb = CrossModalKnowledgeBase.builder()
                    .context(KnowledgeContext.builder().tracingService(tracing).build())
                    .build();

            kb.resolve(Mention.of("doc-1", new TextSpan(0, 8), "Tim Cook", "PERSON", 0.9));
            kb.close();

            verify(tracing).startSpan(eq(TraceOperation.RESOLVE), anyMap());
            verify(tracing, atLeastOnce()).startSpan(eq(TraceOperation.COMMIT), anyMap());
            verify(span, atLeastOnce()).setStatus(Span.SpanStatus.OK);
            verify(span, atLeastOnce()).close();
        }
    }
}
