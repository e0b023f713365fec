package com.knowledge.crossmodal.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;

/**
 * A single textual occurrence of a candidate entity.
 * Immutable. The identifier is derived from the source, span and text so that
 * re-submitting the same occurrence is recognised as a retry.
 */
public record Mention(
        String id,
        String sourceId,
        TextSpan span,
        String text,
        String typeLabel,
        double confidence,
        String context
) {
    public Mention {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(span, "span is required");
        Objects.requireNonNull(text, "text is required");
        if (text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
        context = context != null ? context : "";
    }

    public static Mention of(String sourceId, TextSpan span, String text, String typeLabel, double confidence) {
        return of(sourceId, span, text, typeLabel, confidence, null);
    }

    public static Mention of(String sourceId, TextSpan span, String text, String typeLabel,
                             double confidence, String context) {
        return new Mention(deriveId(sourceId, span, text), sourceId, span, text, typeLabel, confidence, context);
    }

    static String deriveId(String sourceId, TextSpan span, String text) {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(span, "span is required");
        Objects.requireNonNull(text, "text is required");
        String key = sourceId + '\u0000' + span.start() + ':' + span.end() + '\u0000' + text;
        return "m-" + UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
    }
}
