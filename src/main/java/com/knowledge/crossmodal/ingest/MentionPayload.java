package com.knowledge.crossmodal.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.knowledge.crossmodal.core.model.Mention;
import com.knowledge.crossmodal.core.model.TextSpan;
import com.knowledge.crossmodal.error.MalformedPayloadException;
import com.knowledge.crossmodal.error.Provenance;

/**
 * {@code {"kind":"mention","source_id":..,"span":{"start":..,"end":..},"text":..,"type":..,"confidence":..}}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MentionPayload(
        @JsonProperty("source_id") String sourceId,
        @JsonProperty("span") Span span,
        @JsonProperty("text") String text,
        @JsonProperty("type") String type,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("context") String context
) implements EvidencePayload {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Span(@JsonProperty("start") Integer start, @JsonProperty("end") Integer end) {
    }

    @Override
    public String kind() {
        return KIND_MENTION;
    }

    @Override
    public void validate() {
        Provenance provenance = Provenance.builder().source(sourceId).build();
        if (sourceId == null || sourceId.isBlank()) {
            throw new MalformedPayloadException("mention: source_id is required", provenance);
        }
        if (text == null || text.isBlank()) {
            throw new MalformedPayloadException("mention: text is required", provenance);
        }
        if (span == null || span.start() == null || span.end() == null) {
            throw new MalformedPayloadException("mention: span.start and span.end are required", provenance);
        }
        if (span.start() < 0 || span.end() <= span.start()) {
            throw new MalformedPayloadException(
                    "mention: span must satisfy 0 <= start < end, got [" + span.start() + ", " + span.end() + ")",
                    provenance);
        }
        if (confidence == null || confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
            throw new MalformedPayloadException("mention: confidence must be between 0 and 1, got " + confidence,
                    provenance);
        }
    }

    public Mention toMention() {
        validate();
        return Mention.of(sourceId, new TextSpan(span.start(), span.end()), text, type, confidence, context);
    }
}
