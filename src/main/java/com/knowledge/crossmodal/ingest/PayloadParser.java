package com.knowledge.crossmodal.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.knowledge.crossmodal.error.MalformedPayloadException;
import com.knowledge.crossmodal.error.Provenance;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses extractor output. A payload is a mention or a raw claim, told apart by the optional
 * {@code kind} field or, without it, by the presence of {@code span} or {@code predicate}.
 */
public class PayloadParser {

    private final ObjectMapper objectMapper;

    public PayloadParser() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public PayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses one JSON object.
     *
     * @throws MalformedPayloadException if the JSON is invalid or the payload fails validation
     */
    public EvidencePayload parse(String json) {
        return parse(readTree(json));
    }

    /**
     * Parses a JSON array of payloads, or a single object. Fails on the first bad element.
     */
    public List<EvidencePayload> parseAll(String json) {
        JsonNode root = readTree(json);
        List<EvidencePayload> payloads = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode node : root) {
                payloads.add(parse(node));
            }
        } else {
            payloads.add(parse(root));
        }
        return payloads;
    }

    public EvidencePayload parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedPayloadException("payload must be a JSON object", Provenance.empty());
        }
        String sourceId = node.hasNonNull("source_id") ? node.get("source_id").asText() : null;
        Provenance provenance = Provenance.builder().source(sourceId).build();
        String kind = discriminate(node, provenance);
        EvidencePayload payload;
        try {
            payload = EvidencePayload.KIND_MENTION.equals(kind)
                    ? objectMapper.treeToValue(node, MentionPayload.class)
                    : objectMapper.treeToValue(node, RawClaimPayload.class);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException(kind + ": " + e.getOriginalMessage(), provenance, e);
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException(kind + ": " + e.getMessage(), provenance, e);
        }
        payload.validate();
        return payload;
    }

    private static String discriminate(JsonNode node, Provenance provenance) {
        if (node.hasNonNull("kind")) {
            String kind = node.get("kind").asText().trim().toLowerCase(Locale.ROOT);
            if (!EvidencePayload.KIND_MENTION.equals(kind) && !EvidencePayload.KIND_CLAIM.equals(kind)) {
                throw new MalformedPayloadException("unknown payload kind '" + kind + "'", provenance);
            }
            return kind;
        }
        if (node.has("span")) {
            return EvidencePayload.KIND_MENTION;
        }
        if (node.has("predicate")) {
            return EvidencePayload.KIND_CLAIM;
        }
        throw new MalformedPayloadException("cannot tell mention from claim: no kind, span or predicate", provenance);
    }

    private JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedPayloadException("empty payload", Provenance.empty());
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("invalid JSON: " + e.getOriginalMessage(), Provenance.empty(), e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
