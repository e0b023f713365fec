package com.knowledge.crossmodal.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.knowledge.crossmodal.aggregation.ClaimAggregationService;
import com.knowledge.crossmodal.core.model.Claim;
import com.knowledge.crossmodal.core.model.DependencyDeclaration;
import com.knowledge.crossmodal.core.model.Entity;
import com.knowledge.crossmodal.core.model.EvidenceItem;
import com.knowledge.crossmodal.core.model.Mention;
import com.knowledge.crossmodal.core.model.MentionLink;
import com.knowledge.crossmodal.identity.EntityRegistry;
import com.knowledge.crossmodal.identity.IdentityResolutionService;
import com.knowledge.crossmodal.store.CommitLog;
import com.knowledge.crossmodal.store.CommitLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes the logical persisted layout as JSON: an entity table, a mention table keyed to its
 * owning entity, a claim table keyed by triple with an evidence sub-table, and the commit log.
 * Rows are ordered by id so two exports of the same state are byte-identical.
 */
public class StateExporter {
    private static final Logger log = LoggerFactory.getLogger(StateExporter.class);

    private final IdentityResolutionService identityService;
    private final ClaimAggregationService claimService;
    private final CommitLog commitLog;
    private final ObjectMapper objectMapper;

    public StateExporter(IdentityResolutionService identityService, ClaimAggregationService claimService,
                         CommitLog commitLog) {
        this(identityService, claimService, commitLog, new ObjectMapper());
    }

    public StateExporter(IdentityResolutionService identityService, ClaimAggregationService claimService,
                         CommitLog commitLog, ObjectMapper objectMapper) {
        this.identityService = identityService;
        this.claimService = claimService;
        this.commitLog = commitLog;
        this.objectMapper = objectMapper;
    }

    public ObjectNode export() {
        ObjectNode root = objectMapper.createObjectNode();
        EntityRegistry registry = identityService.getRegistry();
        List<Entity> entities = registry.allEntities().stream()
                .sorted(Comparator.comparing(Entity::getId))
                .collect(Collectors.toList());

        ArrayNode entityTable = root.putArray("entities");
        ArrayNode mentionTable = root.putArray("mentions");
        for (Entity entity : entities) {
            ObjectNode row = entityTable.addObject();
            row.put("id", entity.getId());
            row.put("canonical_name", entity.getCanonicalName());
            row.put("type", entity.getTypeLabel());
            row.put("status", entity.getStatus().name());
            row.put("identity_confidence", entity.getIdentityConfidence());
            row.put("merged_into", entity.getMergedInto());
            row.put("created_at", entity.getCreatedAt().toString());
            row.put("updated_at", entity.getUpdatedAt().toString());

            List<Mention> mentions = registry.mentionsOf(entity).stream()
                    .sorted(Comparator.comparing(Mention::id))
                    .collect(Collectors.toList());
            for (Mention mention : mentions) {
                mentionTable.add(mentionRow(entity, mention, registry));
            }
        }

        ArrayNode claimTable = root.putArray("claims");
        claimService.listClaims().stream()
                .sorted(Comparator.comparing(Claim::getId))
                .forEach(claim -> claimTable.add(claimRow(claim)));

        ArrayNode commitRows = root.putArray("commit_log");
        for (CommitLogEntry entry : commitLog.entries()) {
            ObjectNode row = commitRows.addObject();
            row.put("sequence", entry.sequence());
            row.put("record_id", entry.recordId());
            row.put("version", entry.version());
            row.put("outcome", entry.outcome().name());
            row.put("timestamp", entry.timestamp().toString());
            if (entry.detail() != null) {
                row.put("detail", entry.detail());
            }
        }
        return root;
    }

    /**
     * @throws UncheckedIOException if the file cannot be written
     */
    public void exportTo(Path target) {
        try {
            String json = objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(export());
            Files.writeString(target, json);
            log.info("state.exported path={}", target);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize state", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write state to " + target, e);
        }
    }

    private ObjectNode mentionRow(Entity owner, Mention mention, EntityRegistry registry) {
        ObjectNode row = objectMapper.createObjectNode();
        row.put("id", mention.id());
        row.put("entity_id", owner.getId());
        row.put("source_id", mention.sourceId());
        row.put("span_start", mention.span().start());
        row.put("span_end", mention.span().end());
        row.put("text", mention.text());
        row.put("normalized_text", registry.normalizedForm(mention.id()).orElse(null));
        row.put("type", mention.typeLabel());
        row.put("confidence", mention.confidence());
        MentionLink link = owner.getMentionLinks().get(mention.id());
        if (link != null) {
            row.put("link_weight", link.weight());
            row.put("ambiguous", link.ambiguous());
        }
        return row;
    }

    private ObjectNode claimRow(Claim claim) {
        ObjectNode row = objectMapper.createObjectNode();
        row.put("id", claim.getId());
        row.put("subject_id", claim.getKey().subjectId());
        row.put("predicate", claim.getKey().predicate());
        if (claim.getKey().object().isEntity()) {
            row.put("object_entity_id", claim.getKey().object().entityId());
        } else {
            row.put("object_literal", claim.getKey().object().literal());
        }
        row.put("status", claim.getStatus().name());
        row.put("merged_into", claim.getMergedInto());
        if (claim.getPosterior().isPresent()) {
            row.put("posterior", claim.getPosterior().getAsDouble());
        } else {
            row.putNull("posterior");
        }
        row.put("method_version", claim.getMethodVersion());

        ArrayNode evidence = row.putArray("evidence");
        claim.getEvidence().stream()
                .sorted(Comparator.comparing(EvidenceItem::evidenceId))
                .forEach(item -> {
                    ObjectNode ev = evidence.addObject();
                    ev.put("evidence_id", item.evidenceId());
                    ev.put("claim_id", claim.getId());
                    ev.put("source_id", item.sourceId());
                    ev.put("confidence", item.confidence());
                    ev.put("stance", item.stance().name());
                    ev.put("dependency_tag", item.dependencyTag());
                    ArrayNode citations = ev.putArray("citations");
                    item.citations().stream().sorted().forEach(citations::add);
                    ev.put("observed_at", item.observedAt() != null ? item.observedAt().toString() : null);
                });

        ArrayNode declarations = row.putArray("dependency_declarations");
        for (DependencyDeclaration declaration : claim.getDependencyDeclarations()) {
            ObjectNode decl = declarations.addObject();
            ArrayNode ids = decl.putArray("evidence_ids");
            declaration.evidenceIds().stream().sorted().forEach(ids::add);
            decl.put("reason", declaration.reason());
            decl.put("declared_at", declaration.declaredAt().toString());
        }
        return row;
    }
}
