package com.knowledge.crossmodal.projection;

import com.knowledge.crossmodal.core.model.Entity;
import com.knowledge.crossmodal.core.model.Mention;
import com.knowledge.crossmodal.store.CanonicalRecord;
import com.knowledge.crossmodal.store.RecordKind;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Canonical data of an entity: the entity, its mentions and the edges of the
 * active claims it is the subject of.
 */
public record CanonicalEntity(Entity entity, List<Mention> mentions, List<GraphEdge> outgoingEdges)
        implements CanonicalRecord {

    public CanonicalEntity {
        Objects.requireNonNull(entity, "entity is required");
        mentions = mentions != null
                ? mentions.stream().sorted(Comparator.comparing(Mention::id)).collect(Collectors.toUnmodifiableList())
                : List.of();
        outgoingEdges = outgoingEdges != null
                ? outgoingEdges.stream().sorted(Comparator.comparing(GraphEdge::claimId, Comparator.nullsFirst(Comparator.naturalOrder())))
                .collect(Collectors.toUnmodifiableList())
                : List.of();
    }

    @Override
    public String id() {
        return entity.getId();
    }

    @Override
    public RecordKind kind() {
        return RecordKind.ENTITY;
    }
}
