package com.knowledge.crossmodal.store;

import com.knowledge.crossmodal.embedding.EmbeddingFunction;
import com.knowledge.crossmodal.projection.GraphProjection;
import com.knowledge.crossmodal.projection.TableRow;
import com.knowledge.crossmodal.projection.VectorProjection;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable snapshot of one committed version in all three modalities.
 * The store's version pointer always references a whole snapshot, so readers never
 * see one modality ahead of another.
 */
public record CrossModalRecord(
        String id,
        RecordKind kind,
        long version,
        GraphProjection graph,
        TableRow table,
        VectorProjection vector,
        Instant committedAt
) {
    public CrossModalRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(graph, "graph is required");
        Objects.requireNonNull(table, "table is required");
        Objects.requireNonNull(vector, "vector is required");
        Objects.requireNonNull(committedAt, "committedAt is required");
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1");
        }
    }

    /**
     * Whether this snapshot carries exactly these projections, ignoring version and commit time.
     */
    public boolean hasProjections(GraphProjection graph, TableRow table, VectorProjection vector) {
        return this.graph.equals(graph) && this.table.equals(table) && this.vector.equals(vector);
    }

    /**
     * Whether the three projections describe the same record: same id, same label and
     * the same confidence value in graph and table.
     */
    public boolean isConsistent() {
        if (!id.equals(graph.id()) || !id.equals(table.id()) || !id.equals(vector.id())) {
            return false;
        }
        String labelColumn = kind == RecordKind.ENTITY ? "canonical_name" : "label";
        String confidenceColumn = kind == RecordKind.ENTITY ? "identity_confidence" : "posterior_confidence";
        return Objects.equals(graph.property(labelColumn), vector.label())
                && Objects.equals(table.column(labelColumn), vector.label())
                && Objects.equals(graph.property(confidenceColumn), table.confidence(confidenceColumn));
    }

    /**
     * {@link #isConsistent()} plus a check that the vector is the embedding of its label.
     */
    public boolean isConsistent(EmbeddingFunction embeddingFunction) {
        return isConsistent()
                && embeddingFunction.modelId().equals(vector.modelId())
                && Arrays.equals(embeddingFunction.embed(vector.label()), vector.embedding());
    }

    public Object projection(Modality modality) {
        return switch (modality) {
            case GRAPH -> graph;
            case TABLE -> table;
            case VECTOR -> vector;
        };
    }
}
