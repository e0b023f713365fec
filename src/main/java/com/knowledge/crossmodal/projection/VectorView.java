package com.knowledge.crossmodal.projection;

import com.knowledge.crossmodal.embedding.EmbeddingFunction;
import com.knowledge.crossmodal.store.CrossModalRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Read-only embedding matrix. Row {@code i} of {@link #matrix()} belongs to {@code ids().get(i)}.
 */
public final class VectorView {

    private final List<VectorProjection> vectors;

    private VectorView(List<VectorProjection> vectors) {
        this.vectors = vectors;
    }

    public static VectorView of(Collection<CrossModalRecord> records) {
        return new VectorView(records.stream().map(CrossModalRecord::vector).toList());
    }

    public List<String> ids() {
        return vectors.stream().map(VectorProjection::id).toList();
    }

    public double[][] matrix() {
        double[][] matrix = new double[vectors.size()][];
        for (int i = 0; i < vectors.size(); i++) {
            matrix[i] = vectors.get(i).embedding();
        }
        return matrix;
    }

    /**
     * The {@code k} vectors closest to the query by cosine similarity, best first; ties by id.
     */
    public List<Neighbour> nearest(double[] query, int k) {
        List<Neighbour> scored = new ArrayList<>();
        for (VectorProjection vector : vectors) {
            if (vector.dimension() == query.length) {
                scored.add(new Neighbour(vector.id(), vector.label(),
                        EmbeddingFunction.cosine(query, vector.embedding())));
            }
        }
        scored.sort(Comparator.comparingDouble(Neighbour::score).reversed().thenComparing(Neighbour::id));
        return scored.subList(0, Math.min(k, scored.size()));
    }

    public int size() {
        return vectors.size();
    }

    public record Neighbour(String id, String label, double score) {
    }
}
