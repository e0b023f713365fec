package com.knowledge.crossmodal.projection;

import java.util.Arrays;
import java.util.Objects;

/**
 * Embedding of one record together with the label it was derived from and the model id.
 * The array is copied in and out, so instances are immutable.
 */
public final class VectorProjection {
    private final String id;
    private final String label;
    private final String modelId;
    private final double[] embedding;

    public VectorProjection(String id, String label, String modelId, double[] embedding) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.label = Objects.requireNonNull(label, "label is required");
        this.modelId = Objects.requireNonNull(modelId, "modelId is required");
        this.embedding = Objects.requireNonNull(embedding, "embedding is required").clone();
    }

    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    public String modelId() {
        return modelId;
    }

    public double[] embedding() {
        return embedding.clone();
    }

    public int dimension() {
        return embedding.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VectorProjection that = (VectorProjection) o;
        return id.equals(that.id) && label.equals(that.label) && modelId.equals(that.modelId)
                && Arrays.equals(embedding, that.embedding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, modelId, Arrays.hashCode(embedding));
    }

    @Override
    public String toString() {
        return "VectorProjection{id='" + id + "', label='" + label + "', model=" + modelId
                + ", dimension=" + embedding.length + '}';
    }
}
