package com.knowledge.crossmodal.projection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Relational encoding of one record. Regular columns and confidence columns are kept
 * apart so readers can tell measured values from derived confidences.
 * Null column values are allowed (e.g. the posterior of an unaggregated claim).
 */
public record TableRow(String id, String table, Map<String, Object> columns, Map<String, Double> confidenceColumns) {
    public TableRow {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(table, "table is required");
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns != null ? columns : Map.of()));
        confidenceColumns = Collections.unmodifiableMap(
                new LinkedHashMap<>(confidenceColumns != null ? confidenceColumns : Map.of()));
    }

    public Object column(String name) {
        return columns.get(name);
    }

    public Double confidence(String name) {
        return confidenceColumns.get(name);
    }
}
