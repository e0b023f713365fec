package com.knowledge.crossmodal.projection;

import com.knowledge.crossmodal.store.CrossModalRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only relational view: the rows of every committed snapshot.
 */
public final class TableView {

    private final List<TableRow> rows;

    private TableView(List<TableRow> rows) {
        this.rows = rows;
    }

    public static TableView of(Collection<CrossModalRecord> records) {
        return new TableView(records.stream().map(CrossModalRecord::table).collect(Collectors.toUnmodifiableList()));
    }

    public List<TableRow> rows(String table) {
        return rows.stream().filter(r -> r.table().equals(table)).collect(Collectors.toList());
    }

    public List<TableRow> entities() {
        return rows(TableProjector.ENTITY_TABLE);
    }

    public List<TableRow> claims() {
        return rows(TableProjector.CLAIM_TABLE);
    }

    public Optional<TableRow> row(String id) {
        return rows.stream().filter(r -> r.id().equals(id)).findFirst();
    }

    public List<TableRow> where(String table, String column, Object value) {
        return rows(table).stream()
                .filter(r -> value == null ? r.column(column) == null : value.equals(r.column(column)))
                .collect(Collectors.toList());
    }

    public int size() {
        return rows.size();
    }
}
