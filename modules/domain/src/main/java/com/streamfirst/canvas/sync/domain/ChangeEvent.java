package com.streamfirst.canvas.sync.domain;

import lombok.NonNull;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * A row-level notification pushed by the backend's change feed. Rows are kept as raw column maps
 * until the router decodes them, so that a malformed row can be dropped without touching state.
 */
@Value
public class ChangeEvent {

    /**
     * Kind of row change reported by the feed.
     */
    public enum Type {
        INSERT,
        UPDATE,
        DELETE
    }

    @NonNull String table;
    @NonNull Type type;

    /** Row after the change; empty for deletes */
    @NonNull Map<String, Object> newRow;

    /** Row before the change where the backend reports it; often empty */
    @NonNull Map<String, Object> oldRow;

    public static ChangeEvent upsert(String table, boolean inserted, Map<String, Object> row) {
        return new ChangeEvent(table, inserted ? Type.INSERT : Type.UPDATE, row, Map.of());
    }

    public static ChangeEvent delete(String table, Map<String, Object> oldRow) {
        return new ChangeEvent(table, Type.DELETE, Map.of(), oldRow);
    }

    /**
     * Reads a column of the new row as a string, if present and textual.
     */
    public Optional<String> newColumn(String column) {
        Object value = newRow.get(column);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    @Override
    public String toString() {
        return "ChangeEvent{" + type + " on " + table + ", columns=" + newRow.keySet() + '}';
    }
}
