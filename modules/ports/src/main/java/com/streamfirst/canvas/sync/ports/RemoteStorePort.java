package com.streamfirst.canvas.sync.ports;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Port for the hosted relational store. The sync engine only needs keyed upserts and equality
 * selects on a handful of columns, so this is deliberately narrow; rows are plain column maps whose
 * values are JSON-compatible (strings, numbers, booleans, nested maps and lists).
 */
public interface RemoteStorePort {

    /**
     * Inserts a row, or merges the given columns into the existing row whose conflict columns match.
     * Columns not present in {@code row} keep their stored values.
     *
     * @param table the target table
     * @param row the columns to write, including the conflict columns
     * @param conflictColumns the uniqueness constraint the upsert is keyed on
     * @throws RemoteStoreException if the backend is unreachable or rejects the write
     */
    void upsert(String table, Map<String, Object> row, Set<String> conflictColumns);

    /**
     * Selects the single row matching every column/value pair.
     *
     * @return the row, or empty if no row matches
     * @throws RemoteStoreException if the backend fails or more than one row matches
     */
    Optional<Map<String, Object>> selectOne(String table, Map<String, String> match);

    /**
     * Selects all rows matching every column/value pair.
     *
     * @throws RemoteStoreException if the backend fails
     */
    List<Map<String, Object>> selectAll(String table, Map<String, String> match);
}
