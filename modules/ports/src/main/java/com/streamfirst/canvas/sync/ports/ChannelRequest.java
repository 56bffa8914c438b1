package com.streamfirst.canvas.sync.ports;

import java.util.Map;
import java.util.Objects;

/**
 * Everything the change feed needs to register a channel: a unique name, one table, and an equality
 * filter on zero or more columns.
 *
 * @param channelName backend-visible channel name
 * @param table table whose row changes are delivered
 * @param filter column to value equality predicate, e.g. {@code user_id -> 42}
 */
public record ChannelRequest(String channelName, String table, Map<String, String> filter) {
    public ChannelRequest {
        Objects.requireNonNull(channelName, "Channel name cannot be null");
        Objects.requireNonNull(table, "Table cannot be null");
        filter = filter == null ? Map.of() : Map.copyOf(filter);
    }

    /**
     * True when the row satisfies every column of the filter.
     */
    public boolean matches(Map<String, Object> row) {
        return filter.entrySet().stream()
            .allMatch(entry -> entry.getValue().equals(String.valueOf(row.get(entry.getKey()))));
    }
}
