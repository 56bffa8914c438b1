package com.streamfirst.canvas.sync.domain;

import java.util.List;
import java.util.Objects;

/**
 * Ids of the items currently expanded in tree views. Remote updates replace the local list.
 */
public record ExpandedItemsPayload(List<String> itemIds) implements SyncPayload {
    public ExpandedItemsPayload {
        Objects.requireNonNull(itemIds, "Item ids cannot be null");
        itemIds = List.copyOf(itemIds);
    }

    public static ExpandedItemsPayload of(String... itemIds) {
        return new ExpandedItemsPayload(List.of(itemIds));
    }

    @Override
    public DataType dataType() {
        return DataType.EXPANDED_ITEMS;
    }
}
