package com.streamfirst.canvas.sync.domain;

import java.util.List;
import java.util.Objects;

/**
 * The full list of open tabs. Remote updates replace the local list.
 */
public record TabsPayload(List<Tab> tabs) implements SyncPayload {
    public TabsPayload {
        Objects.requireNonNull(tabs, "Tabs cannot be null");
        tabs = List.copyOf(tabs);
    }

    public static TabsPayload of(Tab... tabs) {
        return new TabsPayload(List.of(tabs));
    }

    @Override
    public DataType dataType() {
        return DataType.TABS;
    }
}
