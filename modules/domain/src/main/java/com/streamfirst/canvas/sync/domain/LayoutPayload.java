package com.streamfirst.canvas.sync.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Layout mode plus the grid pagination state that goes with it.
 */
public record LayoutPayload(LayoutMode mode, Map<String, Object> gridModeState) implements SyncPayload {
    public LayoutPayload {
        Objects.requireNonNull(mode, "Layout mode cannot be null");
        gridModeState = gridModeState == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(gridModeState));
    }

    @Override
    public DataType dataType() {
        return DataType.LAYOUT;
    }
}
