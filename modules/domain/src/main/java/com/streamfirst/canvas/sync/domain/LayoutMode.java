package com.streamfirst.canvas.sync.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * How the workspace arranges its items.
 */
public enum LayoutMode {
    GRID("grid"),
    CANVAS("canvas");

    private final String wireName;

    LayoutMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<LayoutMode> fromWireName(String wireName) {
        return Arrays.stream(values())
            .filter(mode -> mode.wireName.equals(wireName))
            .findFirst();
    }
}
