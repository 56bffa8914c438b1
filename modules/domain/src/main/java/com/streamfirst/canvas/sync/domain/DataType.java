package com.streamfirst.canvas.sync.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * The kinds of workspace state kept in the remote canvas-data table. There is exactly one live
 * record per owner and data type.
 */
public enum DataType {
    /** The list of open tabs and their content trees */
    TABS("tabs"),
    /** Layout mode and grid pagination state */
    LAYOUT("layout"),
    /** Free-form settings bag */
    SETTINGS("settings"),
    /** Ids of items expanded in tree views */
    EXPANDED_ITEMS("expanded_items");

    private final String wireName;

    DataType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * The value stored in the {@code data_type} column.
     */
    public String wireName() {
        return wireName;
    }

    public static Optional<DataType> fromWireName(String wireName) {
        return Arrays.stream(values())
            .filter(type -> type.wireName.equals(wireName))
            .findFirst();
    }
}
