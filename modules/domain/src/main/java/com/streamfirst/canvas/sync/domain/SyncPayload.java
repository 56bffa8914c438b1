package com.streamfirst.canvas.sync.domain;

/**
 * Typed content of a {@link SyncRecord}. Closed over the four data types so that every payload
 * crossing the gateway has been decoded and validated against its own schema.
 */
public sealed interface SyncPayload
    permits TabsPayload, LayoutPayload, SettingsPayload, ExpandedItemsPayload {

    /**
     * The data type this payload is stored under.
     */
    DataType dataType();
}
