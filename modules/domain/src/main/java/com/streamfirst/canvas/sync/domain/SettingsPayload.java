package com.streamfirst.canvas.sync.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Free-form settings object.
 */
public record SettingsPayload(Map<String, Object> values) implements SyncPayload {
    public SettingsPayload {
        Objects.requireNonNull(values, "Settings cannot be null");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public DataType dataType() {
        return DataType.SETTINGS;
    }
}
