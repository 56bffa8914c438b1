package com.streamfirst.canvas.sync.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One open workspace tab. Only the id is interpreted by the sync engine; the title and any other
 * fields the UI stores are carried through unchanged.
 *
 * @param id stable tab identifier
 * @param title display title, may be null
 * @param attributes every other field of the tab, in insertion order
 */
public record Tab(String id, String title, Map<String, Object> attributes) {
    public Tab {
        Objects.requireNonNull(id, "Tab id cannot be null");
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Tab of(String id, String title) {
        return new Tab(id, title, Map.of());
    }
}
