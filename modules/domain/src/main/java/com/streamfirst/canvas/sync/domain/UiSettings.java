package com.streamfirst.canvas.sync.domain;

import lombok.Builder;
import lombok.Value;

/**
 * UI toggle flags stored inside the preferences record. A null field means "not set" and is left
 * alone when merging.
 */
@Value
@Builder(toBuilder = true)
public class UiSettings {

    private static final UiSettings EMPTY = UiSettings.builder().build();

    Boolean secondLeftSidebarOpen;
    String activeSecondaryPanel;
    Boolean pointerFrameEnabled;
    Boolean audioTrackerEnabled;
    Boolean mouseTrackerEnabled;
    Boolean virtualizerMode;
    String visualizerMode;

    public static UiSettings empty() {
        return EMPTY;
    }

    /**
     * Returns a copy where every field set in {@code other} replaces the field here.
     */
    public UiSettings merge(UiSettings other) {
        if (other == null) {
            return this;
        }
        return new UiSettings(
            pick(other.secondLeftSidebarOpen, secondLeftSidebarOpen),
            pick(other.activeSecondaryPanel, activeSecondaryPanel),
            pick(other.pointerFrameEnabled, pointerFrameEnabled),
            pick(other.audioTrackerEnabled, audioTrackerEnabled),
            pick(other.mouseTrackerEnabled, mouseTrackerEnabled),
            pick(other.virtualizerMode, virtualizerMode),
            pick(other.visualizerMode, visualizerMode));
    }

    public boolean isEmpty() {
        return equals(EMPTY);
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
