package com.streamfirst.canvas.sync.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A partial write to the preferences record. Only non-null fields are written; everything else keeps
 * its current value.
 */
@Value
@Builder
public class PreferencesUpdate {
    LayoutMode layoutMode;
    String newTabBehavior;
    String startupBehavior;
    Map<String, Object> gridModeState;
    UiSettings uiSettings;

    public boolean isEmpty() {
        return layoutMode == null
            && newTabBehavior == null
            && startupBehavior == null
            && gridModeState == null
            && (uiSettings == null || uiSettings.isEmpty());
    }
}
