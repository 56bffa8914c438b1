package com.streamfirst.canvas.sync.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Map;

/**
 * Per-owner singleton holding scalar workspace preferences and the nested UI toggle flags. Upserted
 * on the owner id, like {@link SyncRecord}.
 */
@Value
@With
@Builder(toBuilder = true)
public class PreferenceRecord {

    @NonNull OwnerId ownerId;
    LayoutMode layoutMode;
    String newTabBehavior;
    String startupBehavior;
    Map<String, Object> gridModeState;
    @NonNull @Builder.Default UiSettings uiSettings = UiSettings.empty();

    /** Device that performed the last write, null for rows written before devices were tagged */
    DeviceId deviceId;
    Instant updatedAt;

    public static PreferenceRecord empty(OwnerId ownerId) {
        return PreferenceRecord.builder().ownerId(ownerId).build();
    }

    /**
     * Applies a partial update field by field. Fields absent from the update are kept.
     */
    public PreferenceRecord merge(PreferencesUpdate update) {
        if (update == null) {
            return this;
        }
        return toBuilder()
            .layoutMode(update.getLayoutMode() != null ? update.getLayoutMode() : layoutMode)
            .newTabBehavior(update.getNewTabBehavior() != null ? update.getNewTabBehavior() : newTabBehavior)
            .startupBehavior(update.getStartupBehavior() != null ? update.getStartupBehavior() : startupBehavior)
            .gridModeState(update.getGridModeState() != null ? update.getGridModeState() : gridModeState)
            .uiSettings(uiSettings.merge(update.getUiSettings()))
            .build();
    }

    /**
     * Merges another full record into this one field by field, as done when a remote device
     * changed its preferences.
     */
    public PreferenceRecord merge(PreferenceRecord remote) {
        return merge(remote.toUpdate())
            .withDeviceId(remote.deviceId)
            .withUpdatedAt(remote.updatedAt);
    }

    public PreferencesUpdate toUpdate() {
        return PreferencesUpdate.builder()
            .layoutMode(layoutMode)
            .newTabBehavior(newTabBehavior)
            .startupBehavior(startupBehavior)
            .gridModeState(gridModeState)
            .uiSettings(uiSettings)
            .build();
    }
}
