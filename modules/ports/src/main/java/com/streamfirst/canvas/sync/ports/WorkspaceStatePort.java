package com.streamfirst.canvas.sync.ports;

import com.streamfirst.canvas.sync.domain.ExpandedItemsPayload;
import com.streamfirst.canvas.sync.domain.LayoutPayload;
import com.streamfirst.canvas.sync.domain.OwnerId;
import com.streamfirst.canvas.sync.domain.PreferenceRecord;
import com.streamfirst.canvas.sync.domain.PreferencesUpdate;
import com.streamfirst.canvas.sync.domain.SettingsPayload;
import com.streamfirst.canvas.sync.domain.TabsPayload;

import java.util.Optional;

/**
 * Port for the local in-memory state container the UI renders from. Local mutations are written
 * here first; remote changes are folded in by the change router.
 */
public interface WorkspaceStatePort {

    void replaceTabs(TabsPayload tabs);

    void replaceExpandedItems(ExpandedItemsPayload expandedItems);

    void replaceLayout(LayoutPayload layout);

    void replaceSettings(SettingsPayload settings);

    /**
     * Merges a partial update into the owner's current preferences; fields absent from the update
     * are kept.
     */
    void mergePreferences(OwnerId ownerId, PreferencesUpdate update);

    Optional<TabsPayload> tabs();

    Optional<ExpandedItemsPayload> expandedItems();

    Optional<LayoutPayload> layout();

    Optional<SettingsPayload> settings();

    Optional<PreferenceRecord> preferences();
}
