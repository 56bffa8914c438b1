package com.streamfirst.canvas.sync.application;

import com.streamfirst.canvas.sync.domain.*;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PayloadCodecTest {

    private final PayloadCodec codec = new PayloadCodec();

    @Test
    void tabsKeepUnknownAttributes() {
        List<Object> data = List.of(Map.of("id", "t1", "title", "Home", "pinned", true));

        TabsPayload tabs = (TabsPayload) codec.decode(DataType.TABS, data).orElseThrow();

        assertThat(tabs.tabs()).singleElement().satisfies(tab -> {
            assertThat(tab.id()).isEqualTo("t1");
            assertThat(tab.title()).isEqualTo("Home");
            assertThat(tab.attributes()).containsEntry("pinned", true);
        });
        assertThat(codec.encode(tabs)).isEqualTo(List.of(Map.of("id", "t1", "title", "Home", "pinned", true)));
    }

    @Test
    void invalidPayloadsAreReportedAsMalformed() {
        assertThat(codec.decode(DataType.TABS, List.of(Map.of("title", "no id")))
            .failedWith(SyncErrorKind.MALFORMED_PAYLOAD)).isTrue();
        assertThat(codec.decode(DataType.TABS, Map.of("id", "t1"))
            .failedWith(SyncErrorKind.MALFORMED_PAYLOAD)).isTrue();
        assertThat(codec.decode(DataType.EXPANDED_ITEMS, List.of("a", 2))
            .failedWith(SyncErrorKind.MALFORMED_PAYLOAD)).isTrue();
        assertThat(codec.decode(DataType.LAYOUT, Map.of("layoutMode", "spiral"))
            .failedWith(SyncErrorKind.MALFORMED_PAYLOAD)).isTrue();
        assertThat(codec.decode(DataType.SETTINGS, "dark")
            .failedWith(SyncErrorKind.MALFORMED_PAYLOAD)).isTrue();
        assertThat(codec.decode(DataType.SETTINGS, null)
            .failedWith(SyncErrorKind.MALFORMED_PAYLOAD)).isTrue();
    }

    @Test
    void layoutDecodesModeAndGridState() {
        Map<String, Object> data = Map.of("layoutMode", "grid", "gridModeState", Map.of("page", 3));

        LayoutPayload layout = (LayoutPayload) codec.decode(DataType.LAYOUT, data).orElseThrow();

        assertThat(layout.mode()).isEqualTo(LayoutMode.GRID);
        assertThat(layout.gridModeState()).containsEntry("page", 3);
    }

    @Test
    void canvasRowCarriesOwnerDeviceAndTimestamp() {
        SyncRecord record = new SyncRecord(new OwnerId("u1"), ExpandedItemsPayload.of("a", "b"),
            new DeviceId("device_1_aaaaaaaaaaaaa"), Instant.parse("2024-05-01T10:00:00Z"));

        Map<String, Object> row = codec.toRow(record);

        assertThat(row)
            .containsEntry(SyncTables.USER_ID, "u1")
            .containsEntry(SyncTables.DATA_TYPE, "expanded_items")
            .containsEntry(SyncTables.DEVICE_ID, "device_1_aaaaaaaaaaaaa")
            .containsEntry(SyncTables.DATA, List.of("a", "b"));
        assertThat(codec.fromRow(row).orElseThrow()).isEqualTo(record);
    }

    @Test
    void rowsWithOffsetTimestampsAreAccepted() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(SyncTables.USER_ID, "u1");
        row.put(SyncTables.DATA_TYPE, "settings");
        row.put(SyncTables.DATA, Map.of("theme", "dark"));
        row.put(SyncTables.DEVICE_ID, "device_2_bbbbbbbbbbbbb");
        row.put(SyncTables.UPDATED_AT, "2024-05-01T12:00:00.123456+02:00");

        SyncRecord record = codec.fromRow(row).orElseThrow();

        assertThat(record.getUpdatedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00.123456Z"));
        assertThat(((SettingsPayload) record.getPayload()).values()).containsEntry("theme", "dark");
    }

    @Test
    void rowsMissingColumnsOrWithUnknownTypeAreMalformed() {
        Map<String, Object> noDevice = Map.of(SyncTables.USER_ID, "u1", SyncTables.DATA_TYPE, "tabs",
            SyncTables.DATA, List.of());
        Map<String, Object> unknownType = Map.of(SyncTables.USER_ID, "u1", SyncTables.DATA_TYPE, "widgets",
            SyncTables.DATA, List.of(), SyncTables.DEVICE_ID, "d");

        assertThat(codec.fromRow(noDevice).failedWith(SyncErrorKind.MALFORMED_PAYLOAD)).isTrue();
        assertThat(codec.fromRow(unknownType).failedWith(SyncErrorKind.MALFORMED_PAYLOAD)).isTrue();
    }

    @Test
    void preferencesRowHoldsOnlyTheFieldsBeingWritten() {
        PreferencesUpdate update = PreferencesUpdate.builder()
            .startupBehavior("restore")
            .uiSettings(UiSettings.builder().secondLeftSidebarOpen(true).build())
            .build();

        Map<String, Object> row = codec.toPreferencesRow(new OwnerId("u1"), update,
            new DeviceId("device_3_ccccccccccccc"), Instant.EPOCH);

        assertThat(row).containsOnlyKeys(SyncTables.USER_ID, SyncTables.STARTUP_BEHAVIOR, SyncTables.UI_SETTINGS,
            SyncTables.DEVICE_ID, SyncTables.UPDATED_AT);
        assertThat(row.get(SyncTables.UI_SETTINGS)).isEqualTo(Map.of("isSecondLeftSidebarOpen", true));
    }

    @Test
    void preferencesRowDecodesUiFlags() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(SyncTables.USER_ID, "u1");
        row.put(SyncTables.LAYOUT_MODE, "canvas");
        row.put(SyncTables.GRID_MODE_STATE, null);
        row.put(SyncTables.UI_SETTINGS, Map.of("audioTrackerEnabled", false, "visualizerMode", "wave"));
        row.put(SyncTables.DEVICE_ID, "device_4_ddddddddddddd");

        PreferenceRecord record = codec.fromPreferencesRow(row).orElseThrow();

        assertThat(record.getLayoutMode()).isEqualTo(LayoutMode.CANVAS);
        assertThat(record.getGridModeState()).isNull();
        assertThat(record.getUiSettings().getAudioTrackerEnabled()).isFalse();
        assertThat(record.getUiSettings().getVisualizerMode()).isEqualTo("wave");
        assertThat(record.getDeviceId()).isEqualTo(new DeviceId("device_4_ddddddddddddd"));
        assertThat(codec.fromPreferencesRow(Map.of(SyncTables.USER_ID, "u1", SyncTables.UI_SETTINGS, "on"))
            .failedWith(SyncErrorKind.MALFORMED_PAYLOAD)).isTrue();
    }
}
