package com.streamfirst.canvas.sync.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PreferenceRecordTest {

    private static final OwnerId OWNER = new OwnerId("user-1");

    @Test
    void partialUpdateKeepsAbsentFields() {
        PreferenceRecord current = PreferenceRecord.builder()
            .ownerId(OWNER)
            .layoutMode(LayoutMode.GRID)
            .newTabBehavior("blank")
            .uiSettings(UiSettings.builder().pointerFrameEnabled(true).visualizerMode("bars").build())
            .build();

        PreferenceRecord merged = current.merge(PreferencesUpdate.builder()
            .layoutMode(LayoutMode.CANVAS)
            .uiSettings(UiSettings.builder().pointerFrameEnabled(false).build())
            .build());

        assertThat(merged.getLayoutMode()).isEqualTo(LayoutMode.CANVAS);
        assertThat(merged.getNewTabBehavior()).isEqualTo("blank");
        assertThat(merged.getUiSettings().getPointerFrameEnabled()).isFalse();
        assertThat(merged.getUiSettings().getVisualizerMode()).isEqualTo("bars");
    }

    @Test
    void mergingRemoteRecordTakesItsDeviceAndTimestamp() {
        DeviceId remoteDevice = new DeviceId("device_1_abcdefghijklm");
        Instant writtenAt = Instant.parse("2024-05-01T10:00:00Z");
        PreferenceRecord local = PreferenceRecord.empty(OWNER).withStartupBehavior("restore");
        PreferenceRecord remote = PreferenceRecord.builder()
            .ownerId(OWNER)
            .gridModeState(Map.of("page", 2))
            .deviceId(remoteDevice)
            .updatedAt(writtenAt)
            .build();

        PreferenceRecord merged = local.merge(remote);

        assertThat(merged.getStartupBehavior()).isEqualTo("restore");
        assertThat(merged.getGridModeState()).containsEntry("page", 2);
        assertThat(merged.getDeviceId()).isEqualTo(remoteDevice);
        assertThat(merged.getUpdatedAt()).isEqualTo(writtenAt);
    }

    @Test
    void emptyUpdateIsRecognized() {
        assertThat(PreferencesUpdate.builder().build().isEmpty()).isTrue();
        assertThat(PreferencesUpdate.builder().uiSettings(UiSettings.empty()).build().isEmpty()).isTrue();
        assertThat(PreferencesUpdate.builder().startupBehavior("restore").build().isEmpty()).isFalse();
        assertThat(PreferenceRecord.empty(OWNER).merge((PreferencesUpdate) null))
            .isEqualTo(PreferenceRecord.empty(OWNER));
    }
}
