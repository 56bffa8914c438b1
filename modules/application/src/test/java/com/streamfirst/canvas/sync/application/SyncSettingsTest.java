package com.streamfirst.canvas.sync.application;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SyncSettingsTest {

    @Test
    void defaultsMatchTheDocumentedTimings() {
        SyncSettings settings = SyncSettings.disabled();

        assertThat(settings.isEnabled()).isFalse();
        assertThat(settings.getDebounceDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(settings.getReconnectBaseDelay()).isEqualTo(Duration.ofSeconds(2));
        assertThat(settings.getMaxReconnectAttempts()).isEqualTo(5);
        assertThat(settings.getLegacyStateKey()).isEqualTo("tv25-storage");
    }

    @Test
    void placeholdersDoNotEnableSync() {
        assertThat(SyncSettings.builder().backendUrl("https://your-project.example.co").accessKey("k").build()
            .isEnabled()).isFalse();
        assertThat(SyncSettings.builder().backendUrl("https://abc.example.co").accessKey("your-anon-key").build()
            .isEnabled()).isFalse();
        assertThat(SyncSettings.builder().backendUrl(" ").accessKey("k").build().isEnabled()).isFalse();
        assertThat(SyncSettings.builder().backendUrl("https://abc.example.co").accessKey("k").build()
            .isEnabled()).isTrue();
    }

    @Test
    void readsEnvironmentAndMasksKey() {
        SyncSettings settings = SyncSettings.fromEnvironment(Map.of(
            SyncSettings.ENV_BACKEND_URL, "https://abc.example.co",
            SyncSettings.ENV_ACCESS_KEY, "secret-key",
            SyncSettings.ENV_PRODUCTION, "true"));

        assertThat(settings.isEnabled()).isTrue();
        assertThat(settings.isProduction()).isTrue();
        assertThat(settings.toString()).doesNotContain("secret-key").contains("****");
    }

    @Test
    void localOnlyModeEnablesSyncWithoutABackend() {
        SyncSettings settings = SyncSettings.builder().localOnly(true).build();

        assertThat(settings.isEnabled()).isTrue();
        assertThat(settings.hasRemoteBackend()).isFalse();
        assertThat(SyncSettings.disabled().hasRemoteBackend()).isFalse();
    }
}
