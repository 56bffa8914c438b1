package com.streamfirst.canvas.sync.boot;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.canvas.sync.adapters.InMemoryChangeFeedAdapter;
import com.streamfirst.canvas.sync.adapters.InMemoryRemoteStoreAdapter;
import com.streamfirst.canvas.sync.adapters.backend.rest.PollingChangeFeedAdapter;
import com.streamfirst.canvas.sync.adapters.backend.rest.RestRemoteStoreAdapter;
import com.streamfirst.canvas.sync.adapters.storage.file.FileLocalStorageAdapter;
import com.streamfirst.canvas.sync.application.PayloadCodec;
import com.streamfirst.canvas.sync.application.StartReport;
import com.streamfirst.canvas.sync.application.SyncEngine;
import com.streamfirst.canvas.sync.application.SyncSettings;
import com.streamfirst.canvas.sync.application.SyncTables;
import com.streamfirst.canvas.sync.domain.DataType;
import com.streamfirst.canvas.sync.domain.DeviceId;
import com.streamfirst.canvas.sync.domain.OwnerId;
import com.streamfirst.canvas.sync.domain.SyncErrorKind;
import com.streamfirst.canvas.sync.domain.SyncRecord;
import com.streamfirst.canvas.sync.domain.Tab;
import com.streamfirst.canvas.sync.domain.TabsPayload;
import com.streamfirst.canvas.sync.ports.ChangeFeedPort;
import com.streamfirst.canvas.sync.ports.LocalStoragePort;
import com.streamfirst.canvas.sync.ports.RemoteStorePort;
import com.streamfirst.canvas.sync.ports.WorkspaceStatePort;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class SyncEngineConfigurationTest {

    private static final OwnerId OWNER = new OwnerId("demo");

    @TempDir
    Path dir;

    private ApplicationContextRunner runner() {
        return new ApplicationContextRunner()
            .withUserConfiguration(SyncEngineConfiguration.class)
            .withPropertyValues("canvas.sync.local-storage-file=" + dir.resolve("local.properties"));
    }

    @Test
    void withoutBackendSyncIsDisabledButLocalEditsApply() {
        runner().run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context.getBean(LocalStoragePort.class)).isInstanceOf(FileLocalStorageAdapter.class);
            assertThat(context).doesNotHaveBean(CommandLineRunner.class);

            SyncEngine engine = context.getBean(SyncEngine.class);
            TabsPayload tabs = TabsPayload.of(Tab.of("t1", "Offline"));
            StartReport report = engine.start(OWNER);
            engine.updateLocal(OWNER, tabs);

            assertThat(engine.isEnabled()).isFalse();
            assertThat(report.channels()).isEmpty();
            assertThat(engine.pendingWrites()).isEmpty();
            assertThat(engine.save(OWNER, tabs).failedWith(SyncErrorKind.CONFIGURATION_ABSENT)).isTrue();
            assertThat(context.getBean(WorkspaceStatePort.class).tabs()).contains(tabs);
        });
    }

    @Test
    void localOnlyModeSyncsThroughTheInProcessStore() {
        runner()
            .withPropertyValues("canvas.sync.local-only=true")
            .run(context -> {
                assertThat(context).hasNotFailed();
                SyncEngine engine = context.getBean(SyncEngine.class);
                InMemoryRemoteStoreAdapter store = (InMemoryRemoteStoreAdapter) context.getBean(RemoteStorePort.class);
                assertThat(context.getBean(ChangeFeedPort.class)).isInstanceOf(InMemoryChangeFeedAdapter.class);
                WorkspaceStatePort state = context.getBean(WorkspaceStatePort.class);

                StartReport report = engine.start(OWNER);
                engine.updateLocal(OWNER, TabsPayload.of(Tab.of("t1", "Local")));
                engine.flushPendingWrites();

                assertThat(engine.isEnabled()).isTrue();
                assertThat(report.channels()).containsExactly("canvas-changes:demo", "preference-changes:demo");
                assertThat(store.rowCount(SyncTables.CANVAS_DATA)).isEqualTo(1);
                assertThat(engine.load(OWNER, DataType.TABS).orElseThrow())
                    .isEqualTo(TabsPayload.of(Tab.of("t1", "Local")));

                // A write from another engine in the same process reaches this one through the feed
                TabsPayload remote = TabsPayload.of(Tab.of("t2", "From elsewhere"));
                store.upsert(SyncTables.CANVAS_DATA, new PayloadCodec().toRow(new SyncRecord(OWNER, remote,
                    new DeviceId("device_1_otherdevice00"), Instant.now())), SyncTables.CANVAS_DATA_KEY);
                assertThat(state.tabs()).contains(remote);
            });
    }

    @Test
    void configuredBackendSelectsTheRestAdapters() {
        runner()
            .withPropertyValues(
                "canvas.sync.backend-url=http://127.0.0.1:54321",
                "canvas.sync.access-key=test-key",
                "canvas.sync.poll-interval=30s")
            .run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context.getBean(RemoteStorePort.class)).isInstanceOf(RestRemoteStoreAdapter.class);
                assertThat(context.getBean(ChangeFeedPort.class)).isInstanceOf(PollingChangeFeedAdapter.class);
                assertThat(context.getBean(SyncEngine.class).isEnabled()).isTrue();
            });
    }

    @Test
    void timingPropertiesReachTheEngineSettings() {
        runner()
            .withPropertyValues(
                "canvas.sync.debounce-delay=250ms",
                "canvas.sync.reconnect-base-delay=1s",
                "canvas.sync.max-reconnect-attempts=3",
                "canvas.sync.legacy-state-key=old-storage")
            .run(context -> {
                SyncSettings settings = context.getBean(SyncSettings.class);
                assertThat(settings.getDebounceDelay()).isEqualTo(Duration.ofMillis(250));
                assertThat(settings.getReconnectBaseDelay()).isEqualTo(Duration.ofSeconds(1));
                assertThat(settings.getMaxReconnectAttempts()).isEqualTo(3);
                assertThat(settings.getLegacyStateKey()).isEqualTo("old-storage");
                assertThat(context.getBean(SyncEngine.class).reconnectDelay(2)).isEqualTo(Duration.ofSeconds(4));
            });
    }

    @Test
    void demoRunnerIsOptIn() {
        runner()
            .withPropertyValues("canvas.sync.demo.enabled=true")
            .run(context -> assertThat(context).hasSingleBean(CommandLineRunner.class));
    }
}
