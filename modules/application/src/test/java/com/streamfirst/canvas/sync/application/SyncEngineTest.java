package com.streamfirst.canvas.sync.application;

import com.streamfirst.canvas.sync.adapters.*;
import com.streamfirst.canvas.sync.domain.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SyncEngineTest {

    private static final OwnerId OWNER = new OwnerId("u1");
    private static final SyncSettings ENABLED =
        SyncSettings.builder().backendUrl("https://abc.example.co").accessKey("test-key").build();

    private InMemoryChangeFeedAdapter feed;
    private InMemoryRemoteStoreAdapter store;
    private ManualTaskScheduler timers;
    private InMemoryWorkspaceStateAdapter state;
    private SyncEngine engine;

    @BeforeEach
    void setUp() {
        feed = new InMemoryChangeFeedAdapter();
        store = new InMemoryRemoteStoreAdapter(feed);
        timers = new ManualTaskScheduler();
        state = new InMemoryWorkspaceStateAdapter();
        engine = new SyncEngine(ENABLED, store, feed, new InMemoryLocalStorageAdapter(), state, timers,
            Clock.systemUTC());
    }

    @Test
    void startHydratesLocalStateAndSubscribes() {
        store.upsert(SyncTables.CANVAS_DATA, new PayloadCodec().toRow(new SyncRecord(OWNER,
                TabsPayload.of(Tab.of("t1", "Remote")), new DeviceId("device_1_remotedevice0"), Instant.EPOCH)),
            SyncTables.CANVAS_DATA_KEY);

        StartReport report = engine.start(OWNER);

        assertThat(report.migration()).isEqualTo(MigrationOutcome.NOTHING_TO_MIGRATE);
        assertThat(report.hydratedTypes()).containsExactly(DataType.TABS);
        assertThat(report.preferencesHydrated()).isFalse();
        assertThat(report.channels()).containsExactly("canvas-changes:u1", "preference-changes:u1");
        assertThat(state.tabs()).contains(TabsPayload.of(Tab.of("t1", "Remote")));
        assertThat(feed.openChannelCount()).isEqualTo(2);
        assertThat(engine.connectionStatus().activeChannels()).isEqualTo(2);
    }

    @Test
    void rapidLocalEditsProduceOneWriteAndNoEcho() {
        engine.start(OWNER);

        engine.updateLocal(OWNER, TabsPayload.of(Tab.of("t1", "A")));
        engine.updateLocal(OWNER, TabsPayload.of(Tab.of("t1", "AB")));
        engine.updateLocal(OWNER, TabsPayload.of(Tab.of("t1", "ABC")));
        long revisionBeforeWrite = state.revision();

        assertThat(state.tabs()).contains(TabsPayload.of(Tab.of("t1", "ABC")));
        assertThat(engine.pendingWrites()).containsExactly("u1:tabs");
        assertThat(store.upsertCount()).isZero();

        timers.advance(Duration.ofMillis(1000));

        assertThat(store.upsertCount()).isEqualTo(1);
        assertThat(engine.load(OWNER, DataType.TABS).orElseThrow()).isEqualTo(TabsPayload.of(Tab.of("t1", "ABC")));
        assertThat(state.revision()).isEqualTo(revisionBeforeWrite);
    }

    @Test
    void partialPreferenceEditsAreSavedTogether() {
        engine.start(OWNER);

        engine.updatePreferences(OWNER, PreferencesUpdate.builder().layoutMode(LayoutMode.GRID).build());
        engine.updatePreferences(OWNER, PreferencesUpdate.builder().startupBehavior("restore").build());
        timers.advance(Duration.ofMillis(1000));

        PreferenceRecord saved = engine.loadPreferences(OWNER).orElseThrow();
        assertThat(store.upsertCount()).isEqualTo(1);
        assertThat(saved.getLayoutMode()).isEqualTo(LayoutMode.GRID);
        assertThat(saved.getStartupBehavior()).isEqualTo("restore");
        assertThat(saved.getDeviceId()).isEqualTo(engine.deviceId());
    }

    @Test
    void closeFlushesPendingWritesAndUnsubscribes() {
        engine.start(OWNER);
        engine.updateLocal(OWNER, ExpandedItemsPayload.of("f1"));

        engine.close();

        assertThat(store.upsertCount()).isEqualTo(1);
        assertThat(engine.pendingWrites()).isEmpty();
        assertThat(feed.openChannelCount()).isZero();
        assertThat(timers.runAll()).isZero();
    }

    @Test
    void disabledSyncKeepsWorkingLocally() {
        SyncEngine offline = new SyncEngine(SyncSettings.disabled(), store, feed, new InMemoryLocalStorageAdapter(),
            state, timers, Clock.systemUTC());

        StartReport report = offline.start(OWNER);
        offline.updateLocal(OWNER, TabsPayload.of(Tab.of("t1", "Local")));
        offline.updatePreferences(OWNER, PreferencesUpdate.builder().newTabBehavior("blank").build());

        assertThat(report.migration()).isEqualTo(MigrationOutcome.SYNC_DISABLED);
        assertThat(report.channels()).isEmpty();
        assertThat(state.tabs()).contains(TabsPayload.of(Tab.of("t1", "Local")));
        assertThat(state.preferences().map(PreferenceRecord::getNewTabBehavior)).contains("blank");
        assertThat(offline.pendingWrites()).isEmpty();
        assertThat(offline.save(OWNER, TabsPayload.of()).failedWith(SyncErrorKind.CONFIGURATION_ABSENT)).isTrue();
        assertThat(store.upsertCount()).isZero();
    }

    @Test
    void unwritableLocalStorageDoesNotStopTheEngine() {
        InMemoryLocalStorageAdapter readOnly = new InMemoryLocalStorageAdapter();
        readOnly.put("tv25-storage", "{\"state\":{\"expandedItems\":[\"f1\"]}}");
        readOnly.setWritable(false);

        SyncEngine readOnlyEngine = new SyncEngine(ENABLED, store, feed, readOnly, state, timers, Clock.systemUTC());
        StartReport report = readOnlyEngine.start(OWNER);
        readOnlyEngine.updateLocal(OWNER, TabsPayload.of(Tab.of("t1", "Edited")));
        timers.advance(Duration.ofMillis(1000));

        assertThat(report.migration()).isEqualTo(MigrationOutcome.MIGRATED);
        assertThat(report.channels()).hasSize(2);
        assertThat(readOnlyEngine.deviceId()).isEqualTo(readOnlyEngine.deviceId());
        assertThat(readOnlyEngine.load(OWNER, DataType.TABS).orElseThrow())
            .isEqualTo(TabsPayload.of(Tab.of("t1", "Edited")));
    }

    @Test
    void missingOwnerIsANoOpEverywhere() {
        StartReport report = engine.start(null);
        engine.updatePreferences(null, PreferencesUpdate.builder().layoutMode(LayoutMode.GRID).build());
        engine.updateLocal(null, TabsPayload.of(Tab.of("t1", "Anonymous")));

        assertThat(report.channels()).isEmpty();
        assertThat(engine.migrateOnce(null)).isEqualTo(MigrationOutcome.NO_OWNER);
        assertThat(state.preferences()).isEmpty();
        assertThat(state.tabs()).contains(TabsPayload.of(Tab.of("t1", "Anonymous")));
        assertThat(engine.pendingWrites()).isEmpty();
        assertThat(store.upsertCount()).isZero();
    }

    @Test
    void reconnectDelayFollowsSettings() {
        assertThat(engine.reconnectDelay(0)).isEqualTo(Duration.ofSeconds(2));
        assertThat(engine.reconnectDelay(4)).isEqualTo(Duration.ofSeconds(32));
    }
}
