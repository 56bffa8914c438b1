package com.streamfirst.canvas.sync.application;

import com.streamfirst.canvas.sync.adapters.InMemoryLocalStorageAdapter;
import com.streamfirst.canvas.sync.adapters.InMemoryRemoteStoreAdapter;
import com.streamfirst.canvas.sync.domain.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CloudPersistenceGatewayTest {

    private static final OwnerId OWNER = new OwnerId("user-1");
    private static final SyncSettings ENABLED =
        SyncSettings.builder().backendUrl("https://abc.example.co").accessKey("test-key").build();

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private InMemoryRemoteStoreAdapter store;
    private DeviceIdentity identity;
    private CloudPersistenceGateway gateway;

    @BeforeEach
    void setUp() {
        store = new InMemoryRemoteStoreAdapter();
        identity = new DeviceIdentity(new InMemoryLocalStorageAdapter());
        gateway = new CloudPersistenceGateway(ENABLED, store, identity, new PayloadCodec(), clock);
    }

    @Test
    void saveThenLoadReturnsTheLastWrite() {
        assertThat(gateway.save(OWNER, TabsPayload.of(Tab.of("t1", "A"))).isSuccess()).isTrue();
        assertThat(gateway.save(OWNER, TabsPayload.of(Tab.of("t2", "B"))).isSuccess()).isTrue();

        assertThat(gateway.load(OWNER, DataType.TABS).orElseThrow())
            .isEqualTo(TabsPayload.of(Tab.of("t2", "B")));
        assertThat(store.rowCount(SyncTables.CANVAS_DATA)).isEqualTo(1);
    }

    @Test
    void savedRecordIsTaggedWithThisDevice() {
        gateway.save(OWNER, ExpandedItemsPayload.of("folder-1"));

        SyncRecord record = gateway.loadRecord(OWNER, DataType.EXPANDED_ITEMS).orElseThrow();

        assertThat(record.writtenBy(identity.getDeviceId())).isTrue();
        assertThat(record.getUpdatedAt()).isEqualTo(clock.instant());
    }

    @Test
    void missingRowIsNotFound() {
        assertThat(gateway.load(OWNER, DataType.LAYOUT).failedWith(SyncErrorKind.NOT_FOUND)).isTrue();
        assertThat(gateway.loadPreferences(OWNER).failedWith(SyncErrorKind.NOT_FOUND)).isTrue();
    }

    @Test
    void disabledSyncOrMissingOwnerIsANoOp() {
        CloudPersistenceGateway disabled = new CloudPersistenceGateway(
            SyncSettings.disabled(), store, identity, new PayloadCodec(), clock);

        assertThat(disabled.isEnabled()).isFalse();
        assertThat(disabled.save(OWNER, ExpandedItemsPayload.of("a"))
            .failedWith(SyncErrorKind.CONFIGURATION_ABSENT)).isTrue();
        assertThat(disabled.loadAll(OWNER).failedWith(SyncErrorKind.CONFIGURATION_ABSENT)).isTrue();
        assertThat(gateway.save(null, ExpandedItemsPayload.of("a"))
            .failedWith(SyncErrorKind.CONFIGURATION_ABSENT)).isTrue();
        assertThat(store.upsertCount()).isZero();
    }

    @Test
    void backendFailuresAreReportedNotThrown() {
        store.setReachable(false);

        assertThat(gateway.save(OWNER, ExpandedItemsPayload.of("a"))
            .failedWith(SyncErrorKind.TRANSIENT_BACKEND)).isTrue();
        assertThat(gateway.load(OWNER, DataType.TABS).failedWith(SyncErrorKind.TRANSIENT_BACKEND)).isTrue();
        assertThat(gateway.savePreferences(OWNER, PreferencesUpdate.builder().startupBehavior("x").build())
            .failedWith(SyncErrorKind.TRANSIENT_BACKEND)).isTrue();
    }

    @Test
    void loadAllSkipsMissingAndUndecodableTypes() {
        gateway.save(OWNER, TabsPayload.of(Tab.of("t1", "A")));
        gateway.save(OWNER, new SettingsPayload(Map.of("theme", "dark")));
        store.putRaw(SyncTables.CANVAS_DATA, Map.of(
            SyncTables.USER_ID, OWNER.value(),
            SyncTables.DATA_TYPE, "expanded_items",
            SyncTables.DATA, List.of(1, 2),
            SyncTables.DEVICE_ID, "device_9_zzzzzzzzzzzzz"));

        Map<DataType, SyncPayload> loaded = gateway.loadAll(OWNER).orElseThrow();

        assertThat(loaded).containsOnlyKeys(DataType.TABS, DataType.SETTINGS);
        assertThat(gateway.load(OWNER, DataType.EXPANDED_ITEMS)
            .failedWith(SyncErrorKind.MALFORMED_PAYLOAD)).isTrue();
    }

    @Test
    void preferencesUpsertsMergeByField() {
        gateway.savePreferences(OWNER, PreferencesUpdate.builder().layoutMode(LayoutMode.GRID).build());
        gateway.savePreferences(OWNER, PreferencesUpdate.builder().newTabBehavior("duplicate").build());

        PreferenceRecord record = gateway.loadPreferences(OWNER).orElseThrow();

        assertThat(record.getLayoutMode()).isEqualTo(LayoutMode.GRID);
        assertThat(record.getNewTabBehavior()).isEqualTo("duplicate");
        assertThat(record.getDeviceId()).isEqualTo(identity.getDeviceId());
        assertThat(store.rowCount(SyncTables.PREFERENCES)).isEqualTo(1);
    }
}
