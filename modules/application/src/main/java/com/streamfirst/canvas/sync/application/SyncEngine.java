package com.streamfirst.canvas.sync.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.canvas.sync.domain.ChangeEvent;
import com.streamfirst.canvas.sync.domain.ChannelName;
import com.streamfirst.canvas.sync.domain.ChannelSpec;
import com.streamfirst.canvas.sync.domain.DataType;
import com.streamfirst.canvas.sync.domain.DeviceId;
import com.streamfirst.canvas.sync.domain.OwnerId;
import com.streamfirst.canvas.sync.domain.PreferenceRecord;
import com.streamfirst.canvas.sync.domain.PreferencesUpdate;
import com.streamfirst.canvas.sync.domain.Result;
import com.streamfirst.canvas.sync.domain.SyncPayload;
import com.streamfirst.canvas.sync.ports.ChangeFeedPort;
import com.streamfirst.canvas.sync.ports.LocalStoragePort;
import com.streamfirst.canvas.sync.ports.RemoteStorePort;
import com.streamfirst.canvas.sync.ports.TaskScheduler;
import com.streamfirst.canvas.sync.ports.WorkspaceStatePort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Sync session of one device. Wires the device identity, persistence gateway, write debouncer,
 * subscription manager, change router and migrator over the given ports, and exposes the operations
 * the host application uses.
 *
 * <p>Typical lifecycle: {@link #start} once the owner is known, {@link #updateLocal} and
 * {@link #updatePreferences} on every local edit, {@link #close} on sign-out or shutdown.
 */
@Slf4j
public class SyncEngine implements AutoCloseable {

    private final SyncSettings settings;
    private final WorkspaceStatePort state;
    private final DeviceIdentity deviceIdentity;
    private final PayloadCodec codec;
    private final CloudPersistenceGateway gateway;
    private final DebouncedWriteScheduler writeScheduler;
    private final ChangeFeedSubscriptionManager subscriptions;
    private final ChangeNotificationRouter router;
    private final LocalToCloudMigrator migrator;

    public SyncEngine(
            SyncSettings settings,
            RemoteStorePort remoteStore,
            ChangeFeedPort changeFeed,
            LocalStoragePort localStorage,
            WorkspaceStatePort state,
            TaskScheduler scheduler,
            Clock clock) {
        this(settings, remoteStore, changeFeed, localStorage, state, scheduler, clock, new ObjectMapper());
    }

    public SyncEngine(
            SyncSettings settings,
            RemoteStorePort remoteStore,
            ChangeFeedPort changeFeed,
            LocalStoragePort localStorage,
            WorkspaceStatePort state,
            TaskScheduler scheduler,
            Clock clock,
            ObjectMapper mapper) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.state = Objects.requireNonNull(state, "state");
        this.deviceIdentity = new DeviceIdentity(localStorage);
        this.codec = new PayloadCodec(mapper);
        this.gateway = new CloudPersistenceGateway(settings, remoteStore, deviceIdentity, codec, clock);
        this.writeScheduler = new DebouncedWriteScheduler(scheduler);
        this.subscriptions = new ChangeFeedSubscriptionManager(changeFeed, scheduler, settings);
        this.router = new ChangeNotificationRouter(state, deviceIdentity, codec);
        this.migrator = new LocalToCloudMigrator(localStorage, gateway, codec, settings);
        log.info("Sync engine created for device {} with {}", deviceIdentity.getDeviceId(), settings);
    }

    public DeviceId deviceId() {
        return deviceIdentity.getDeviceId();
    }

    public boolean isEnabled() {
        return gateway.isEnabled();
    }

    public Result<Void> save(OwnerId ownerId, SyncPayload payload) {
        return gateway.save(ownerId, payload);
    }

    public Result<SyncPayload> load(OwnerId ownerId, DataType dataType) {
        return gateway.load(ownerId, dataType);
    }

    public Result<Map<DataType, SyncPayload>> loadAll(OwnerId ownerId) {
        return gateway.loadAll(ownerId);
    }

    public Result<Void> savePreferences(OwnerId ownerId, PreferencesUpdate update) {
        return gateway.savePreferences(ownerId, update);
    }

    public Result<PreferenceRecord> loadPreferences(OwnerId ownerId) {
        return gateway.loadPreferences(ownerId);
    }

    /**
     * Debounces an arbitrary write with the configured delay.
     */
    public <T> void schedule(String key, T payload, Consumer<T> writeFn) {
        writeScheduler.schedule(key, payload, writeFn, settings.getDebounceDelay());
    }

    public SubscriptionHandle subscribe(
            ChannelSpec spec, Consumer<ChangeEvent> onUpdate, Consumer<SubscriptionError> onError) {
        return subscriptions.subscribe(spec, onUpdate, onError);
    }

    public MigrationOutcome migrateOnce(OwnerId ownerId) {
        return migrator.migrateOnce(ownerId);
    }

    public StartReport start(OwnerId ownerId) {
        return start(ownerId, error -> log.error("Sync channel {} failed: {} ({})",
            error.channelKey(), error.message(), error.kind()));
    }

    /**
     * Brings this device in line with the cloud for the owner: runs the legacy migration, loads the
     * remote state into local state and subscribes to canvas and preference changes.
     *
     * @param onError receives subscription failures, including channel exhaustion
     */
    public StartReport start(OwnerId ownerId, Consumer<SubscriptionError> onError) {
        if (ownerId == null || !gateway.isEnabled()) {
            log.info("Sync disabled or no owner, working locally only for owner {}", ownerId);
            return StartReport.disabled();
        }
        log.info("Starting sync for owner {} on device {}", ownerId, deviceId());

        MigrationOutcome migration = migrator.migrateOnce(ownerId);

        Set<DataType> hydrated = EnumSet.noneOf(DataType.class);
        gateway.loadAll(ownerId).getData().ifPresent(loaded -> loaded.forEach((dataType, payload) -> {
            router.applyPayload(ownerId, payload);
            hydrated.add(dataType);
        }));
        Result<PreferenceRecord> preferences = gateway.loadPreferences(ownerId);
        preferences.getData().ifPresent(router::applyPreferences);

        List<String> channels = new ArrayList<>();
        for (ChannelName channel : List.of(ChannelName.CANVAS_CHANGES, ChannelName.PREFERENCE_CHANGES)) {
            channels.add(subscriptions.subscribe(ChannelSpec.forOwner(channel, ownerId), router, onError).channelKey());
        }

        StartReport report = new StartReport(migration, hydrated, preferences.isSuccess(), channels);
        log.info("Sync started for owner {}: {}", ownerId, report);
        return report;
    }

    /**
     * Applies a local edit to the workspace state right away and saves it to the cloud once edits of
     * the same data type pause for the debounce delay.
     */
    public void updateLocal(OwnerId ownerId, SyncPayload payload) {
        Objects.requireNonNull(payload, "payload");
        router.applyPayload(ownerId, payload);
        if (ownerId == null || !gateway.isEnabled()) {
            return;
        }
        writeScheduler.schedule(writeKey(ownerId, payload.dataType().wireName()), payload,
            latest -> gateway.save(ownerId, latest), settings.getDebounceDelay());
    }

    /**
     * Merges a preferences edit into the local state right away and saves the merged preferences once
     * edits pause for the debounce delay.
     */
    public void updatePreferences(OwnerId ownerId, PreferencesUpdate update) {
        Objects.requireNonNull(update, "update");
        if (ownerId == null) {
            // Preferences belong to an owner, so there is nothing to merge into yet
            log.debug("No owner, dropping preferences edit {}", update);
            return;
        }
        state.mergePreferences(ownerId, update);
        if (!gateway.isEnabled()) {
            return;
        }
        // Partial edits coalesce, so the write carries everything merged so far
        PreferencesUpdate merged = state.preferences().map(PreferenceRecord::toUpdate).orElse(update);
        writeScheduler.schedule(writeKey(ownerId, "preferences"), merged,
            latest -> gateway.savePreferences(ownerId, latest), settings.getDebounceDelay());
    }

    public int flushPendingWrites() {
        return writeScheduler.flushAll();
    }

    public Set<String> pendingWrites() {
        return writeScheduler.pendingKeys();
    }

    public ConnectionStatus connectionStatus() {
        return subscriptions.connectionStatus();
    }

    public Duration reconnectDelay(int attempts) {
        return subscriptions.backoffDelay(attempts);
    }

    /**
     * Flushes pending writes and closes every subscription.
     */
    @Override
    public void close() {
        int flushed = writeScheduler.flushAll();
        int closed = subscriptions.unsubscribeAll();
        log.info("Sync engine for device {} closed ({} writes flushed, {} channels closed)",
            deviceId(), flushed, closed);
    }

    private static String writeKey(OwnerId ownerId, String kind) {
        return ownerId.value() + ":" + kind;
    }
}
