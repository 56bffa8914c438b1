package com.streamfirst.canvas.sync.application;

import com.streamfirst.canvas.sync.domain.*;
import com.streamfirst.canvas.sync.ports.RemoteStoreException;
import com.streamfirst.canvas.sync.ports.RemoteStorePort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.streamfirst.canvas.sync.application.SyncTables.*;

/**
 * Keyed read/write access to the remote store. Every write is an upsert tagged with this device's id,
 * so the remote side holds exactly one current record per owner and data type and the last write to
 * arrive wins.
 *
 * <p>Nothing here throws for backend trouble. Missing configuration or owner turns every call into a
 * no-op reporting {@link SyncErrorKind#CONFIGURATION_ABSENT}; backend errors are logged and reported
 * as {@link SyncErrorKind#TRANSIENT_BACKEND}; callers keep their optimistic local state.
 */
@Slf4j
public class CloudPersistenceGateway {

    private final SyncSettings settings;
    private final RemoteStorePort remoteStore;
    private final DeviceIdentity deviceIdentity;
    private final PayloadCodec codec;
    private final Clock clock;
    private final AtomicBoolean configurationWarningLogged = new AtomicBoolean();

    public CloudPersistenceGateway(
            SyncSettings settings,
            RemoteStorePort remoteStore,
            DeviceIdentity deviceIdentity,
            PayloadCodec codec,
            Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.remoteStore = Objects.requireNonNull(remoteStore, "remoteStore");
        this.deviceIdentity = Objects.requireNonNull(deviceIdentity, "deviceIdentity");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public boolean isEnabled() {
        return settings.isEnabled();
    }

    /**
     * Upserts the payload as the owner's current record for its data type.
     *
     * @param ownerId the owner, may be null when nobody is signed in
     * @param payload the new state
     * @return success, or a failure whose kind says why nothing was written
     */
    public Result<Void> save(OwnerId ownerId, SyncPayload payload) {
        Objects.requireNonNull(payload, "payload");
        String dataType = payload.dataType().wireName();
        Optional<Result<Void>> unavailable = checkAvailable(ownerId, "save " + dataType);
        if (unavailable.isPresent()) {
            return unavailable.get();
        }

        SyncRecord record = new SyncRecord(ownerId, payload, deviceIdentity.getDeviceId(), clock.instant());
        try {
            remoteStore.upsert(CANVAS_DATA, codec.toRow(record), CANVAS_DATA_KEY);
            log.debug("Saved {} for owner {} from device {}", dataType, ownerId, record.getDeviceId());
            return Result.success();
        } catch (RemoteStoreException e) {
            log.error("Failed to save {} for owner {}: {}", dataType, ownerId, e.getMessage());
            return Result.failure(SyncErrorKind.TRANSIENT_BACKEND, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error saving {} for owner {}", dataType, ownerId, e);
            return Result.failure(SyncErrorKind.TRANSIENT_BACKEND, String.valueOf(e.getMessage()));
        }
    }

    /**
     * Loads the owner's current payload for one data type.
     *
     * @return the payload, or a failure: NOT_FOUND when there is no remote state yet
     */
    public Result<SyncPayload> load(OwnerId ownerId, DataType dataType) {
        return loadRecord(ownerId, dataType).map(SyncRecord::getPayload);
    }

    /**
     * Loads the owner's current record for one data type, including which device wrote it.
     */
    public Result<SyncRecord> loadRecord(OwnerId ownerId, DataType dataType) {
        Objects.requireNonNull(dataType, "dataType");
        Optional<Result<SyncRecord>> unavailable = checkAvailable(ownerId, "load " + dataType.wireName());
        if (unavailable.isPresent()) {
            return unavailable.get();
        }

        Optional<Map<String, Object>> row;
        try {
            row = remoteStore.selectOne(CANVAS_DATA,
                Map.of(USER_ID, ownerId.value(), DATA_TYPE, dataType.wireName()));
        } catch (RemoteStoreException e) {
            if (e.isNotFound()) {
                return Result.failure(SyncErrorKind.NOT_FOUND, "No " + dataType.wireName() + " for " + ownerId);
            }
            log.warn("Failed to load {} for owner {}: {}", dataType.wireName(), ownerId, e.getMessage());
            return Result.failure(SyncErrorKind.TRANSIENT_BACKEND, String.valueOf(e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("Failed to load {} for owner {}: {}", dataType.wireName(), ownerId, e.getMessage());
            return Result.failure(SyncErrorKind.TRANSIENT_BACKEND, String.valueOf(e.getMessage()));
        }

        if (row.isEmpty()) {
            log.debug("No remote {} for owner {}", dataType.wireName(), ownerId);
            return Result.failure(SyncErrorKind.NOT_FOUND, "No " + dataType.wireName() + " for " + ownerId);
        }

        Result<SyncRecord> decoded = codec.fromRow(row.get());
        if (decoded.isFailure()) {
            log.warn("Ignoring undecodable {} row for owner {}: {}",
                dataType.wireName(), ownerId, decoded.getErrorMessage().orElse(""));
        }
        return decoded;
    }

    /**
     * Loads every data type for the owner. Types that are missing or fail to load are left out of the
     * map instead of failing the whole call.
     */
    public Result<Map<DataType, SyncPayload>> loadAll(OwnerId ownerId) {
        Optional<Result<Map<DataType, SyncPayload>>> unavailable = checkAvailable(ownerId, "load all");
        if (unavailable.isPresent()) {
            return unavailable.get();
        }

        Map<DataType, SyncPayload> loaded = new EnumMap<>(DataType.class);
        int skipped = 0;
        for (DataType dataType : DataType.values()) {
            Result<SyncPayload> result = load(ownerId, dataType);
            if (result.isSuccess()) {
                loaded.put(dataType, result.orElseThrow());
            } else if (!result.failedWith(SyncErrorKind.NOT_FOUND)) {
                skipped++;
            }
        }
        log.debug("Loaded {} data types for owner {} ({} skipped after errors)", loaded.size(), ownerId, skipped);
        return Result.success(loaded);
    }

    /**
     * Upserts the fields present in the update onto the owner's preferences record.
     */
    public Result<Void> savePreferences(OwnerId ownerId, PreferencesUpdate update) {
        Objects.requireNonNull(update, "update");
        Optional<Result<Void>> unavailable = checkAvailable(ownerId, "save preferences");
        if (unavailable.isPresent()) {
            return unavailable.get();
        }

        try {
            remoteStore.upsert(PREFERENCES,
                codec.toPreferencesRow(ownerId, update, deviceIdentity.getDeviceId(), clock.instant()),
                PREFERENCES_KEY);
            log.debug("Saved preferences for owner {}", ownerId);
            return Result.success();
        } catch (RemoteStoreException e) {
            log.error("Failed to save preferences for owner {}: {}", ownerId, e.getMessage());
            return Result.failure(SyncErrorKind.TRANSIENT_BACKEND, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error saving preferences for owner {}", ownerId, e);
            return Result.failure(SyncErrorKind.TRANSIENT_BACKEND, String.valueOf(e.getMessage()));
        }
    }

    public Result<PreferenceRecord> loadPreferences(OwnerId ownerId) {
        Optional<Result<PreferenceRecord>> unavailable = checkAvailable(ownerId, "load preferences");
        if (unavailable.isPresent()) {
            return unavailable.get();
        }

        Optional<Map<String, Object>> row;
        try {
            row = remoteStore.selectOne(PREFERENCES, Map.of(USER_ID, ownerId.value()));
        } catch (RemoteStoreException e) {
            if (e.isNotFound()) {
                return Result.failure(SyncErrorKind.NOT_FOUND, "No preferences for " + ownerId);
            }
            log.warn("Failed to load preferences for owner {}: {}", ownerId, e.getMessage());
            return Result.failure(SyncErrorKind.TRANSIENT_BACKEND, String.valueOf(e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("Failed to load preferences for owner {}: {}", ownerId, e.getMessage());
            return Result.failure(SyncErrorKind.TRANSIENT_BACKEND, String.valueOf(e.getMessage()));
        }

        if (row.isEmpty()) {
            return Result.failure(SyncErrorKind.NOT_FOUND, "No preferences for " + ownerId);
        }
        Result<PreferenceRecord> decoded = codec.fromPreferencesRow(row.get());
        if (decoded.isFailure()) {
            log.warn("Ignoring undecodable preferences for owner {}: {}",
                ownerId, decoded.getErrorMessage().orElse(""));
        }
        return decoded;
    }

    private <T> Optional<Result<T>> checkAvailable(OwnerId ownerId, String operation) {
        if (!settings.isEnabled()) {
            if (!settings.isProduction() && configurationWarningLogged.compareAndSet(false, true)) {
                log.warn("Sync backend is not configured; '{}' and later sync calls are skipped", operation);
            }
            return Optional.of(Result.failure(SyncErrorKind.CONFIGURATION_ABSENT, "Sync backend not configured"));
        }
        if (ownerId == null) {
            log.debug("No owner for '{}', skipping", operation);
            return Optional.of(Result.failure(SyncErrorKind.CONFIGURATION_ABSENT, "No owner id"));
        }
        return Optional.empty();
    }
}
