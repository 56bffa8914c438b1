package com.streamfirst.canvas.sync.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.streamfirst.canvas.sync.domain.DataType;
import com.streamfirst.canvas.sync.domain.LayoutMode;
import com.streamfirst.canvas.sync.domain.OwnerId;
import com.streamfirst.canvas.sync.domain.PreferencesUpdate;
import com.streamfirst.canvas.sync.domain.Result;
import com.streamfirst.canvas.sync.domain.SyncPayload;
import com.streamfirst.canvas.sync.domain.UiSettings;
import com.streamfirst.canvas.sync.ports.LocalStoragePort;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * One-time upload of the workspace persisted locally before cloud sync existed. Runs at most once
 * per owner and device: a flag in local storage records that it happened, and is set even when some
 * of the writes failed so that a flaky backend does not cause repeated uploads on every start.
 */
@Slf4j
public class LocalToCloudMigrator {

    static final String FLAG_PREFIX = "migration_done_";

    private final LocalStoragePort localStorage;
    private final CloudPersistenceGateway gateway;
    private final PayloadCodec codec;
    private final String legacyStateKey;

    public LocalToCloudMigrator(
            LocalStoragePort localStorage,
            CloudPersistenceGateway gateway,
            PayloadCodec codec,
            SyncSettings settings) {
        this.localStorage = Objects.requireNonNull(localStorage, "localStorage");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.legacyStateKey = settings.getLegacyStateKey();
    }

    public MigrationOutcome migrateOnce(OwnerId ownerId) {
        if (ownerId == null) {
            log.debug("No owner, skipping local storage migration");
            return MigrationOutcome.NO_OWNER;
        }
        String flagKey = flagKey(ownerId);
        if (localStorage.get(flagKey).isPresent()) {
            log.debug("Migration already done for owner {}", ownerId);
            return MigrationOutcome.ALREADY_MIGRATED;
        }
        if (!gateway.isEnabled()) {
            log.debug("Sync disabled, leaving legacy state of owner {} in place", ownerId);
            return MigrationOutcome.SYNC_DISABLED;
        }

        Optional<String> blob = localStorage.get(legacyStateKey).filter(value -> !value.isBlank());
        if (blob.isEmpty()) {
            markDone(flagKey);
            log.info("No legacy state to migrate for owner {}", ownerId);
            return MigrationOutcome.NOTHING_TO_MIGRATE;
        }

        JsonNode state;
        try {
            state = codec.parse(blob.get()).path("state");
        } catch (JsonProcessingException e) {
            log.error("Error migrating local storage for owner {}: legacy state is not JSON ({})",
                ownerId, e.getOriginalMessage());
            return MigrationOutcome.FAILED;
        }
        if (!state.isObject()) {
            log.error("Error migrating local storage for owner {}: legacy state has no 'state' object", ownerId);
            return MigrationOutcome.FAILED;
        }

        int failures = 0;
        failures += migratePayload(ownerId, DataType.TABS, state.get("tabs"));
        failures += migratePayload(ownerId, DataType.EXPANDED_ITEMS, state.get("expandedItems"));
        failures += migratePreferences(ownerId, state);

        markDone(flagKey);
        if (failures > 0) {
            log.warn("Migrated local storage for owner {} with {} failed writes; they will not be retried",
                ownerId, failures);
            return MigrationOutcome.MIGRATED_WITH_FAILURES;
        }
        log.info("Local storage migrated to cloud for owner {}", ownerId);
        return MigrationOutcome.MIGRATED;
    }

    public boolean isMigrated(OwnerId ownerId) {
        return localStorage.get(flagKey(ownerId)).isPresent();
    }

    static String flagKey(OwnerId ownerId) {
        return FLAG_PREFIX + ownerId.value();
    }

    private int migratePayload(OwnerId ownerId, DataType dataType, JsonNode value) {
        if (value == null || value.isNull()) {
            return 0;
        }
        Result<SyncPayload> payload = codec.decode(dataType, value);
        if (payload.isFailure()) {
            log.warn("Skipping legacy {}: {}", dataType.wireName(), payload.getErrorMessage().orElse(""));
            return 1;
        }
        return gateway.save(ownerId, payload.orElseThrow()).isSuccess() ? 0 : 1;
    }

    private int migratePreferences(OwnerId ownerId, JsonNode state) {
        PreferencesUpdate update;
        try {
            String mode = PayloadCodec.optionalText(state, "layoutMode");
            update = PreferencesUpdate.builder()
                .layoutMode(mode == null ? null : LayoutMode.fromWireName(mode).orElse(null))
                .newTabBehavior(PayloadCodec.optionalText(state, "newTabBehavior"))
                .startupBehavior(PayloadCodec.optionalText(state, "startupBehavior"))
                .gridModeState(state.hasNonNull("gridModeState") ? codec.optionalObject(state, "gridModeState") : null)
                .uiSettings(UiSettings.builder()
                    .secondLeftSidebarOpen(PayloadCodec.optionalBoolean(state, "isSecondLeftSidebarOpen"))
                    .activeSecondaryPanel(PayloadCodec.optionalText(state, "activeSecondaryPanel"))
                    .pointerFrameEnabled(PayloadCodec.optionalBoolean(state, "pointerFrameEnabled"))
                    .audioTrackerEnabled(PayloadCodec.optionalBoolean(state, "audioTrackerEnabled"))
                    .mouseTrackerEnabled(PayloadCodec.optionalBoolean(state, "mouseTrackerEnabled"))
                    .virtualizerMode(PayloadCodec.optionalBoolean(state, "virtualizerMode"))
                    .visualizerMode(PayloadCodec.optionalText(state, "visualizerMode"))
                    .build())
                .build();
        } catch (RuntimeException e) {
            log.warn("Skipping legacy preferences of owner {}: {}", ownerId, e.getMessage());
            return 1;
        }
        if (update.isEmpty()) {
            return 0;
        }
        return gateway.savePreferences(ownerId, update).isSuccess() ? 0 : 1;
    }

    private void markDone(String flagKey) {
        try {
            localStorage.put(flagKey, "true");
        } catch (RuntimeException e) {
            log.warn("Could not store migration flag {}, migration will run again next start: {}",
                flagKey, e.getMessage());
        }
    }
}
