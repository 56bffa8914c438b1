package com.streamfirst.canvas.sync.application;

import com.streamfirst.canvas.sync.domain.ChangeEvent;
import com.streamfirst.canvas.sync.domain.ExpandedItemsPayload;
import com.streamfirst.canvas.sync.domain.LayoutPayload;
import com.streamfirst.canvas.sync.domain.OwnerId;
import com.streamfirst.canvas.sync.domain.PreferenceRecord;
import com.streamfirst.canvas.sync.domain.Result;
import com.streamfirst.canvas.sync.domain.SettingsPayload;
import com.streamfirst.canvas.sync.domain.SyncPayload;
import com.streamfirst.canvas.sync.domain.SyncRecord;
import com.streamfirst.canvas.sync.domain.TabsPayload;
import com.streamfirst.canvas.sync.ports.WorkspaceStatePort;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Applies remote row changes to the local workspace state. Rows written by this device are dropped
 * since the optimistic local update already reflects them. Canvas rows replace the matching slice of
 * state wholesale; preference rows are merged field by field.
 */
@Slf4j
public class ChangeNotificationRouter implements Consumer<ChangeEvent> {

    private final WorkspaceStatePort state;
    private final DeviceIdentity deviceIdentity;
    private final PayloadCodec codec;

    public ChangeNotificationRouter(WorkspaceStatePort state, DeviceIdentity deviceIdentity, PayloadCodec codec) {
        this.state = Objects.requireNonNull(state, "state");
        this.deviceIdentity = Objects.requireNonNull(deviceIdentity, "deviceIdentity");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public void accept(ChangeEvent event) {
        onRemoteChange(event);
    }

    public RouteOutcome onRemoteChange(ChangeEvent event) {
        if (event.getType() == ChangeEvent.Type.DELETE) {
            log.debug("Ignoring delete on {}", event.getTable());
            return RouteOutcome.IGNORED;
        }
        if (event.newColumn(SyncTables.DEVICE_ID).filter(deviceIdentity::isLocal).isPresent()) {
            log.debug("Dropping echo of own write on {}", event.getTable());
            return RouteOutcome.ECHO_DROPPED;
        }

        return switch (event.getTable()) {
            case SyncTables.CANVAS_DATA -> routeCanvasRow(event);
            case SyncTables.PREFERENCES -> routePreferencesRow(event);
            default -> {
                log.debug("No route for table {}", event.getTable());
                yield RouteOutcome.IGNORED;
            }
        };
    }

    private RouteOutcome routeCanvasRow(ChangeEvent event) {
        Result<SyncRecord> decoded = codec.fromRow(event.getNewRow());
        if (decoded.isFailure()) {
            log.warn("Dropping malformed canvas change: {}", decoded.getErrorMessage().orElse(""));
            return RouteOutcome.MALFORMED_DROPPED;
        }
        SyncRecord record = decoded.orElseThrow();
        log.debug("Applying remote {} from {}", record.getDataType().wireName(), record.getDeviceId());
        applyPayload(record.getOwnerId(), record.getPayload());
        return RouteOutcome.APPLIED;
    }

    private RouteOutcome routePreferencesRow(ChangeEvent event) {
        Result<PreferenceRecord> decoded = codec.fromPreferencesRow(event.getNewRow());
        if (decoded.isFailure()) {
            log.warn("Dropping malformed preferences change: {}", decoded.getErrorMessage().orElse(""));
            return RouteOutcome.MALFORMED_DROPPED;
        }
        applyPreferences(decoded.orElseThrow());
        return RouteOutcome.APPLIED;
    }

    /**
     * Replaces the slice of local state that matches the payload's data type.
     */
    public void applyPayload(OwnerId ownerId, SyncPayload payload) {
        log.trace("Applying {} for owner {}", payload.dataType(), ownerId);
        switch (payload.dataType()) {
            case TABS -> state.replaceTabs((TabsPayload) payload);
            case EXPANDED_ITEMS -> state.replaceExpandedItems((ExpandedItemsPayload) payload);
            case LAYOUT -> state.replaceLayout((LayoutPayload) payload);
            case SETTINGS -> state.replaceSettings((SettingsPayload) payload);
        }
    }

    public void applyPreferences(PreferenceRecord record) {
        state.mergePreferences(record.getOwnerId(), record.toUpdate());
    }
}
