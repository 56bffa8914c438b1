package com.streamfirst.canvas.sync.domain;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * The current remote state of one data type for one owner. Writes are upserts keyed on
 * (ownerId, dataType), so there is never more than one live record per pair and no history is kept:
 * the last write to reach the backend wins.
 */
@Value
@EqualsAndHashCode(of = {"ownerId", "payload", "deviceId"})
public class SyncRecord {

    /** Owner whose workspace this record belongs to */
    @NonNull OwnerId ownerId;

    /** Decoded, validated content; its variant determines the data type */
    @NonNull SyncPayload payload;

    /** Device that performed the write */
    @NonNull DeviceId deviceId;

    /** When the writing device produced this state */
    @NonNull Instant updatedAt;

    public DataType getDataType() {
        return payload.dataType();
    }

    /**
     * True when this record was written by the given device.
     */
    public boolean writtenBy(DeviceId device) {
        return deviceId.equals(device);
    }

    @Override
    public String toString() {
        return "SyncRecord{" +
               "ownerId=" + ownerId +
               ", dataType=" + getDataType().wireName() +
               ", deviceId=" + deviceId +
               ", updatedAt=" + updatedAt +
               '}';
    }
}
