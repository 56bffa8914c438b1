package com.streamfirst.canvas.sync.domain;

import java.util.Objects;

/**
 * Opaque, locally generated identifier of one browser profile or device. It tags every write so
 * that change notifications produced by this device can be recognized and dropped.
 *
 * @param value the device identifier, e.g. {@code device_1718000000000_k3j9x0a1b2c3d}
 */
public record DeviceId(String value) {
    public DeviceId {
        Objects.requireNonNull(value, "Device ID cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Device ID cannot be empty");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
