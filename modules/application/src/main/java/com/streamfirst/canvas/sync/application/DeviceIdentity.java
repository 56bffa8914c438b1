package com.streamfirst.canvas.sync.application;

import com.streamfirst.canvas.sync.domain.DeviceId;
import com.streamfirst.canvas.sync.ports.LocalStoragePort;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Objects;
import java.util.Random;

/**
 * Stable identifier of this device or browser profile. Generated on first use from a timestamp and a
 * random suffix, persisted to local storage and never rotated; later calls, in this process or after
 * a restart, return the same value. Never touches the network and never throws: when local storage
 * cannot be written the id only lives as long as the process.
 */
@Slf4j
public class DeviceIdentity {

    static final String STORAGE_KEY = "device_id";
    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 13;

    private final LocalStoragePort localStorage;
    private final Clock clock;
    private final Random random;
    private volatile DeviceId cached;

    public DeviceIdentity(LocalStoragePort localStorage) {
        this(localStorage, Clock.systemUTC(), new SecureRandom());
    }

    public DeviceIdentity(LocalStoragePort localStorage, Clock clock, Random random) {
        this.localStorage = Objects.requireNonNull(localStorage, "localStorage");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Returns this device's id, creating and persisting it on the very first call.
     */
    public DeviceId getDeviceId() {
        DeviceId current = cached;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (cached == null) {
                cached = localStorage.get(STORAGE_KEY)
                    .filter(value -> !value.isBlank())
                    .map(DeviceId::new)
                    .orElseGet(this::generateAndPersist);
            }
            return cached;
        }
    }

    /**
     * True when the given id belongs to this device.
     */
    public boolean isLocal(String deviceId) {
        return deviceId != null && deviceId.equals(getDeviceId().value());
    }

    private DeviceId generateAndPersist() {
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        DeviceId generated = new DeviceId("device_" + clock.millis() + "_" + suffix);
        try {
            localStorage.put(STORAGE_KEY, generated.value());
            log.info("Generated new device id {}", generated);
        } catch (RuntimeException e) {
            // Still cached, so the id stays stable until the process exits
            log.warn("Could not persist device id {}, it will change after a restart: {}", generated, e.getMessage());
        }
        return generated;
    }
}
