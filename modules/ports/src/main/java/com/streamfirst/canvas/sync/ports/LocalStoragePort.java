package com.streamfirst.canvas.sync.ports;

import java.util.Optional;

/**
 * Device-local durable key/value storage. Values survive process restarts but are never visible to
 * other devices. Holds the device id and migration flags.
 */
public interface LocalStoragePort {

    Optional<String> get(String key);

    void put(String key, String value);

    void remove(String key);
}
