package com.streamfirst.canvas.sync.adapters;

import com.streamfirst.canvas.sync.ports.LocalStoragePort;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of LocalStoragePort. Survives for the lifetime of the instance only, so
 * tests can model an application restart by building a new engine over the same instance.
 */
public class InMemoryLocalStorageAdapter implements LocalStoragePort {

  private final Map<String, String> values = new ConcurrentHashMap<>();
  private volatile boolean writable = true;

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  @Override
  public void put(String key, String value) {
    if (!writable) {
      throw new UncheckedIOException(
          "Cannot write local storage key " + key, new IOException("Read-only storage"));
    }
    values.put(key, value);
  }

  @Override
  public void remove(String key) {
    values.remove(key);
  }

  /**
   * Makes writes fail the way a read-only or full disk does. Reads keep working.
   */
  public void setWritable(boolean writable) {
    this.writable = writable;
  }

  public int size() {
    return values.size();
  }
}
