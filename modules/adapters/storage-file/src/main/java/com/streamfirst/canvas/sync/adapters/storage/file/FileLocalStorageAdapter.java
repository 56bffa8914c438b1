package com.streamfirst.canvas.sync.adapters.storage.file;

import com.streamfirst.canvas.sync.ports.LocalStoragePort;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;

/**
 * LocalStoragePort backed by a properties file, the desktop counterpart of browser local storage.
 * Every write rewrites the file through a temporary sibling and an atomic move, so a crash leaves
 * either the old or the new contents.
 */
@Slf4j
public final class FileLocalStorageAdapter implements LocalStoragePort {

  private static final String HEADER = "canvas-sync local storage";

  private final Path file;
  private final Properties values = new Properties();

  public FileLocalStorageAdapter(Path file) {
    this.file = file;
    load();
  }

  @Override
  public synchronized Optional<String> get(String key) {
    return Optional.ofNullable(values.getProperty(key));
  }

  @Override
  public synchronized void put(String key, String value) {
    values.setProperty(key, value);
    store();
  }

  @Override
  public synchronized void remove(String key) {
    if (values.remove(key) != null) {
      store();
    }
  }

  public Path file() {
    return file;
  }

  private void load() {
    if (!Files.exists(file)) {
      log.debug("No local storage file at {}, starting empty", file);
      return;
    }
    try (InputStream in = Files.newInputStream(file)) {
      values.load(in);
      log.debug("Loaded {} local storage entries from {}", values.size(), file);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read local storage " + file, e);
    }
  }

  private void store() {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
      try (OutputStream out = Files.newOutputStream(tmp)) {
        values.store(out, HEADER);
      }
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot write local storage " + file, e);
    }
  }
}
