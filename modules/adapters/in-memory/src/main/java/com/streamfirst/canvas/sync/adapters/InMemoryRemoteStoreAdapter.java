package com.streamfirst.canvas.sync.adapters;

import com.streamfirst.canvas.sync.domain.ChangeEvent;
import com.streamfirst.canvas.sync.ports.RemoteStoreException;
import com.streamfirst.canvas.sync.ports.RemoteStorePort;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of RemoteStorePort for testing and development. Behaves like a single
 * hosted database shared by every simulated device: upserts merge columns into the row matching the
 * conflict columns and are then published to the attached change feed. Data is lost when the
 * application stops - not suitable for production use.
 */
@Slf4j
public class InMemoryRemoteStoreAdapter implements RemoteStorePort {

  private final Map<String, List<Map<String, Object>>> tables = new ConcurrentHashMap<>();
  private final Set<String> failingTables = ConcurrentHashMap.newKeySet();
  private final AtomicLong upsertCount = new AtomicLong();
  private final InMemoryChangeFeedAdapter changeFeed;
  private volatile boolean reachable = true;

  /** Creates a store without a change feed. */
  public InMemoryRemoteStoreAdapter() {
    this(null);
  }

  /** Creates a store that publishes every successful upsert to the given change feed. */
  public InMemoryRemoteStoreAdapter(InMemoryChangeFeedAdapter changeFeed) {
    this.changeFeed = changeFeed;
  }

  @Override
  public void upsert(String table, Map<String, Object> row, Set<String> conflictColumns) {
    checkAvailable(table);
    for (String column : conflictColumns) {
      if (row.get(column) == null) {
        throw new RemoteStoreException(
            "Upsert on " + table + " is missing conflict column " + column, 400, null);
      }
    }

    ChangeEvent event;
    synchronized (this) {
      List<Map<String, Object>> rows = tables.computeIfAbsent(table, k -> new ArrayList<>());
      Optional<Map<String, Object>> existing =
          rows.stream().filter(stored -> sameKey(stored, row, conflictColumns)).findFirst();

      boolean inserted = existing.isEmpty();
      Map<String, Object> stored = existing.orElseGet(LinkedHashMap::new);
      stored.putAll(row);
      if (inserted) {
        rows.add(stored);
      }
      upsertCount.incrementAndGet();
      event = ChangeEvent.upsert(table, inserted, Collections.unmodifiableMap(new LinkedHashMap<>(stored)));
      log.debug("{} row in '{}' keyed on {}", inserted ? "Inserted" : "Updated", table, conflictColumns);
    }

    // Delivered outside the lock, the same way a real feed arrives after the write returns
    if (changeFeed != null) {
      changeFeed.publish(event);
    }
  }

  @Override
  public synchronized Optional<Map<String, Object>> selectOne(
      String table, Map<String, String> match) {
    List<Map<String, Object>> matching = selectAll(table, match);
    if (matching.size() > 1) {
      throw new RemoteStoreException(
          "Expected at most one row in " + table + " for " + match + " but found " + matching.size(),
          406,
          null);
    }
    return matching.stream().findFirst();
  }

  @Override
  public synchronized List<Map<String, Object>> selectAll(String table, Map<String, String> match) {
    checkAvailable(table);
    return tables.getOrDefault(table, List.of()).stream()
        .filter(row -> matches(row, match))
        .map(row -> Collections.unmodifiableMap(new LinkedHashMap<>(row)))
        .toList();
  }

  /**
   * Simulates the backend going offline (false) or coming back (true).
   */
  public void setReachable(boolean reachable) {
    log.info("Remote store is now {}", reachable ? "reachable" : "unreachable");
    this.reachable = reachable;
  }

  /**
   * Makes every read and write against one table fail while the rest of the store keeps working.
   */
  public void setTableFailing(String table, boolean failing) {
    if (failing) {
      failingTables.add(table);
    } else {
      failingTables.remove(table);
    }
  }

  /** Number of successful upserts since creation. */
  public long upsertCount() {
    return upsertCount.get();
  }

  /** Number of rows stored in a table. */
  public synchronized int rowCount(String table) {
    return tables.getOrDefault(table, List.of()).size();
  }

  /** Writes a raw row directly, bypassing validation and the change feed. */
  public synchronized void putRaw(String table, Map<String, Object> row) {
    tables.computeIfAbsent(table, k -> new ArrayList<>()).add(new LinkedHashMap<>(row));
  }

  private void checkAvailable(String table) {
    if (!reachable) {
      throw new RemoteStoreException("Remote store unreachable");
    }
    if (failingTables.contains(table)) {
      throw new RemoteStoreException("Simulated failure on table " + table, 503, null);
    }
  }

  private static boolean sameKey(
      Map<String, Object> stored, Map<String, Object> row, Set<String> conflictColumns) {
    return conflictColumns.stream()
        .allMatch(column -> Objects.equals(stored.get(column), row.get(column)));
  }

  private static boolean matches(Map<String, Object> row, Map<String, String> match) {
    return match.entrySet().stream()
        .allMatch(entry -> entry.getValue().equals(String.valueOf(row.get(entry.getKey()))));
  }
}
