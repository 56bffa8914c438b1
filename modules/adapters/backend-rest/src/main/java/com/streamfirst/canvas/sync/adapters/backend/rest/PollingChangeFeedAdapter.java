package com.streamfirst.canvas.sync.adapters.backend.rest;

import com.streamfirst.canvas.sync.domain.ChangeEvent;
import com.streamfirst.canvas.sync.ports.ChangeFeedPort;
import com.streamfirst.canvas.sync.ports.ChannelRequest;
import com.streamfirst.canvas.sync.ports.RemoteStorePort;
import com.streamfirst.canvas.sync.ports.TaskScheduler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * ChangeFeedPort that approximates a push feed by polling the remote store. The first successful
 * poll records a baseline and reports the channel as subscribed; every later poll emits an insert for
 * each new row and an update for each changed row. Deletes are not detected. A failed poll reports a
 * channel error and stops the channel, leaving the retry decision to the subscriber.
 */
@Slf4j
public final class PollingChangeFeedAdapter implements ChangeFeedPort {

  private static final Set<String> DEFAULT_KEY = Set.of("id");

  private final RemoteStorePort store;
  private final TaskScheduler scheduler;
  private final Duration interval;
  private final Map<String, Set<String>> keyColumns;

  /**
   * @param keyColumns per table, the columns identifying a row; tables not listed use {@code id}
   */
  public PollingChangeFeedAdapter(
      RemoteStorePort store,
      TaskScheduler scheduler,
      Duration interval,
      Map<String, Set<String>> keyColumns) {
    this.store = store;
    this.scheduler = scheduler;
    this.interval = interval;
    this.keyColumns = Map.copyOf(keyColumns);
  }

  @Override
  public ChannelHandle open(
      ChannelRequest request,
      Consumer<ChangeEvent> rowListener,
      Consumer<ChannelStatus> statusListener) {
    PollingChannel channel =
        new PollingChannel(
            request, keyColumns.getOrDefault(request.table(), DEFAULT_KEY), rowListener, statusListener);
    log.debug("Polling {} every {}ms for channel {}", request.table(), interval.toMillis(), request.channelName());
    channel.scheduleNext(Duration.ZERO);
    return channel;
  }

  private final class PollingChannel implements ChannelHandle {
    private final ChannelRequest request;
    private final Set<String> key;
    private final Consumer<ChangeEvent> rowListener;
    private final Consumer<ChannelStatus> statusListener;
    private final Map<List<Object>, Map<String, Object>> seen = new HashMap<>();
    private boolean baselined;
    private volatile boolean closed;
    private boolean released;
    private TaskScheduler.Cancellable timer;

    private PollingChannel(
        ChannelRequest request,
        Set<String> key,
        Consumer<ChangeEvent> rowListener,
        Consumer<ChannelStatus> statusListener) {
      this.request = request;
      this.key = key;
      this.rowListener = rowListener;
      this.statusListener = statusListener;
    }

    private synchronized void scheduleNext(Duration delay) {
      if (!closed) {
        timer = scheduler.schedule(this::poll, delay);
      }
    }

    private void poll() {
      if (closed) {
        return;
      }
      List<Map<String, Object>> rows;
      try {
        rows = store.selectAll(request.table(), request.filter());
      } catch (RuntimeException e) {
        log.warn("Polling {} failed: {}", request.channelName(), e.getMessage());
        closed = true;
        statusListener.accept(ChannelStatus.CHANNEL_ERROR);
        return;
      }

      List<ChangeEvent> changes = new ArrayList<>();
      for (Map<String, Object> row : rows) {
        List<Object> rowKey = new ArrayList<>();
        key.stream().sorted().forEach(column -> rowKey.add(row.get(column)));
        Map<String, Object> previous = seen.put(rowKey, row);
        if (baselined && !row.equals(previous)) {
          changes.add(ChangeEvent.upsert(request.table(), previous == null, row));
        }
      }
      if (!baselined) {
        baselined = true;
        statusListener.accept(ChannelStatus.SUBSCRIBED);
      }
      for (ChangeEvent change : changes) {
        if (closed) {
          return;
        }
        rowListener.accept(change);
      }
      scheduleNext(interval);
    }

    @Override
    public String channelName() {
      return request.channelName();
    }

    @Override
    public void close() {
      TaskScheduler.Cancellable pending;
      synchronized (this) {
        if (released) {
          return;
        }
        released = true;
        closed = true;
        pending = timer;
        timer = null;
      }
      if (pending != null) {
        pending.cancel();
      }
      statusListener.accept(ChannelStatus.CLOSED);
    }
  }
}
