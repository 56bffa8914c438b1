package com.streamfirst.canvas.sync.adapters;

import com.streamfirst.canvas.sync.domain.ChangeEvent;
import com.streamfirst.canvas.sync.ports.ChangeFeedPort;
import com.streamfirst.canvas.sync.ports.ChannelRequest;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of ChangeFeedPort for testing and development. Plays the backend's side
 * of the change feed: one instance is shared by every simulated device, row changes published by
 * {@link InMemoryRemoteStoreAdapter} are delivered synchronously to every channel whose table and
 * filter match, including the channel of the device that wrote the row.
 *
 * <p>Connection trouble can be simulated with {@link #failChannel}, {@link #timeOutChannel} and
 * {@link #setAcceptingSubscriptions}.
 */
@Slf4j
public class InMemoryChangeFeedAdapter implements ChangeFeedPort {

  private final Map<Long, Registration> channels = new ConcurrentHashMap<>();
  private final AtomicLong channelCounter = new AtomicLong(1);
  private final AtomicLong openAttempts = new AtomicLong();
  private volatile boolean acceptingSubscriptions = true;
  private volatile ChannelStatus rejectionStatus = ChannelStatus.CHANNEL_ERROR;

  @Override
  public ChannelHandle open(
      ChannelRequest request, Consumer<ChangeEvent> onChange, Consumer<ChannelStatus> onStatus) {
    openAttempts.incrementAndGet();
    long id = channelCounter.getAndIncrement();
    Registration registration = new Registration(id, request, onChange, onStatus);

    if (!acceptingSubscriptions) {
      log.debug("Rejecting channel '{}' with {}", request.channelName(), rejectionStatus);
      registration.notifyStatus(rejectionStatus);
      return registration;
    }

    channels.put(id, registration);
    log.debug(
        "Opened channel '{}' on table '{}' with filter {}",
        request.channelName(),
        request.table(),
        request.filter());
    registration.notifyStatus(ChannelStatus.SUBSCRIBED);
    return registration;
  }

  /**
   * Delivers a row change to every matching channel. Subscriber exceptions are logged and do not
   * stop delivery to the remaining channels.
   *
   * @return number of channels the event was delivered to
   */
  public int publish(ChangeEvent event) {
    int delivered = 0;
    for (Registration registration : List.copyOf(channels.values())) {
      if (!registration.accepts(event)) {
        continue;
      }
      try {
        registration.onChange.accept(event);
        delivered++;
      } catch (Exception e) {
        log.error(
            "Error delivering {} to channel '{}'",
            event,
            registration.request.channelName(),
            e);
      }
    }
    log.trace("Published {} to {} channels", event, delivered);
    return delivered;
  }

  /**
   * Drops every open channel with the given name and reports CHANNEL_ERROR to it.
   *
   * @return number of channels failed
   */
  public int failChannel(String channelName) {
    return drop(channelName, ChannelStatus.CHANNEL_ERROR);
  }

  /**
   * Drops every open channel with the given name and reports TIMED_OUT to it.
   */
  public int timeOutChannel(String channelName) {
    return drop(channelName, ChannelStatus.TIMED_OUT);
  }

  /**
   * When false, new channels are answered with CHANNEL_ERROR instead of SUBSCRIBED. Useful for
   * driving a subscriber through its reconnect attempts.
   */
  public void setAcceptingSubscriptions(boolean accepting) {
    setAcceptingSubscriptions(accepting, ChannelStatus.CHANNEL_ERROR);
  }

  public void setAcceptingSubscriptions(boolean accepting, ChannelStatus rejectionStatus) {
    log.info("Change feed {} new channels", accepting ? "accepting" : "rejecting");
    this.acceptingSubscriptions = accepting;
    this.rejectionStatus = rejectionStatus;
  }

  public int openChannelCount() {
    return channels.size();
  }

  /** Names of the currently open channels, for assertions. */
  public Set<String> openChannelNames() {
    Set<String> names = ConcurrentHashMap.newKeySet();
    channels.values().forEach(registration -> names.add(registration.request.channelName()));
    return names;
  }

  /** Total number of {@link #open} calls, accepted or not. */
  public long openAttempts() {
    return openAttempts.get();
  }

  private int drop(String channelName, ChannelStatus status) {
    int dropped = 0;
    for (Registration registration : List.copyOf(channels.values())) {
      if (registration.request.channelName().equals(channelName)
          && channels.remove(registration.id) != null) {
        log.info("Dropping channel '{}' with {}", channelName, status);
        registration.notifyStatus(status);
        dropped++;
      }
    }
    return dropped;
  }

  private final class Registration implements ChannelHandle {
    private final long id;
    private final ChannelRequest request;
    private final Consumer<ChangeEvent> onChange;
    private final Consumer<ChannelStatus> onStatus;

    private Registration(
        long id,
        ChannelRequest request,
        Consumer<ChangeEvent> onChange,
        Consumer<ChannelStatus> onStatus) {
      this.id = id;
      this.request = request;
      this.onChange = onChange;
      this.onStatus = onStatus;
    }

    private boolean accepts(ChangeEvent event) {
      if (!request.table().equals(event.getTable())) {
        return false;
      }
      Map<String, Object> row =
          event.getType() == ChangeEvent.Type.DELETE ? event.getOldRow() : event.getNewRow();
      return request.matches(row);
    }

    private void notifyStatus(ChannelStatus status) {
      try {
        onStatus.accept(status);
      } catch (Exception e) {
        log.error("Status callback failed for channel '{}'", request.channelName(), e);
      }
    }

    @Override
    public String channelName() {
      return request.channelName();
    }

    @Override
    public void close() {
      if (channels.remove(id) != null) {
        log.debug("Closed channel '{}'", request.channelName());
        notifyStatus(ChannelStatus.CLOSED);
      }
    }
  }
}
