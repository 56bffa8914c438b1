package com.streamfirst.canvas.sync.application;

import com.streamfirst.canvas.sync.domain.ChangeEvent;
import com.streamfirst.canvas.sync.domain.ChannelSpec;
import com.streamfirst.canvas.sync.domain.SubscriptionStatus;
import com.streamfirst.canvas.sync.domain.SyncErrorKind;
import com.streamfirst.canvas.sync.ports.ChangeFeedPort;
import com.streamfirst.canvas.sync.ports.ChangeFeedPort.ChannelHandle;
import com.streamfirst.canvas.sync.ports.ChangeFeedPort.ChannelStatus;
import com.streamfirst.canvas.sync.ports.ChannelRequest;
import com.streamfirst.canvas.sync.ports.TaskScheduler;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Owns one change-feed subscription per channel key and keeps it alive.
 *
 * <p>A subscription goes IDLE → SUBSCRIBING → SUBSCRIBED once the backend acknowledges it. A channel
 * error or timeout moves it to RECONNECTING: after {@code baseDelay × 2^attempts} the old channel is
 * torn down and a new one opened, and an acknowledgement resets the attempt counter. When the
 * attempts reach {@code maxAttempts} the subscription becomes EXHAUSTED, is removed and the subscriber
 * receives a {@link SyncErrorKind#CHANNEL_EXHAUSTED} error; nothing retries until the caller
 * subscribes again. Unsubscribing cancels any pending backoff timer and closes the channel.
 *
 * <p>Subscribing under a key that is already live tears the old subscription down first. Callbacks
 * from a channel that has since been replaced are ignored.
 */
@Slf4j
public class ChangeFeedSubscriptionManager {

    private final ChangeFeedPort changeFeed;
    private final TaskScheduler scheduler;
    private final Duration baseDelay;
    private final int maxAttempts;
    private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();

    public ChangeFeedSubscriptionManager(
            ChangeFeedPort changeFeed, TaskScheduler scheduler, Duration baseDelay, int maxAttempts) {
        this.changeFeed = Objects.requireNonNull(changeFeed, "changeFeed");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative");
        }
        this.maxAttempts = maxAttempts;
    }

    public ChangeFeedSubscriptionManager(ChangeFeedPort changeFeed, TaskScheduler scheduler, SyncSettings settings) {
        this(changeFeed, scheduler, settings.getReconnectBaseDelay(), settings.getMaxReconnectAttempts());
    }

    /**
     * Starts observing a channel.
     *
     * @param spec channel, owner filter and optional sub-resource filter
     * @param onUpdate receives every row change delivered on the channel
     * @param onError receives handler failures and the terminal exhaustion error
     * @return handle whose {@code close()} unsubscribes
     */
    public synchronized SubscriptionHandle subscribe(
            ChannelSpec spec, Consumer<ChangeEvent> onUpdate, Consumer<SubscriptionError> onError) {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(onUpdate, "onUpdate");
        String channelKey = spec.channelKey();

        Subscription existing = subscriptions.get(channelKey);
        if (existing != null) {
            log.debug("Channel {} already exists, unsubscribing old", channelKey);
            unsubscribe(existing);
        }

        Subscription subscription = new Subscription(spec, toRequest(spec), onUpdate,
            onError != null ? onError : error -> { });
        subscriptions.put(channelKey, subscription);
        log.info("Subscribing to channel {} on table {}", channelKey, spec.tableName());
        connect(subscription);
        return subscription;
    }

    /**
     * Unsubscribes whatever subscription currently holds the key.
     *
     * @return true if one was live
     */
    public synchronized boolean unsubscribe(String channelKey) {
        Subscription subscription = subscriptions.get(channelKey);
        if (subscription == null) {
            return false;
        }
        unsubscribe(subscription);
        return true;
    }

    /**
     * @return number of subscriptions closed
     */
    public synchronized int unsubscribeAll() {
        List<Subscription> live = new ArrayList<>(subscriptions.values());
        log.info("Unsubscribing from {} channels", live.size());
        live.forEach(this::unsubscribe);
        return live.size();
    }

    public synchronized Optional<SubscriptionStatus> status(String channelKey) {
        return Optional.ofNullable(subscriptions.get(channelKey)).map(subscription -> subscription.status);
    }

    public synchronized int reconnectAttempts(String channelKey) {
        Subscription subscription = subscriptions.get(channelKey);
        return subscription == null ? 0 : subscription.reconnectAttempts;
    }

    public synchronized ConnectionStatus connectionStatus() {
        return new ConnectionStatus(subscriptions.size(), new ArrayList<>(subscriptions.keySet()));
    }

    /**
     * Delay before the reconnect that follows {@code attempts} failed attempts.
     */
    public Duration backoffDelay(int attempts) {
        return baseDelay.multipliedBy(1L << attempts);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    // ---------------------------------------------------------------- state machine

    private void connect(Subscription subscription) {
        long generation = ++subscription.generation;
        if (subscription.status != SubscriptionStatus.RECONNECTING) {
            transition(subscription, SubscriptionStatus.SUBSCRIBING);
        }

        ChannelHandle channel;
        try {
            channel = changeFeed.open(subscription.request,
                event -> onRow(subscription, generation, event),
                status -> onChannelStatus(subscription, generation, status));
        } catch (RuntimeException e) {
            log.error("Failed to open channel {}", subscription.key, e);
            scheduleReconnect(subscription);
            return;
        }

        if (subscription.generation != generation || !isLive(subscription)) {
            // Failed, exhausted or unsubscribed while opening
            channel.close();
            return;
        }
        subscription.channel = channel;
    }

    private synchronized void onChannelStatus(Subscription subscription, long generation, ChannelStatus status) {
        if (!isCurrent(subscription, generation)) {
            log.trace("Ignoring {} from replaced channel {}", status, subscription.key);
            return;
        }
        switch (status) {
            case SUBSCRIBED -> {
                subscription.reconnectAttempts = 0;
                transition(subscription, SubscriptionStatus.SUBSCRIBED);
            }
            case CHANNEL_ERROR -> {
                log.error("Channel error for {}", subscription.key);
                scheduleReconnect(subscription);
            }
            case TIMED_OUT -> {
                log.warn("Subscription timeout for {}", subscription.key);
                scheduleReconnect(subscription);
            }
            case CLOSED -> log.info("Channel closed: {}", subscription.key);
        }
    }

    private void onRow(Subscription subscription, long generation, ChangeEvent event) {
        synchronized (this) {
            if (!isCurrent(subscription, generation)) {
                return;
            }
        }
        log.debug("Received {} on {}", event.getType(), subscription.key);
        try {
            subscription.onUpdate.accept(event);
        } catch (RuntimeException e) {
            log.error("Error handling payload for {}", subscription.key, e);
            notifyError(subscription, new SubscriptionError(subscription.key,
                SyncErrorKind.MALFORMED_PAYLOAD, "Handler failed: " + e.getMessage(), e));
        }
    }

    private void scheduleReconnect(Subscription subscription) {
        if (subscription.backoffTimer != null) {
            log.debug("Reconnect already pending for {}", subscription.key);
            return;
        }
        int attempts = subscription.reconnectAttempts;
        if (attempts >= maxAttempts) {
            exhaust(subscription);
            return;
        }

        Duration delay = backoffDelay(attempts);
        subscription.reconnectAttempts = attempts + 1;
        transition(subscription, SubscriptionStatus.RECONNECTING);
        log.warn("Reconnecting {} in {}ms (attempt {}/{})",
            subscription.key, delay.toMillis(), attempts + 1, maxAttempts);
        subscription.backoffTimer = scheduler.schedule(() -> reconnect(subscription), delay);
    }

    private synchronized void reconnect(Subscription subscription) {
        subscription.backoffTimer = null;
        if (!isLive(subscription)) {
            return;
        }
        closeChannel(subscription);
        connect(subscription);
    }

    private void exhaust(Subscription subscription) {
        log.error("Max reconnect attempts reached for {}", subscription.key);
        subscriptions.remove(subscription.key);
        closeChannel(subscription);
        transition(subscription, SubscriptionStatus.EXHAUSTED);
        notifyError(subscription, new SubscriptionError(subscription.key,
            SyncErrorKind.CHANNEL_EXHAUSTED, "Max reconnection attempts reached", null));
    }

    private synchronized void unsubscribe(Subscription subscription) {
        if (subscriptions.get(subscription.key) != subscription) {
            return;
        }
        log.info("Unsubscribing from channel: {}", subscription.key);
        subscriptions.remove(subscription.key);
        if (subscription.backoffTimer != null) {
            subscription.backoffTimer.cancel();
            subscription.backoffTimer = null;
        }
        closeChannel(subscription);
        transition(subscription, SubscriptionStatus.CLOSED);
    }

    private void closeChannel(Subscription subscription) {
        // Bump first so the CLOSED status the old channel reports is recognized as stale
        subscription.generation++;
        ChannelHandle channel = subscription.channel;
        subscription.channel = null;
        if (channel != null) {
            try {
                channel.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close channel {}: {}", subscription.key, e.getMessage());
            }
        }
    }

    private void transition(Subscription subscription, SubscriptionStatus next) {
        SubscriptionStatus previous = subscription.status;
        subscription.status = next;
        log.info("Channel {} {} -> {} (attempts {})",
            subscription.key, previous, next, subscription.reconnectAttempts);
    }

    private void notifyError(Subscription subscription, SubscriptionError error) {
        try {
            subscription.onError.accept(error);
        } catch (RuntimeException e) {
            log.error("Error callback failed for {}", subscription.key, e);
        }
    }

    private boolean isLive(Subscription subscription) {
        return subscriptions.get(subscription.key) == subscription && !subscription.status.isTerminal();
    }

    private boolean isCurrent(Subscription subscription, long generation) {
        return subscription.generation == generation && isLive(subscription);
    }

    private static ChannelRequest toRequest(ChannelSpec spec) {
        Map<String, String> filter = new LinkedHashMap<>();
        spec.owner().ifPresent(owner -> filter.put(SyncTables.USER_ID, owner.value()));
        spec.subResourceId().ifPresent(id -> filter.put(spec.name().subResourceColumn(), id));
        return new ChannelRequest(spec.channelKey(), spec.tableName(), filter);
    }

    private final class Subscription implements SubscriptionHandle {
        private final String key;
        private final ChannelSpec spec;
        private final ChannelRequest request;
        private final Consumer<ChangeEvent> onUpdate;
        private final Consumer<SubscriptionError> onError;
        private SubscriptionStatus status = SubscriptionStatus.IDLE;
        private int reconnectAttempts;
        private long generation;
        private ChannelHandle channel;
        private TaskScheduler.Cancellable backoffTimer;

        private Subscription(
                ChannelSpec spec,
                ChannelRequest request,
                Consumer<ChangeEvent> onUpdate,
                Consumer<SubscriptionError> onError) {
            this.key = spec.channelKey();
            this.spec = spec;
            this.request = request;
            this.onUpdate = onUpdate;
            this.onError = onError;
        }

        @Override
        public String channelKey() {
            return key;
        }

        @Override
        public SubscriptionStatus status() {
            synchronized (ChangeFeedSubscriptionManager.this) {
                return status;
            }
        }

        @Override
        public void close() {
            unsubscribe(this);
        }

        @Override
        public String toString() {
            return "Subscription{" + spec + ", status=" + status + '}';
        }
    }
}
