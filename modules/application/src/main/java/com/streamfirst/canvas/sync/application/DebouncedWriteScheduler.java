package com.streamfirst.canvas.sync.application;

import com.streamfirst.canvas.sync.ports.TaskScheduler;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Trailing-edge coalescing of outbound writes. Each key has at most one pending timer; scheduling
 * again for the same key cancels it and starts a new one, so a burst of local edits produces a single
 * write carrying the last payload once the burst pauses. Writes for one key are therefore never
 * reordered. Writes for different keys are independent.
 */
@Slf4j
public class DebouncedWriteScheduler {

    private final TaskScheduler taskScheduler;
    private final Map<String, PendingWrite<?>> pending = new HashMap<>();

    public DebouncedWriteScheduler(TaskScheduler taskScheduler) {
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "taskScheduler");
    }

    /**
     * Schedules {@code writeFn(payload)} to run once after {@code delay} unless another call for the
     * same key arrives first.
     */
    public synchronized <T> void schedule(String key, T payload, Consumer<T> writeFn, Duration delay) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(writeFn, "writeFn");
        PendingWrite<?> previous = pending.remove(key);
        if (previous != null) {
            previous.timer.cancel();
            log.trace("Coalesced pending write for '{}'", key);
        }
        PendingWrite<T> write = new PendingWrite<>(key, payload, writeFn);
        pending.put(key, write);
        write.timer = taskScheduler.schedule(() -> fire(write), delay);
    }

    /**
     * Runs the pending write for a key now instead of waiting for its timer.
     *
     * @return true if a write was pending
     */
    public boolean flush(String key) {
        PendingWrite<?> write;
        synchronized (this) {
            write = pending.remove(key);
            if (write == null) {
                return false;
            }
            write.timer.cancel();
        }
        write.run();
        return true;
    }

    /**
     * Runs every pending write now, e.g. before shutting down.
     *
     * @return number of writes run
     */
    public int flushAll() {
        List<PendingWrite<?>> writes;
        synchronized (this) {
            writes = new ArrayList<>(pending.values());
            pending.clear();
            writes.forEach(write -> write.timer.cancel());
        }
        writes.forEach(PendingWrite::run);
        if (!writes.isEmpty()) {
            log.info("Flushed {} pending writes", writes.size());
        }
        return writes.size();
    }

    /**
     * Drops every pending write without running it.
     *
     * @return number of writes dropped
     */
    public synchronized int cancelAll() {
        int dropped = pending.size();
        pending.values().forEach(write -> write.timer.cancel());
        pending.clear();
        return dropped;
    }

    public synchronized Set<String> pendingKeys() {
        return Set.copyOf(pending.keySet());
    }

    private void fire(PendingWrite<?> write) {
        synchronized (this) {
            // A newer schedule or a flush got here first
            if (pending.get(write.key) != write) {
                return;
            }
            pending.remove(write.key);
        }
        write.run();
    }

    private static final class PendingWrite<T> {
        private final String key;
        private final T payload;
        private final Consumer<T> writeFn;
        private TaskScheduler.Cancellable timer;

        private PendingWrite(String key, T payload, Consumer<T> writeFn) {
            this.key = key;
            this.payload = payload;
            this.writeFn = writeFn;
        }

        private void run() {
            try {
                writeFn.accept(payload);
            } catch (RuntimeException e) {
                log.error("Debounced write for '{}' failed", key, e);
            }
        }
    }
}
