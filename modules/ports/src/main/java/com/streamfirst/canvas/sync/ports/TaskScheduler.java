package com.streamfirst.canvas.sync.ports;

import java.time.Duration;

/**
 * Timer source for debounce and backoff delays. Implementations run tasks one at a time, which is
 * the only concurrency the engine relies on.
 */
public interface TaskScheduler {

    /**
     * Runs the task once after the delay.
     *
     * @return a handle that prevents the task from running if it has not started yet
     */
    Cancellable schedule(Runnable task, Duration delay);

    /**
     * A pending task.
     */
    @FunctionalInterface
    interface Cancellable {

        /**
         * Cancels the task. No effect if it already ran or was already cancelled.
         */
        void cancel();
    }
}
