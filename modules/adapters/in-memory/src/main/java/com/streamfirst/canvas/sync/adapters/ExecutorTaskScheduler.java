package com.streamfirst.canvas.sync.adapters;

import com.streamfirst.canvas.sync.ports.TaskScheduler;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * TaskScheduler backed by a single daemon thread, which acts as the engine's event loop: debounce
 * and backoff tasks never run concurrently with each other.
 */
@Slf4j
public class ExecutorTaskScheduler implements TaskScheduler, AutoCloseable {

  private final ScheduledExecutorService executor;

  public ExecutorTaskScheduler(String threadName) {
    this.executor =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, threadName);
              thread.setDaemon(true);
              return thread;
            });
  }

  @Override
  public Cancellable schedule(Runnable task, Duration delay) {
    ScheduledFuture<?> future =
        executor.schedule(
            () -> {
              try {
                task.run();
              } catch (Exception e) {
                log.error("Scheduled task failed", e);
              }
            },
            Math.max(0, delay.toMillis()),
            TimeUnit.MILLISECONDS);
    return () -> future.cancel(false);
  }

  @Override
  public void close() {
    log.info("Shutting down sync scheduler");
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
