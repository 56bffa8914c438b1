package com.streamfirst.canvas.sync.adapters;

import com.streamfirst.canvas.sync.ports.TaskScheduler;
import java.time.Duration;
import java.util.PriorityQueue;
import lombok.extern.slf4j.Slf4j;

/**
 * Virtual-time implementation of TaskScheduler. Nothing runs until {@link #advance} moves the clock;
 * due tasks then run on the calling thread in due-time order, including tasks scheduled by other
 * tasks while advancing. Makes debounce and backoff behaviour testable without sleeping.
 */
@Slf4j
public class ManualTaskScheduler implements TaskScheduler {

  private final PriorityQueue<ScheduledTask> queue =
      new PriorityQueue<>(
          (a, b) -> a.dueAtMillis != b.dueAtMillis
              ? Long.compare(a.dueAtMillis, b.dueAtMillis)
              : Long.compare(a.sequence, b.sequence));
  private long nowMillis;
  private long sequence;

  @Override
  public synchronized Cancellable schedule(Runnable task, Duration delay) {
    ScheduledTask scheduled =
        new ScheduledTask(nowMillis + Math.max(0, delay.toMillis()), sequence++, task);
    queue.add(scheduled);
    return () -> {
      synchronized (ManualTaskScheduler.this) {
        queue.remove(scheduled);
      }
    };
  }

  /**
   * Moves virtual time forward, running every task that becomes due.
   *
   * @return number of tasks run
   */
  public int advance(Duration duration) {
    long target;
    synchronized (this) {
      target = nowMillis + duration.toMillis();
    }
    int ran = 0;
    while (true) {
      ScheduledTask next;
      synchronized (this) {
        next = queue.peek();
        if (next == null || next.dueAtMillis > target) {
          nowMillis = target;
          return ran;
        }
        queue.poll();
        nowMillis = next.dueAtMillis;
      }
      next.task.run();
      ran++;
    }
  }

  /** Runs everything currently queued, however far in the future. */
  public int runAll() {
    int ran = 0;
    while (true) {
      ScheduledTask next;
      synchronized (this) {
        next = queue.poll();
        if (next == null) {
          return ran;
        }
        nowMillis = Math.max(nowMillis, next.dueAtMillis);
      }
      next.task.run();
      ran++;
    }
  }

  public synchronized int pendingCount() {
    return queue.size();
  }

  /** Virtual milliseconds elapsed since creation. */
  public synchronized long nowMillis() {
    return nowMillis;
  }

  /** Delay until the earliest pending task is due, or -1 if nothing is pending. */
  public synchronized long millisUntilNextTask() {
    ScheduledTask next = queue.peek();
    return next == null ? -1 : next.dueAtMillis - nowMillis;
  }

  private record ScheduledTask(long dueAtMillis, long sequence, Runnable task) {}
}
