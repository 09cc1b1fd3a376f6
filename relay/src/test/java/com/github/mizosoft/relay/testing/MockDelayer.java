/*
 * Copyright (c) 2025 Moataz Hussein
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.relay.testing;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.mizosoft.relay.internal.concurrent.Delayer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link Delayer} that runs tasks when a {@link MockClock} passes their due time. Every delay it
 * was asked for is recorded.
 */
public final class MockDelayer implements Delayer {
  private final MockClock clock;
  private final ReentrantLock lock = new ReentrantLock();
  private final PriorityQueue<DelayedFuture> taskQueue =
      new PriorityQueue<>(DelayedFuture.DELAY_ORDER);
  private final List<Duration> delays = new ArrayList<>();

  public MockDelayer(MockClock clock) {
    this.clock = clock;
    clock.onTick((instant, ticks) -> dispatchReadyTasks(instant.plus(ticks)));
  }

  @Override
  public CompletableFuture<Void> delay(Runnable task, Duration delay, Executor executor) {
    var now = clock.peekInstant();
    var future = new DelayedFuture(task, now.plus(delay), executor);
    lock.lock();
    try {
      delays.add(delay);
      taskQueue.add(future);
    } finally {
      lock.unlock();
    }

    // Run tasks that are due right away.
    dispatchReadyTasks(now);
    return future;
  }

  /** Returns the number of tasks waiting for their time. */
  public int taskCount() {
    lock.lock();
    try {
      taskQueue.removeIf(CompletableFuture::isDone);
      return taskQueue.size();
    } finally {
      lock.unlock();
    }
  }

  /** Returns all the delays asked for so far, in order. */
  public List<Duration> delays() {
    lock.lock();
    try {
      return List.copyOf(delays);
    } finally {
      lock.unlock();
    }
  }

  public DelayedFuture peekEarliestFuture() {
    lock.lock();
    try {
      assertThat(taskQueue).isNotEmpty();
      return taskQueue.element();
    } finally {
      lock.unlock();
    }
  }

  private void dispatchReadyTasks(Instant now) {
    DelayedFuture ready;
    while ((ready = pollReady(now)) != null) {
      ready.dispatch();
    }
  }

  private @Nullable DelayedFuture pollReady(Instant now) {
    lock.lock();
    try {
      var future = taskQueue.peek();
      if (future != null && future.isReady(now)) {
        taskQueue.poll();
        return future;
      }
      return null;
    } finally {
      lock.unlock();
    }
  }

  /** A future for a task waiting for its time. */
  public static final class DelayedFuture extends CompletableFuture<Void> {
    static final Comparator<DelayedFuture> DELAY_ORDER =
        Comparator.<DelayedFuture, Instant>comparing(future -> future.when)
            .thenComparingLong(future -> future.sequenceNumber);

    /** Breaks ties between tasks due at the same time. */
    private static final AtomicLong sequencer = new AtomicLong();

    final long sequenceNumber = sequencer.getAndIncrement();
    final Runnable task;
    final Instant when;
    final Executor executor;

    private DelayedFuture(Runnable task, Instant when, Executor executor) {
      this.task = task;
      this.when = when;
      this.executor = executor;
    }

    public Instant when() {
      return when;
    }

    void dispatch() {
      if (isDone()) {
        return;
      }
      completeAsync(
          () -> {
            task.run();
            return null;
          },
          executor);
    }

    boolean isReady(Instant now) {
      return now.compareTo(when) >= 0;
    }
  }
}
