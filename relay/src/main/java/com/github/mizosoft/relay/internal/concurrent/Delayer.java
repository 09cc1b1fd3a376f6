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

package com.github.mizosoft.relay.internal.concurrent;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs tasks after a delay without blocking the caller. Cancelling a returned future before the
 * delay elapses prevents the task from running.
 */
@FunctionalInterface
public interface Delayer {

  /**
   * Arranges for the given task to run on the given executor after the given delay. Returns a
   * future that completes when the task finishes running.
   */
  CompletableFuture<Void> delay(Runnable task, Duration delay, Executor executor);

  static Delayer defaultDelayer() {
    return DefaultDelayerHolder.INSTANCE;
  }

  final class DefaultDelayerHolder {
    static final Delayer INSTANCE =
        new ScheduledExecutorServiceDelayer(SharedExecutors.scheduler());

    private DefaultDelayerHolder() {}
  }
}
