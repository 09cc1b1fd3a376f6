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

package com.github.mizosoft.relay.retry;

import static com.github.mizosoft.relay.internal.Utils.requireNonNegativeDuration;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/** What a {@link RetryPolicy} decides after an attempt: stop, or retry after some delay. */
public final class RetryDecision {
  private static final RetryDecision STOP = new RetryDecision(null);

  private final @Nullable Duration delay;

  private RetryDecision(@Nullable Duration delay) {
    this.delay = delay;
  }

  public boolean isStop() {
    return delay == null;
  }

  /** Returns the delay to wait before retrying, or an empty optional if this is a stop. */
  public Optional<Duration> delay() {
    return Optional.ofNullable(delay);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof RetryDecision && Objects.equals(delay, ((RetryDecision) obj).delay);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(delay);
  }

  @Override
  public String toString() {
    return delay == null ? "RetryDecision[stop]" : "RetryDecision[retryAfter=" + delay + "]";
  }

  public static RetryDecision stop() {
    return STOP;
  }

  public static RetryDecision retryAfter(Duration delay) {
    return new RetryDecision(requireNonNegativeDuration(delay));
  }
}
