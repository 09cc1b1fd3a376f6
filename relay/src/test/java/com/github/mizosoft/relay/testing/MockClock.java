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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A {@code Clock} that only moves when told to, either manually or on each read. */
public final class MockClock extends Clock {
  private final ZoneId zoneId;
  private final AtomicReference<Instant> now;

  private volatile @Nullable Duration autoAdvance;

  /** Invoked with the time before advancing and the advanced amount whenever the clock moves. */
  private volatile @Nullable BiConsumer<Instant, Duration> tickListener;

  public MockClock() {
    this(Instant.parse("2025-01-01T00:00:00.00Z"));
  }

  public MockClock(Instant inception) {
    this(ZoneOffset.UTC, inception);
  }

  private MockClock(ZoneId zoneId, Instant inception) {
    this.zoneId = zoneId;
    this.now = new AtomicReference<>(inception);
  }

  @Override
  public ZoneId getZone() {
    return zoneId;
  }

  @Override
  public MockClock withZone(ZoneId zone) {
    return new MockClock(zone, peekInstant());
  }

  @Override
  public Instant instant() {
    var ticks = autoAdvance;
    return ticks != null ? getAndAdvance(ticks) : peekInstant();
  }

  /** Returns the clock's time without advancing it. */
  public Instant peekInstant() {
    return now.get();
  }

  public void onTick(@Nullable BiConsumer<Instant, Duration> listener) {
    tickListener = listener;
  }

  public void advance(Duration ticks) {
    getAndAdvance(ticks);
  }

  public void advanceSeconds(long seconds) {
    advance(Duration.ofSeconds(seconds));
  }

  /** Makes each read of {@link #instant()} advance the clock by the given amount. */
  public void autoAdvance(@Nullable Duration ticks) {
    this.autoAdvance = ticks;
  }

  private Instant getAndAdvance(Duration ticks) {
    var past = now.getAndUpdate(instant -> instant.plus(ticks));
    var listener = tickListener;
    if (listener != null) {
      listener.accept(past, ticks);
    }
    return past;
  }
}
