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
import static com.github.mizosoft.relay.internal.Utils.requirePositiveDuration;
import static com.github.mizosoft.relay.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.relay.internal.Compare;
import com.github.mizosoft.relay.internal.Utils;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Duration;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decides whether and when a request is retried. A policy classifies the outcome of each attempt
 * with its {@link RetryClassifier}, and computes exponentially growing backoff delays between
 * attempts:
 *
 * <pre>{@code delay(i) = min(maxDelay, baseDelay * 2^i)}</pre>
 *
 * where {@code i} is the index of the attempt that just finished, after which the configured
 * {@link Jitter} is applied. A policy is immutable, and its decisions only depend on their inputs
 * and its random source.
 */
public final class RetryPolicy {
  private static final int DEFAULT_MAX_RETRIES = 3;
  private static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
  private static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

  private static final RetryPolicy DEFAULT = newBuilder().build();

  private final int maxRetries;
  private final Duration baseDelay;
  private final Duration maxDelay;
  private final Jitter jitter;
  private final RetryClassifier classifier;
  private final DoubleSupplier random;
  private final @Nullable Duration timeout;

  private RetryPolicy(Builder builder) {
    requireArgument(
        builder.baseDelay.compareTo(builder.maxDelay) <= 0,
        "Base delay (%s) must be less than or equal to max delay (%s)",
        builder.baseDelay,
        builder.maxDelay);
    this.maxRetries = builder.maxRetries;
    this.baseDelay = builder.baseDelay;
    this.maxDelay = builder.maxDelay;
    this.jitter = builder.jitter;
    this.classifier = builder.classifier;
    this.random = builder.random;
    this.timeout = builder.timeout;
  }

  public int maxRetries() {
    return maxRetries;
  }

  public Duration baseDelay() {
    return baseDelay;
  }

  public Duration maxDelay() {
    return maxDelay;
  }

  public Jitter jitter() {
    return jitter;
  }

  public RetryClassifier classifier() {
    return classifier;
  }

  /** Returns the time allowed for all attempts of a request, if limited. */
  public Optional<Duration> timeout() {
    return Optional.ofNullable(timeout);
  }

  /** Classifies the given attempt's outcome with this policy's classifier. */
  public Retryability classify(RetryContext context) {
    return requireNonNull(classifier.classify(context), "RetryClassifier returned null");
  }

  /**
   * Decides whether to retry after the attempt with the given index, which is {@code 0} for the
   * first attempt, and how long to wait before doing so.
   */
  public RetryDecision nextDelay(int attemptIndex) {
    requireArgument(attemptIndex >= 0, "negative attempt index: %d", attemptIndex);
    if (attemptIndex >= maxRetries) {
      return RetryDecision.stop();
    }
    return RetryDecision.retryAfter(applyJitter(exponentialDelay(attemptIndex)));
  }

  private Duration exponentialDelay(int attemptIndex) {
    if (attemptIndex >= Long.SIZE - 2) { // Avoid overflow.
      return maxDelay;
    }
    try {
      return Compare.min(maxDelay, baseDelay.multipliedBy(1L << attemptIndex));
    } catch (ArithmeticException e) {
      return maxDelay;
    }
  }

  private Duration applyJitter(Duration delay) {
    switch (jitter) {
      case NONE:
        return delay;
      case FULL:
        return sample(Duration.ZERO, delay);
      case BOUNDED:
        return sample(baseDelay, delay);
      default:
        throw new AssertionError("Unexpected jitter: " + jitter);
    }
  }

  /** Samples a delay uniformly from {@code [lower, upper]}, with nanosecond precision. */
  private Duration sample(Duration lower, Duration upper) {
    long lowerNanos = saturatedNanos(lower);
    long rangeNanos = Math.max(0, saturatedNanos(upper) - lowerNanos);
    double fraction = random.getAsDouble();
    requireArgument(
        fraction >= 0.0 && fraction <= 1.0, "Random source gave %f outside [0, 1]", fraction);
    return Duration.ofNanos(lowerNanos + Math.min(rangeNanos, Math.round(rangeNanos * fraction)));
  }

  private static long saturatedNanos(Duration duration) {
    try {
      return duration.toNanos();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[maxRetries="
        + maxRetries
        + ", baseDelay="
        + baseDelay
        + ", maxDelay="
        + maxDelay
        + ", jitter="
        + jitter
        + ", timeout="
        + timeout
        + "]";
  }

  /**
   * Returns the default policy: 3 retries with delays starting at 1 second and capped at 30
   * seconds, full jitter, and the {@link RetryClassifier#defaults() default classifier}.
   */
  public static RetryPolicy defaults() {
    return DEFAULT;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@link RetryPolicy} instances. */
  public static final class Builder {
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private Duration baseDelay = DEFAULT_BASE_DELAY;
    private Duration maxDelay = DEFAULT_MAX_DELAY;
    private Jitter jitter = Jitter.FULL;
    private RetryClassifier classifier = RetryClassifier.defaults();
    private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();
    private @MonotonicNonNull Duration timeout;

    Builder() {}

    /** Sets how many times a request may be retried. {@code 0} disables retries. */
    @CanIgnoreReturnValue
    public Builder maxRetries(int maxRetries) {
      requireArgument(maxRetries >= 0, "negative maxRetries: %d", maxRetries);
      this.maxRetries = maxRetries;
      return this;
    }

    /** Sets the delay before the first retry. */
    @CanIgnoreReturnValue
    public Builder baseDelay(Duration baseDelay) {
      this.baseDelay = requireNonNegativeDuration(baseDelay);
      return this;
    }

    /** Sets the cap of computed delays. */
    @CanIgnoreReturnValue
    public Builder maxDelay(Duration maxDelay) {
      this.maxDelay = requireNonNegativeDuration(maxDelay);
      return this;
    }

    /** Sets the base and cap delays. */
    @CanIgnoreReturnValue
    public Builder backoff(Duration baseDelay, Duration maxDelay) {
      return baseDelay(baseDelay).maxDelay(maxDelay);
    }

    @CanIgnoreReturnValue
    public Builder jitter(Jitter jitter) {
      this.jitter = requireNonNull(jitter);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder classifier(RetryClassifier classifier) {
      this.classifier = requireNonNull(classifier);
      return this;
    }

    /** Sets the source of randomness used for jitter. */
    @CanIgnoreReturnValue
    public Builder random(Random random) {
      requireNonNull(random);
      this.random = random::nextDouble;
      return this;
    }

    /**
     * Sets the source of randomness used for jitter as a supplier of values in {@code [0, 1]}.
     */
    @CanIgnoreReturnValue
    public Builder random(DoubleSupplier random) {
      this.random = requireNonNull(random);
      return this;
    }

    /**
     * Sets the time allowed for all attempts of a request, measured from the start of the first
     * attempt. No retry is scheduled if waiting for it would pass that time, in which case the
     * last outcome is returned as-is.
     */
    @CanIgnoreReturnValue
    public Builder timeout(Duration timeout) {
      this.timeout = requirePositiveDuration(timeout);
      return this;
    }

    /**
     * Builds a new policy.
     *
     * @throws IllegalArgumentException if the base delay is greater than the max delay
     */
    public RetryPolicy build() {
      return new RetryPolicy(this);
    }
  }
}
