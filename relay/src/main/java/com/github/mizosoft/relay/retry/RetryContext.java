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
import static com.github.mizosoft.relay.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.relay.Request;
import com.github.mizosoft.relay.Response;
import com.github.mizosoft.relay.internal.Utils;
import java.time.Duration;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The outcome of one attempt to send a request, used to decide whether to retry it. Exactly one of
 * {@link #response()} or {@link #exception()} is present.
 */
public final class RetryContext {
  private final Request request;
  private final @Nullable Response response;
  private final @Nullable Throwable exception;
  private final int attemptIndex;
  private final Duration elapsed;

  private RetryContext(
      Request request,
      @Nullable Response response,
      @Nullable Throwable exception,
      int attemptIndex,
      Duration elapsed) {
    requireArgument(
        response != null ^ exception != null,
        "Exactly one of response or exception must be non-null");
    requireArgument(attemptIndex >= 0, "Expected attemptIndex to be non-negative");
    this.request = requireNonNull(request);
    this.response = response;
    this.exception = exception;
    this.attemptIndex = attemptIndex;
    this.elapsed = requireNonNegativeDuration(elapsed);
  }

  /** Returns the request sent in this attempt. */
  public Request request() {
    return request;
  }

  public Optional<Response> response() {
    return Optional.ofNullable(response);
  }

  /** Returns the attempt's failure, with any {@code CompletionException} layers removed. */
  public Optional<Throwable> exception() {
    return Optional.ofNullable(exception);
  }

  /** Returns the index of this attempt, where the first attempt is {@code 0}. */
  public int attemptIndex() {
    return attemptIndex;
  }

  /** Returns the time elapsed since the first attempt started. */
  public Duration elapsed() {
    return elapsed;
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[request="
        + request
        + ", response="
        + response
        + ", exception="
        + exception
        + ", attemptIndex="
        + attemptIndex
        + ", elapsed="
        + elapsed
        + ']';
  }

  /**
   * Creates a new retry context based on the given state.
   *
   * @throws IllegalArgumentException if it is not the case that exactly one of {@code response}
   *     or {@code exception} is non-null, or if {@code attemptIndex} is negative
   */
  public static RetryContext of(
      Request request,
      @Nullable Response response,
      @Nullable Throwable exception,
      int attemptIndex,
      Duration elapsed) {
    return new RetryContext(
        request,
        response,
        exception != null ? Utils.getDeepCompletionCause(exception) : null,
        attemptIndex,
        elapsed);
  }

  /** Creates a context for the first attempt at the given request that got the given response. */
  public static RetryContext of(Request request, Response response) {
    return of(request, response, null, 0, Duration.ZERO);
  }

  /** Creates a context for the first attempt at the given request that failed. */
  public static RetryContext of(Request request, Throwable exception) {
    return of(request, null, exception, 0, Duration.ZERO);
  }
}
