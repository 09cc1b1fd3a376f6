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

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.relay.ErrorKind;
import com.github.mizosoft.relay.Extensions;
import com.github.mizosoft.relay.Middleware;
import com.github.mizosoft.relay.ReplayUnsupportedException;
import com.github.mizosoft.relay.Request;
import com.github.mizosoft.relay.Response;
import com.github.mizosoft.relay.internal.Compare;
import com.github.mizosoft.relay.internal.HttpDates;
import com.github.mizosoft.relay.internal.Utils;
import com.github.mizosoft.relay.internal.concurrent.Delayer;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A middleware that resends requests failing in a transient manner, as told by a {@link
 * RetryPolicy}. Each attempt runs the remainder of the chain with an identical copy of the request
 * as it was when it reached this middleware.
 *
 * <p>The first attempt is sent right away. After an attempt the policy classifies its outcome. If
 * it's {@link Retryability#RETRYABLE retryable} and the policy allows another retry, the {@link
 * RetryCount} in the request's {@link Extensions} is incremented and the request is resent after
 * the policy's backoff delay. Otherwise, the outcome is returned as-is. Contract violations, replay
 * failures and cancellations are never retried. Waiting between attempts doesn't block any thread.
 *
 * <p>Requests with a {@link com.github.mizosoft.relay.Body.Kind#STREAMING streaming} body can't
 * be resent, so they fail with a {@link ReplayUnsupportedException} before the first attempt.
 *
 * <p>This middleware knows nothing about the semantics of HTTP methods. It's up to the user to
 * only retry requests that are safe to send more than once, which can be done by {@link
 * Builder#build(Predicate) selecting} the requests to retry.
 *
 * <pre>{@code
 * var relay = Relay.newBuilder()
 *     .middleware(RetryMiddleware.newBuilder()
 *         .policy(RetryPolicy.newBuilder()
 *             .maxRetries(5)
 *             .backoff(Duration.ofMillis(100), Duration.ofSeconds(10))
 *             .build())
 *         .respectRetryAfter()
 *         .build(request -> !request.method().equals("POST")))
 *     .build();
 * }</pre>
 */
public final class RetryMiddleware implements Middleware {
  private static final Logger logger = System.getLogger(RetryMiddleware.class.getName());

  private final Predicate<Request> selector;
  private final RetryPolicy policy;
  private final boolean respectRetryAfter;
  private final Listener listener;
  private final Level logLevel;
  private final Delayer delayer;
  private final Clock clock;

  private RetryMiddleware(Predicate<Request> selector, Builder builder) {
    this.selector = requireNonNull(selector);
    this.policy = builder.policy;
    this.respectRetryAfter = builder.respectRetryAfter;
    this.listener = builder.listener;
    this.logLevel = builder.logLevel;
    this.delayer = builder.delayer;
    this.clock = builder.clock;
  }

  public RetryPolicy policy() {
    return policy;
  }

  @Override
  public CompletableFuture<Response> handle(Request request, Extensions extensions, Next next) {
    if (!selector.test(request)) {
      return next.run(request);
    }

    var buffer = ReplayBuffer.capture(request);
    if (!buffer.canReplay()) {
      return CompletableFuture.failedFuture(
          new ReplayUnsupportedException(
              "Can't retry " + request + " as its body can only be sent once"));
    }
    extensions.put(RetryCount.class, RetryCount.of(0));
    return new Retrier(buffer, extensions, next).start();
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this) + "[policy=" + policy + "]";
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Runs the attempts of one logical request. Attempts are started from a drain loop so that
   * retries completing synchronously, like immediate retries over a synchronous transport, don't
   * grow the stack.
   */
  private final class Retrier {
    private final ReplayBuffer buffer;
    private final Extensions extensions;
    private final Next next;
    private final Instant start;
    private final @Nullable Instant deadline;
    private final CompletableFuture<Response> resultFuture = new CompletableFuture<>();

    /** The number of attempts scheduled but not yet started by the drain loop. */
    private final AtomicInteger scheduledAttempts = new AtomicInteger();

    /** Only accessed by the thread running the drain loop. */
    private int nextAttemptIndex;

    Retrier(ReplayBuffer buffer, Extensions extensions, Next next) {
      this.buffer = buffer;
      this.extensions = extensions;
      this.next = next;
      this.start = clock.instant();
      this.deadline = policy.timeout().map(start::plus).orElse(null);
    }

    CompletableFuture<Response> start() {
      listener.onFirstAttempt(buffer.request());
      scheduleAttempt();
      return resultFuture;
    }

    private void scheduleAttempt() {
      if (scheduledAttempts.getAndIncrement() == 0) {
        do {
          attempt(nextAttemptIndex++);
        } while (scheduledAttempts.decrementAndGet() > 0);
      }
    }

    private void attempt(int attemptIndex) {
      Request request;
      try {
        request = buffer.replay();
      } catch (ReplayUnsupportedException e) {
        resultFuture.completeExceptionally(e);
        return;
      }

      // Each attempt runs a fresh continuation as a Next can only be run once.
      CompletableFuture<Response> responseFuture;
      try {
        responseFuture = next.fork().run(request);
      } catch (RuntimeException e) {
        resultFuture.completeExceptionally(e);
        return;
      }
      responseFuture.whenComplete(
          (response, exception) -> onAttemptComplete(request, attemptIndex, response, exception));
    }

    private void onAttemptComplete(
        Request request,
        int attemptIndex,
        @Nullable Response response,
        @Nullable Throwable exception) {
      if (response == null && exception == null) {
        resultFuture.complete(null); // Let Relay report.
        return;
      }

      try {
        var context =
            RetryContext.of(
                request,
                response,
                exception,
                attemptIndex,
                Compare.max(Duration.ZERO, Duration.between(start, clock.instant())));
        var delay = nextDelay(context);
        if (delay.isEmpty()) {
          complete(context);
        } else {
          retryAfter(context, delay.get());
        }
      } catch (Throwable t) {
        resultFuture.completeExceptionally(t);
      }
    }

    private void retryAfter(RetryContext context, Duration delay) {
      var retryCount =
          extensions.update(RetryCount.class, RetryCount.of(1), RetryCount::increment);
      logger.log(
          logLevel,
          () ->
              "Retry #"
                  + retryCount.retries()
                  + " of "
                  + context.request()
                  + " after "
                  + context.response().map(Object::toString).orElseGet(() -> failureOf(context))
                  + ", sleeping "
                  + delay
                  + " before the next attempt");
      listener.onRetry(context, delay);

      var delayFuture = delayer.delay(this::scheduleAttempt, delay, Runnable::run);
      delayFuture.whenComplete(
          (__, exception) -> {
            if (exception != null) {
              resultFuture.completeExceptionally(exception);
            }
          });
      next.onCancel(() -> delayFuture.cancel(false));
    }

    private Optional<Duration> nextDelay(RetryContext context) {
      var exception = context.exception();
      if (next.isCancelled()
          || (exception.isPresent() && !ErrorKind.of(exception.get()).isRetryCandidate())
          || policy.classify(context) != Retryability.RETRYABLE) {
        listener.onComplete(context);
        return Optional.empty();
      }

      var decision = policy.nextDelay(context.attemptIndex());
      if (decision.isStop()) {
        logger.log(
            logLevel,
            () ->
                "Retries of "
                    + context.request()
                    + " exhausted after "
                    + (context.attemptIndex() + 1)
                    + " attempts");
        listener.onExhaustion(context);
        return Optional.empty();
      }

      var delay = decision.delay().orElseThrow();
      if (respectRetryAfter) {
        delay = retryAfterDelay(context).orElse(delay);
      }

      // If we'll reach or exceed the deadline while waiting, give up now.
      if (deadline != null
          && Duration.between(clock.instant(), deadline).compareTo(delay) <= 0) {
        listener.onTimeout(context);
        return Optional.empty();
      }
      return Optional.of(delay);
    }

    private Optional<Duration> retryAfterDelay(RetryContext context) {
      return context
          .response()
          .flatMap(response -> response.headers().firstValue("Retry-After"))
          .flatMap(value -> HttpDates.tryParseRetryAfter(value, clock.instant()))
          .map(delay -> Compare.min(delay, policy.maxDelay()));
    }

    private void complete(RetryContext context) {
      var response = context.response();
      if (response.isPresent()) {
        resultFuture.complete(response.get());
      } else {
        resultFuture.completeExceptionally(
            context
                .exception()
                .orElseThrow(
                    () ->
                        new AssertionError(
                            "Expected response or exception to be present in context: "
                                + context)));
      }
    }

    private String failureOf(RetryContext context) {
      return context.exception().map(Object::toString).orElse("nothing");
    }
  }

  /**
   * A listener for {@link RetryMiddleware} events. Useful for logging, metrics collection, and
   * monitoring retry behavior.
   */
  public interface Listener {

    /** Called when the middleware is about to send the request for the first time. */
    default void onFirstAttempt(Request request) {}

    /**
     * Called when the middleware is about to retry a request after the attempt described by the
     * given context, and after waiting for the given delay.
     */
    default void onRetry(RetryContext context, Duration delay) {}

    /** Called when the middleware is about to return the given attempt's outcome as final. */
    default void onComplete(RetryContext context) {}

    /** Called when the policy's timeout doesn't leave room for another retry. */
    default void onTimeout(RetryContext context) {}

    /**
     * Called when the middleware has made all the retries its policy allows. The given context's
     * {@link RetryContext#attemptIndex()} equals the policy's {@link RetryPolicy#maxRetries()}.
     */
    default void onExhaustion(RetryContext context) {}
  }

  private enum EmptyListener implements Listener {
    INSTANCE
  }

  /** A builder of {@link RetryMiddleware} instances. */
  public static final class Builder {
    private RetryPolicy policy = RetryPolicy.defaults();
    private boolean respectRetryAfter;
    private Listener listener = EmptyListener.INSTANCE;
    private Level logLevel = Level.WARNING;
    private Delayer delayer = Delayer.defaultDelayer();
    private Clock clock = Utils.systemMillisUtc();

    Builder() {}

    /** Sets the retry policy. The default is {@link RetryPolicy#defaults()}. */
    @CanIgnoreReturnValue
    public Builder policy(RetryPolicy policy) {
      this.policy = requireNonNull(policy);
      return this;
    }

    /**
     * Specifies that the delay given by a retryable response's {@code Retry-After} header, capped
     * at the policy's max delay, is to be waited instead of the computed one.
     */
    @CanIgnoreReturnValue
    public Builder respectRetryAfter() {
      this.respectRetryAfter = true;
      return this;
    }

    /** Sets the listener for retry events. */
    @CanIgnoreReturnValue
    public Builder listener(Listener listener) {
      this.listener = requireNonNull(listener);
      return this;
    }

    /** Sets the level retry events are logged at. The default is {@code WARNING}. */
    @CanIgnoreReturnValue
    public Builder logLevel(Level logLevel) {
      this.logLevel = requireNonNull(logLevel);
      return this;
    }

    @CanIgnoreReturnValue
    Builder delayer(Delayer delayer) {
      this.delayer = requireNonNull(delayer);
      return this;
    }

    @CanIgnoreReturnValue
    Builder clock(Clock clock) {
      this.clock = requireNonNull(clock);
      return this;
    }

    /** Builds a new {@code RetryMiddleware} that retries all requests. */
    public RetryMiddleware build() {
      return build(__ -> true);
    }

    /**
     * Builds a new {@code RetryMiddleware} that only retries requests matched by the given
     * predicate. Other requests are forwarded as-is.
     */
    public RetryMiddleware build(Predicate<Request> selector) {
      return new RetryMiddleware(selector, this);
    }
  }
}
