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

package com.github.mizosoft.relay;

import static com.github.mizosoft.relay.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.relay.internal.Utils;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An HTTP client that sends requests through an ordered chain of {@link Middleware}, closed by a
 * {@link Transport} that performs the actual exchange.
 *
 * <p>Each call to {@link #execute(Request)} starts a logical request with its own {@link
 * Extensions}. The first registered middleware is invoked first. It either forwards the request to
 * the next middleware, and so on till the transport is reached, or short-circuits the chain. A
 * {@code Relay} holds no per-request state, so it can be shared by concurrent requests.
 *
 * <pre>{@code
 * var relay = Relay.newBuilder()
 *     .middleware(RetryMiddleware.newBuilder()
 *         .policy(RetryPolicy.newBuilder()
 *             .maxRetries(3)
 *             .baseDelay(Duration.ofMillis(100))
 *             .build())
 *         .build())
 *     .build();
 * var response = relay.send(Request.GET("https://example.com"));
 * }</pre>
 */
public final class Relay {
  private static final Logger logger = System.getLogger(Relay.class.getName());

  private final Transport transport;
  private final List<Middleware> middlewares;
  private final List<RequestInitializer> initializers;

  private Relay(Builder builder) {
    this.transport =
        builder.transport != null ? builder.transport : HttpClientTransport.create();
    this.middlewares = List.copyOf(builder.middlewares);
    this.initializers = List.copyOf(builder.initializers);
  }

  /** Returns this relay's transport. */
  public Transport transport() {
    return transport;
  }

  /** Returns an immutable list of this relay's middleware in registration order. */
  public List<Middleware> middlewares() {
    return middlewares;
  }

  /** Returns an immutable list of this relay's request initializers. */
  public List<RequestInitializer> initializers() {
    return initializers;
  }

  /**
   * Sends the given request through the chain with new {@link Extensions}. Cancelling the returned
   * future cancels the logical request: pending retry waits are aborted, the transport's exchange
   * is cancelled and no further attempts are made.
   */
  public CompletableFuture<Response> execute(Request request) {
    return execute(request, new Extensions());
  }

  /**
   * Sends the given request through the chain with the given {@link Extensions}, which must not
   * have been used for another request.
   *
   * @throws IllegalStateException if the given extensions were already used for another request
   */
  public CompletableFuture<Response> execute(Request request, Extensions extensions) {
    requireNonNull(request);
    extensions.bind();

    var call = new Call(extensions);
    CompletableFuture<Response> responseFuture;
    try {
      responseFuture = new Continuation(call, 0).run(initialize(request, extensions));
    } catch (RuntimeException e) {
      responseFuture = CompletableFuture.failedFuture(e);
    }

    var resultFuture = new CompletableFuture<Response>();
    responseFuture.whenComplete(
        (response, exception) -> call.complete(resultFuture, response, exception));
    resultFuture.whenComplete(
        (__, exception) -> {
          if (exception instanceof CancellationException) {
            call.cancel();
          }
        });
    return resultFuture;
  }

  /**
   * Sends the given request through the chain and waits for its response. The logical request is
   * cancelled if the calling thread is interrupted while waiting.
   *
   * @throws IOException if the request fails with an {@code IOException}, like a {@link
   *     TransportException}
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public Response send(Request request) throws IOException, InterruptedException {
    return Utils.get(execute(request));
  }

  /** Same as {@link #send(Request)} but with the given {@link Extensions}. */
  public Response send(Request request, Extensions extensions)
      throws IOException, InterruptedException {
    return Utils.get(execute(request, extensions));
  }

  private Request initialize(Request request, Extensions extensions) {
    var initializedRequest = request;
    for (var initializer : initializers) {
      initializedRequest =
          requireNonNull(
              initializer.initialize(initializedRequest, extensions),
              "RequestInitializer returned a null request");
    }
    return initializedRequest;
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[transport="
        + transport
        + ", middlewares="
        + middlewares
        + "]";
  }

  /** Returns a new builder that uses an {@link HttpClientTransport} unless told otherwise. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /** Returns a new builder that uses the given transport. */
  public static Builder newBuilder(Transport transport) {
    return new Builder().transport(transport);
  }

  /** A builder of {@link Relay} instances. */
  public static final class Builder {
    private final List<Middleware> middlewares = new ArrayList<>();
    private final List<RequestInitializer> initializers = new ArrayList<>();
    private @MonotonicNonNull Transport transport;

    Builder() {}

    /** Calls the given consumer against this builder. */
    @CanIgnoreReturnValue
    public Builder apply(Consumer<? super Builder> consumer) {
      consumer.accept(this);
      return this;
    }

    /**
     * Sets the transport closing the chain.
     *
     * @throws IllegalStateException if a transport is already set
     */
    @CanIgnoreReturnValue
    public Builder transport(Transport transport) {
      requireState(this.transport == null, "A transport is already set");
      this.transport = requireNonNull(transport);
      return this;
    }

    /** Adds a middleware that is invoked after the ones added so far. */
    @CanIgnoreReturnValue
    public Builder middleware(Middleware middleware) {
      middlewares.add(requireNonNull(middleware));
      return this;
    }

    /** Adds an initializer that is invoked after the ones added so far. */
    @CanIgnoreReturnValue
    public Builder initializer(RequestInitializer initializer) {
      initializers.add(requireNonNull(initializer));
      return this;
    }

    public Relay build() {
      return new Relay(this);
    }
  }

  /** The state of one logical request. */
  private static final class Call {
    final Extensions extensions;
    private final CompletableFuture<Void> cancellation = new CompletableFuture<>();
    private volatile @Nullable ContractViolationException violation;

    Call(Extensions extensions) {
      this.extensions = extensions;
    }

    ContractViolationException reportViolation(ContractViolationException violation) {
      logger.log(Level.WARNING, "Middleware contract violation", violation);
      if (this.violation == null) {
        this.violation = violation;
      }
      return violation;
    }

    boolean isCancelled() {
      return cancellation.isDone();
    }

    void onCancel(Runnable action) {
      cancellation.thenRun(action);
    }

    void cancel() {
      cancellation.complete(null);
    }

    void complete(
        CompletableFuture<Response> resultFuture,
        @Nullable Response response,
        @Nullable Throwable exception) {
      // A violation wins over whatever the offending middleware made of it.
      var reportedViolation = violation;
      if (reportedViolation != null) {
        resultFuture.completeExceptionally(reportedViolation);
      } else if (exception != null) {
        resultFuture.completeExceptionally(Utils.getDeepCompletionCause(exception));
      } else if (response == null) {
        resultFuture.completeExceptionally(
            reportViolation(new ContractViolationException("Chain completed with no response")));
      } else {
        resultFuture.complete(response);
      }
    }
  }

  /** A {@link Middleware.Next} positioned at a given index in the chain. */
  private final class Continuation implements Middleware.Next {
    private final Call call;
    private final int index;
    private final AtomicBoolean consumed = new AtomicBoolean();

    Continuation(Call call, int index) {
      this.call = call;
      this.index = index;
    }

    @Override
    public CompletableFuture<Response> run(Request request) {
      requireNonNull(request);
      if (!consumed.compareAndSet(false, true)) {
        return CompletableFuture.failedFuture(
            call.reportViolation(
                new ContractViolationException(
                    caller() + " ran its continuation more than once")));
      }
      if (call.isCancelled()) {
        return CompletableFuture.failedFuture(
            new CancellationException("Request was cancelled: " + request));
      }
      return index < middlewares.size()
          ? handle(middlewares.get(index), request)
          : sendOverTransport(request);
    }

    @Override
    public Middleware.Next fork() {
      return new Continuation(call, index);
    }

    @Override
    public boolean isCancelled() {
      return call.isCancelled();
    }

    @Override
    public void onCancel(Runnable action) {
      call.onCancel(requireNonNull(action));
    }

    private CompletableFuture<Response> handle(Middleware middleware, Request request) {
      CompletableFuture<Response> responseFuture;
      try {
        responseFuture =
            middleware.handle(request, call.extensions, new Continuation(call, index + 1));
      } catch (ContractViolationException e) {
        return CompletableFuture.failedFuture(call.reportViolation(e));
      } catch (RuntimeException e) {
        return CompletableFuture.failedFuture(e);
      }

      if (responseFuture == null) {
        return CompletableFuture.failedFuture(
            call.reportViolation(
                new ContractViolationException(middleware + " returned a null future")));
      }
      return responseFuture;
    }

    private CompletableFuture<Response> sendOverTransport(Request request) {
      final CompletableFuture<Response> responseFuture;
      try {
        responseFuture = transport.send(request);
      } catch (RuntimeException e) {
        return CompletableFuture.failedFuture(e);
      }

      if (responseFuture == null) {
        return CompletableFuture.failedFuture(
            call.reportViolation(
                new ContractViolationException(transport + " returned a null future")));
      }
      call.onCancel(() -> responseFuture.cancel(true));
      return responseFuture.handle(
          (response, exception) -> {
            if (exception == null) {
              return response;
            }
            var cause = Utils.getDeepCompletionCause(exception);
            if (cause instanceof IOException && !(cause instanceof ReplayUnsupportedException)) {
              throw new CompletionException(TransportException.from((IOException) cause));
            }
            throw Utils.toCompletionException(cause);
          });
    }

    private String caller() {
      return index > 0 ? String.valueOf(middlewares.get(index - 1)) : "Relay";
    }
  }
}
