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

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * An object that intercepts requests sent over a {@link Relay}. Middleware are invoked in the order
 * they're registered, each wrapping the ones registered after it: the first middleware sees the
 * request before all others and the response after all others.
 *
 * <p>A middleware either forwards the (possibly modified) request by calling {@link
 * Next#run(Request) next.run} exactly once and returning (possibly transforming) its result, or
 * short-circuits by returning a response or failure without calling it.
 */
@FunctionalInterface
public interface Middleware {

  /**
   * Handles the given request, returning a future for the resulting response. The given extensions
   * belong to the logical request being sent, and are shared by all middleware in the chain.
   */
  CompletableFuture<Response> handle(Request request, Extensions extensions, Next next);

  /** Returns a middleware that forwards the request after applying the given operator. */
  static Middleware create(UnaryOperator<Request> operator) {
    return (request, extensions, next) -> next.run(operator.apply(request));
  }

  /** Returns a middleware that forwards the request then transforms its response. */
  static Middleware mapResponse(Function<Response, Response> mapper) {
    return (request, extensions, next) -> next.run(request).thenApply(mapper);
  }

  /**
   * The continuation of a chain after the current middleware: the middleware registered after it,
   * ending with the {@link Transport}.
   *
   * <p>A {@code Next} can be run at most once. Running it again fails with a {@link
   * ContractViolationException}, which is also reported to the caller of the logical request.
   * Middleware that need to send the request more than once, like retries, run a {@link #fork()
   * fork} for each attempt.
   */
  interface Next {

    /**
     * Forwards the given request to the next middleware, or to the transport if called by the last
     * middleware.
     */
    CompletableFuture<Response> run(Request request);

    /** Returns a new single-use continuation over the same remainder of the chain. */
    Next fork();

    /** Returns whether the caller has cancelled the logical request. */
    boolean isCancelled();

    /**
     * Arranges for the given action to run when the caller cancels the logical request, or
     * immediately if it's already cancelled.
     */
    void onCancel(Runnable action);
  }
}
