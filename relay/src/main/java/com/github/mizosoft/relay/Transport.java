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

/**
 * Performs the actual exchange of a request for a response, closing a {@link Relay}'s chain. A
 * transport is shared by all requests sent over a {@code Relay}, and is expected to be safe for
 * concurrent use.
 *
 * <p>I/O failures are to be reported as exceptionally completed futures. The chain converts any
 * reported {@code IOException} into a {@link TransportException}. Cancelling a returned future
 * should abort the exchange.
 */
@FunctionalInterface
public interface Transport {

  /** Asynchronously sends the given request, returning a future for its response. */
  CompletableFuture<Response> send(Request request);
}
