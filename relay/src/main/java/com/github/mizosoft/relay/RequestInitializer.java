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

import static java.util.Objects.requireNonNull;

/**
 * Prepares each request sent over a {@link Relay} before it enters the middleware chain. An
 * initializer can derive a new request and seed the request's {@link Extensions}.
 */
@FunctionalInterface
public interface RequestInitializer {

  /** Returns the request to send, possibly after modifying the given one. */
  Request initialize(Request request, Extensions extensions);

  /** Returns an initializer that maps the given value to the given type in every request. */
  static <T> RequestInitializer extension(Class<T> type, T value) {
    requireNonNull(type);
    requireNonNull(value);
    return (request, extensions) -> {
      extensions.put(type, value);
      return request;
    };
  }
}
