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

import static com.github.mizosoft.relay.internal.Validate.requireArgument;

/**
 * The number of times a logical request has been retried so far. {@link RetryMiddleware} keeps an
 * instance in the request's {@link com.github.mizosoft.relay.Extensions}, where it can be read by
 * middleware running inside the retry loop.
 */
public final class RetryCount {
  private static final RetryCount ZERO = new RetryCount(0);

  private final int retries;

  private RetryCount(int retries) {
    this.retries = retries;
  }

  public int retries() {
    return retries;
  }

  RetryCount increment() {
    return new RetryCount(retries + 1);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof RetryCount && retries == ((RetryCount) obj).retries;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(retries);
  }

  @Override
  public String toString() {
    return "RetryCount[" + retries + "]";
  }

  public static RetryCount of(int retries) {
    requireArgument(retries >= 0, "negative retry count: %d", retries);
    return retries == 0 ? ZERO : new RetryCount(retries);
  }
}
