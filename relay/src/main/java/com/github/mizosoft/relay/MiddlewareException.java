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

import static com.github.mizosoft.relay.internal.Validate.requireArgument;

import java.io.IOException;
import java.util.OptionalInt;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An error raised by a middleware's own logic. A middleware can attach the HTTP status code that
 * caused the failure, which lets the {@link com.github.mizosoft.relay.retry.RetryClassifier
 * default classifier} treat it like a response with that status.
 */
public class MiddlewareException extends IOException {
  private static final long serialVersionUID = 1L;

  private final int statusCode;

  public MiddlewareException(String message) {
    this(message, null);
  }

  public MiddlewareException(String message, @Nullable Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  public MiddlewareException(String message, int statusCode, @Nullable Throwable cause) {
    super(message, cause);
    requireArgument(statusCode >= 100 && statusCode <= 999, "invalid status code: %d", statusCode);
    this.statusCode = statusCode;
  }

  /** Returns the status code this error was raised for, if any. */
  public OptionalInt statusCode() {
    return statusCode >= 0 ? OptionalInt.of(statusCode) : OptionalInt.empty();
  }
}
