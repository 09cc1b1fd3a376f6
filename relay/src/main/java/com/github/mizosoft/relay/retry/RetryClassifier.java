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

import com.github.mizosoft.relay.MiddlewareException;
import com.github.mizosoft.relay.TransportException;

/** Tells transient outcomes that are worth retrying from permanent ones. */
@FunctionalInterface
public interface RetryClassifier {

  /** Classifies the outcome of the given attempt. */
  Retryability classify(RetryContext context);

  /**
   * Returns the default classifier, which finds the following outcomes retryable:
   *
   * <ul>
   *   <li>Responses with a {@code 429} or {@code 5xx} status code.
   *   <li>{@link TransportException transport failures}.
   *   <li>{@link MiddlewareException Middleware failures} carrying one of the status codes above,
   *       or caused by a transport failure.
   * </ul>
   *
   * Every other outcome is permanent.
   */
  static RetryClassifier defaults() {
    return DefaultRetryClassifier.INSTANCE;
  }

  /** Returns whether the given status code is one the default classifier retries. */
  static boolean isRetryableStatus(int statusCode) {
    return statusCode == 429 || (statusCode >= 500 && statusCode <= 599);
  }
}

enum DefaultRetryClassifier implements RetryClassifier {
  INSTANCE;

  @Override
  public Retryability classify(RetryContext context) {
    boolean retryable =
        context
            .response()
            .map(response -> RetryClassifier.isRetryableStatus(response.statusCode()))
            .orElseGet(() -> context.exception().map(this::isTransient).orElse(false));
    return retryable ? Retryability.RETRYABLE : Retryability.PERMANENT;
  }

  private boolean isTransient(Throwable exception) {
    if (exception instanceof TransportException) {
      return true;
    }
    if (exception instanceof MiddlewareException) {
      var statusCode = ((MiddlewareException) exception).statusCode();
      if (statusCode.isPresent() && RetryClassifier.isRetryableStatus(statusCode.getAsInt())) {
        return true;
      }
      for (var cause = exception.getCause(); cause != null; cause = cause.getCause()) {
        if (cause instanceof TransportException) {
          return true;
        }
      }
    }
    return false;
  }
}
