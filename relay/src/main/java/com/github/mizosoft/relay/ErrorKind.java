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

import com.github.mizosoft.relay.internal.Utils;
import java.util.concurrent.CancellationException;

/** The closed set of failure kinds a logical request can end with. */
public enum ErrorKind {
  /** The {@link Transport} failed to exchange the request, see {@link TransportException}. */
  TRANSPORT(true),

  /** A middleware failed on its own, see {@link MiddlewareException}. */
  MIDDLEWARE(true),

  /** A middleware misused the chain, see {@link ContractViolationException}. */
  CONTRACT_VIOLATION(false),

  /** A request body had to be resent but couldn't, see {@link ReplayUnsupportedException}. */
  REPLAY_UNSUPPORTED(false),

  /** The caller cancelled the logical request. */
  CANCELLATION(false);

  private final boolean retryCandidate;

  ErrorKind(boolean retryCandidate) {
    this.retryCandidate = retryCandidate;
  }

  /**
   * Returns whether failures of this kind may be retried, subject to the retry policy's
   * classification. Contract violations, replay failures and cancellations are always final.
   */
  public boolean isRetryCandidate() {
    return retryCandidate;
  }

  /**
   * Returns the kind of the given failure after unwrapping any {@code CompletionException} or
   * {@code ExecutionException} layers. Failures that aren't raised by the transport or the chain
   * itself are attributed to middleware.
   */
  public static ErrorKind of(Throwable throwable) {
    var cause = Utils.getDeepCompletionCause(throwable);
    if (cause instanceof ContractViolationException) {
      return CONTRACT_VIOLATION;
    } else if (cause instanceof ReplayUnsupportedException) {
      return REPLAY_UNSUPPORTED;
    } else if (cause instanceof CancellationException) {
      return CANCELLATION;
    } else if (cause instanceof TransportException) {
      return TRANSPORT;
    } else {
      return MIDDLEWARE;
    }
  }
}
