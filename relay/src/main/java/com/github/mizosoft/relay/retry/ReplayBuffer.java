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

import com.github.mizosoft.relay.ReplayUnsupportedException;
import com.github.mizosoft.relay.Request;

/**
 * Holds a request captured on entry to the retry loop so that an identical copy can be sent on
 * every attempt. What inner middleware do to the requests they receive doesn't affect the captured
 * one.
 */
public final class ReplayBuffer {
  private final Request request;

  private ReplayBuffer(Request request) {
    this.request = request;
  }

  /** Returns the captured request. */
  public Request request() {
    return request;
  }

  /** Returns whether the captured request can be sent again, which is not the case for streams. */
  public boolean canReplay() {
    return request.body().isReplayable();
  }

  /**
   * Returns a copy of the captured request to send in a new attempt.
   *
   * @throws ReplayUnsupportedException if the captured request has a streaming body
   */
  public Request replay() throws ReplayUnsupportedException {
    var body = request.body();
    var duplicateBody = body.duplicate();
    return duplicateBody == body ? request : request.withBody(duplicateBody);
  }

  @Override
  public String toString() {
    return "ReplayBuffer[" + request + ", " + request.body() + "]";
  }

  /** Captures the given request. */
  public static ReplayBuffer capture(Request request) {
    return new ReplayBuffer(requireNonNull(request));
  }
}
