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

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * A failure of the {@link Transport} to exchange a request for a response. The chain converts any
 * {@code IOException} reported by the transport into a {@code TransportException}, keeping the
 * original as its cause.
 */
public class TransportException extends IOException {
  private static final long serialVersionUID = 1L;

  private final Kind kind;

  public TransportException(Kind kind, String message) {
    super(message);
    this.kind = requireNonNull(kind);
  }

  public TransportException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = requireNonNull(kind);
  }

  /** Returns the kind of this failure. */
  public Kind kind() {
    return kind;
  }

  /** The kinds of transport failures. */
  public enum Kind {
    /** The connection couldn't be established. */
    CONNECT,

    /** The exchange didn't complete in time. */
    TIMEOUT,

    /** Any other I/O failure during the exchange. */
    NETWORK
  }

  /**
   * Returns the given exception if it's a {@code TransportException}, or a new one of a matching
   * kind that wraps it otherwise.
   */
  public static TransportException from(IOException exception) {
    if (exception instanceof TransportException) {
      return (TransportException) exception;
    }
    return new TransportException(kindOf(exception), String.valueOf(exception), exception);
  }

  private static Kind kindOf(IOException exception) {
    if (exception instanceof HttpConnectTimeoutException
        || exception instanceof ConnectException
        || exception instanceof UnknownHostException
        || exception instanceof NoRouteToHostException) {
      return Kind.CONNECT;
    } else if (exception instanceof HttpTimeoutException
        || exception instanceof InterruptedIOException) {
      return Kind.TIMEOUT; // Includes SocketTimeoutException.
    } else {
      return Kind.NETWORK;
    }
  }
}
