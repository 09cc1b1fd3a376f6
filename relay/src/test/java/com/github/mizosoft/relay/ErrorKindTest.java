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

import static org.assertj.core.api.Assertions.assertThat;

import com.github.mizosoft.relay.testing.TestException;
import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Test;

class ErrorKindTest {
  @Test
  void kindOfEachFailure() {
    assertThat(ErrorKind.of(new TransportException(TransportException.Kind.CONNECT, "")))
        .isEqualTo(ErrorKind.TRANSPORT);
    assertThat(ErrorKind.of(new MiddlewareException("")))
        .isEqualTo(ErrorKind.MIDDLEWARE);
    assertThat(ErrorKind.of(new ContractViolationException("")))
        .isEqualTo(ErrorKind.CONTRACT_VIOLATION);
    assertThat(ErrorKind.of(new ReplayUnsupportedException("")))
        .isEqualTo(ErrorKind.REPLAY_UNSUPPORTED);
    assertThat(ErrorKind.of(new CancellationException()))
        .isEqualTo(ErrorKind.CANCELLATION);
  }

  @Test
  void foreignFailuresAreAttributedToMiddleware() {
    assertThat(ErrorKind.of(new TestException())).isEqualTo(ErrorKind.MIDDLEWARE);
    assertThat(ErrorKind.of(new IOException())).isEqualTo(ErrorKind.MIDDLEWARE);
  }

  @Test
  void asyncWrappersAreUnwrapped() {
    var transportException = TransportException.from(new ConnectException());
    assertThat(ErrorKind.of(new CompletionException(transportException)))
        .isEqualTo(ErrorKind.TRANSPORT);
    assertThat(
            ErrorKind.of(
                new ExecutionException(
                    new CompletionException(new ReplayUnsupportedException("")))))
        .isEqualTo(ErrorKind.REPLAY_UNSUPPORTED);
  }

  @Test
  void onlyTransportAndMiddlewareFailuresAreRetryCandidates() {
    assertThat(ErrorKind.TRANSPORT.isRetryCandidate()).isTrue();
    assertThat(ErrorKind.MIDDLEWARE.isRetryCandidate()).isTrue();
    assertThat(ErrorKind.CONTRACT_VIOLATION.isRetryCandidate()).isFalse();
    assertThat(ErrorKind.REPLAY_UNSUPPORTED.isRetryCandidate()).isFalse();
    assertThat(ErrorKind.CANCELLATION.isRetryCandidate()).isFalse();
  }

  @Test
  void middlewareExceptionStatusCode() {
    assertThat(new MiddlewareException("").statusCode()).isEmpty();
    assertThat(new MiddlewareException("", 503, null).statusCode()).hasValue(503);
  }
}
