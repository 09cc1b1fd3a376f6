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

import com.github.mizosoft.relay.internal.Utils;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.util.concurrent.CompletableFuture;

/**
 * A {@link Transport} that exchanges requests over a {@link HttpClient}. Response bodies are read
 * fully into memory.
 */
public final class HttpClientTransport implements Transport {
  private final HttpClient client;

  private HttpClientTransport(HttpClient client) {
    this.client = requireNonNull(client);
  }

  /** Returns the underlying {@code HttpClient}. */
  public HttpClient client() {
    return client;
  }

  @Override
  public CompletableFuture<Response> send(Request request) {
    return client
        .sendAsync(toHttpRequest(request), BodyHandlers.ofByteArray())
        .thenApply(httpResponse -> toResponse(request, httpResponse));
  }

  private static HttpRequest toHttpRequest(Request request) {
    var builder =
        HttpRequest.newBuilder(request.uri())
            .method(request.method(), toBodyPublisher(request.body()));
    request.headers().map().forEach((name, values) -> values.forEach(v -> builder.header(name, v)));
    request.timeout().ifPresent(builder::timeout);
    return builder.build();
  }

  private static BodyPublisher toBodyPublisher(Body body) {
    switch (body.kind()) {
      case ABSENT:
        return BodyPublishers.noBody();
      case BUFFERED:
        return BodyPublishers.ofByteArray(((Body.Buffered) body).bytes());
      case STREAMING:
        var publisher = BodyPublishers.ofInputStream(() -> open(body));
        return body.contentLength() >= 0
            ? BodyPublishers.fromPublisher(publisher, body.contentLength())
            : publisher;
      default:
        throw new AssertionError("Unexpected body kind: " + body.kind());
    }
  }

  private static InputStream open(Body body) {
    try {
      return body.open();
    } catch (ReplayUnsupportedException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static Response toResponse(Request request, HttpResponse<byte[]> httpResponse) {
    return Response.newBuilder()
        .request(request)
        .uri(httpResponse.uri())
        .statusCode(httpResponse.statusCode())
        .headers(httpResponse.headers())
        .body(httpResponse.body())
        .build();
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this) + "[client=" + client + "]";
  }

  /** Returns a transport over a new {@code HttpClient} with default settings. */
  public static HttpClientTransport create() {
    return new HttpClientTransport(HttpClient.newHttpClient());
  }

  /** Returns a transport over the given {@code HttpClient}. */
  public static HttpClientTransport create(HttpClient client) {
    return new HttpClientTransport(client);
  }
}
