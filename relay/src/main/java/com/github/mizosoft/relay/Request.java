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

import static com.github.mizosoft.relay.internal.Utils.isValidToken;
import static com.github.mizosoft.relay.internal.Utils.requirePositiveDuration;
import static com.github.mizosoft.relay.internal.Validate.requireArgument;
import static com.github.mizosoft.relay.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.relay.internal.HeadersBuilder;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.time.Duration;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable HTTP request. Middleware that need to change a request derive a new one with
 * {@link #toBuilder()} and pass it on to the rest of the chain.
 */
public final class Request {
  private final String method;
  private final URI uri;
  private final HttpHeaders headers;
  private final Body body;
  private final @Nullable Duration timeout;

  private Request(Builder builder) {
    this.method = builder.method;
    this.uri = requireNonNull(builder.uri);
    this.headers = builder.headersBuilder.build();
    this.body = builder.body;
    this.timeout = builder.timeout;
  }

  public String method() {
    return method;
  }

  public URI uri() {
    return uri;
  }

  public HttpHeaders headers() {
    return headers;
  }

  public Body body() {
    return body;
  }

  /** Returns the timeout the transport is to apply to a single exchange of this request. */
  public Optional<Duration> timeout() {
    return Optional.ofNullable(timeout);
  }

  /** Returns a builder initialized with this request's state. */
  public Builder toBuilder() {
    return new Builder(this);
  }

  /** Returns a copy of this request that carries the given body. */
  public Request withBody(Body body) {
    return toBuilder().body(body).build();
  }

  @Override
  public String toString() {
    return uri + " " + method;
  }

  /** Returns a new {@code GET} request to the given URI. */
  public static Request GET(String uri) {
    return newBuilder(uri).build();
  }

  /** Returns a new {@code GET} request to the given URI. */
  public static Request GET(URI uri) {
    return newBuilder(uri).build();
  }

  /** Returns a new {@code POST} request to the given URI with the given body. */
  public static Request POST(String uri, Body body) {
    return newBuilder(uri).POST(body).build();
  }

  /** Returns a new {@code POST} request to the given URI with the given body. */
  public static Request POST(URI uri, Body body) {
    return newBuilder(uri).POST(body).build();
  }

  /** Returns a new {@code PUT} request to the given URI with the given body. */
  public static Request PUT(String uri, Body body) {
    return newBuilder(uri).PUT(body).build();
  }

  /** Returns a new {@code DELETE} request to the given URI. */
  public static Request DELETE(String uri) {
    return newBuilder(uri).DELETE().build();
  }

  /** Returns a new builder with no URI and a default {@code GET} method. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /** Returns a new builder with the given URI and a default {@code GET} method. */
  public static Builder newBuilder(String uri) {
    return new Builder().uri(uri);
  }

  /** Returns a new builder with the given URI and a default {@code GET} method. */
  public static Builder newBuilder(URI uri) {
    return new Builder().uri(uri);
  }

  /** A builder of {@link Request} instances. */
  public static final class Builder {
    private final HeadersBuilder headersBuilder = new HeadersBuilder();
    private String method = "GET";
    private @MonotonicNonNull URI uri;
    private Body body = Body.absent();
    private @Nullable Duration timeout;

    Builder() {}

    Builder(Request request) {
      this.method = request.method;
      this.uri = request.uri;
      this.body = request.body;
      this.timeout = request.timeout;
      headersBuilder.addAll(request.headers);
    }

    @CanIgnoreReturnValue
    public Builder uri(String uri) {
      return uri(URI.create(uri));
    }

    @CanIgnoreReturnValue
    public Builder uri(URI uri) {
      this.uri = requireNonNull(uri);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder method(String method, Body body) {
      requireArgument(isValidToken(method), "Illegal method name: '%s'", method);
      this.method = method;
      this.body = requireNonNull(body);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder GET() {
      return method("GET", Body.absent());
    }

    @CanIgnoreReturnValue
    public Builder POST(Body body) {
      return method("POST", body);
    }

    @CanIgnoreReturnValue
    public Builder PUT(Body body) {
      return method("PUT", body);
    }

    @CanIgnoreReturnValue
    public Builder DELETE() {
      return method("DELETE", Body.absent());
    }

    /** Sets the body while keeping the current method. */
    @CanIgnoreReturnValue
    public Builder body(Body body) {
      this.body = requireNonNull(body);
      return this;
    }

    /** Adds the given header. */
    @CanIgnoreReturnValue
    public Builder header(String name, String value) {
      headersBuilder.add(name, value);
      return this;
    }

    /** Adds each of the given name-value pairs. */
    @CanIgnoreReturnValue
    public Builder headers(String... headers) {
      headersBuilder.addAll(headers);
      return this;
    }

    /** Sets the given header, replacing any values it previously had. */
    @CanIgnoreReturnValue
    public Builder setHeader(String name, String value) {
      headersBuilder.set(name, value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder removeHeader(String name) {
      headersBuilder.remove(name);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder timeout(Duration timeout) {
      this.timeout = requirePositiveDuration(timeout);
      return this;
    }

    public Request build() {
      requireState(uri != null, "Expected a URI to be set");
      return new Request(this);
    }
  }
}
