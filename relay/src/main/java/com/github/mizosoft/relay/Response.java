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
import static com.github.mizosoft.relay.internal.Validate.requireState;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.relay.internal.HeadersBuilder;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.nio.charset.Charset;
import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/** An immutable HTTP response whose body has been fully read into memory. */
public final class Response {
  private static final byte[] EMPTY_BODY = new byte[0];

  private final int statusCode;
  private final URI uri;
  private final HttpHeaders headers;
  private final byte[] body;
  private final Request request;

  private Response(Builder builder) {
    this.statusCode = builder.statusCode;
    this.request = requireNonNull(builder.request);
    this.uri = builder.uri != null ? builder.uri : builder.request.uri();
    this.headers = builder.headersBuilder.build();
    this.body = builder.body;
  }

  public int statusCode() {
    return statusCode;
  }

  /** Returns the URI the response was received from, which may differ from the request's. */
  public URI uri() {
    return uri;
  }

  public HttpHeaders headers() {
    return headers;
  }

  /** Returns a copy of the response body. */
  public byte[] body() {
    return body.clone();
  }

  /** Returns the response body decoded as UTF-8. */
  public String bodyAsString() {
    return bodyAsString(UTF_8);
  }

  public String bodyAsString(Charset charset) {
    return new String(body, charset);
  }

  /** Returns the request that was sent to get this response. */
  public Request request() {
    return request;
  }

  /** Returns whether the status code is in the {@code 2xx} range. */
  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }

  /** Returns a builder initialized with this response's state. */
  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override
  public String toString() {
    return "(" + request.method() + " " + uri + ") " + statusCode;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@link Response} instances. */
  public static final class Builder {
    private static final int UNSET_STATUS_CODE = -1;

    private final HeadersBuilder headersBuilder = new HeadersBuilder();
    private int statusCode = UNSET_STATUS_CODE;
    private @MonotonicNonNull Request request;
    private @Nullable URI uri;
    private byte[] body = EMPTY_BODY;

    Builder() {}

    Builder(Response response) {
      this.statusCode = response.statusCode;
      this.request = response.request;
      this.uri = response.uri;
      this.body = response.body;
      headersBuilder.addAll(response.headers);
    }

    @CanIgnoreReturnValue
    public Builder statusCode(int statusCode) {
      requireArgument(
          statusCode >= 100 && statusCode <= 999, "invalid status code: %d", statusCode);
      this.statusCode = statusCode;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder request(Request request) {
      this.request = requireNonNull(request);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder uri(URI uri) {
      this.uri = requireNonNull(uri);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder header(String name, String value) {
      headersBuilder.add(name, value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setHeader(String name, String value) {
      headersBuilder.set(name, value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder headers(HttpHeaders headers) {
      headersBuilder.addAll(headers);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder body(byte[] body) {
      this.body = body.clone();
      return this;
    }

    @CanIgnoreReturnValue
    public Builder body(String body) {
      this.body = body.getBytes(UTF_8);
      return this;
    }

    /** Calls the given consumer against this builder. */
    @CanIgnoreReturnValue
    public Builder apply(Consumer<? super Builder> consumer) {
      consumer.accept(this);
      return this;
    }

    public Response build() {
      requireState(statusCode != UNSET_STATUS_CODE, "Expected a status code to be set");
      requireState(request != null, "Expected a request to be set");
      return new Response(this);
    }
  }
}
