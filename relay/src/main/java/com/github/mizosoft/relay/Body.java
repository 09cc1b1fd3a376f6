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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The body of a {@link Request}. A body is either {@link Kind#ABSENT absent}, {@link
 * Kind#BUFFERED buffered} in memory, or {@link Kind#STREAMING streaming} from a source that can
 * only be read once. Only absent and buffered bodies can be sent more than once, which is what
 * allows {@link com.github.mizosoft.relay.retry.RetryMiddleware retrying} requests carrying them.
 */
public abstract class Body {
  Body() {}

  /** The kinds of request bodies. */
  public enum Kind {
    ABSENT,
    BUFFERED,
    STREAMING
  }

  /** Returns this body's kind. */
  public abstract Kind kind();

  /** Returns this body's length in bytes, or {@code -1} if unknown. */
  public abstract long contentLength();

  /** Returns whether this body can be read more than once. */
  public boolean isReplayable() {
    return kind() != Kind.STREAMING;
  }

  /**
   * Opens a stream over this body's content.
   *
   * @throws ReplayUnsupportedException if this is a streaming body that has already been opened
   */
  public abstract InputStream open() throws ReplayUnsupportedException;

  /**
   * Returns a body with the same content that can be sent independently of this one. Buffered
   * bodies are immutable, so this is a cheap operation.
   *
   * @throws ReplayUnsupportedException if this is a streaming body
   */
  public abstract Body duplicate() throws ReplayUnsupportedException;

  /** Returns an absent body. */
  public static Body absent() {
    return Absent.INSTANCE;
  }

  /** Returns a buffered body with a copy of the given bytes. */
  public static Body of(byte[] content) {
    return new Buffered(content.clone());
  }

  /** Returns a buffered body with the given string encoded in UTF-8. */
  public static Body of(String content) {
    return of(content, UTF_8);
  }

  /** Returns a buffered body with the given string encoded in the given charset. */
  public static Body of(String content, Charset charset) {
    return new Buffered(content.getBytes(charset));
  }

  /**
   * Returns a streaming body that reads from the given stream. The stream is consumed when the
   * request is sent, so the body can't be sent again.
   */
  public static Body ofStream(InputStream source) {
    return new Streaming(requireNonNull(source), -1);
  }

  /** Returns a streaming body with a known length that reads from the given stream. */
  public static Body ofStream(InputStream source, long contentLength) {
    return new Streaming(requireNonNull(source), contentLength);
  }

  private static final class Absent extends Body {
    static final Absent INSTANCE = new Absent();

    @Override
    public Kind kind() {
      return Kind.ABSENT;
    }

    @Override
    public long contentLength() {
      return 0;
    }

    @Override
    public InputStream open() {
      return InputStream.nullInputStream();
    }

    @Override
    public Body duplicate() {
      return this;
    }

    @Override
    public String toString() {
      return "Body[ABSENT]";
    }
  }

  /** A buffered body. Use {@link #bytes()} or {@link #asByteBuffer()} to access its content. */
  public static final class Buffered extends Body {
    private final byte[] content;

    private Buffered(byte[] content) {
      this.content = content;
    }

    @Override
    public Kind kind() {
      return Kind.BUFFERED;
    }

    @Override
    public long contentLength() {
      return content.length;
    }

    @Override
    public InputStream open() {
      return new ByteArrayInputStream(content);
    }

    /** Returns this body, as it's immutable. */
    @Override
    public Body duplicate() {
      return this;
    }

    /** Returns a copy of this body's content. */
    public byte[] bytes() {
      return content.clone();
    }

    /** Returns a read-only view of this body's content. */
    public ByteBuffer asByteBuffer() {
      return ByteBuffer.wrap(content).asReadOnlyBuffer();
    }

    @Override
    public String toString() {
      return "Body[BUFFERED, " + content.length + " bytes]";
    }
  }

  private static final class Streaming extends Body {
    private final InputStream source;
    private final long contentLength;
    private final AtomicBoolean opened = new AtomicBoolean();

    Streaming(InputStream source, long contentLength) {
      this.source = source;
      this.contentLength = contentLength;
    }

    @Override
    public Kind kind() {
      return Kind.STREAMING;
    }

    @Override
    public long contentLength() {
      return contentLength;
    }

    @Override
    public InputStream open() throws ReplayUnsupportedException {
      if (!opened.compareAndSet(false, true)) {
        throw new ReplayUnsupportedException("Streaming body has already been consumed");
      }
      return source;
    }

    @Override
    public Body duplicate() throws ReplayUnsupportedException {
      throw new ReplayUnsupportedException("Streaming bodies can't be duplicated");
    }

    @Override
    public String toString() {
      return "Body[STREAMING]";
    }
  }
}
