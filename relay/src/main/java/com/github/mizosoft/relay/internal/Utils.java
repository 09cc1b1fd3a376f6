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

package com.github.mizosoft.relay.internal;

import static com.github.mizosoft.relay.internal.Validate.requireArgument;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/** Miscellaneous utilities. */
public class Utils {
  private static final Clock SYSTEM_MILLIS_UTC = Clock.tickMillis(ZoneOffset.UTC);

  // tchar = "!" / "#" / "$" / "%" / "&" / "'" / "*" / "+" / "-" / "." / "^" / "_" / "`" / "|" /
  //         "~" / DIGIT / ALPHA
  private static final String TOKEN_SPECIALS = "!#$%&'*+-.^_`|~";

  private Utils() {}

  public static boolean isValidToken(CharSequence token) {
    if (token.length() == 0) {
      return false;
    }
    for (int i = 0; i < token.length(); i++) {
      char c = token.charAt(i);
      boolean isAlphaNumeric =
          (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
      if (!isAlphaNumeric && TOKEN_SPECIALS.indexOf(c) < 0) {
        return false;
      }
    }
    return true;
  }

  /** Checks the value is made of visible ASCII characters, spaces and horizontal tabs. */
  public static boolean isValidHeaderValue(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if ((c < 0x21 || c > 0x7E) && c != ' ' && c != '\t') {
        return false;
      }
    }
    return true;
  }

  public static String requireValidHeaderName(String name) {
    requireArgument(isValidToken(name), "illegal header name: '%s'", name);
    return name;
  }

  public static String requireValidHeaderValue(String value) {
    requireArgument(isValidHeaderValue(value), "illegal header value: '%s'", value);
    return value;
  }

  public static void requireValidHeader(String name, String value) {
    requireValidHeaderName(name);
    requireValidHeaderValue(value);
  }

  public static Duration requirePositiveDuration(Duration duration) {
    requireArgument(
        !(duration.isNegative() || duration.isZero()), "non-positive duration: %s", duration);
    return duration;
  }

  public static Duration requireNonNegativeDuration(Duration duration) {
    requireArgument(!duration.isNegative(), "negative duration: %s", duration);
    return duration;
  }

  public static Clock systemMillisUtc() {
    return SYSTEM_MILLIS_UTC;
  }

  public static String toStringIdentityPrefix(Object object) {
    return object.getClass().getSimpleName()
        + "@"
        + Integer.toHexString(System.identityHashCode(object));
  }

  /**
   * Rethrows the cause of an asynchronous failure as-is if it can be thrown from a method declaring
   * {@code IOException} and {@code InterruptedException}, or wraps it in an {@code IOException}
   * otherwise. Return type is only declared for this method to be conveniently used in a {@code
   * throw} statement.
   */
  private static RuntimeException rethrowAsyncThrowable(Throwable throwable)
      throws IOException, InterruptedException {
    var cause = getDeepCompletionCause(throwable);
    if (cause instanceof RuntimeException) {
      throw (RuntimeException) cause;
    } else if (cause instanceof Error) {
      throw (Error) cause;
    } else if (cause instanceof IOException) {
      throw (IOException) cause;
    } else if (cause instanceof InterruptedException) {
      throw (InterruptedException) cause;
    } else {
      throw new IOException(cause);
    }
  }

  public static Throwable getDeepCompletionCause(Throwable t) {
    var cause = t;
    while (cause instanceof CompletionException || cause instanceof ExecutionException) {
      var deeperCause = cause.getCause();
      if (deeperCause == null) {
        break;
      }
      cause = deeperCause;
    }
    return cause;
  }

  public static CompletionException toCompletionException(Throwable t) {
    return t instanceof CompletionException
        ? ((CompletionException) t)
        : new CompletionException(t);
  }

  /**
   * Waits for the given future, rethrowing its failure from the calling thread. The future is
   * cancelled if the calling thread is interrupted while waiting.
   */
  public static <T> T get(Future<T> future) throws IOException, InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      throw rethrowAsyncThrowable(e.getCause());
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    }
  }
}
