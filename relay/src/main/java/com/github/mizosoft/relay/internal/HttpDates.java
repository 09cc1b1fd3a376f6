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

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Parsing of the values HTTP uses for dates and delays, as in {@code Retry-After}. */
public final class HttpDates {
  private static final Logger logger = System.getLogger(HttpDates.class.getName());

  /** Formats accepted by rfc7231 Section 7.1.1.1, tried in sequence till one succeeds. */
  private static final List<DateTimeFormatter> FORMATTERS =
      List.of(
          DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US),
          DateTimeFormatter.ofPattern("EEEE, dd-MMM-uu HH:mm:ss 'GMT'", Locale.US), // rfc850
          DateTimeFormatter.ofPattern("EEE MMM ppd HH:mm:ss uuuu", Locale.US), // asctime()
          DateTimeFormatter.RFC_1123_DATE_TIME);

  private HttpDates() {}

  /** Parses the given value as an HTTP date, logging and returning empty if it's malformed. */
  public static Optional<Instant> tryParseHttpDate(String value) {
    TemporalAccessor parsed = null;
    for (var formatter : FORMATTERS) {
      try {
        parsed = formatter.parse(value.trim());
        break;
      } catch (DateTimeException ignored) {
        // Try next formatter.
      }
    }

    DateTimeException failure = null;
    if (parsed != null) {
      try {
        var dateTime = LocalDateTime.from(parsed);
        var offset = parsed.query(TemporalQueries.offset());
        return Optional.of(dateTime.toInstant(offset != null ? offset : ZoneOffset.UTC));
      } catch (DateTimeException e) {
        failure = e;
      }
    }
    logger.log(Level.WARNING, () -> "Malformed or unrecognized HTTP date: " + value, failure);
    return Optional.empty();
  }

  /**
   * Parses the given value as a non-negative number of seconds. Values beyond {@code
   * Integer.MAX_VALUE} are truncated to avoid overflowing further calculations.
   */
  public static Optional<Duration> tryParseDeltaSeconds(String value) {
    long seconds;
    try {
      seconds = Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
    return seconds >= 0
        ? Optional.of(Duration.ofSeconds(Math.min(seconds, Integer.MAX_VALUE)))
        : Optional.empty();
  }

  /**
   * Parses a {@code Retry-After} value, which is either delta seconds or an HTTP date, into the
   * delay it specifies relative to the given instant. A date in the past gives a zero delay.
   */
  public static Optional<Duration> tryParseRetryAfter(String value, Instant now) {
    return tryParseDeltaSeconds(value)
        .or(
            () ->
                tryParseHttpDate(value)
                    .map(date -> Compare.max(Duration.ZERO, Duration.between(now, date))));
  }
}
