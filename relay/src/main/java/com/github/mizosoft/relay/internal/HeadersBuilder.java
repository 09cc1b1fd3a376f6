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

import static com.github.mizosoft.relay.internal.Utils.requireValidHeader;
import static com.github.mizosoft.relay.internal.Utils.requireValidHeaderName;
import static com.github.mizosoft.relay.internal.Utils.requireValidHeaderValue;
import static com.github.mizosoft.relay.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import java.net.http.HttpHeaders;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Accumulates a case-insensitive header multimap into {@link HttpHeaders}. */
public final class HeadersBuilder {
  private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

  public HeadersBuilder() {}

  public void add(String name, String value) {
    requireValidHeader(name, value);
    headers.computeIfAbsent(name, __ -> new ArrayList<>()).add(value);
  }

  public void addAll(String... headers) {
    requireArgument(
        headers.length > 0 && headers.length % 2 == 0,
        "Expected a even-numbered, positive array length: %d",
        headers.length);
    for (int i = 0; i < headers.length; i += 2) {
      add(headers[i], headers[i + 1]);
    }
  }

  /** Adds all given headers without validation, as they're assumed to be valid. */
  public void addAll(HttpHeaders headers) {
    headers
        .map()
        .forEach(
            (name, values) ->
                this.headers.computeIfAbsent(name, __ -> new ArrayList<>()).addAll(values));
  }

  public void set(String name, String value) {
    requireValidHeaderName(name);
    requireValidHeaderValue(value);
    var myValues = headers.computeIfAbsent(name, __ -> new ArrayList<>());
    myValues.clear();
    myValues.add(value);
  }

  public boolean remove(String name) {
    return headers.remove(requireNonNull(name)) != null;
  }

  public HttpHeaders build() {
    return HttpHeaders.of(headers, (n, v) -> true);
  }
}
