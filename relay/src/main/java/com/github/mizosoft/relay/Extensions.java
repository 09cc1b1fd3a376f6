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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * A per-request store of arbitrary values, mapped by their type. An {@code Extensions} instance
 * lives as long as one logical request: it's created before the first middleware runs, is handed
 * to every {@link Middleware} in the chain, and is shared by all attempts made to send the request
 * (e.g. by {@link com.github.mizosoft.relay.retry.RetryMiddleware retrying}). A value put by one
 * middleware is seen by all middleware that run after it.
 *
 * <p>An {@code Extensions} can't be used for more than one logical request.
 */
public final class Extensions {
  private final ConcurrentMap<Class<?>, Object> values = new ConcurrentHashMap<>();
  private final AtomicBoolean bound = new AtomicBoolean();

  public Extensions() {}

  /** Returns the value mapped to the given type, if any. */
  public <T> Optional<T> get(Class<T> type) {
    return Optional.ofNullable(values.get(requireNonNull(type))).map(type::cast);
  }

  /** Maps the given value to the given type, returning the previously mapped value, if any. */
  @CanIgnoreReturnValue
  public <T> Optional<T> put(Class<T> type, T value) {
    return Optional.ofNullable(values.put(requireNonNull(type), type.cast(requireNonNull(value))))
        .map(type::cast);
  }

  /** Maps the given value to its runtime type. */
  @CanIgnoreReturnValue
  @SuppressWarnings("unchecked")
  public <T> Optional<T> put(T value) {
    return put((Class<T>) value.getClass(), value);
  }

  /**
   * Returns the value mapped to the given type, first mapping the value created by the given
   * factory if there's none.
   */
  public <T> T computeIfAbsent(Class<T> type, Supplier<? extends T> factory) {
    requireNonNull(factory);
    return type.cast(values.computeIfAbsent(requireNonNull(type), __ -> factory.get()));
  }

  /**
   * Replaces the value mapped to the given type with the result of applying the given function,
   * or with the given initial value if there's none. Returns the newly mapped value.
   */
  @CanIgnoreReturnValue
  public <T> T update(Class<T> type, T initialValue, UnaryOperator<T> updater) {
    requireNonNull(initialValue);
    requireNonNull(updater);
    return type.cast(
        values.merge(
            requireNonNull(type),
            initialValue,
            (current, __) -> requireNonNull(updater.apply(type.cast(current)))));
  }

  /** Removes the value mapped to the given type, returning it if present. */
  @CanIgnoreReturnValue
  public <T> Optional<T> remove(Class<T> type) {
    return Optional.ofNullable(values.remove(requireNonNull(type))).map(type::cast);
  }

  public boolean contains(Class<?> type) {
    return values.containsKey(requireNonNull(type));
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /**
   * Binds this instance to a logical request.
   *
   * @throws IllegalStateException if this instance is already bound to another logical request
   */
  void bind() {
    if (!bound.compareAndSet(false, true)) {
      throw new IllegalStateException(
          "Extensions are already in use by another request; create one per request");
    }
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this) + values;
  }
}
