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

package com.github.mizosoft.relay.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RetryPolicyTest {
  @Test
  void defaults() {
    var policy = RetryPolicy.defaults();
    assertThat(policy.maxRetries()).isEqualTo(3);
    assertThat(policy.baseDelay()).isEqualTo(Duration.ofSeconds(1));
    assertThat(policy.maxDelay()).isEqualTo(Duration.ofSeconds(30));
    assertThat(policy.jitter()).isEqualTo(Jitter.FULL);
    assertThat(policy.classifier()).isSameAs(RetryClassifier.defaults());
    assertThat(policy.timeout()).isEmpty();
  }

  @Test
  void exponentialWithoutJitter() {
    var policy = RetryPolicy.newBuilder()
        .maxRetries(10)
        .backoff(Duration.ofMillis(100), Duration.ofSeconds(1))
        .jitter(Jitter.NONE)
        .build();
    assertThat(policy.nextDelay(0)).isEqualTo(RetryDecision.retryAfter(Duration.ofMillis(100)));
    assertThat(policy.nextDelay(1)).isEqualTo(RetryDecision.retryAfter(Duration.ofMillis(200)));
    assertThat(policy.nextDelay(2)).isEqualTo(RetryDecision.retryAfter(Duration.ofMillis(400)));
    assertThat(policy.nextDelay(3)).isEqualTo(RetryDecision.retryAfter(Duration.ofMillis(800)));
    assertThat(policy.nextDelay(4)).isEqualTo(RetryDecision.retryAfter(Duration.ofSeconds(1)));
    assertThat(policy.nextDelay(9)).isEqualTo(RetryDecision.retryAfter(Duration.ofSeconds(1)));
    assertThat(policy.nextDelay(10)).isEqualTo(RetryDecision.stop());
  }

  @Test
  void delaysAreMonotoneAndCapped() {
    var policy = RetryPolicy.newBuilder()
        .maxRetries(Integer.MAX_VALUE)
        .backoff(Duration.ofMillis(7), Duration.ofMinutes(3))
        .jitter(Jitter.NONE)
        .build();
    var previous = Duration.ZERO;
    for (int i = 0; i < 200; i++) {
      var delay = policy.nextDelay(i).delay().orElseThrow();
      assertThat(delay).isGreaterThanOrEqualTo(previous).isLessThanOrEqualTo(Duration.ofMinutes(3));
      previous = delay;
    }
  }

  @ParameterizedTest
  @ValueSource(ints = {61, 62, 63, 64, 1000, Integer.MAX_VALUE - 1})
  void overflowSaturatesAtMaxDelay(int attemptIndex) {
    var policy = RetryPolicy.newBuilder()
        .maxRetries(Integer.MAX_VALUE)
        .backoff(Duration.ofSeconds(1), Duration.ofDays(365))
        .jitter(Jitter.NONE)
        .build();
    assertThat(policy.nextDelay(attemptIndex).delay()).hasValue(Duration.ofDays(365));
  }

  @Test
  void largeBaseDelayOverflowSaturates() {
    var policy = RetryPolicy.newBuilder()
        .maxRetries(100)
        .backoff(Duration.ofSeconds(Long.MAX_VALUE / 4), Duration.ofSeconds(Long.MAX_VALUE / 2))
        .jitter(Jitter.NONE)
        .build();
    assertThat(policy.nextDelay(10).delay()).hasValue(Duration.ofSeconds(Long.MAX_VALUE / 2));
  }

  @Test
  void zeroMaxRetriesNeverRetries() {
    var policy = RetryPolicy.newBuilder().maxRetries(0).build();
    assertThat(policy.nextDelay(0).isStop()).isTrue();
  }

  @Test
  void zeroBaseDelayWithoutJitterGivesZeroDelay() {
    var policy = RetryPolicy.newBuilder()
        .backoff(Duration.ZERO, Duration.ZERO)
        .jitter(Jitter.NONE)
        .build();
    assertThat(policy.nextDelay(0).delay()).hasValue(Duration.ZERO);
    assertThat(policy.nextDelay(2).delay()).hasValue(Duration.ZERO);
  }

  @Test
  void fullJitterStaysWithinComputedDelay() {
    var policy = RetryPolicy.newBuilder()
        .maxRetries(5)
        .backoff(Duration.ofMillis(100), Duration.ofSeconds(10))
        .jitter(Jitter.FULL)
        .random(new Random(42))
        .build();
    for (int round = 0; round < 100; round++) {
      for (int i = 0; i < 5; i++) {
        assertThat(policy.nextDelay(i).delay().orElseThrow())
            .isBetween(Duration.ZERO, Duration.ofMillis(100L << i));
      }
    }
  }

  @Test
  void boundedJitterStaysAboveBaseDelay() {
    var policy = RetryPolicy.newBuilder()
        .maxRetries(5)
        .backoff(Duration.ofMillis(100), Duration.ofSeconds(10))
        .jitter(Jitter.BOUNDED)
        .random(new Random(42))
        .build();
    for (int round = 0; round < 100; round++) {
      for (int i = 0; i < 5; i++) {
        assertThat(policy.nextDelay(i).delay().orElseThrow())
            .isBetween(Duration.ofMillis(100), Duration.ofMillis(100L << i));
      }
    }
  }

  @Test
  void jitterExtremes() {
    var builder = RetryPolicy.newBuilder().backoff(Duration.ofMillis(100), Duration.ofSeconds(1));
    assertThat(builder.jitter(Jitter.FULL).random(() -> 0.0).build().nextDelay(2).delay())
        .hasValue(Duration.ZERO);
    assertThat(builder.jitter(Jitter.FULL).random(() -> 1.0).build().nextDelay(2).delay())
        .hasValue(Duration.ofMillis(400));
    assertThat(builder.jitter(Jitter.BOUNDED).random(() -> 0.0).build().nextDelay(2).delay())
        .hasValue(Duration.ofMillis(100));
    assertThat(builder.jitter(Jitter.BOUNDED).random(() -> 0.5).build().nextDelay(2).delay())
        .hasValue(Duration.ofMillis(250));
  }

  @Test
  void subMillisecondJitter() {
    var builder =
        RetryPolicy.newBuilder()
            .backoff(Duration.ofNanos(500_000), Duration.ofMillis(1))
            .random(() -> 0.5);
    assertThat(builder.jitter(Jitter.FULL).build().nextDelay(0).delay())
        .hasValue(Duration.ofNanos(250_000));
    assertThat(builder.jitter(Jitter.BOUNDED).build().nextDelay(1).delay())
        .hasValue(Duration.ofNanos(750_000));
  }

  @Test
  void jitterSaturatesOnHugeMaxDelay() {
    var builder =
        RetryPolicy.newBuilder()
            .maxRetries(Integer.MAX_VALUE)
            .backoff(Duration.ofSeconds(1), Duration.ofSeconds(Long.MAX_VALUE));
    assertThat(builder.jitter(Jitter.FULL).random(() -> 1.0).build().nextDelay(100).delay())
        .hasValue(Duration.ofNanos(Long.MAX_VALUE));
    assertThat(builder.jitter(Jitter.BOUNDED).random(() -> 0.0).build().nextDelay(100).delay())
        .hasValue(Duration.ofSeconds(1));
    assertThat(builder.jitter(Jitter.NONE).build().nextDelay(100).delay())
        .hasValue(Duration.ofSeconds(Long.MAX_VALUE));
  }

  @Test
  void seededJitterIsReproducible() {
    assertThat(delaysWithSeed(7)).isEqualTo(delaysWithSeed(7));
  }

  private static List<Duration> delaysWithSeed(long seed) {
    var policy = RetryPolicy.newBuilder()
        .maxRetries(8)
        .backoff(Duration.ofMillis(10), Duration.ofSeconds(5))
        .random(new Random(seed))
        .build();
    var delays = new ArrayList<Duration>();
    for (int i = 0; i < 8; i++) {
      delays.add(policy.nextDelay(i).delay().orElseThrow());
    }
    return delays;
  }

  @Test
  void invalidConfiguration() {
    assertThatThrownBy(() -> RetryPolicy.newBuilder().maxRetries(-1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RetryPolicy.newBuilder().baseDelay(Duration.ofMillis(-1)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RetryPolicy.newBuilder().maxDelay(Duration.ofMillis(-1)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () ->
                RetryPolicy.newBuilder()
                    .backoff(Duration.ofSeconds(2), Duration.ofSeconds(1))
                    .build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RetryPolicy.newBuilder().timeout(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RetryPolicy.defaults().nextDelay(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void randomSourceOutOfRange() {
    var policy = RetryPolicy.newBuilder().random(() -> 1.5).build();
    assertThatThrownBy(() -> policy.nextDelay(0)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void retryDecision() {
    assertThat(RetryDecision.stop().isStop()).isTrue();
    assertThat(RetryDecision.stop().delay()).isEmpty();
    assertThat(RetryDecision.retryAfter(Duration.ofSeconds(1)).isStop()).isFalse();
    assertThat(RetryDecision.retryAfter(Duration.ofSeconds(1)).delay())
        .hasValue(Duration.ofSeconds(1));
    assertThatThrownBy(() -> RetryDecision.retryAfter(Duration.ofSeconds(-1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
