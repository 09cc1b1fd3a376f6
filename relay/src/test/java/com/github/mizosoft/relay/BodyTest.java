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
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class BodyTest {
  @Test
  void absent() throws IOException {
    var body = Body.absent();
    assertThat(body.kind()).isEqualTo(Body.Kind.ABSENT);
    assertThat(body.contentLength()).isZero();
    assertThat(body.isReplayable()).isTrue();
    assertThat(body.open().readAllBytes()).isEmpty();
    assertThat(body.duplicate()).isSameAs(body);
  }

  @Test
  void bufferedCanBeReadRepeatedly() throws IOException {
    var body = Body.of("Pikachu");
    assertThat(body.kind()).isEqualTo(Body.Kind.BUFFERED);
    assertThat(body.contentLength()).isEqualTo(7);
    assertThat(body.isReplayable()).isTrue();
    assertThat(new String(body.open().readAllBytes(), UTF_8)).isEqualTo("Pikachu");
    assertThat(new String(body.open().readAllBytes(), UTF_8)).isEqualTo("Pikachu");
    assertThat(new String(body.duplicate().open().readAllBytes(), UTF_8)).isEqualTo("Pikachu");
  }

  @Test
  void bufferedCopiesItsContent() {
    var bytes = new byte[] {1, 2, 3};
    var body = (Body.Buffered) Body.of(bytes);
    bytes[0] = 9;
    assertThat(body.bytes()).containsExactly(1, 2, 3);
    body.bytes()[1] = 9;
    assertThat(body.bytes()).containsExactly(1, 2, 3);
    assertThat(body.asByteBuffer().isReadOnly()).isTrue();
  }

  @Test
  void streamingCanBeOpenedOnce() throws IOException {
    var body = Body.ofStream(new ByteArrayInputStream(new byte[] {1, 2}), 2);
    assertThat(body.kind()).isEqualTo(Body.Kind.STREAMING);
    assertThat(body.contentLength()).isEqualTo(2);
    assertThat(body.isReplayable()).isFalse();
    assertThat(body.open().readAllBytes()).containsExactly(1, 2);
    assertThatThrownBy(body::open).isInstanceOf(ReplayUnsupportedException.class);
  }

  @Test
  void streamingCannotBeDuplicated() {
    var body = Body.ofStream(new ByteArrayInputStream(new byte[0]));
    assertThat(body.contentLength()).isEqualTo(-1);
    assertThatThrownBy(body::duplicate).isInstanceOf(ReplayUnsupportedException.class);
  }
}
