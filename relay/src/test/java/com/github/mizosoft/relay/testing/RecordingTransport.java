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

package com.github.mizosoft.relay.testing;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.mizosoft.relay.Request;
import com.github.mizosoft.relay.Response;
import com.github.mizosoft.relay.Transport;
import java.util.List;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link Transport} that records the requests it's asked to send, leaving their responses to be
 * completed by the test, either explicitly or through a call handler.
 */
public final class RecordingTransport implements Transport {
  private final BlockingDeque<Call> pendingCalls = new LinkedBlockingDeque<>();
  private final List<Call> calls = new CopyOnWriteArrayList<>();
  private volatile @Nullable Consumer<Call> callHandler;

  public RecordingTransport() {}

  /** Sets a handler that's invoked with each call as soon as it's made. */
  public RecordingTransport handleCalls(@Nullable Consumer<Call> callHandler) {
    this.callHandler = callHandler;
    return this;
  }

  /** Waits for the next call that wasn't awaited yet. */
  public Call awaitCall() {
    try {
      var call = pendingCalls.pollFirst(5, TimeUnit.SECONDS);
      assertThat(call).withFailMessage("Expected a call to be made").isNotNull();
      return call;
    } catch (InterruptedException e) {
      throw new RuntimeException(e);
    }
  }

  public Call lastCall() {
    assertThat(calls).isNotEmpty();
    return calls.get(calls.size() - 1);
  }

  public int sendCount() {
    return calls.size();
  }

  /** Returns the requests sent so far, in order. */
  public List<Request> requests() {
    return calls.stream().map(Call::request).collect(Collectors.toList());
  }

  @Override
  public CompletableFuture<Response> send(Request request) {
    var call = new Call(request, calls.size());
    calls.add(call);
    var handler = callHandler;
    if (handler != null) {
      handler.accept(call);
    } else {
      pendingCalls.add(call);
    }
    return call.future();
  }

  /** A request made to the transport. */
  public static final class Call {
    private final CompletableFuture<Response> responseFuture = new CompletableFuture<>();
    private final Request request;
    private final int index;

    private Call(Request request, int index) {
      this.request = request;
      this.index = index;
    }

    public Request request() {
      return request;
    }

    /** Returns the index of this call among all calls made to the transport. */
    public int index() {
      return index;
    }

    public CompletableFuture<Response> future() {
      return responseFuture;
    }

    public boolean isCancelled() {
      return responseFuture.isCancelled();
    }

    public void complete() {
      complete(200);
    }

    public void complete(int statusCode) {
      complete(builder -> builder.statusCode(statusCode));
    }

    public void complete(Consumer<? super Response.Builder> mutator) {
      complete(Response.newBuilder().statusCode(200).request(request).apply(mutator).build());
    }

    public void complete(Response response) {
      assertThat(responseFuture.complete(response)).isTrue();
    }

    public void completeExceptionally(Throwable exception) {
      assertThat(responseFuture.completeExceptionally(exception)).isTrue();
    }
  }
}
