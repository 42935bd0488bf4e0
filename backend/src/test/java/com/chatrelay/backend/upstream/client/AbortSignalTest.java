package com.chatrelay.backend.upstream.client;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class AbortSignalTest {

  @Test
  void runsTheRegisteredHandlerOnce() {
    AbortSignal signal = new AbortSignal();
    AtomicInteger runs = new AtomicInteger();
    signal.register(runs::incrementAndGet);

    signal.abort();
    signal.abort();

    assertThat(signal.isAborted()).isTrue();
    assertThat(runs.get()).isEqualTo(1);
  }

  @Test
  void handlerRegisteredAfterAbortRunsImmediately() {
    AbortSignal signal = new AbortSignal();
    signal.abort();
    AtomicInteger runs = new AtomicInteger();

    signal.register(runs::incrementAndGet);

    assertThat(runs.get()).isEqualTo(1);
  }

  @Test
  void unregisteredHandlerIsSkipped() {
    AbortSignal signal = new AbortSignal();
    AtomicInteger runs = new AtomicInteger();
    Runnable handler = runs::incrementAndGet;
    signal.register(handler);
    signal.unregister(handler);

    signal.abort();

    assertThat(runs.get()).isZero();
  }

  @Test
  void awaitReturnsEarlyOnceAborted() throws InterruptedException {
    AbortSignal signal = new AbortSignal();
    signal.abort();
    long started = System.nanoTime();

    signal.await(30_000);

    assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
  }
}
