package com.chatrelay.backend.upstream.client;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One-shot cancellation signal shared by a caller and the upstream call it is waiting on. Once
 * aborted it stays aborted: a handler registered afterwards runs immediately.
 */
public final class AbortSignal {

  private final CountDownLatch aborted = new CountDownLatch(1);
  private final AtomicReference<Runnable> handler = new AtomicReference<>();

  public void abort() {
    if (aborted.getCount() == 0) {
      return;
    }
    aborted.countDown();
    Runnable current = handler.getAndSet(null);
    if (current != null) {
      current.run();
    }
  }

  public boolean isAborted() {
    return aborted.getCount() == 0;
  }

  /** Makes {@code onAbort} the action taken on abort, replacing any earlier one. */
  public void register(Runnable onAbort) {
    handler.set(onAbort);
    if (isAborted() && handler.compareAndSet(onAbort, null)) {
      onAbort.run();
    }
  }

  public void unregister(Runnable onAbort) {
    handler.compareAndSet(onAbort, null);
  }

  /** Sleeps for up to {@code millis}, returning early once aborted. */
  public void await(long millis) throws InterruptedException {
    aborted.await(millis, TimeUnit.MILLISECONDS);
  }
}
