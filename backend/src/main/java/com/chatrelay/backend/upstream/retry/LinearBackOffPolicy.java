package com.chatrelay.backend.upstream.retry;

import java.time.Duration;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

/** Delay grows by a fixed step after each failure: {@code min(initial + step * n, max)}. */
public class LinearBackOffPolicy implements BackOffPolicy {

  private final long initialMillis;
  private final long stepMillis;
  private final long maxMillis;
  private final Sleeper sleeper;

  public LinearBackOffPolicy(Duration initial, Duration step, Duration max, Sleeper sleeper) {
    this.initialMillis = Math.max(0, initial.toMillis());
    this.stepMillis = Math.max(0, step.toMillis());
    this.maxMillis = Math.max(initialMillis, max.toMillis());
    this.sleeper = sleeper;
  }

  @Override
  public BackOffContext start(RetryContext context) {
    return new LinearBackOffContext();
  }

  @Override
  public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
    LinearBackOffContext context = (LinearBackOffContext) backOffContext;
    long delay = delayFor(context.failures++);
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new BackOffInterruptedException("Interrupted while backing off", ex);
    }
  }

  long delayFor(int failures) {
    return Math.min(initialMillis + stepMillis * failures, maxMillis);
  }

  private static final class LinearBackOffContext implements BackOffContext {
    private int failures;
  }
}
