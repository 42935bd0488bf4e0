package com.chatrelay.backend.quota.service;

import java.time.Duration;
import java.time.Instant;

/**
 * Lazy counter rollover. Windows restart at the moment of the read that finds them expired;
 * cycles only ever move by whole multiples of their length from the anchor, so every subscription
 * on a plan keeps the same cadence.
 */
public final class BudgetRollover {

  private BudgetRollover() {}

  public record Result(Instant start, boolean reset) {}

  public static Result rollWindow(Instant now, Instant windowStart, Duration length) {
    if (windowStart == null) {
      return new Result(now, true);
    }
    if (Duration.between(windowStart, now).compareTo(length) >= 0) {
      return new Result(now, true);
    }
    return new Result(windowStart, false);
  }

  /**
   * @param cycleStart current cycle start, {@code null} before the first read
   * @param anchor subscription start used when no cycle has been started yet
   */
  public static Result rollCycle(
      Instant now, Instant cycleStart, Instant anchor, Duration length) {
    if (cycleStart == null) {
      Instant base = anchor != null ? anchor : now;
      return new Result(alignedStart(base, now, length), true);
    }
    if (Duration.between(cycleStart, now).compareTo(length) >= 0) {
      return new Result(alignedStart(cycleStart, now, length), true);
    }
    return new Result(cycleStart, false);
  }

  /** Latest {@code base + k * length} (k ≥ 0) that is not after {@code now}. */
  static Instant alignedStart(Instant base, Instant now, Duration length) {
    long elapsedMillis = Duration.between(base, now).toMillis();
    if (elapsedMillis <= 0) {
      return base;
    }
    long cycles = elapsedMillis / length.toMillis();
    return base.plus(length.multipliedBy(cycles));
  }
}
