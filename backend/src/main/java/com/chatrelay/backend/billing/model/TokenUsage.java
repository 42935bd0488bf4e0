package com.chatrelay.backend.billing.model;

/** Token counters reported by the upstream API for one or more responses. */
public record TokenUsage(
    long inputTokens, long outputTokens, long cacheCreationTokens, long cacheReadTokens) {

  public static final TokenUsage EMPTY = new TokenUsage(0, 0, 0, 0);

  public TokenUsage {
    inputTokens = Math.max(0, inputTokens);
    outputTokens = Math.max(0, outputTokens);
    cacheCreationTokens = Math.max(0, cacheCreationTokens);
    cacheReadTokens = Math.max(0, cacheReadTokens);
  }

  public TokenUsage plus(TokenUsage other) {
    if (other == null) {
      return this;
    }
    return new TokenUsage(
        inputTokens + other.inputTokens,
        outputTokens + other.outputTokens,
        cacheCreationTokens + other.cacheCreationTokens,
        cacheReadTokens + other.cacheReadTokens);
  }

  public long totalTokens() {
    return inputTokens + outputTokens + cacheCreationTokens + cacheReadTokens;
  }

  public boolean hasUsage() {
    return totalTokens() > 0;
  }
}
