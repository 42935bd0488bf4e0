package com.chatrelay.backend.billing.model;

import java.math.BigDecimal;

/** Resolved pricing multipliers for a single model. */
public record RateCard(
    String modelId,
    BigDecimal modelMultiplier,
    BigDecimal outputMultiplier,
    BigDecimal cacheReadMultiplier,
    BigDecimal cacheCreationMultiplier) {

  public static final BigDecimal DEFAULT_MODEL_MULTIPLIER = BigDecimal.ONE;
  public static final BigDecimal DEFAULT_OUTPUT_MULTIPLIER = new BigDecimal("5.0");
  public static final BigDecimal DEFAULT_CACHE_READ_MULTIPLIER = new BigDecimal("0.1");
  public static final BigDecimal DEFAULT_CACHE_CREATION_MULTIPLIER = new BigDecimal("2.0");

  public RateCard {
    modelMultiplier = modelMultiplier != null ? modelMultiplier : DEFAULT_MODEL_MULTIPLIER;
    outputMultiplier = outputMultiplier != null ? outputMultiplier : DEFAULT_OUTPUT_MULTIPLIER;
    cacheReadMultiplier =
        cacheReadMultiplier != null ? cacheReadMultiplier : DEFAULT_CACHE_READ_MULTIPLIER;
    cacheCreationMultiplier =
        cacheCreationMultiplier != null
            ? cacheCreationMultiplier
            : DEFAULT_CACHE_CREATION_MULTIPLIER;
  }

  public static RateCard defaults(String modelId) {
    return new RateCard(modelId, null, null, null, null);
  }
}
